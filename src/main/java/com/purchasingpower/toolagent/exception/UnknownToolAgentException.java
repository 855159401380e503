package com.purchasingpower.toolagent.exception;

import lombok.Getter;

@Getter
public class UnknownToolAgentException extends RuntimeException {

    private final String agentName;

    public UnknownToolAgentException(String agentName) {
        super("No tool agent registered under name '" + agentName + "'");
        this.agentName = agentName;
    }

}
