package com.purchasingpower.toolagent;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ToolAgentApplication {

    public static void main(String[] args) {
        SpringApplication.run(ToolAgentApplication.class, args);
    }
}
