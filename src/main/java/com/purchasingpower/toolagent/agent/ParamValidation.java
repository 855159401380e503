package com.purchasingpower.toolagent.agent;

import java.util.Map;

/**
 * Result of the pre-invocation parameter check.
 *
 * @param valid  whether the tool may be invoked
 * @param params parameters to forward (possibly normalized); null when invalid
 * @param reason rejection reason; null when valid
 */
public record ParamValidation(boolean valid, Map<String, Object> params, String reason) {

    public static ParamValidation valid(Map<String, Object> params) {
        return new ParamValidation(true, params, null);
    }

    public static ParamValidation invalid(String reason) {
        return new ParamValidation(false, null, reason);
    }
}
