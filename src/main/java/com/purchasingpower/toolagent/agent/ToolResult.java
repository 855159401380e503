package com.purchasingpower.toolagent.agent;

/**
 * Result from a tool execution: explicit success or failure, never an exception.
 *
 * @since 1.0.0
 */
public interface ToolResult {

    /**
     * Whether the tool executed successfully.
     */
    boolean isSuccess();

    /**
     * The primary result data. Null for failures.
     */
    Object getData();

    /**
     * Human-readable message; the failure reason when {@link #isSuccess()} is false.
     */
    String getMessage();

    static ToolResult success(Object data, String message) {
        return new ToolResultImpl(true, data, message);
    }

    static ToolResult failure(String message) {
        return new ToolResultImpl(false, null, message);
    }
}

/**
 * Default implementation of ToolResult.
 */
record ToolResultImpl(
    boolean isSuccess,
    Object data,
    String message
) implements ToolResult {

    @Override
    public boolean isSuccess() {
        return isSuccess;
    }

    @Override
    public Object getData() {
        return data;
    }

    @Override
    public String getMessage() {
        return message;
    }
}
