package io.cronkeeper.core;

/**
 * Text returned to the model from a tool call.
 *
 * @param value text shown to the model
 * @param error whether the call failed
 */
public record ToolResult(String value, boolean error) {

    public static ToolResult of(String value) {
        return new ToolResult(value, false);
    }

    public static ToolResult error(String message) {
        return new ToolResult("Error: " + message, true);
    }
}
