package com.example.Orin.tools;

/**
 * Text handed back to the model after a tool call, tagged with whether the tool succeeded.
 */
public record ToolResult(boolean success, String content) {

    public static ToolResult ok(String content) {
        return new ToolResult(true, content);
    }

    public static ToolResult failure(String content) {
        return new ToolResult(false, content);
    }
}
