package com.example.Orin.tools;

/**
 * A named capability the orchestration loop may offer to the model.
 * <p>
 * Implementations never throw for expected failures (missing credential, empty
 * search, unreachable portal); they return {@link ToolResult#failure} so the model
 * can read the problem and react to it.
 */
public interface AgentTool {

    /**
     * Unique tool name announced to the model and used for dispatch.
     */
    String name();

    /**
     * Natural language description visible to the model.
     */
    String description();

    /**
     * JSON schema of the arguments object.
     */
    String inputSchema();

    ToolResult execute(ToolInvocation invocation);
}
