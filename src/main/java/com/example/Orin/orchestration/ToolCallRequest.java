package com.example.Orin.orchestration;

/**
 * A tool call proposed by the model.
 *
 * @param id        call id assigned by the model, echoed back with the result
 * @param name      requested tool name
 * @param arguments JSON object with the tool arguments
 */
public record ToolCallRequest(String id, String name, String arguments) {
}
