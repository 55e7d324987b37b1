package com.example.Orin.tools;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Serializes structured data into indented JSON text.
 */
@Component
@RequiredArgsConstructor
public class ResponseFormatTool implements AgentTool {

    public static final String NAME = "create_api_response";

    private final ObjectMapper objectMapper;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String description() {
        return "Format data into a structured API response format.";
    }

    @Override
    public String inputSchema() {
        return """
                {
                  "type": "object",
                  "properties": {
                    "data": {"type": "object", "description": "Data to format"}
                  },
                  "required": ["data"]
                }
                """;
    }

    @Override
    public ToolResult execute(ToolInvocation invocation) {
        JsonNode data = invocation.arguments().get("data");
        if (data == null || data.isNull()) {
            return ToolResult.failure("Error formatting response: no data given.");
        }
        try {
            return ToolResult.ok(objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(data));
        } catch (JsonProcessingException e) {
            return ToolResult.failure("Error formatting response: " + e.getOriginalMessage());
        }
    }
}
