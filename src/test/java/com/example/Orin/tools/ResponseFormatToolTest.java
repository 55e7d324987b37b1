package com.example.Orin.tools;

import com.example.Orin.orchestration.QueryScope;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ResponseFormatToolTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final ResponseFormatTool tool = new ResponseFormatTool(objectMapper);

    @Test
    void formatsDataAsIndentedJson() throws Exception {
        ToolResult result = tool.execute(new ToolInvocation(
                objectMapper.readTree("{\"data\": {\"status\": \"approved\", \"days\": 3}}"), new QueryScope(), null));

        assertThat(result.success()).isTrue();
        assertThat(objectMapper.readTree(result.content()))
                .isEqualTo(objectMapper.readTree("{\"status\": \"approved\", \"days\": 3}"));
        assertThat(result.content()).contains("\n");
    }

    @Test
    void missingDataIsAToolFailure() throws Exception {
        ToolResult result = tool.execute(new ToolInvocation(objectMapper.readTree("{}"), new QueryScope(), null));

        assertThat(result.success()).isFalse();
    }
}
