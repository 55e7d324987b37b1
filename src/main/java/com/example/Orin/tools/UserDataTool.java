package com.example.Orin.tools;

import com.example.Orin.exception.AuthenticationRequiredException;
import com.example.Orin.exception.PortalUnavailableException;
import com.example.Orin.service.UserPortalClient;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Fetches personal data (marks, attendance, profile) for the caller from the internal portal.
 */
@Component
@RequiredArgsConstructor
public class UserDataTool implements AgentTool {

    private static final Logger log = LoggerFactory.getLogger(UserDataTool.class);

    public static final String NAME = "fetch_user_data";

    private final UserPortalClient portalClient;
    private final ObjectMapper objectMapper;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String description() {
        return "Fetch personalized user data like marks, attendance, or profile information. "
                + "Requires authentication.";
    }

    @Override
    public String inputSchema() {
        return """
                {
                  "type": "object",
                  "properties": {
                    "data_type": {"type": "string", "description": "Kind of data, e.g. marks, attendance, profile"}
                  },
                  "required": ["data_type"]
                }
                """;
    }

    @Override
    public ToolResult execute(ToolInvocation invocation) {
        String dataType = invocation.argument("data_type");
        if (dataType == null) {
            return ToolResult.failure("Error fetching user data: data_type is required.");
        }
        if (!invocation.user().hasAuthToken()) {
            return ToolResult.failure(AuthenticationRequiredException.MISSING_CREDENTIAL);
        }
        if (!invocation.user().hasUserId()) {
            return ToolResult.failure("Error fetching user data: the caller is not identified.");
        }

        try {
            Optional<JsonNode> data = portalClient.fetchUserData(
                    invocation.user().userId(), dataType, invocation.user().authToken());
            if (data.isEmpty()) {
                return ToolResult.ok("Data type '" + dataType + "' not available.");
            }
            return ToolResult.ok("User data retrieved:\n"
                    + objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(data.get()));
        } catch (AuthenticationRequiredException | PortalUnavailableException e) {
            log.warn("fetch_user_data failed for data type {}: {}", dataType, e.getMessage());
            return ToolResult.failure(e.getMessage());
        } catch (JsonProcessingException e) {
            return ToolResult.failure("Error fetching user data: " + e.getOriginalMessage());
        }
    }
}
