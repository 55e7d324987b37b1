package com.example.Orin.tools;

import com.example.Orin.exception.AuthenticationRequiredException;
import com.example.Orin.exception.PortalUnavailableException;
import com.example.Orin.model.UserContext;
import com.example.Orin.orchestration.QueryScope;
import com.example.Orin.service.UserPortalClient;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class UserDataToolTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final UserPortalClient portal = mock(UserPortalClient.class);
    private final UserDataTool tool = new UserDataTool(portal, objectMapper);

    private final UserContext caller = new UserContext("u-1", "HR", "token-1", "s-1", null);

    @Test
    void returnsPrettyPrintedPortalData() throws Exception {
        when(portal.fetchUserData("u-1", "marks", "token-1"))
                .thenReturn(Optional.of(objectMapper.readTree("{\"Math\": 85}")));

        ToolResult result = tool.execute(invocation("{\"data_type\": \"marks\"}", caller));

        assertThat(result.success()).isTrue();
        assertThat(result.content()).startsWith("User data retrieved:\n{").contains("\"Math\" : 85");
    }

    @Test
    void unknownDataTypeIsReportedAsText() throws Exception {
        when(portal.fetchUserData(eq("u-1"), eq("salary"), any())).thenReturn(Optional.empty());

        ToolResult result = tool.execute(invocation("{\"data_type\": \"salary\"}", caller));

        assertThat(result.content()).isEqualTo("Data type 'salary' not available.");
    }

    @Test
    void missingCredentialIsReportedBeforeAnythingElse() throws Exception {
        ToolResult result = tool.execute(invocation("{\"data_type\": \"marks\"}", UserContext.anonymous()));

        assertThat(result.success()).isFalse();
        assertThat(result.content()).isEqualTo(AuthenticationRequiredException.MISSING_CREDENTIAL);
        verifyNoInteractions(portal);
    }

    @Test
    void tokenWithoutUserIdIsRejected() throws Exception {
        UserContext tokenOnly = new UserContext(null, null, "token-1", null, null);

        ToolResult result = tool.execute(invocation("{\"data_type\": \"marks\"}", tokenOnly));

        assertThat(result.success()).isFalse();
        assertThat(result.content()).contains("not identified");
        verifyNoInteractions(portal);
    }

    @Test
    void rejectedCredentialBecomesToolText() throws Exception {
        when(portal.fetchUserData("u-1", "marks", "token-1"))
                .thenThrow(new AuthenticationRequiredException("The portal rejected the supplied credentials."));

        ToolResult result = tool.execute(invocation("{\"data_type\": \"marks\"}", caller));

        assertThat(result.success()).isFalse();
        assertThat(result.content()).isEqualTo("The portal rejected the supplied credentials.");
    }

    @Test
    void unreachablePortalBecomesToolText() throws Exception {
        when(portal.fetchUserData(any(), any(), any()))
                .thenThrow(new PortalUnavailableException("Internal portal integration not configured."));

        ToolResult result = tool.execute(invocation("{\"data_type\": \"attendance\"}", caller));

        assertThat(result.success()).isFalse();
        assertThat(result.content()).isEqualTo("Internal portal integration not configured.");
    }

    private ToolInvocation invocation(String json, UserContext user) throws Exception {
        return new ToolInvocation(objectMapper.readTree(json), new QueryScope(), user);
    }
}
