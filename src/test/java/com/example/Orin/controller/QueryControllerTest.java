package com.example.Orin.controller;

import com.example.Orin.model.QueryResponse;
import com.example.Orin.model.SourceRecord;
import com.example.Orin.model.UserContext;
import com.example.Orin.service.ChatMemoryStore;
import com.example.Orin.service.QueryService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class QueryControllerTest {

    private QueryService queryService;
    private ChatMemoryStore chatMemoryStore;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        queryService = mock(QueryService.class);
        chatMemoryStore = mock(ChatMemoryStore.class);
        mockMvc = MockMvcBuilders.standaloneSetup(new QueryController(queryService, chatMemoryStore)).build();
    }

    @Test
    void forwardsBearerTokenAndReturnsSources() throws Exception {
        when(queryService.query(eq("How much leave?"), any())).thenReturn(QueryResponse.success(
                "Twenty days.",
                List.of(new SourceRecord("leave-policy.pdf", "policy", "HR", "/docs/leave-policy.pdf")),
                List.of("search_documents")));

        mockMvc.perform(post("/api/orin/query")
                        .header("Authorization", "Bearer t-123")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"message\": \"How much leave?\", \"userId\": \"u-1\", \"department\": \"HR\", \"sessionId\": \"s-1\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.response").value("Twenty days."))
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.sources[0].filename").value("leave-policy.pdf"))
                .andExpect(jsonPath("$.sources[0].document_type").value("policy"))
                .andExpect(jsonPath("$.toolsUsed[0]").value("search_documents"))
                .andExpect(jsonPath("$.error").doesNotExist());

        ArgumentCaptor<UserContext> user = ArgumentCaptor.forClass(UserContext.class);
        verify(queryService).query(eq("How much leave?"), user.capture());
        assertThat(user.getValue()).isEqualTo(new UserContext("u-1", "HR", "t-123", "s-1", null));
    }

    @Test
    void clearsSessionMemory() throws Exception {
        mockMvc.perform(delete("/api/orin/sessions/s-1"))
                .andExpect(status().isOk());

        verify(chatMemoryStore).clear("s-1");
    }

    @Test
    void extractsTokenFromAuthorizationHeader() {
        assertThat(QueryController.extractToken("Bearer abc")).isEqualTo("abc");
        assertThat(QueryController.extractToken("bearer  abc ")).isEqualTo("abc");
        assertThat(QueryController.extractToken("abc")).isEqualTo("abc");
        assertThat(QueryController.extractToken("Bearer ")).isNull();
        assertThat(QueryController.extractToken(null)).isNull();
    }
}
