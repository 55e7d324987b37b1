package com.example.Orin.service;

import com.example.Orin.config.OrinProperties;
import com.example.Orin.exception.ModelUnavailableException;
import com.example.Orin.exception.RequestCancelledException;
import com.example.Orin.model.MetadataFilter;
import com.example.Orin.model.MetadataKeys;
import com.example.Orin.model.QueryResponse;
import com.example.Orin.model.SourceRecord;
import com.example.Orin.model.UserContext;
import com.example.Orin.orchestration.ModelReply;
import com.example.Orin.orchestration.ToolOrchestrator;
import com.example.Orin.repository.InMemoryIndexStore;
import com.example.Orin.service.loader.DocumentLoaderRegistry;
import com.example.Orin.service.loader.TextDocumentLoader;
import com.example.Orin.support.KeywordEmbeddingModel;
import com.example.Orin.support.ScriptedGenerativeModel;
import com.example.Orin.tools.ChatHistorySearchTool;
import com.example.Orin.tools.DocumentSearchTool;
import com.example.Orin.tools.ToolRegistry;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class QueryServiceTest {

    @TempDir
    Path tempDir;

    private InMemoryIndexStore store;
    private DocumentIngestionService ingestionService;
    private ScriptedGenerativeModel model;
    private QueryService queryService;

    @BeforeEach
    void setUp() {
        OrinProperties properties = new OrinProperties();
        properties.getMemory().setBackend("memory");
        store = new InMemoryIndexStore(KeywordEmbeddingModel.DIMENSIONS);
        EmbeddingGateway gateway = new EmbeddingGateway(new KeywordEmbeddingModel());
        ingestionService = new DocumentIngestionService(
                new DocumentLoaderRegistry(List.of(new TextDocumentLoader())), gateway, store, properties);
        RetrievalService retrieval = new RetrievalService(gateway, store);
        ToolRegistry tools = new ToolRegistry(List.of(
                new DocumentSearchTool(retrieval, properties),
                new ChatHistorySearchTool(retrieval, properties)));

        model = new ScriptedGenerativeModel();
        ToolOrchestrator orchestrator = new ToolOrchestrator(
                model, tools, new InMemoryChatMemoryStore(properties), new ObjectMapper(), properties);
        queryService = new QueryService(orchestrator, new ChatHistoryRecorder(ingestionService));
    }

    @Test
    void answersWithTheIngestedDocumentAsOnlySource() throws Exception {
        String sentence = "Employees are entitled to annual leave of twenty working days. ";
        String text = sentence.repeat(2500 / sentence.length() + 1).substring(0, 2500);
        Path file = Files.writeString(tempDir.resolve("leave-policy.txt"), text);
        List<String> ids = ingestionService.ingest(file, "HR", "policy", null);
        assertThat(ids).hasSizeGreaterThan(1);

        model.then(ModelReply.toolCall("c1", "search_documents",
                        "{\"query\": \"annual leave\", \"department\": \"HR\"}"))
                .then(ModelReply.answer("You get twenty working days of annual leave."));

        QueryResponse response = queryService.query("How much annual leave do I get?",
                new UserContext("u-1", "HR", null, "s-1", null));

        assertThat(response.success()).isTrue();
        assertThat(response.response()).isEqualTo("You get twenty working days of annual leave.");
        assertThat(response.toolsUsed()).containsExactly("search_documents");
        assertThat(response.sources()).extracting(SourceRecord::filename).containsExactly("leave-policy.txt");
        assertThat(response.error()).isNull();
    }

    @Test
    void successfulAnswerIsRecordedAsChatHistory() {
        model.then(ModelReply.answer("Office hours are nine to five."));

        queryService.query("When is the office open?", new UserContext("u-1", null, null, null, null));

        MetadataFilter history = MetadataFilter.none()
                .and(MetadataKeys.TYPE, MetadataKeys.TYPE_CHAT_HISTORY)
                .and(MetadataKeys.USER_ID, "u-1");
        assertThat(store.search(KeywordEmbeddingModel.vectorOf("office open"), 5, history))
                .singleElement()
                .satisfies(hit -> assertThat(hit.chunk().text())
                        .isEqualTo("Query: When is the office open?\nAnswer: Office hours are nine to five."));
    }

    @Test
    void anonymousQueriesAreNotRecorded() {
        model.then(ModelReply.answer("Hello."));

        queryService.query("Hi", UserContext.anonymous());

        assertThat(store.size()).isZero();
    }

    @Test
    void modelFailureBecomesApology() {
        model.then(request -> {
            throw new ModelUnavailableException("rate limited");
        });

        QueryResponse response = queryService.query("q", new UserContext("u-1", "HR", null, null, null));

        assertThat(response.success()).isFalse();
        assertThat(response.response()).isEqualTo(QueryService.APOLOGY);
        assertThat(response.error()).contains("rate limited");
        assertThat(response.sources()).isEmpty();
        assertThat(store.size()).isZero();
    }

    @Test
    void cancelledQueryWritesNoHistory() {
        ToolOrchestrator orchestrator = mock(ToolOrchestrator.class);
        ChatHistoryRecorder recorder = mock(ChatHistoryRecorder.class);
        when(orchestrator.run(anyString(), any())).thenThrow(new RequestCancelledException("client gone"));

        QueryResponse response = new QueryService(orchestrator, recorder)
                .query("q", new UserContext("u-1", "HR", null, null, null));

        assertThat(response.success()).isFalse();
        verify(recorder, never()).record(any(), any(), any(), any());
    }

    @Test
    void blankMessageIsRejected() {
        assertThatThrownBy(() -> queryService.query(" ", UserContext.anonymous()))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
