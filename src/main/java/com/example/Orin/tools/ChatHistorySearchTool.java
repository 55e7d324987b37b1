package com.example.Orin.tools;

import com.example.Orin.config.OrinProperties;
import com.example.Orin.model.MetadataFilter;
import com.example.Orin.model.MetadataKeys;
import com.example.Orin.model.ScoredChunk;
import com.example.Orin.service.RetrievalService;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Searches the caller's earlier conversations. Hits are context for the model,
 * not citations, so nothing is recorded in the request's scope.
 */
@Component
public class ChatHistorySearchTool implements AgentTool {

    public static final String NAME = "search_chat_history";

    private final RetrievalService retrievalService;
    private final OrinProperties.Retrieval settings;

    public ChatHistorySearchTool(RetrievalService retrievalService, OrinProperties properties) {
        this.retrievalService = retrievalService;
        this.settings = properties.getRetrieval();
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String description() {
        return "Search through previous chat conversations to provide consistent responses and context.";
    }

    @Override
    public String inputSchema() {
        return """
                {
                  "type": "object",
                  "properties": {
                    "query": {"type": "string", "description": "Topic of the earlier conversation"}
                  },
                  "required": ["query"]
                }
                """;
    }

    @Override
    public ToolResult execute(ToolInvocation invocation) {
        String query = invocation.argument("query");
        if (query == null) {
            return ToolResult.failure("Error searching chat history: a query is required.");
        }
        if (!invocation.user().hasUserId()) {
            return ToolResult.ok("No relevant chat history found.");
        }

        MetadataFilter filter = MetadataFilter.none()
                .and(MetadataKeys.TYPE, MetadataKeys.TYPE_CHAT_HISTORY)
                .and(MetadataKeys.USER_ID, invocation.user().userId());

        List<ScoredChunk> hits = retrievalService.search(query, settings.getHistoryTopK(), filter);
        if (hits.isEmpty()) {
            return ToolResult.ok("No relevant chat history found.");
        }

        StringBuilder sb = new StringBuilder("Previous relevant conversations:\n");
        for (int i = 0; i < hits.size(); i++) {
            if (i > 0) {
                sb.append("\n\n");
            }
            sb.append(i + 1).append(". ")
                    .append(RetrievalService.preview(hits.get(i).chunk().text(), settings.getHistoryPreviewLength()));
        }
        return ToolResult.ok(sb.toString());
    }
}
