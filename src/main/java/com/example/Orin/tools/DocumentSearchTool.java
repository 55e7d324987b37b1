package com.example.Orin.tools;

import com.example.Orin.config.OrinProperties;
import com.example.Orin.model.MetadataFilter;
import com.example.Orin.model.MetadataKeys;
import com.example.Orin.model.ScoredChunk;
import com.example.Orin.model.SourceRecord;
import com.example.Orin.service.RetrievalService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Searches official documents and records every citable hit in the request's scope.
 */
@Component
public class DocumentSearchTool implements AgentTool {

    private static final Logger log = LoggerFactory.getLogger(DocumentSearchTool.class);

    public static final String NAME = "search_documents";

    private final RetrievalService retrievalService;
    private final OrinProperties.Retrieval settings;

    public DocumentSearchTool(RetrievalService retrievalService, OrinProperties properties) {
        this.retrievalService = retrievalService;
        this.settings = properties.getRetrieval();
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String description() {
        return "Search through official documents, policies, and procedures. "
                + "Use this for general information queries.";
    }

    @Override
    public String inputSchema() {
        return """
                {
                  "type": "object",
                  "properties": {
                    "query": {"type": "string", "description": "What to look for"},
                    "document_type": {"type": "string", "description": "Optional document type, e.g. policy"},
                    "department": {"type": "string", "description": "Optional owning department, e.g. HR"}
                  },
                  "required": ["query"]
                }
                """;
    }

    @Override
    public ToolResult execute(ToolInvocation invocation) {
        String query = invocation.argument("query");
        if (query == null) {
            return ToolResult.failure("Error searching documents: a query is required.");
        }

        MetadataFilter filter = MetadataFilter.none()
                .and(MetadataKeys.TYPE, MetadataKeys.TYPE_OFFICIAL_DOCUMENT)
                .and(MetadataKeys.DOCUMENT_TYPE, invocation.argument(MetadataKeys.DOCUMENT_TYPE))
                .and(MetadataKeys.DEPARTMENT, invocation.argument(MetadataKeys.DEPARTMENT));

        List<ScoredChunk> hits = retrievalService.search(query, settings.getDocumentTopK(), filter);
        if (hits.isEmpty()) {
            return ToolResult.ok("No relevant documents found for your query.");
        }

        List<SourceRecord> sources = new ArrayList<>();
        StringBuilder sb = new StringBuilder("Relevant documents found:\n");
        for (int i = 0; i < hits.size(); i++) {
            ScoredChunk hit = hits.get(i);
            Optional<SourceRecord> source = SourceRecord.fromMetadata(hit.chunk().metadata());
            source.ifPresent(sources::add);

            if (i > 0) {
                sb.append("\n\n");
            }
            sb.append(i + 1).append(". ")
                    .append(RetrievalService.preview(hit.chunk().text(), settings.getDocumentPreviewLength()))
                    .append(" [Source: ")
                    .append(source.map(SourceRecord::filename).orElse("Unknown"))
                    .append("]");
        }

        if (invocation.scope() != null) {
            invocation.scope().record(sources);
        }
        log.debug("search_documents: {} hits, {} citable (filter={})", hits.size(), sources.size(), filter.constraints());
        return ToolResult.ok(sb.toString());
    }
}
