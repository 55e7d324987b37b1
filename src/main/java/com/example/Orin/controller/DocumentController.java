package com.example.Orin.controller;

import com.example.Orin.model.IngestRequest;
import com.example.Orin.model.IngestResponse;
import com.example.Orin.model.SearchHit;
import com.example.Orin.service.DocumentIngestionService;
import com.example.Orin.service.RetrievalService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/orin/documents")
@RequiredArgsConstructor
public class DocumentController {

    private final DocumentIngestionService ingestionService;
    private final RetrievalService retrievalService;

    /**
     * Index a document already present on the server.
     *  POST /api/orin/documents
     *  {
     *    "path": "/data/policies/leave-policy.pdf",
     *    "department": "HR",
     *    "documentType": "policy"
     *  }
     */
    @PostMapping
    public IngestResponse ingest(@RequestBody IngestRequest request) throws IOException {
        if (request.path() == null || request.path().isBlank()) {
            throw new IllegalArgumentException("path must not be blank");
        }
        Path path = Path.of(request.path());
        List<String> ids = ingestionService.ingest(
                path, request.department(), request.documentType(), request.extraMetadata());
        return new IngestResponse(
                "Document '" + path.getFileName() + "' indexed into " + ids.size() + " chunks", ids, true);
    }

    @DeleteMapping
    public Map<String, Object> delete(@RequestBody List<String> chunkIds) {
        int removed = ingestionService.delete(chunkIds);
        return Map.of("requested", chunkIds.size(), "deleted", removed);
    }

    /**
     * Search official documents directly, without the assistant.
     *  GET /api/orin/documents/search?query=annual+leave&department=HR
     */
    @GetMapping("/search")
    public List<SearchHit> search(
            @RequestParam("query") String query,
            @RequestParam(value = "department", required = false) String department,
            @RequestParam(value = "documentType", required = false) String documentType,
            @RequestParam(value = "limit", defaultValue = "5") int limit
    ) {
        return retrievalService.searchDocuments(query, limit, department, documentType);
    }
}
