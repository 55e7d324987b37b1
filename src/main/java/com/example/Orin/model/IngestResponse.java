package com.example.Orin.model;

import java.util.List;

public record IngestResponse(
        String message,
        List<String> chunkIds,
        boolean success
) {
}
