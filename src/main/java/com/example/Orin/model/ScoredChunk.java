package com.example.Orin.model;

public record ScoredChunk(IndexedChunk chunk, double score) {
}
