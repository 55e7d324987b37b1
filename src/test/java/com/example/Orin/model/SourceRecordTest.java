package com.example.Orin.model;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class SourceRecordTest {

    @Test
    void filenameFallsBackToLastSegmentOfSource() {
        assertThat(SourceRecord.fromMetadata(Map.of(
                "source", "/data/hr/leave-policy.pdf",
                "department", "HR",
                "document_type", "policy")))
                .contains(new SourceRecord("leave-policy.pdf", "policy", "HR", "/data/hr/leave-policy.pdf"));
    }

    @Test
    void explicitFilenameWins() {
        assertThat(SourceRecord.fromMetadata(Map.of("source", "/tmp/upload-123", "filename", "Handbook.docx")))
                .map(SourceRecord::filename)
                .contains("Handbook.docx");
    }

    @Test
    void metadataWithoutFilenameIsNotCitable() {
        assertThat(SourceRecord.fromMetadata(Map.of("department", "HR"))).isEmpty();
        assertThat(SourceRecord.fromMetadata(Map.of("filename", "unknown"))).isEmpty();
        assertThat(SourceRecord.fromMetadata(null)).isEmpty();
    }
}
