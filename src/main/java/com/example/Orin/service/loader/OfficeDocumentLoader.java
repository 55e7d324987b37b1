package com.example.Orin.service.loader;

import org.springframework.ai.document.Document;
import org.springframework.ai.reader.tika.TikaDocumentReader;
import org.springframework.core.io.FileSystemResource;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Word documents (.doc and .docx) through Apache Tika.
 */
@Component
public class OfficeDocumentLoader implements DocumentLoader {

    @Override
    public Set<String> extensions() {
        return Set.of(".doc", ".docx");
    }

    @Override
    public String load(Path path) {
        TikaDocumentReader reader = new TikaDocumentReader(new FileSystemResource(path));
        return reader.get().stream()
                .map(Document::getText)
                .filter(Objects::nonNull)
                .collect(Collectors.joining("\n\n"));
    }
}
