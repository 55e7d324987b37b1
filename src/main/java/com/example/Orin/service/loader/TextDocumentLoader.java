package com.example.Orin.service.loader;

import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Set;

@Component
public class TextDocumentLoader implements DocumentLoader {

    @Override
    public Set<String> extensions() {
        return Set.of(".txt");
    }

    @Override
    public String load(Path path) throws IOException {
        return Files.readString(path, StandardCharsets.UTF_8);
    }
}
