package com.example.Orin.service.loader;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Set;

/**
 * Extracts raw text from one family of file formats.
 */
public interface DocumentLoader {

    /**
     * Lower-case extensions including the dot, e.g. {@code ".pdf"}.
     */
    Set<String> extensions();

    String load(Path path) throws IOException;
}
