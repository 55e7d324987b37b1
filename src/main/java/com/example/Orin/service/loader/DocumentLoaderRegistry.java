package com.example.Orin.service.loader;

import com.example.Orin.exception.UnsupportedFormatException;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Explicit extension to loader mapping. Unknown extensions are rejected, never guessed.
 */
@Component
public class DocumentLoaderRegistry {

    private final Map<String, DocumentLoader> loadersByExtension;

    public DocumentLoaderRegistry(List<DocumentLoader> loaders) {
        Map<String, DocumentLoader> tmp = new TreeMap<>();
        for (DocumentLoader loader : loaders) {
            for (String extension : loader.extensions()) {
                DocumentLoader previous = tmp.put(extension.toLowerCase(Locale.ROOT), loader);
                if (previous != null) {
                    throw new IllegalStateException("Duplicate loader for extension " + extension);
                }
            }
        }
        this.loadersByExtension = Collections.unmodifiableMap(tmp);
    }

    public DocumentLoader resolve(Path path) {
        String extension = extensionOf(path);
        DocumentLoader loader = loadersByExtension.get(extension);
        if (loader == null) {
            throw new UnsupportedFormatException(extension,
                    "Unsupported file type '" + extension + "' for " + path.getFileName()
                            + ". Allowed: " + supportedExtensions());
        }
        return loader;
    }

    public Set<String> supportedExtensions() {
        return loadersByExtension.keySet();
    }

    static String extensionOf(Path path) {
        Path fileName = path.getFileName();
        String name = fileName == null ? "" : fileName.toString();
        int dot = name.lastIndexOf('.');
        return dot < 0 ? "" : name.substring(dot).toLowerCase(Locale.ROOT);
    }
}
