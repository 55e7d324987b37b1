package com.example.Orin.exception;

/** Thrown when a document's extension has no registered loader. */
public class UnsupportedFormatException extends RuntimeException {

    private final String extension;

    public UnsupportedFormatException(String extension, String message) {
        super(message);
        this.extension = extension;
    }

    public String getExtension() {
        return extension;
    }

    public String getUserMessage() {
        return "Unsupported file type. Allowed: .pdf, .txt, .doc, .docx";
    }
}
