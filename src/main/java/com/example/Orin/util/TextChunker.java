package com.example.Orin.util;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits text into overlapping windows of at most {@code size} characters.
 * <p>
 * A window ends at the latest paragraph break, line break, sentence end or space
 * found in its second half, and is hard-cut at {@code size} when none exists.
 * The next window starts up to {@code overlap} characters earlier, moved forward
 * to a word boundary. The output depends only on the input and the parameters.
 */
public final class TextChunker {

    private TextChunker() {
    }

    private static final String[] SEPARATORS = {"\n\n", "\n", ". ", "! ", "? ", " "};

    public static List<String> split(String text, int size, int overlap) {
        if (size <= 0) {
            throw new IllegalArgumentException("size must be positive, got " + size);
        }
        if (overlap < 0 || overlap >= size) {
            throw new IllegalArgumentException("overlap must be in [0, size), got " + overlap);
        }
        if (text == null || text.isBlank()) {
            return List.of();
        }

        List<String> chunks = new ArrayList<>();
        int length = text.length();
        int start = 0;
        while (start < length) {
            int end = Math.min(start + size, length);
            if (end < length) {
                end = findBreak(text, start, end, size, overlap);
            }

            String piece = text.substring(start, end).strip();
            if (!piece.isEmpty()) {
                chunks.add(piece);
            }
            if (end >= length) {
                break;
            }

            int next = end - overlap;
            if (next <= start) {
                next = end;
            }
            start = alignToWordStart(text, next, end);
        }
        return chunks;
    }

    private static int findBreak(String text, int start, int end, int size, int overlap) {
        int earliest = start + Math.max(overlap + 1, size / 2);
        if (earliest >= end) {
            return end;
        }
        for (String separator : SEPARATORS) {
            int pos = text.lastIndexOf(separator, end - separator.length());
            if (pos >= start && pos + separator.length() >= earliest) {
                return pos + separator.length();
            }
        }
        return end;
    }

    private static int alignToWordStart(String text, int position, int limit) {
        if (position <= 0 || Character.isWhitespace(text.charAt(position - 1))) {
            return position;
        }
        for (int i = position; i < limit; i++) {
            if (Character.isWhitespace(text.charAt(i))) {
                return i + 1;
            }
        }
        return position;
    }
}
