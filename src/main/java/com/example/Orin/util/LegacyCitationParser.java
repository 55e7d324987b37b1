package com.example.Orin.util;

import com.example.Orin.model.SourceRecord;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Handles the inline citation block older model prompts produced:
 * <pre>
 * answer text
 * --- SOURCES ---
 * • policy.pdf
 * • handbook.docx
 * </pre>
 * Everything from the marker on is hidden from the user and can be read back
 * as filename-only source records.
 */
public final class LegacyCitationParser {

    private LegacyCitationParser() {
    }

    public static final String MARKER = "--- SOURCES ---";
    private static final String BULLET = "•";

    /** Answer text with the marker and everything after it removed. */
    public static String strip(String answer) {
        if (answer == null) {
            return "";
        }
        int markerAt = answer.indexOf(MARKER);
        String visible = markerAt < 0 ? answer : answer.substring(0, markerAt);
        return visible.strip();
    }

    public static boolean hasCitationBlock(String answer) {
        return answer != null && answer.contains(MARKER);
    }

    /** Filename-only records for every bulleted line after the marker, first occurrence wins. */
    public static List<SourceRecord> parse(String answer) {
        if (!hasCitationBlock(answer)) {
            return List.of();
        }
        String block = answer.substring(answer.indexOf(MARKER) + MARKER.length());
        Set<SourceRecord> records = new LinkedHashSet<>();
        for (String line : block.split("\\R")) {
            String trimmed = line.strip();
            if (!trimmed.startsWith(BULLET)) {
                continue;
            }
            SourceRecord record = SourceRecord.ofFilename(trimmed.substring(BULLET.length()).strip());
            if (record.hasUsableFilename()) {
                records.add(record);
            }
        }
        return new ArrayList<>(records);
    }
}
