package com.example.Orin.orchestration;

import com.example.Orin.model.SourceRecord;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Sources cited during one orchestration run.
 * <p>
 * One instance per request, created right before the tool loop and handed to every
 * tool invocation of that request. Records are deduplicated on the full
 * {@link SourceRecord} value and kept in first-seen order. Safe for concurrent
 * {@link #record} calls from tools of the same request.
 */
public final class QueryScope {

    private final Set<SourceRecord> sources = new LinkedHashSet<>();

    /**
     * Add every record with a usable filename that is not already present.
     */
    public synchronized void record(List<SourceRecord> records) {
        if (records == null) {
            return;
        }
        for (SourceRecord record : records) {
            if (record != null && record.hasUsableFilename()) {
                sources.add(record);
            }
        }
    }

    /**
     * Return the collected sources in first-seen order and empty the scope.
     */
    public synchronized List<SourceRecord> drain() {
        List<SourceRecord> drained = new ArrayList<>(sources);
        sources.clear();
        return drained;
    }

    public synchronized void reset() {
        sources.clear();
    }

    public synchronized int size() {
        return sources.size();
    }
}
