package com.example.Orin.orchestration;

import com.example.Orin.model.SourceRecord;

import java.util.List;

/**
 * Result of one orchestration run.
 *
 * @param answer       answer text with any legacy citation block removed
 * @param sources      citations, structured ones if any were recorded, else parsed legacy ones
 * @param toolsInvoked tool names in dispatch order
 * @param iterations   number of tool dispatch steps taken
 * @param exhausted    true when the iteration cap ended the run
 */
public record OrchestrationOutcome(
        String answer,
        List<SourceRecord> sources,
        List<String> toolsInvoked,
        int iterations,
        boolean exhausted
) {
}
