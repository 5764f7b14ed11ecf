package com.starscape.destinationtags.features.tagtransfer.domain;

import java.util.List;

/**
 * Outcome of a tag import.
 */
public record ImportReport(
    int imported,
    List<RecordFailure> failures
) {
    
    public ImportReport {
        failures = List.copyOf(failures);
    }
    
    public boolean hasFailures() {
        return !failures.isEmpty();
    }
    
    /**
     * A record that was skipped, identified by its key in the document.
     */
    public record RecordFailure(
        String recordKey,
        String field,
        String value,
        String message
    ) {}
}
