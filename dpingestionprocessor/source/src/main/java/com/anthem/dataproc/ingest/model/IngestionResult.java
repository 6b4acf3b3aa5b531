package com.anthem.dataproc.ingest.model;

import lombok.Value;

import java.util.List;
import java.util.Optional;

/**
 * Outcome of writing one batch. Failures are in input order.
 */
@Value
public class IngestionResult {

    int recordsWritten;

    List<RecordFailure> failures;

    public IngestionResult(int recordsWritten, List<RecordFailure> failures) {
        this.recordsWritten = recordsWritten;
        this.failures = List.copyOf(failures);
    }

    public static IngestionResult empty() {
        return new IngestionResult(0, List.of());
    }

    /**
     * Written plus failed, including records never started because the batch was cancelled.
     */
    public int recordsAttempted() {
        return recordsWritten + failures.size();
    }

    public boolean isCompleteSuccess() {
        return failures.isEmpty();
    }

    public boolean isTotalFailure() {
        return recordsWritten == 0 && !failures.isEmpty();
    }

    public Optional<RecordFailure> firstFailure() {
        return failures.stream().findFirst();
    }
}
