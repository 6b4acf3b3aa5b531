package com.anthem.dataproc.ingest.model;

import lombok.NonNull;
import lombok.Value;

@Value
public class RecordFailure {

    public static final String NOT_ATTEMPTED = "Not attempted: ingestion cancelled";

    @NonNull
    Record record;

    @NonNull
    String cause;

    public static RecordFailure notAttempted(Record record) {
        return new RecordFailure(record, NOT_ATTEMPTED);
    }
}
