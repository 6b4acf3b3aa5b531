package com.anthem.dataproc.ingest.model;

import lombok.NonNull;
import lombok.Value;

/**
 * One non-blank line of an uploaded payload, addressed by a generated id.
 */
@Value
public class Record {

    @NonNull
    String id;

    @NonNull
    String content;
}
