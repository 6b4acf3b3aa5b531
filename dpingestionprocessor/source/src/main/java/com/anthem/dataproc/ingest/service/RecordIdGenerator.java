package com.anthem.dataproc.ingest.service;

import java.util.UUID;

@FunctionalInterface
public interface RecordIdGenerator {

    String nextId();

    static RecordIdGenerator randomUuid() {
        return () -> UUID.randomUUID().toString();
    }
}
