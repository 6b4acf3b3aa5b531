package com.anthem.dataproc.ingest.storage;

/**
 * A record could not be stored. Permanent unless it is a {@link TransientRecordStoreException}.
 */
public class RecordStoreException extends RuntimeException {

    public RecordStoreException(String message) {
        super(message);
    }

    public RecordStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
