package com.anthem.dataproc.ingest.storage;

/**
 * Throttling, a 5xx from the store, or a client-side I/O failure. Worth retrying.
 */
public class TransientRecordStoreException extends RecordStoreException {

    public TransientRecordStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
