package com.anthem.dataproc.ingest.service;

/**
 * The whole payload was refused before any record was produced.
 */
public abstract class PayloadRejectedException extends RuntimeException {

    protected PayloadRejectedException(String message) {
        super(message);
    }

    protected PayloadRejectedException(String message, Throwable cause) {
        super(message, cause);
    }
}
