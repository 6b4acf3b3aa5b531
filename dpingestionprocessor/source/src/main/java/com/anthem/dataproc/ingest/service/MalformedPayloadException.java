package com.anthem.dataproc.ingest.service;

public class MalformedPayloadException extends PayloadRejectedException {

    public MalformedPayloadException(String message, Throwable cause) {
        super(message, cause);
    }
}
