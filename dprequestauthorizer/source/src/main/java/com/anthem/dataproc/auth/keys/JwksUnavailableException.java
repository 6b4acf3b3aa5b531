package com.anthem.dataproc.auth.keys;

/**
 * The signing-key set could not be fetched or parsed.
 */
public class JwksUnavailableException extends RuntimeException {

    public JwksUnavailableException(String message) {
        super(message);
    }

    public JwksUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
