package com.anthem.dataproc.auth.keys;

import io.jsonwebtoken.JwtException;

/**
 * The token names a key id that is not in the current trusted key set.
 */
public class UnknownSigningKeyException extends JwtException {

    private final String keyId;

    public UnknownSigningKeyException(String keyId) {
        super("No trusted signing key for kid=" + keyId);
        this.keyId = keyId;
    }

    public String getKeyId() {
        return keyId;
    }
}
