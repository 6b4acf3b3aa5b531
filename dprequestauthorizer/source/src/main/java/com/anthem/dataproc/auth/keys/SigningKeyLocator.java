package com.anthem.dataproc.auth.keys;

import io.jsonwebtoken.JwsHeader;
import io.jsonwebtoken.LocatorAdapter;

import java.security.Key;
import java.util.Optional;

/**
 * Resolves the verification key for a JWS from one key-set snapshot.
 * One instance per verification; remembers whether the key id was unknown.
 */
public class SigningKeyLocator extends LocatorAdapter<Key> {

    private final TrustedKeySet keySet;
    private String unknownKeyId;
    private boolean unknownKey;

    public SigningKeyLocator(TrustedKeySet keySet) {
        this.keySet = keySet;
    }

    @Override
    protected Key locate(JwsHeader header) {
        String keyId = header.getKeyId();
        Optional<Key> key = keySet.find(keyId);
        if (key.isEmpty()) {
            unknownKey = true;
            unknownKeyId = keyId;
            throw new UnknownSigningKeyException(keyId);
        }
        return key.get();
    }

    public boolean wasKeyUnknown() {
        return unknownKey;
    }

    public String getUnknownKeyId() {
        return unknownKeyId;
    }
}
