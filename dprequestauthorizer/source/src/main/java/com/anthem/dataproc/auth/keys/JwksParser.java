package com.anthem.dataproc.auth.keys;

import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.security.Jwk;
import io.jsonwebtoken.security.JwkSet;
import io.jsonwebtoken.security.Jwks;
import io.jsonwebtoken.security.PublicJwk;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.security.Key;
import java.security.PublicKey;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Turns a JWK Set document into a {@link TrustedKeySet} of public signing keys.
 */
public class JwksParser {

    private static final Logger log = LoggerFactory.getLogger(JwksParser.class);

    static final String NO_KEY_ID = "";

    public TrustedKeySet parse(String json, Instant loadedAt) {
        JwkSet jwkSet;
        try {
            jwkSet = Jwks.setParser().build().parse(json);
        } catch (JwtException | IllegalArgumentException e) {
            throw new JwksUnavailableException("Invalid JWK Set document: " + e.getMessage(), e);
        }

        Map<String, Key> keys = new LinkedHashMap<>();
        for (Jwk<?> jwk : jwkSet.getKeys()) {
            if (!(jwk instanceof PublicJwk)) {
                log.warn("Ignoring non-public JWK: kid={}, kty={}", jwk.getId(), jwk.getType());
                continue;
            }
            PublicJwk<?> publicJwk = (PublicJwk<?>) jwk;
            if ("enc".equals(publicJwk.getPublicKeyUse())) {
                log.debug("Ignoring encryption JWK: kid={}", jwk.getId());
                continue;
            }
            PublicKey key = publicJwk.toKey();
            keys.put(jwk.getId() != null ? jwk.getId() : NO_KEY_ID, key);
        }
        return TrustedKeySet.of(keys, loadedAt);
    }
}
