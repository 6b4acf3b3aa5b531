package com.anthem.dataproc.auth.service;

import com.anthem.dataproc.auth.config.AuthorizerConfig;
import com.anthem.dataproc.auth.keys.SigningKeyLocator;
import com.anthem.dataproc.auth.keys.TrustedKeySet;
import com.anthem.dataproc.auth.keys.TrustedKeyStore;
import com.anthem.dataproc.auth.model.FailureKind;
import com.anthem.dataproc.auth.model.IdentityClaims;
import com.anthem.dataproc.auth.model.VerificationResult;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.IncorrectClaimException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.MalformedJwtException;
import io.jsonwebtoken.MissingClaimException;
import io.jsonwebtoken.UnsupportedJwtException;
import io.jsonwebtoken.security.SecurityException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Date;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Verifies bearer JWTs issued by the identity provider.
 *
 * <p>Checks run in order and stop at the first failure: structure, signature against the
 * trusted key set, issuer and audience, expiry. The result is a pure function of the token,
 * the current key snapshot and the clock; nothing is cached and the token is never logged.</p>
 */
public class CredentialVerifier {

    private static final Logger log = LoggerFactory.getLogger(CredentialVerifier.class);

    private static final Pattern BASE64URL_SEGMENT = Pattern.compile("[A-Za-z0-9_-]+={0,2}");

    private final TrustedKeyStore keyStore;
    private final AuthorizerConfig config;
    private final Clock clock;

    public CredentialVerifier(TrustedKeyStore keyStore, AuthorizerConfig config, Clock clock) {
        this.keyStore = keyStore;
        this.config = config;
        this.clock = clock;
    }

    /**
     * Verify a credential and extract its claims.
     *
     * @param credential compact JWS with any "Bearer " prefix already removed
     * @return verified claims, or a classified failure
     */
    public VerificationResult verify(String credential) {
        if (credential == null || credential.isBlank()) {
            return VerificationResult.failed(FailureKind.MISSING_CREDENTIAL, "No credential presented");
        }
        if (!isWellFormed(credential)) {
            return VerificationResult.failed(FailureKind.MALFORMED_CREDENTIAL, "Not a compact JWS");
        }

        TrustedKeySet keys = keyStore.current();
        SigningKeyLocator locator = new SigningKeyLocator(keys);
        try {
            Claims claims = Jwts.parser()
                    .keyLocator(locator)
                    .requireIssuer(config.getExpectedIssuer())
                    .clock(() -> Date.from(clock.instant()))
                    .clockSkewSeconds(config.getClockSkew().getSeconds())
                    .build()
                    .parseSignedClaims(credential)
                    .getPayload();

            if (!audienceMatches(claims)) {
                return invalid("Audience mismatch");
            }
            if (claims.getExpiration() == null) {
                return invalid("Token has no expiry");
            }
            if (claims.getSubject() == null || claims.getSubject().isBlank()) {
                return invalid("Token has no subject");
            }

            return VerificationResult.verified(IdentityClaims.builder()
                    .subject(claims.getSubject())
                    .email(stringClaim(claims, "email"))
                    .role(stringClaim(claims, config.getRoleClaim()))
                    .expiry(claims.getExpiration().toInstant())
                    .build());

        } catch (JwtException e) {
            return classify(e, locator, keys);
        }
    }

    private VerificationResult classify(JwtException e, SigningKeyLocator locator, TrustedKeySet keys) {
        if (locator.wasKeyUnknown()) {
            log.warn("Token signed with unknown key: kid={}, knownKids={}, keysLoadedAt={}",
                    locator.getUnknownKeyId(), keys.keyIds(), keys.getLoadedAt());
            keyStore.requestRotation();
            return invalid("Unknown signing key");
        }
        if (e instanceof ExpiredJwtException) {
            return invalid("Token expired");
        }
        if (e instanceof IncorrectClaimException || e instanceof MissingClaimException) {
            return invalid("Issuer mismatch");
        }
        if (e instanceof MalformedJwtException) {
            return VerificationResult.failed(FailureKind.MALFORMED_CREDENTIAL, "Unparseable token");
        }
        if (e instanceof UnsupportedJwtException) {
            return invalid("Unsupported token type");
        }
        if (e instanceof SecurityException) {
            return invalid("Signature not trusted");
        }
        return invalid("Token rejected: " + e.getClass().getSimpleName());
    }

    private VerificationResult invalid(String reason) {
        log.debug("Credential rejected: reason={}", reason);
        return VerificationResult.failed(FailureKind.INVALID_CREDENTIAL, reason);
    }

    private boolean isWellFormed(String credential) {
        String[] segments = credential.split("\\.", -1);
        if (segments.length != 3) {
            return false;
        }
        for (String segment : segments) {
            if (!BASE64URL_SEGMENT.matcher(segment).matches()) {
                return false;
            }
        }
        return true;
    }

    /**
     * ID tokens carry the app client in {@code aud}; Cognito access tokens carry it in
     * {@code client_id} and have no {@code aud}.
     */
    private boolean audienceMatches(Claims claims) {
        String expected = config.getExpectedAudience();
        Set<String> audience = claims.getAudience();
        if (audience != null && audience.contains(expected)) {
            return true;
        }
        return expected.equals(stringClaim(claims, "client_id"));
    }

    private static String stringClaim(Claims claims, String name) {
        Object value = claims.get(name);
        return value instanceof String ? (String) value : null;
    }
}
