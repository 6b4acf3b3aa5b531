package com.anthem.dataproc.auth.model;

import java.util.Objects;

/**
 * Outcome of verifying a credential: either claims, or a classified failure with a
 * diagnostic reason. Never carries the credential itself.
 */
public final class VerificationResult {

    private final IdentityClaims claims;
    private final FailureKind failureKind;
    private final String reason;

    private VerificationResult(IdentityClaims claims, FailureKind failureKind, String reason) {
        this.claims = claims;
        this.failureKind = failureKind;
        this.reason = reason;
    }

    public static VerificationResult verified(IdentityClaims claims) {
        return new VerificationResult(Objects.requireNonNull(claims, "claims"), null, null);
    }

    public static VerificationResult failed(FailureKind kind, String reason) {
        return new VerificationResult(null, Objects.requireNonNull(kind, "kind"), reason);
    }

    public boolean isVerified() {
        return claims != null;
    }

    /**
     * @throws IllegalStateException if verification failed
     */
    public IdentityClaims getClaims() {
        if (claims == null) {
            throw new IllegalStateException("Verification failed: " + failureKind);
        }
        return claims;
    }

    public FailureKind getFailureKind() {
        return failureKind;
    }

    public String getReason() {
        return reason;
    }

    @Override
    public String toString() {
        return isVerified()
                ? "VerificationResult[verified, subject=" + claims.getSubject() + "]"
                : "VerificationResult[" + failureKind + ", reason=" + reason + "]";
    }
}
