package com.anthem.dataproc.auth.service;

import com.anthem.dataproc.auth.model.AuthorizationDecision;
import com.anthem.dataproc.auth.model.Effect;
import com.anthem.dataproc.auth.model.IdentityClaims;
import com.anthem.dataproc.auth.model.VerificationResult;

/**
 * Maps a verification outcome onto an Allow/Deny decision for one resource.
 */
public class PolicyDecisionBuilder {

    public static final String ANONYMOUS_PRINCIPAL = "anonymous";
    public static final String DEFAULT_ROLE = "USER";
    public static final String GUEST_ROLE = "GUEST";

    public static final String CONTEXT_SUBJECT = "subject";
    public static final String CONTEXT_EMAIL = "email";
    public static final String CONTEXT_ROLE = "role";

    /**
     * @param verification outcome of {@link CredentialVerifier#verify(String)}
     * @param resource     the invoked operation; a decision is bound to exactly this resource
     * @throws IllegalArgumentException if resource is null or blank
     */
    public AuthorizationDecision decide(VerificationResult verification, String resource) {
        if (resource == null || resource.isBlank()) {
            throw new IllegalArgumentException("resource must identify the invoked operation");
        }

        if (!verification.isVerified()) {
            return AuthorizationDecision.builder()
                    .principal(ANONYMOUS_PRINCIPAL)
                    .effect(Effect.DENY)
                    .resource(resource)
                    .contextEntry(CONTEXT_ROLE, GUEST_ROLE)
                    .build();
        }

        IdentityClaims claims = verification.getClaims();
        AuthorizationDecision.AuthorizationDecisionBuilder decision = AuthorizationDecision.builder()
                .principal(claims.getSubject())
                .effect(Effect.ALLOW)
                .resource(resource)
                .contextEntry(CONTEXT_SUBJECT, claims.getSubject())
                .contextEntry(CONTEXT_ROLE, claims.getRole().orElse(DEFAULT_ROLE));
        claims.getEmail().ifPresent(email -> decision.contextEntry(CONTEXT_EMAIL, email));
        return decision.build();
    }
}
