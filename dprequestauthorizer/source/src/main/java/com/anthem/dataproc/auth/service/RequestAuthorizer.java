package com.anthem.dataproc.auth.service;

import com.anthem.dataproc.auth.model.AuthorizationDecision;
import com.anthem.dataproc.auth.model.MethodArn;
import com.anthem.dataproc.auth.model.VerificationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns a bearer credential into an authorization decision for one resource.
 * Decisions are computed fresh on every call and never cached.
 */
public class RequestAuthorizer {

    private static final Logger log = LoggerFactory.getLogger(RequestAuthorizer.class);

    private final CredentialVerifier verifier;
    private final PolicyDecisionBuilder decisionBuilder;

    public RequestAuthorizer(CredentialVerifier verifier, PolicyDecisionBuilder decisionBuilder) {
        this.verifier = verifier;
        this.decisionBuilder = decisionBuilder;
    }

    /**
     * @param credential bearer token, empty when the caller sent no Authorization header,
     *                   null when the request carries no credential source at all
     * @param resource   the invoked operation (method ARN)
     * @throws UnauthorizedRequestException if {@code credential} is null
     */
    public AuthorizationDecision authorize(String credential, String resource) {
        if (credential == null) {
            log.warn("Rejecting request without credential source: resource={}", describe(resource));
            throw new UnauthorizedRequestException();
        }

        VerificationResult verification = verifier.verify(credential);
        AuthorizationDecision decision = decisionBuilder.decide(verification, resource);

        if (decision.isAllowed()) {
            log.info("Authorization decision: principal={}, effect={}, resource={}",
                    decision.getPrincipal(), decision.getEffect().getValue(), describe(resource));
        } else {
            log.warn("Authorization decision: principal={}, effect={}, resource={}, failure={}, reason={}",
                    decision.getPrincipal(), decision.getEffect().getValue(), describe(resource),
                    verification.getFailureKind(), verification.getReason());
        }
        return decision;
    }

    private static String describe(String resource) {
        return MethodArn.parse(resource).map(MethodArn::signature).orElse(resource);
    }
}
