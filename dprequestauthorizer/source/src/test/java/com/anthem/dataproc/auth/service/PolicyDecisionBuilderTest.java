package com.anthem.dataproc.auth.service;

import com.anthem.dataproc.auth.model.AuthorizationDecision;
import com.anthem.dataproc.auth.model.Effect;
import com.anthem.dataproc.auth.model.FailureKind;
import com.anthem.dataproc.auth.model.IdentityClaims;
import com.anthem.dataproc.auth.model.VerificationResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PolicyDecisionBuilderTest {

    private static final String RESOURCE = "arn:aws:execute-api:us-east-1:123456789012:abc123/prod/POST/app";

    private PolicyDecisionBuilder builder;

    @BeforeEach
    void setUp() {
        builder = new PolicyDecisionBuilder();
    }

    @Test
    void decide_verifiedClaims_allowsWithIdentityContext() {
        IdentityClaims claims = IdentityClaims.builder()
                .subject("user-123")
                .email("user@example.com")
                .role("ADMIN")
                .expiry(Instant.parse("2026-03-01T13:00:00Z"))
                .build();

        AuthorizationDecision decision = builder.decide(VerificationResult.verified(claims), RESOURCE);

        assertThat(decision.getEffect()).isEqualTo(Effect.ALLOW);
        assertThat(decision.getPrincipal()).isEqualTo("user-123");
        assertThat(decision.getResource()).isEqualTo(RESOURCE);
        assertThat(decision.getContext()).containsExactlyInAnyOrderEntriesOf(Map.of(
                "subject", "user-123",
                "email", "user@example.com",
                "role", "ADMIN"));
    }

    @Test
    void decide_claimsWithoutRole_defaultsToUser() {
        IdentityClaims claims = IdentityClaims.builder()
                .subject("user-123")
                .expiry(Instant.parse("2026-03-01T13:00:00Z"))
                .build();

        AuthorizationDecision decision = builder.decide(VerificationResult.verified(claims), RESOURCE);

        assertThat(decision.getContext()).containsEntry("role", "USER");
        assertThat(decision.getContext()).doesNotContainKey("email");
    }

    @Test
    void decide_blankRoleClaim_defaultsToUser() {
        IdentityClaims claims = IdentityClaims.builder()
                .subject("user-123")
                .role("  ")
                .expiry(Instant.parse("2026-03-01T13:00:00Z"))
                .build();

        assertThat(builder.decide(VerificationResult.verified(claims), RESOURCE).getContext())
                .containsEntry("role", "USER");
    }

    @ParameterizedTest
    @EnumSource(FailureKind.class)
    void decide_anyFailure_deniesAnonymousGuest(FailureKind kind) {
        AuthorizationDecision decision = builder.decide(VerificationResult.failed(kind, "test"), RESOURCE);

        assertThat(decision.getEffect()).isEqualTo(Effect.DENY);
        assertThat(decision.getPrincipal()).isEqualTo("anonymous");
        assertThat(decision.getResource()).isEqualTo(RESOURCE);
        assertThat(decision.getContext()).containsExactlyEntriesOf(Map.of("role", "GUEST"));
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"   "})
    void decide_withoutResource_isRejected(String resource) {
        VerificationResult failed = VerificationResult.failed(FailureKind.MISSING_CREDENTIAL, "none");

        assertThatThrownBy(() -> builder.decide(failed, resource))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void decide_isBoundToTheGivenResource() {
        IdentityClaims claims = IdentityClaims.builder()
                .subject("user-123")
                .expiry(Instant.parse("2026-03-01T13:00:00Z"))
                .build();
        String other = "arn:aws:execute-api:us-east-1:123456789012:abc123/prod/GET/status";

        AuthorizationDecision first = builder.decide(VerificationResult.verified(claims), RESOURCE);
        AuthorizationDecision second = builder.decide(VerificationResult.verified(claims), other);

        assertThat(first.getResource()).isEqualTo(RESOURCE);
        assertThat(second.getResource()).isEqualTo(other);
    }
}
