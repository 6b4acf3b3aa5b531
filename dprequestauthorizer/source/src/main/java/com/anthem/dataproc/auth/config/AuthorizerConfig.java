package com.anthem.dataproc.auth.config;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.util.Map;

/**
 * Authorizer settings, read once per cold start from the Lambda environment.
 */
@Value
@Builder(toBuilder = true)
public class AuthorizerConfig {

    public static final String DEFAULT_ROLE_CLAIM = "custom:role";

    @Builder.Default
    String region = "us-east-1";

    @Builder.Default
    String environment = "dev";

    /**
     * Expected {@code iss}, e.g. https://cognito-idp.us-east-1.amazonaws.com/us-east-1_AbCdEf
     */
    String expectedIssuer;

    /**
     * Expected audience: {@code aud} of an ID token or {@code client_id} of an access token.
     */
    String expectedAudience;

    String jwksUrl;

    /**
     * When set, the key set is read from this Secrets Manager secret instead of {@link #jwksUrl}.
     */
    String jwksSecretId;

    @Builder.Default
    String roleClaim = DEFAULT_ROLE_CLAIM;

    @Builder.Default
    Duration clockSkew = Duration.ZERO;

    @Builder.Default
    Duration keyRotationMinInterval = Duration.ofMinutes(5);

    @Builder.Default
    Duration jwksTimeout = Duration.ofSeconds(3);

    public static AuthorizerConfig fromEnvironment() {
        return fromEnvironment(System.getenv());
    }

    public static AuthorizerConfig fromEnvironment(Map<String, String> env) {
        String issuer = required(env, "TOKEN_ISSUER");
        String issuerBase = issuer.endsWith("/") ? issuer.substring(0, issuer.length() - 1) : issuer;
        return AuthorizerConfig.builder()
                .region(env.getOrDefault("AWS_REGION", "us-east-1"))
                .environment(env.getOrDefault("ENVIRONMENT", "dev"))
                .expectedIssuer(issuer)
                .expectedAudience(required(env, "TOKEN_AUDIENCE"))
                .jwksUrl(env.getOrDefault("JWKS_URL", issuerBase + "/.well-known/jwks.json"))
                .jwksSecretId(blankToNull(env.get("JWKS_SECRET_ID")))
                .roleClaim(env.getOrDefault("ROLE_CLAIM", DEFAULT_ROLE_CLAIM))
                .clockSkew(Duration.ofSeconds(Long.parseLong(env.getOrDefault("CLOCK_SKEW_SECONDS", "0"))))
                .keyRotationMinInterval(Duration.ofSeconds(
                        Long.parseLong(env.getOrDefault("KEY_ROTATION_MIN_INTERVAL_SECONDS", "300"))))
                .jwksTimeout(Duration.ofMillis(Long.parseLong(env.getOrDefault("JWKS_TIMEOUT_MILLIS", "3000"))))
                .build();
    }

    public boolean usesSecretsManager() {
        return jwksSecretId != null;
    }

    private static String required(Map<String, String> env, String name) {
        String value = blankToNull(env.get(name));
        if (value == null) {
            throw new IllegalStateException("Missing required environment variable: " + name);
        }
        return value;
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
