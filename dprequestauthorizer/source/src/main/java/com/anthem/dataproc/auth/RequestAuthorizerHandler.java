package com.anthem.dataproc.auth;

import com.amazonaws.services.lambda.runtime.Context;
import com.amazonaws.services.lambda.runtime.RequestHandler;
import com.anthem.dataproc.auth.config.AuthorizerConfig;
import com.anthem.dataproc.auth.keys.HttpJwksSource;
import com.anthem.dataproc.auth.keys.JwksSource;
import com.anthem.dataproc.auth.keys.SecretsManagerJwksSource;
import com.anthem.dataproc.auth.keys.TrustedKeyStore;
import com.anthem.dataproc.auth.model.AuthPolicy;
import com.anthem.dataproc.auth.model.AuthRequest;
import com.anthem.dataproc.auth.model.AuthorizationDecision;
import com.anthem.dataproc.auth.service.CredentialVerifier;
import com.anthem.dataproc.auth.service.PolicyDecisionBuilder;
import com.anthem.dataproc.auth.service.RequestAuthorizer;
import com.anthem.dataproc.auth.service.UnauthorizedRequestException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.secretsmanager.SecretsManagerClient;

import java.time.Clock;

/**
 * AWS Lambda Authorizer for the data processing API.
 * Validates identity provider bearer tokens and returns an IAM policy for the invoked method.
 *
 * Accepts both authorizer types:
 * - TOKEN (authorizationToken)
 * - REQUEST (Authorization header, optional x-api-key for usage plans)
 */
public class RequestAuthorizerHandler implements RequestHandler<AuthRequest, AuthPolicy> {

    private static final Logger log = LoggerFactory.getLogger(RequestAuthorizerHandler.class);

    static final String AUTHORIZATION_HEADER = "Authorization";
    static final String API_KEY_HEADER = "x-api-key";
    private static final String BEARER_PREFIX = "bearer ";

    private final RequestAuthorizer authorizer;

    public RequestAuthorizerHandler() {
        this(AuthorizerConfig.fromEnvironment());
    }

    private RequestAuthorizerHandler(AuthorizerConfig config) {
        Clock clock = Clock.systemUTC();
        TrustedKeyStore keyStore = new TrustedKeyStore(jwksSource(config), clock, config.getKeyRotationMinInterval());
        keyStore.load();
        this.authorizer = new RequestAuthorizer(
                new CredentialVerifier(keyStore, config, clock),
                new PolicyDecisionBuilder());
        log.info("Authorizer initialized: environment={}, issuer={}", config.getEnvironment(), config.getExpectedIssuer());
    }

    // For testing
    public RequestAuthorizerHandler(RequestAuthorizer authorizer) {
        this.authorizer = authorizer;
    }

    @Override
    public AuthPolicy handleRequest(AuthRequest request, Context context) {
        String methodArn = request.getMethodArn();
        log.info("Processing auth request: type={}, methodArn={}", request.getType(), methodArn);

        if (methodArn == null || methodArn.isBlank()) {
            log.error("Auth request has no methodArn");
            throw new UnauthorizedRequestException();
        }

        String credential = extractCredential(request);
        AuthorizationDecision decision = authorizer.authorize(credential, methodArn);

        String usageKey = decision.isAllowed() ? request.header(API_KEY_HEADER) : null;
        return AuthPolicy.from(decision, usageKey);
    }

    /**
     * @return the bearer token; empty if the headers carry no Authorization header; null if the
     *         request has neither a token field nor headers
     */
    String extractCredential(AuthRequest request) {
        String token = request.getAuthorizationToken();
        if (token != null) {
            return stripBearer(token);
        }
        if (request.getHeaders() == null) {
            return null;
        }
        String authHeader = request.header(AUTHORIZATION_HEADER);
        return authHeader != null ? stripBearer(authHeader) : "";
    }

    private static String stripBearer(String value) {
        String trimmed = value.trim();
        if (trimmed.equalsIgnoreCase(BEARER_PREFIX.trim())) {
            return "";
        }
        if (trimmed.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())) {
            return trimmed.substring(BEARER_PREFIX.length()).trim();
        }
        return trimmed;
    }

    private static JwksSource jwksSource(AuthorizerConfig config) {
        if (config.usesSecretsManager()) {
            SecretsManagerClient secretsClient = SecretsManagerClient.builder()
                    .region(Region.of(config.getRegion()))
                    .build();
            return new SecretsManagerJwksSource(secretsClient, config.getJwksSecretId());
        }
        return new HttpJwksSource(config.getJwksUrl(), config.getJwksTimeout());
    }
}
