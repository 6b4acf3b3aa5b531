package com.anthem.dataproc.auth.keys;

import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.secretsmanager.SecretsManagerClient;
import software.amazon.awssdk.services.secretsmanager.model.GetSecretValueRequest;

/**
 * Reads a JWK Set document stored as a Secrets Manager secret string.
 * Used where the authorizer cannot reach the identity provider's endpoint directly.
 */
public class SecretsManagerJwksSource implements JwksSource {

    private final SecretsManagerClient secretsClient;
    private final String secretId;

    public SecretsManagerJwksSource(SecretsManagerClient secretsClient, String secretId) {
        this.secretsClient = secretsClient;
        this.secretId = secretId;
    }

    @Override
    public String fetch() {
        try {
            GetSecretValueRequest request = GetSecretValueRequest.builder()
                    .secretId(secretId)
                    .build();
            String secretValue = secretsClient.getSecretValue(request).secretString();
            if (secretValue == null || secretValue.isBlank()) {
                throw new JwksUnavailableException("Secret has no string value: " + secretId);
            }
            return secretValue;
        } catch (SdkException e) {
            throw new JwksUnavailableException("Failed to read JWKS secret " + secretId, e);
        }
    }

    @Override
    public String describe() {
        return "secretsmanager:" + secretId;
    }
}
