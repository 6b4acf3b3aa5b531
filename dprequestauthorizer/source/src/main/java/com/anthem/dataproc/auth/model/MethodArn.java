package com.anthem.dataproc.auth.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * HTTP method and resource path of an API Gateway method ARN.
 * Format: arn:aws:execute-api:region:account:api-id/stage/method/resource-path
 */
public final class MethodArn {

    private final String httpMethod;
    private final String resourcePath;

    private MethodArn(String httpMethod, String resourcePath) {
        this.httpMethod = httpMethod;
        this.resourcePath = resourcePath;
    }

    public static Optional<MethodArn> parse(String methodArn) {
        if (methodArn == null || !methodArn.startsWith("arn:")) {
            return Optional.empty();
        }
        String[] parts = methodArn.split(":", 6);
        if (parts.length < 6 || !"execute-api".equals(parts[2])) {
            return Optional.empty();
        }
        String[] apiParts = parts[5].split("/");
        if (apiParts.length < 3) {
            return Optional.empty();
        }
        String path = apiParts.length > 3
                ? "/" + String.join("/", Arrays.copyOfRange(apiParts, 3, apiParts.length))
                : "/";
        return Optional.of(new MethodArn(apiParts[2], path));
    }

    /**
     * Method and path, e.g. {@code POST /app}.
     */
    public String signature() {
        return httpMethod + " " + resourcePath;
    }

    @Override
    public String toString() {
        return signature();
    }
}
