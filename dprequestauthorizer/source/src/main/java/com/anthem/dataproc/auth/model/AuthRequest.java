package com.anthem.dataproc.auth.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * API Gateway Lambda Authorizer request.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AuthRequest {
    
    /**
     * The type of authorizer: TOKEN or REQUEST
     */
    private String type;
    
    /**
     * The authorization token (for TOKEN authorizer)
     */
    private String authorizationToken;
    
    /**
     * The method ARN being invoked
     * Format: arn:aws:execute-api:region:account-id:api-id/stage/method/resource-path
     */
    private String methodArn;
    
    /**
     * Request headers (for REQUEST authorizer)
     */
    private Map<String, String> headers;

    /**
     * Request context
     */
    private Map<String, Object> requestContext;

    /**
     * Case-insensitive header lookup. API Gateway preserves the caller's casing.
     *
     * @return the header value, or null when the header (or the whole header map) is absent
     */
    public String header(String name) {
        if (headers == null) {
            return null;
        }
        for (Map.Entry<String, String> entry : headers.entrySet()) {
            if (entry.getKey() != null && entry.getKey().equalsIgnoreCase(name)) {
                return entry.getValue();
            }
        }
        return null;
    }
}
