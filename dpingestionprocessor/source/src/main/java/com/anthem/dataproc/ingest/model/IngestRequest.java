package com.anthem.dataproc.ingest.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * API Gateway proxy integration event, reduced to the fields ingestion reads.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IngestRequest {

    private String body;

    /**
     * Set by API Gateway when the body is binary and was base64-framed on the way in.
     */
    private Boolean isBase64Encoded;

    private Map<String, String> headers;

    private Map<String, Object> requestContext;

    public boolean framed() {
        return Boolean.TRUE.equals(isBase64Encoded);
    }

    public byte[] bodyBytes() {
        return body != null ? body.getBytes(StandardCharsets.UTF_8) : null;
    }

    /**
     * Subject placed in the authorizer context by the request authorizer, if present.
     */
    public String authorizerSubject() {
        if (requestContext == null) {
            return null;
        }
        Object authorizer = requestContext.get("authorizer");
        if (authorizer instanceof Map) {
            Object subject = ((Map<?, ?>) authorizer).get("subject");
            return subject != null ? subject.toString() : null;
        }
        return null;
    }
}
