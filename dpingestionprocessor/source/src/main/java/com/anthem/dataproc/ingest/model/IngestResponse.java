package com.anthem.dataproc.ingest.model;

import com.anthem.dataproc.ingest.util.JsonUtils;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * API Gateway proxy integration response.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class IngestResponse {

    private int statusCode;

    private Map<String, String> headers;

    private String body;

    public static IngestResponse json(int statusCode, IngestResponseBody body) {
        return new IngestResponse(statusCode, Map.of("Content-Type", "application/json"), JsonUtils.toJson(body));
    }
}
