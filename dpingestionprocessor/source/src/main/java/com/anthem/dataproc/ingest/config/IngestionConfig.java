package com.anthem.dataproc.ingest.config;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.util.Map;

/**
 * Ingestion settings, read once per cold start from the Lambda environment.
 */
@Value
@Builder(toBuilder = true)
public class IngestionConfig {

    public static final long DEFAULT_MAX_PAYLOAD_BYTES = 6 * 1024 * 1024;

    @Builder.Default
    String region = "us-east-1";

    String tableName;

    @Builder.Default
    long maxPayloadBytes = DEFAULT_MAX_PAYLOAD_BYTES;

    /**
     * Retries after the first attempt, for transient store failures only.
     */
    @Builder.Default
    int writeMaxRetries = 2;

    @Builder.Default
    Duration writeRetryBackoff = Duration.ofMillis(100);

    /**
     * Writes in flight at once; 1 writes strictly one record after another.
     */
    @Builder.Default
    int writeConcurrency = 4;

    /**
     * No new write starts once less invocation time than this remains.
     */
    @Builder.Default
    Duration cancelMargin = Duration.ofSeconds(2);

    public static IngestionConfig fromEnvironment() {
        return fromEnvironment(System.getenv());
    }

    public static IngestionConfig fromEnvironment(Map<String, String> env) {
        String table = env.get("TABLE_NAME");
        if (table == null || table.isBlank()) {
            throw new IllegalStateException("Missing required environment variable: TABLE_NAME");
        }
        IngestionConfig config = IngestionConfig.builder()
                .region(env.getOrDefault("AWS_REGION", "us-east-1"))
                .tableName(table.trim())
                .maxPayloadBytes(Long.parseLong(env.getOrDefault("MAX_PAYLOAD_BYTES", String.valueOf(DEFAULT_MAX_PAYLOAD_BYTES))))
                .writeMaxRetries(Integer.parseInt(env.getOrDefault("WRITE_MAX_RETRIES", "2")))
                .writeRetryBackoff(Duration.ofMillis(Long.parseLong(env.getOrDefault("WRITE_RETRY_BACKOFF_MILLIS", "100"))))
                .writeConcurrency(Integer.parseInt(env.getOrDefault("WRITE_CONCURRENCY", "4")))
                .cancelMargin(Duration.ofMillis(Long.parseLong(env.getOrDefault("CANCEL_MARGIN_MILLIS", "2000"))))
                .build();
        if (config.getWriteConcurrency() < 1) {
            throw new IllegalStateException("WRITE_CONCURRENCY must be at least 1");
        }
        if (config.getWriteMaxRetries() < 0) {
            throw new IllegalStateException("WRITE_MAX_RETRIES must not be negative");
        }
        return config;
    }
}
