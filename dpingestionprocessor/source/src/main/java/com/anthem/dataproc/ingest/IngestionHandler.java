package com.anthem.dataproc.ingest;

import com.amazonaws.services.lambda.runtime.Context;
import com.amazonaws.services.lambda.runtime.RequestHandler;
import com.anthem.dataproc.ingest.config.IngestionConfig;
import com.anthem.dataproc.ingest.model.IngestRequest;
import com.anthem.dataproc.ingest.model.IngestResponse;
import com.anthem.dataproc.ingest.model.IngestResponseBody;
import com.anthem.dataproc.ingest.model.IngestionResult;
import com.anthem.dataproc.ingest.service.IngestionProcessor;
import com.anthem.dataproc.ingest.service.MalformedPayloadException;
import com.anthem.dataproc.ingest.service.PayloadDecoder;
import com.anthem.dataproc.ingest.service.PayloadTooLargeException;
import com.anthem.dataproc.ingest.service.RecordWriter;
import com.anthem.dataproc.ingest.storage.DynamoDbRecordStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.core.retry.RetryPolicy;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;

import java.time.Clock;
import java.time.Duration;
import java.util.function.BooleanSupplier;

/**
 * AWS Lambda behind the API Gateway upload route.
 * Splits the uploaded text into records and stores each one, reporting per-record failures.
 *
 * Status codes:
 * - 200 every record stored, or some stored with failure detail
 * - 400 body is not valid base64 / UTF-8
 * - 413 body exceeds the size limit
 * - 500 no record could be stored, or an unexpected error
 */
public class IngestionHandler implements RequestHandler<IngestRequest, IngestResponse> {

    private static final Logger log = LoggerFactory.getLogger(IngestionHandler.class);

    static final String SUCCESS_MESSAGE = "File processed and data stored successfully!";
    static final String PARTIAL_MESSAGE = "File processed with errors";
    static final String TOTAL_FAILURE_ERROR = "Failed to store any records";
    static final String UNEXPECTED_ERROR = "Failed to process the file";

    private final IngestionProcessor processor;
    private final Duration cancelMargin;

    public IngestionHandler() {
        this(IngestionConfig.fromEnvironment());
    }

    private IngestionHandler(IngestionConfig config) {
        DynamoDbClient dynamoDb = DynamoDbClient.builder()
                .region(Region.of(config.getRegion()))
                .overrideConfiguration(c -> c.retryPolicy(RetryPolicy.none()))
                .build();
        RecordWriter writer = new RecordWriter(
                new DynamoDbRecordStore(dynamoDb, config.getTableName(), Clock.systemUTC()),
                RecordWriter.transientFailureRetry(config.getWriteMaxRetries(), config.getWriteRetryBackoff()),
                config.getWriteConcurrency());
        this.processor = new IngestionProcessor(new PayloadDecoder(config.getMaxPayloadBytes()), writer);
        this.cancelMargin = config.getCancelMargin();
        log.info("Ingestion handler initialized: table={}, concurrency={}, maxRetries={}",
                config.getTableName(), config.getWriteConcurrency(), config.getWriteMaxRetries());
    }

    // For testing
    public IngestionHandler(IngestionProcessor processor, Duration cancelMargin) {
        this.processor = processor;
        this.cancelMargin = cancelMargin;
    }

    @Override
    public IngestResponse handleRequest(IngestRequest request, Context context) {
        String subject = request.authorizerSubject();
        log.info("Processing upload: subject={}, framed={}", subject, request.framed());

        try {
            IngestionResult result = processor.process(request.bodyBytes(), request.framed(), cancellation(context));
            log.info("Upload processed: subject={}, written={}, failed={}",
                    subject, result.getRecordsWritten(), result.getFailures().size());
            return toResponse(result);

        } catch (PayloadTooLargeException e) {
            log.warn("Upload rejected: subject={}, size={}, limit={}", subject, e.getSize(), e.getLimit());
            return IngestResponse.json(413, IngestResponseBody.error(e.getMessage()));
        } catch (MalformedPayloadException e) {
            log.warn("Upload rejected: subject={}, reason={}", subject, e.getMessage());
            return IngestResponse.json(400, IngestResponseBody.error(e.getMessage()));
        } catch (RuntimeException e) {
            log.error("Error processing upload: subject={}", subject, e);
            return IngestResponse.json(500, IngestResponseBody.error(UNEXPECTED_ERROR));
        }
    }

    private static IngestResponse toResponse(IngestionResult result) {
        if (result.isCompleteSuccess()) {
            return IngestResponse.json(200, IngestResponseBody.builder()
                    .message(SUCCESS_MESSAGE)
                    .recordsWritten(result.getRecordsWritten())
                    .build());
        }
        if (result.isTotalFailure()) {
            return IngestResponse.json(500, IngestResponseBody.builder()
                    .error(TOTAL_FAILURE_ERROR)
                    .failures(IngestResponseBody.details(result.getFailures()))
                    .build());
        }
        return IngestResponse.json(200, IngestResponseBody.builder()
                .message(PARTIAL_MESSAGE)
                .recordsWritten(result.getRecordsWritten())
                .failures(IngestResponseBody.details(result.getFailures()))
                .build());
    }

    private BooleanSupplier cancellation(Context context) {
        if (context == null) {
            return () -> false;
        }
        long marginMillis = cancelMargin.toMillis();
        return () -> context.getRemainingTimeInMillis() < marginMillis;
    }
}
