package com.anthem.dataproc.ingest.storage;

import com.anthem.dataproc.ingest.model.Record;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.awscore.exception.AwsServiceException;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;
import software.amazon.awssdk.services.dynamodb.model.ConditionalCheckFailedException;
import software.amazon.awssdk.services.dynamodb.model.ProvisionedThroughputExceededException;
import software.amazon.awssdk.services.dynamodb.model.PutItemRequest;
import software.amazon.awssdk.services.dynamodb.model.RequestLimitExceededException;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Clock;
import java.util.Map;

/**
 * Stores each record as one DynamoDB item: {@code {id, content, ingestedAt}}.
 *
 * <p>Puts are conditional on the id being absent, so a record is never written twice. When a
 * repeated put hits the condition, the earlier attempt already landed and the record counts as
 * stored.</p>
 */
public class DynamoDbRecordStore implements RecordStore {

    private static final Logger log = LoggerFactory.getLogger(DynamoDbRecordStore.class);

    static final String ATTR_ID = "id";
    static final String ATTR_CONTENT = "content";
    static final String ATTR_INGESTED_AT = "ingestedAt";
    static final String ID_ABSENT = "attribute_not_exists(" + ATTR_ID + ")";

    private final DynamoDbClient dynamoDb;
    private final String tableName;
    private final Clock clock;

    public DynamoDbRecordStore(DynamoDbClient dynamoDb, String tableName, Clock clock) {
        this.dynamoDb = dynamoDb;
        this.tableName = tableName;
        this.clock = clock;
    }

    @Override
    public void put(Record record) {
        try {
            dynamoDb.putItem(request(record));
        } catch (ConditionalCheckFailedException e) {
            throw new RecordStoreException("Record id already exists: " + record.getId(), e);
        } catch (SdkException e) {
            throw classify(record, e);
        }
    }

    @Override
    public void retryPut(Record record) {
        try {
            dynamoDb.putItem(request(record));
        } catch (ConditionalCheckFailedException e) {
            log.info("Record already stored by an earlier attempt: id={}", record.getId());
        } catch (SdkException e) {
            throw classify(record, e);
        }
    }

    private PutItemRequest request(Record record) {
        return PutItemRequest.builder()
                .tableName(tableName)
                .item(Map.of(
                        ATTR_ID, AttributeValue.builder().s(record.getId()).build(),
                        ATTR_CONTENT, AttributeValue.builder().s(record.getContent()).build(),
                        ATTR_INGESTED_AT, AttributeValue.builder().s(clock.instant().toString()).build()))
                .conditionExpression(ID_ABSENT)
                .build();
    }

    static RecordStoreException classify(Record record, SdkException e) {
        String message = "Failed to store record " + record.getId() + ": " + e.getMessage();
        return isTransient(e)
                ? new TransientRecordStoreException(message, e)
                : new RecordStoreException(message, e);
    }

    static boolean isTransient(SdkException e) {
        if (e instanceof ProvisionedThroughputExceededException || e instanceof RequestLimitExceededException) {
            return true;
        }
        if (e instanceof AwsServiceException) {
            AwsServiceException serviceError = (AwsServiceException) e;
            return serviceError.statusCode() >= 500 || serviceError.isThrottlingException();
        }
        if (e instanceof SdkClientException) {
            Throwable cause = e.getCause();
            return cause instanceof IOException || cause instanceof UncheckedIOException;
        }
        return false;
    }
}
