package com.anthem.dataproc.ingest.service;

import com.anthem.dataproc.ingest.model.IngestionResult;
import com.anthem.dataproc.ingest.model.Record;
import com.anthem.dataproc.ingest.model.RecordFailure;
import com.anthem.dataproc.ingest.storage.RecordStore;
import com.anthem.dataproc.ingest.storage.RecordStoreException;
import com.anthem.dataproc.ingest.storage.TransientRecordStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.retry.support.RetryTemplateBuilder;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.Semaphore;
import java.util.function.BooleanSupplier;
import java.util.stream.Stream;

/**
 * Persists a batch of records, each as an independent write.
 *
 * <p>At most {@code concurrency} writes are in flight. A failed record never stops its
 * siblings; failures are reported in input order whatever order the writes finish in.</p>
 */
public class RecordWriter {

    private static final Logger log = LoggerFactory.getLogger(RecordWriter.class);

    private final RecordStore store;
    private final RetryTemplate retryTemplate;
    private final int concurrency;

    public RecordWriter(RecordStore store, RetryTemplate retryTemplate, int concurrency) {
        if (concurrency < 1) {
            throw new IllegalArgumentException("concurrency must be at least 1");
        }
        this.store = store;
        this.retryTemplate = retryTemplate;
        this.concurrency = concurrency;
    }

    /**
     * Retry policy for transient store failures: {@code 1 + maxRetries} attempts in total.
     */
    public static RetryTemplate transientFailureRetry(int maxRetries, Duration backoff) {
        RetryTemplateBuilder builder = RetryTemplate.builder()
                .maxAttempts(maxRetries + 1)
                .retryOn(TransientRecordStoreException.class);
        if (backoff.isZero()) {
            builder.noBackoff();
        } else {
            builder.fixedBackoff(backoff.toMillis());
        }
        return builder.build();
    }

    public IngestionResult writeAll(Stream<Record> records) {
        return writeAll(records, () -> false);
    }

    /**
     * @param cancelled consulted before each write starts; once true, no further write starts
     *                  and every remaining record is reported as not attempted
     */
    public IngestionResult writeAll(Stream<Record> records, BooleanSupplier cancelled) {
        ExecutorService executor = Executors.newFixedThreadPool(concurrency);
        Semaphore inFlight = new Semaphore(concurrency);
        List<Future<RecordFailure>> outcomes = new ArrayList<>();
        int notAttempted = 0;

        try {
            Iterator<Record> it = records.iterator();
            while (it.hasNext()) {
                Record record = it.next();
                if (cancelled.getAsBoolean()) {
                    outcomes.add(CompletableFuture.completedFuture(RecordFailure.notAttempted(record)));
                    notAttempted++;
                    continue;
                }
                inFlight.acquire();
                if (cancelled.getAsBoolean()) {
                    inFlight.release();
                    outcomes.add(CompletableFuture.completedFuture(RecordFailure.notAttempted(record)));
                    notAttempted++;
                    continue;
                }
                outcomes.add(executor.submit(() -> {
                    try {
                        return write(record);
                    } finally {
                        inFlight.release();
                    }
                }));
            }
            IngestionResult result = collect(outcomes);
            if (notAttempted > 0) {
                log.warn("Ingestion cancelled: notAttempted={}, written={}", notAttempted, result.getRecordsWritten());
            }
            return result;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while writing records", e);
        } finally {
            executor.shutdown();
        }
    }

    /**
     * @return null if the record was stored
     */
    private RecordFailure write(Record record) {
        try {
            retryTemplate.execute(context -> {
                if (context.getRetryCount() == 0) {
                    store.put(record);
                } else {
                    log.debug("Retrying record write: id={}, attempt={}", record.getId(), context.getRetryCount() + 1);
                    store.retryPut(record);
                }
                return null;
            });
            return null;
        } catch (RecordStoreException e) {
            log.warn("Record write failed: id={}, transient={}, error={}",
                    record.getId(), e instanceof TransientRecordStoreException, e.getMessage());
            return new RecordFailure(record, e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        } catch (RuntimeException e) {
            log.error("Unexpected error writing record: id={}", record.getId(), e);
            return new RecordFailure(record, "Unexpected error: " + e.getClass().getSimpleName());
        }
    }

    private static IngestionResult collect(List<Future<RecordFailure>> outcomes) throws InterruptedException {
        int written = 0;
        List<RecordFailure> failures = new ArrayList<>();
        for (Future<RecordFailure> outcome : outcomes) {
            RecordFailure failure;
            try {
                failure = outcome.get();
            } catch (ExecutionException e) {
                throw new IllegalStateException("Record write task failed", e.getCause());
            }
            if (failure == null) {
                written++;
            } else {
                failures.add(failure);
            }
        }
        return new IngestionResult(written, failures);
    }
}
