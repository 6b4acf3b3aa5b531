package com.anthem.dataproc.ingest.storage;

import com.anthem.dataproc.ingest.model.Record;

/**
 * Durable single-item sink keyed by record id.
 */
public interface RecordStore {

    /**
     * Store a record that has not been written before.
     *
     * @throws TransientRecordStoreException if the write may succeed when repeated
     * @throws RecordStoreException          if the write cannot succeed
     */
    void put(Record record);

    /**
     * Repeat a put whose earlier attempt failed but may still have reached the store. A store
     * that can detect an existing item treats it as this record already persisted.
     */
    default void retryPut(Record record) {
        put(record);
    }
}
