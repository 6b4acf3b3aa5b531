package com.anthem.dataproc.ingest.service;

import com.anthem.dataproc.ingest.model.IngestionResult;
import com.anthem.dataproc.ingest.model.Record;

import java.util.function.BooleanSupplier;
import java.util.stream.Stream;

/**
 * Decodes one payload and writes its records. A rejected payload fails before any write.
 */
public class IngestionProcessor {

    private final PayloadDecoder decoder;
    private final RecordWriter writer;

    public IngestionProcessor(PayloadDecoder decoder, RecordWriter writer) {
        this.decoder = decoder;
        this.writer = writer;
    }

    public IngestionResult process(byte[] raw, boolean framed) {
        return process(raw, framed, () -> false);
    }

    /**
     * @throws MalformedPayloadException if the payload cannot be decoded
     * @throws PayloadTooLargeException  if the payload exceeds the size limit
     */
    public IngestionResult process(byte[] raw, boolean framed, BooleanSupplier cancelled) {
        try (Stream<Record> records = decoder.decode(raw, framed)) {
            return writer.writeAll(records, cancelled);
        }
    }
}
