package com.anthem.dataproc.ingest.service;

import com.anthem.dataproc.ingest.model.Record;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Turns an uploaded body into records, one per non-blank line.
 *
 * <p>Size checks, base64 unframing and UTF-8 decoding all happen inside {@link #decode}, so a
 * rejected payload fails before the caller sees a single record. Splitting into lines and id
 * generation are lazy.</p>
 */
public class PayloadDecoder {

    private static final Pattern LINE_BREAK = Pattern.compile("\\r\\n|\\r|\\n");

    /**
     * Leading or trailing Unicode White_Space (NBSP and narrow NBSP included) and byte-order marks.
     */
    private static final Pattern EDGE_WHITESPACE = Pattern.compile("^[\\p{IsWhite_Space}\\uFEFF]+|[\\p{IsWhite_Space}\\uFEFF]+\\z");

    private final long maxPayloadBytes;
    private final RecordIdGenerator idGenerator;

    public PayloadDecoder(long maxPayloadBytes) {
        this(maxPayloadBytes, RecordIdGenerator.randomUuid());
    }

    public PayloadDecoder(long maxPayloadBytes, RecordIdGenerator idGenerator) {
        this.maxPayloadBytes = maxPayloadBytes;
        this.idGenerator = idGenerator;
    }

    /**
     * @param raw    request body bytes; null is treated as empty
     * @param framed true if the body is base64 text wrapping the real bytes
     * @return one-shot stream of records in line order
     * @throws PayloadTooLargeException  if the payload exceeds the configured maximum
     * @throws MalformedPayloadException if the framing or the UTF-8 text is invalid
     */
    public Stream<Record> decode(byte[] raw, boolean framed) {
        if (raw == null || raw.length == 0) {
            return Stream.empty();
        }
        checkSize(raw.length);

        byte[] bytes = framed ? unframe(raw) : raw;
        checkSize(bytes.length);

        return LINE_BREAK.splitAsStream(toText(bytes))
                .map(PayloadDecoder::trim)
                .filter(line -> !line.isEmpty())
                .map(line -> new Record(idGenerator.nextId(), line));
    }

    static String trim(String line) {
        return EDGE_WHITESPACE.matcher(line).replaceAll("");
    }

    private void checkSize(long size) {
        if (size > maxPayloadBytes) {
            throw new PayloadTooLargeException(size, maxPayloadBytes);
        }
    }

    private static byte[] unframe(byte[] raw) {
        String framedText = new String(raw, StandardCharsets.ISO_8859_1);
        StringBuilder compact = new StringBuilder(framedText.length());
        for (int i = 0; i < framedText.length(); i++) {
            char c = framedText.charAt(i);
            if (c != '\r' && c != '\n' && c != ' ') {
                compact.append(c);
            }
        }
        try {
            return Base64.getDecoder().decode(compact.toString());
        } catch (IllegalArgumentException e) {
            throw new MalformedPayloadException("Body is not valid base64", e);
        }
    }

    private static String toText(byte[] bytes) {
        try {
            return StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(bytes))
                    .toString();
        } catch (CharacterCodingException e) {
            throw new MalformedPayloadException("Body is not valid UTF-8 text", e);
        }
    }
}
