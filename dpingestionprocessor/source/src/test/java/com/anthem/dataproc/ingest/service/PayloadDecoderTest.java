package com.anthem.dataproc.ingest.service;

import com.anthem.dataproc.ingest.model.Record;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PayloadDecoderTest {

    private final PayloadDecoder decoder = new PayloadDecoder(1024);

    @Test
    void decode_skipsBlankLinesAndTrims() {
        List<String> contents = contents(decoder.decode(utf8("hello\nworld\n\n  \n"), false));

        assertThat(contents).containsExactly("hello", "world");
    }

    @Test
    void decode_emptyBody_yieldsNoRecords() {
        assertThat(decoder.decode(utf8(""), false)).isEmpty();
        assertThat(decoder.decode(null, false)).isEmpty();
        assertThat(decoder.decode(utf8(" \n\t\r\n "), false)).isEmpty();
    }

    @Test
    void decode_allLineBreakStyles() {
        List<String> contents = contents(decoder.decode(utf8("a\r\nb\rc\n  d  "), false));

        assertThat(contents).containsExactly("a", "b", "c", "d");
    }

    @Test
    void decode_keepsInnerWhitespaceAndUnicode() {
        List<String> contents = contents(decoder.decode(utf8("  caf\u00E9 au\u00A0lait \t\n\u00A0 x\u2003"), false));

        assertThat(contents).containsExactly("caf\u00E9 au\u00A0lait", "x");
    }

    @Test
    void decode_lineOfNonBreakingSpaces_isBlank() {
        List<String> contents = contents(decoder.decode(utf8("hello\n\u00A0\n\u202F\u00A0\u2007\nworld\n"), false));

        assertThat(contents).containsExactly("hello", "world");
    }

    @Test
    void decode_byteOrderMark_isNotPartOfFirstRecord() {
        List<String> contents = contents(decoder.decode(utf8("\uFEFFhello\nworld"), false));

        assertThat(contents).containsExactly("hello", "world");
    }

    @Test
    void decode_framedBodyWithByteOrderMark_isNotPartOfFirstRecord() {
        byte[] framed = Base64.getEncoder().encode(utf8("\uFEFFhello\r\n\uFEFF\n"));

        assertThat(contents(decoder.decode(framed, true))).containsExactly("hello");
    }

    @Test
    void decode_framedBody_reproducesTrimmedLines() {
        Set<String> lines = Set.of("alpha", "beta gamma", "delta");
        String text = "  alpha\n\nbeta gamma  \r\ndelta\n";
        byte[] framed = Base64.getEncoder().encode(utf8(text));

        Set<String> decoded = decoder.decode(framed, true).map(Record::getContent).collect(Collectors.toSet());

        assertThat(decoded).isEqualTo(lines);
    }

    @Test
    void decode_framedBodyWithLineWrapping_isAccepted() {
        byte[] framed = Base64.getMimeEncoder().encode(utf8("first line of a long upload\nsecond line of a long upload\n"
                + "third line making the base64 wrap at seventy six characters"));

        assertThat(contents(decoder.decode(framed, true))).hasSize(3);
    }

    @Test
    void decode_invalidBase64_isMalformed() {
        assertThatThrownBy(() -> decoder.decode(utf8("not*base64!"), true))
                .isInstanceOf(MalformedPayloadException.class)
                .hasMessageContaining("base64");
    }

    @Test
    void decode_invalidUtf8_isMalformed() {
        byte[] invalid = {'o', 'k', '\n', (byte) 0xC3, (byte) 0x28};

        assertThatThrownBy(() -> decoder.decode(invalid, false))
                .isInstanceOf(MalformedPayloadException.class)
                .hasMessageContaining("UTF-8");
    }

    @Test
    void decode_invalidUtf8InsideFraming_isMalformed() {
        byte[] framed = Base64.getEncoder().encode(new byte[]{(byte) 0xFF, (byte) 0xFE, 'a'});

        assertThatThrownBy(() -> decoder.decode(framed, true)).isInstanceOf(MalformedPayloadException.class);
    }

    @Test
    void decode_oversizedBody_failsBeforeSplitting() {
        AtomicInteger ids = new AtomicInteger();
        PayloadDecoder small = new PayloadDecoder(10, () -> "id-" + ids.incrementAndGet());

        assertThatThrownBy(() -> small.decode(utf8("0123456789\nabc"), false))
                .isInstanceOf(PayloadTooLargeException.class)
                .satisfies(e -> {
                    PayloadTooLargeException tooLarge = (PayloadTooLargeException) e;
                    assertThat(tooLarge.getSize()).isEqualTo(14);
                    assertThat(tooLarge.getLimit()).isEqualTo(10);
                });
        assertThat(ids).hasValue(0);
    }

    @Test
    void decode_bodyAtLimit_isAccepted() {
        PayloadDecoder small = new PayloadDecoder(10);

        assertThat(contents(small.decode(utf8("0123456789"), false))).containsExactly("0123456789");
    }

    @Test
    void decode_generatesIdsLazily() {
        AtomicInteger ids = new AtomicInteger();
        PayloadDecoder counting = new PayloadDecoder(1024, () -> "id-" + ids.incrementAndGet());

        Stream<Record> records = counting.decode(utf8("a\nb\nc"), false);
        assertThat(ids).hasValue(0);

        List<Record> first = records.limit(1).collect(Collectors.toList());
        assertThat(first).extracting(Record::getId).containsExactly("id-1");
        assertThat(ids).hasValue(1);
    }

    @Test
    void decode_twice_sameContentsFreshIds() {
        byte[] raw = utf8("x\ny\nz");

        List<Record> first = decoder.decode(raw, false).collect(Collectors.toList());
        List<Record> second = decoder.decode(raw, false).collect(Collectors.toList());

        assertThat(first).extracting(Record::getContent)
                .containsExactlyInAnyOrderElementsOf(second.stream().map(Record::getContent).collect(Collectors.toList()));
        assertThat(first).extracting(Record::getId)
                .doesNotContainAnyElementsOf(second.stream().map(Record::getId).collect(Collectors.toList()));
        assertThat(first.stream().map(Record::getId).distinct().count()).isEqualTo(3);
    }

    private static List<String> contents(Stream<Record> records) {
        return records.map(Record::getContent).collect(Collectors.toList());
    }

    private static byte[] utf8(String text) {
        return text.getBytes(StandardCharsets.UTF_8);
    }
}
