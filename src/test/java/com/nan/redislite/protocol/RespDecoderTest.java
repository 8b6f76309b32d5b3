package com.nan.redislite.protocol;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.ByteArrayInputStream;
import java.io.EOFException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;

import org.junit.jupiter.api.Test;

class RespDecoderTest {

    private static RespDecoder decoder(String wire) {
        return new RespDecoder(new ByteArrayInputStream(wire.getBytes(StandardCharsets.UTF_8)));
    }

    private static RespValue decode(String wire) throws IOException {
        return decoder(wire).read();
    }

    @Test
    void simpleStringAndError() throws IOException {
        assertThat(decode("+OK\r\n")).isEqualTo(new SimpleString("OK"));
        assertThat(decode("-ERR boom\r\n")).isEqualTo(new RespError("ERR boom"));
    }

    @Test
    void lineWithoutCarriageReturnIsAccepted() throws IOException {
        assertThat(decode("+PONG\n")).isEqualTo(new SimpleString("PONG"));
    }

    @Test
    void integers() throws IOException {
        assertThat(decode(":42\r\n")).isEqualTo(new RespInteger(42));
        assertThat(decode(":-9223372036854775808\r\n")).isEqualTo(new RespInteger(Long.MIN_VALUE));
    }

    @Test
    void malformedIntegerIsProtocolError() {
        assertThatThrownBy(() -> decode(":12a\r\n"))
                .isInstanceOf(RespProtocolException.class)
                .hasMessageContaining("invalid integer");
    }

    @Test
    void bulkStrings() throws IOException {
        assertThat(decode("$5\r\nhello\r\n")).isEqualTo(BulkString.of("hello"));
        assertThat(decode("$0\r\n\r\n")).isEqualTo(BulkString.EMPTY);
    }

    @Test
    void bulkPayloadMayContainCrLf() throws IOException {
        BulkString value = (BulkString) decode("$4\r\na\r\nb\r\n");

        assertThat(value.getBytes()).containsExactly('a', '\r', '\n', 'b');
    }

    @Test
    void nullSentinelsConsumeNothingMore() throws IOException {
        RespDecoder decoder = decoder("$-1\r\n*-1\r\n+next\r\n");

        RespValue bulk = decoder.read();
        RespValue array = decoder.read();

        assertThat(bulk.isNull()).isTrue();
        assertThat(bulk).isSameAs(BulkString.NULL);
        assertThat(array.isNull()).isTrue();
        assertThat(array).isSameAs(RespArray.NULL);
        assertThat(decoder.read()).isEqualTo(new SimpleString("next"));
    }

    @Test
    void shortBulkReadIsProtocolError() {
        assertThatThrownBy(() -> decode("$10\r\nhello\r\n"))
                .isInstanceOf(RespProtocolException.class)
                .hasMessageContaining("short read");
    }

    @Test
    void bulkPayloadMustEndWithCrLf() {
        assertThatThrownBy(() -> decode("$3\r\nhello\r\n"))
                .isInstanceOf(RespProtocolException.class);
    }

    @Test
    void invalidLengths() {
        assertThatThrownBy(() -> decode("$abc\r\n")).isInstanceOf(RespProtocolException.class);
        assertThatThrownBy(() -> decode("$-2\r\n")).isInstanceOf(RespProtocolException.class);
        assertThatThrownBy(() -> decode("*x\r\n")).isInstanceOf(RespProtocolException.class);
    }

    @Test
    void unknownTag() {
        assertThatThrownBy(() -> decode("!oops\r\n"))
                .isInstanceOf(RespProtocolException.class)
                .hasMessageContaining("unknown data type");
    }

    @Test
    void arrayKeepsOrderAndKinds() throws IOException {
        RespArray array = (RespArray) decode("*3\r\n:1\r\n$3\r\ntwo\r\n+three\r\n");

        assertThat(array.getElements()).containsExactly(
                new RespInteger(1), BulkString.of("two"), new SimpleString("three"));
    }

    @Test
    void nestedArray() throws IOException {
        RespValue value = decode("*2\r\n*1\r\n:7\r\n*0\r\n");

        assertThat(value).isEqualTo(RespArray.of(RespArray.of(new RespInteger(7)), RespArray.of()));
    }

    @Test
    void badElementAbortsWholeArray() {
        assertThatThrownBy(() -> decode("*2\r\n:1\r\n?\r\n"))
                .isInstanceOf(RespProtocolException.class);
    }

    @Test
    void truncatedArrayIsProtocolError() {
        assertThatThrownBy(() -> decode("*3\r\n:1\r\n"))
                .isInstanceOf(RespProtocolException.class);
    }

    @Test
    void nestingUpToLimitIsAccepted() throws IOException {
        String wire = "*1\r\n".repeat(RespDecoder.MAX_NESTING_DEPTH) + "*0\r\n";

        RespValue value = decode(wire);
        int depth = 0;
        while (((RespArray) value).size() == 1) {
            value = ((RespArray) value).getElements().get(0);
            depth++;
        }
        assertThat(depth).isEqualTo(RespDecoder.MAX_NESTING_DEPTH);
    }

    @Test
    void nestingBeyondLimitIsProtocolError() {
        String wire = "*1\r\n".repeat(RespDecoder.MAX_NESTING_DEPTH + 1) + "*0\r\n";

        assertThatThrownBy(() -> decode(wire))
                .isInstanceOf(RespProtocolException.class)
                .hasMessageContaining("nesting too deep");
    }

    @Test
    void hugeNestingFailsWithoutExhaustingStack() {
        assertThatThrownBy(() -> decode("*1\r\n".repeat(200_000)))
                .isInstanceOf(RespProtocolException.class);
    }

    @Test
    void cleanEndOfStreamIsEof() {
        assertThatThrownBy(() -> decode(""))
                .isInstanceOf(EOFException.class)
                .isNotInstanceOf(RespProtocolException.class);
    }

    @Test
    void endOfStreamInsideLineIsProtocolError() {
        assertThatThrownBy(() -> decode("+unterminated"))
                .isInstanceOf(RespProtocolException.class);
    }

    @Test
    void readsConsecutiveValuesFromOneStream() throws IOException {
        RespDecoder decoder = decoder("*1\r\n$4\r\nPING\r\n*2\r\n$3\r\nGET\r\n$1\r\nk\r\n");

        assertThat(decoder.read()).isEqualTo(RespArray.ofBulkStrings("PING"));
        assertThat(decoder.read()).isEqualTo(RespArray.ofBulkStrings("GET", "k"));
    }

    @Test
    void decodesWhatTheEncoderWrites() throws IOException {
        List<RespValue> values = List.of(
                new SimpleString("OK"),
                new RespError("ERR x"),
                new RespInteger(-1),
                BulkString.of("hello world"),
                BulkString.EMPTY,
                BulkString.NULL,
                RespArray.NULL,
                RespArray.of(new RespInteger(1), BulkString.of("two"), RespArray.of(new SimpleString("three"))));

        for (RespValue value : values) {
            byte[] wire = RespEncoder.encode(value);
            assertThat(new RespDecoder(new ByteArrayInputStream(wire)).read()).isEqualTo(value);
        }
    }
}
