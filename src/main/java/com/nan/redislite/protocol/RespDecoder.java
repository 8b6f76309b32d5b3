package com.nan.redislite.protocol;

import java.io.ByteArrayOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/*
  Reads one value per read() call, consuming exactly that value's bytes.
  No buffering of its own: wrap socket streams in a BufferedInputStream.
  Blocks as long as the underlying stream blocks.
*/
public class RespDecoder {

    // Upper bound for the initial array allocation; the list still grows to the declared count.
    private static final int MAX_PREALLOCATED_ELEMENTS = 1024;
    // Arrays nested deeper than this are rejected instead of recursing further.
    static final int MAX_NESTING_DEPTH = 512;

    private final InputStream in;

    public RespDecoder(InputStream in) {
        this.in = in;
    }

    // EOFException: stream ended cleanly before a value.
    // RespProtocolException: malformed bytes, or stream ended inside a value.
    public RespValue read() throws IOException {
        int tag = in.read();
        if (tag == -1) {
            throw new EOFException("end of stream");
        }
        return readValue(tag, 0);
    }

    private RespValue readValue(int tag, int depth) throws IOException {
        RespValue.Type type = RespValue.Type.fromTag(tag);
        if (type == null) {
            throw new RespProtocolException("unknown data type: '" + printable(tag) + "'");
        }
        switch (type) {
            case SIMPLE_STRING:
                return new SimpleString(readLine());
            case ERROR:
                return new RespError(readLine());
            case INTEGER:
                return new RespInteger(parseLong(readLine()));
            case BULK_STRING:
                return readBulk();
            case ARRAY:
                return readArray(depth);
            default:
                throw new RespProtocolException("unknown data type: '" + printable(tag) + "'");
        }
    }

    private BulkString readBulk() throws IOException {
        int length = parseLength(readLine(), "bulk length");
        if (length == -1) {
            return BulkString.NULL;
        }
        if (length > Integer.MAX_VALUE - 2) {
            throw new RespProtocolException("bulk length too large: " + length);
        }
        byte[] payload = in.readNBytes(length + 2);
        if (payload.length < length + 2) {
            throw new RespProtocolException("short read: expected " + (length + 2)
                    + " bytes of bulk payload, got " + payload.length);
        }
        if (payload[length] != '\r' || payload[length + 1] != '\n') {
            throw new RespProtocolException("bulk payload of length " + length + " not terminated by CRLF");
        }
        byte[] value = new byte[length];
        System.arraycopy(payload, 0, value, 0, length);
        return BulkString.wrap(value);
    }

    private RespArray readArray(int depth) throws IOException {
        int count = parseLength(readLine(), "array length");
        if (count == -1) {
            return RespArray.NULL;
        }
        if (count > 0 && depth >= MAX_NESTING_DEPTH) {
            throw new RespProtocolException("nesting too deep: more than " + MAX_NESTING_DEPTH + " levels");
        }
        List<RespValue> elements = new ArrayList<>(Math.min(count, MAX_PREALLOCATED_ELEMENTS));
        for (int i = 0; i < count; i++) {
            int tag = in.read();
            if (tag == -1) {
                throw new RespProtocolException("stream ended after " + i + " of " + count + " array elements");
            }
            elements.add(readValue(tag, depth + 1));
        }
        return RespArray.of(elements);
    }

    /*
      Reads up to and including the next LF and returns the text before it,
      with trailing CR/LF characters removed.
    */
    private String readLine() throws IOException {
        ByteArrayOutputStream line = new ByteArrayOutputStream();
        int b;
        while ((b = in.read()) != '\n') {
            if (b == -1) {
                throw new RespProtocolException("stream ended before end of line");
            }
            line.write(b);
        }
        byte[] bytes = line.toByteArray();
        int end = bytes.length;
        while (end > 0 && (bytes[end - 1] == '\r' || bytes[end - 1] == '\n')) {
            end--;
        }
        return new String(bytes, 0, end, StandardCharsets.UTF_8);
    }

    private static long parseLong(String text) throws RespProtocolException {
        try {
            return Long.parseLong(text);
        } catch (NumberFormatException e) {
            throw new RespProtocolException("invalid integer: '" + text + "'", e);
        }
    }

    private static int parseLength(String text, String what) throws RespProtocolException {
        int length;
        try {
            length = Integer.parseInt(text);
        } catch (NumberFormatException e) {
            throw new RespProtocolException("invalid " + what + ": '" + text + "'", e);
        }
        if (length < -1) {
            throw new RespProtocolException("invalid " + what + ": " + length);
        }
        return length;
    }

    private static String printable(int b) {
        return b >= 0x20 && b < 0x7f ? String.valueOf((char) b) : String.format("0x%02x", b);
    }
}
