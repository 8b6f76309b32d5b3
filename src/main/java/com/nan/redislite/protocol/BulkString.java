package com.nan.redislite.protocol;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;

/*
  Binary-safe string, or the null marker. EMPTY ($0) and NULL ($-1) are different values.
  Immutable: the payload is copied in and out.
*/
public final class BulkString extends RespValue {

    public static final BulkString NULL = new BulkString(null);
    public static final BulkString EMPTY = new BulkString(new byte[0]);

    private final byte[] bytes;

    private BulkString(byte[] bytes) {
        this.bytes = bytes;
    }

    public static BulkString of(byte[] bytes) {
        Objects.requireNonNull(bytes, "bytes");
        return new BulkString(bytes.clone());
    }

    public static BulkString of(String text) {
        Objects.requireNonNull(text, "text");
        return new BulkString(text.getBytes(StandardCharsets.UTF_8));
    }

    // Takes ownership of the array; used by the decoder for freshly read payloads.
    static BulkString wrap(byte[] bytes) {
        return new BulkString(bytes);
    }

    @Override
    public Type type() {
        return Type.BULK_STRING;
    }

    @Override
    public boolean isNull() {
        return bytes == null;
    }

    // null for NULL
    public byte[] getBytes() {
        return bytes == null ? null : bytes.clone();
    }

    // UTF-8 text; null for NULL
    public String asString() {
        return bytes == null ? null : new String(bytes, StandardCharsets.UTF_8);
    }

    public int length() {
        return bytes == null ? -1 : bytes.length;
    }

    // Package access for the encoder, which only reads.
    byte[] payload() {
        return bytes;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof BulkString)) return false;
        return Arrays.equals(bytes, ((BulkString) o).bytes);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
        return isNull() ? "BulkString[null]" : "BulkString[" + asString() + "]";
    }
}
