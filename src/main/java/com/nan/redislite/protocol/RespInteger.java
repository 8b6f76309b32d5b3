package com.nan.redislite.protocol;

/* Signed 64-bit integer. */
public final class RespInteger extends RespValue {

    private final long value;

    public RespInteger(long value) {
        this.value = value;
    }

    @Override
    public Type type() {
        return Type.INTEGER;
    }

    public long getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RespInteger)) return false;
        return value == ((RespInteger) o).value;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(value);
    }

    @Override
    public String toString() {
        return "RespInteger[" + value + "]";
    }
}
