package com.nan.redislite.protocol;

import java.util.Objects;

/*
  Status line such as "OK" or "PONG".
  Not binary safe: the text must not contain CR or LF.
*/
public final class SimpleString extends RespValue {

    public static final SimpleString OK = new SimpleString("OK");
    public static final SimpleString PONG = new SimpleString("PONG");

    private final String value;

    public SimpleString(String value) {
        this.value = Objects.requireNonNull(value, "value");
    }

    @Override
    public Type type() {
        return Type.SIMPLE_STRING;
    }

    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SimpleString)) return false;
        return value.equals(((SimpleString) o).value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "SimpleString[" + value + "]";
    }
}
