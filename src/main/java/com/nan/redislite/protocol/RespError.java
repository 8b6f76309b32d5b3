package com.nan.redislite.protocol;

import java.util.Objects;

/*
  Error status line, e.g. "ERR syntax error".
  Same line format as SimpleString, only the tag differs.
*/
public final class RespError extends RespValue {

    private final String message;

    public RespError(String message) {
        this.message = Objects.requireNonNull(message, "message");
    }

    @Override
    public Type type() {
        return Type.ERROR;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RespError)) return false;
        return message.equals(((RespError) o).message);
    }

    @Override
    public int hashCode() {
        return message.hashCode();
    }

    @Override
    public String toString() {
        return "RespError[" + message + "]";
    }
}
