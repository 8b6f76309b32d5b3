package com.nan.redislite.protocol;

import java.util.StringJoiner;

/* Console rendering, never sent on the wire. */
public final class RespFormatter {

    public static final String NIL = "(nil)";

    private RespFormatter() {
    }

    public static String display(RespValue value) {
        switch (value.type()) {
            case SIMPLE_STRING:
                return ((SimpleString) value).getValue();
            case ERROR:
                return ((RespError) value).getMessage();
            case INTEGER:
                return Long.toString(((RespInteger) value).getValue());
            case BULK_STRING:
                return value.isNull() ? NIL : ((BulkString) value).asString();
            case ARRAY:
                return value.isNull() ? NIL : displayArray((RespArray) value);
            default:
                throw new IllegalArgumentException("unsupported value type: " + value.type());
        }
    }

    private static String displayArray(RespArray array) {
        StringJoiner joiner = new StringJoiner(",", "[", "]");
        for (RespValue element : array.getElements()) {
            joiner.add(display(element));
        }
        return joiner.toString();
    }
}
