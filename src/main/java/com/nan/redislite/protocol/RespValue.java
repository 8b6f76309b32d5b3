package com.nan.redislite.protocol;

/*
  One protocol value. The five kinds are closed: code that handles every kind
  switches on type() instead of on the concrete class.
*/
public abstract class RespValue {

    public enum Type {
        SIMPLE_STRING('+'),
        ERROR('-'),
        INTEGER(':'),
        BULK_STRING('$'),
        ARRAY('*');

        private final char tag;

        Type(char tag) {
            this.tag = tag;
        }

        public char tag() {
            return tag;
        }

        // null if the byte is not a known tag
        public static Type fromTag(int tag) {
            for (Type t : values()) {
                if (t.tag == tag) return t;
            }
            return null;
        }
    }

    // Only the five kinds in this package may extend RespValue.
    RespValue() {
    }

    public abstract Type type();

    // true for the null bulk string and the null array
    public boolean isNull() {
        return false;
    }
}
