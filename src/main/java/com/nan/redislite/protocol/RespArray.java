package com.nan.redislite.protocol;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/*
  Ordered, possibly nested sequence of values, or the null marker.
  Client requests are arrays of bulk strings.
*/
public final class RespArray extends RespValue {

    public static final RespArray NULL = new RespArray(null);

    private final List<RespValue> elements;

    private RespArray(List<RespValue> elements) {
        this.elements = elements;
    }

    public static RespArray of(List<? extends RespValue> elements) {
        Objects.requireNonNull(elements, "elements");
        List<RespValue> copy = new ArrayList<>(elements.size());
        for (RespValue element : elements) {
            copy.add(Objects.requireNonNull(element, "element"));
        }
        return new RespArray(Collections.unmodifiableList(copy));
    }

    public static RespArray of(RespValue... elements) {
        return of(Arrays.asList(elements));
    }

    public static RespArray ofBulkStrings(String... tokens) {
        List<RespValue> values = new ArrayList<>(tokens.length);
        for (String token : tokens) {
            values.add(BulkString.of(token));
        }
        return new RespArray(Collections.unmodifiableList(values));
    }

    @Override
    public Type type() {
        return Type.ARRAY;
    }

    @Override
    public boolean isNull() {
        return elements == null;
    }

    // unmodifiable; null for NULL
    public List<RespValue> getElements() {
        return elements;
    }

    public int size() {
        return elements == null ? -1 : elements.size();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RespArray)) return false;
        return Objects.equals(elements, ((RespArray) o).elements);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(elements);
    }

    @Override
    public String toString() {
        return isNull() ? "RespArray[null]" : "RespArray" + elements;
    }
}
