package com.nan.redislite.model;

/*
  JSON body returned by the HTTP API for a single key.
  - key:   the key that was read or written
  - value: stored bytes decoded as UTF-8
*/
public class KeyValue {
    private String key;
    private String value;

    // Default constructor required by Jackson
    public KeyValue() {}

    public KeyValue(String key, String value) {
        this.key = key;
        this.value = value;
    }

    public String getKey() { return key; }
    public String getValue() { return value; }

    public void setKey(String key) { this.key = key; }
    public void setValue(String value) { this.value = value; }
}
