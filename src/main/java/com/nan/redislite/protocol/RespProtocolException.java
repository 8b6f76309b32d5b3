package com.nan.redislite.protocol;

import java.io.IOException;

/*
  Malformed input on the wire. There is no resynchronization, so the stream is abandoned.
*/
public class RespProtocolException extends IOException {

    public RespProtocolException(String message) {
        super(message);
    }

    public RespProtocolException(String message, Throwable cause) {
        super(message, cause);
    }
}
