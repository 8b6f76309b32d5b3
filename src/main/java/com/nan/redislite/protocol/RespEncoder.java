package com.nan.redislite.protocol;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

/*
  Wire form:
    +text\r\n          simple string
    -text\r\n          error
    :123\r\n           integer
    $5\r\nhello\r\n    bulk string   ($-1\r\n when null)
    *2\r\n...          array         (*-1\r\n when null)
  Simple strings and errors are written as given; CR/LF inside them is the caller's problem.
*/
public final class RespEncoder {

    private static final byte[] CRLF = {'\r', '\n'};
    private static final byte[] NULL_BULK = {'$', '-', '1', '\r', '\n'};
    private static final byte[] NULL_ARRAY = {'*', '-', '1', '\r', '\n'};

    private RespEncoder() {
    }

    public static byte[] encode(RespValue value) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try {
            write(value, out);
        } catch (IOException e) {
            // ByteArrayOutputStream does not throw
            throw new UncheckedIOException(e);
        }
        return out.toByteArray();
    }

    // Does not flush.
    public static void write(RespValue value, OutputStream out) throws IOException {
        switch (value.type()) {
            case SIMPLE_STRING:
                writeLine(out, '+', ((SimpleString) value).getValue());
                break;
            case ERROR:
                writeLine(out, '-', ((RespError) value).getMessage());
                break;
            case INTEGER:
                writeLine(out, ':', Long.toString(((RespInteger) value).getValue()));
                break;
            case BULK_STRING:
                writeBulk(out, (BulkString) value);
                break;
            case ARRAY:
                writeArray(out, (RespArray) value);
                break;
            default:
                throw new IllegalArgumentException("unsupported value type: " + value.type());
        }
    }

    private static void writeBulk(OutputStream out, BulkString bulk) throws IOException {
        if (bulk.isNull()) {
            out.write(NULL_BULK);
            return;
        }
        byte[] payload = bulk.payload();
        writeLine(out, '$', Integer.toString(payload.length));
        out.write(payload);
        out.write(CRLF);
    }

    private static void writeArray(OutputStream out, RespArray array) throws IOException {
        if (array.isNull()) {
            out.write(NULL_ARRAY);
            return;
        }
        writeLine(out, '*', Integer.toString(array.size()));
        for (RespValue element : array.getElements()) {
            write(element, out);
        }
    }

    private static void writeLine(OutputStream out, char tag, String text) throws IOException {
        out.write(tag);
        out.write(text.getBytes(StandardCharsets.UTF_8));
        out.write(CRLF);
    }
}
