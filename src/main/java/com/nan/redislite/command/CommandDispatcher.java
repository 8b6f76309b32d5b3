package com.nan.redislite.command;

import java.io.ByteArrayOutputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import org.springframework.stereotype.Component;

import com.nan.redislite.protocol.BulkString;
import com.nan.redislite.protocol.RespArray;
import com.nan.redislite.protocol.RespError;
import com.nan.redislite.protocol.RespValue;
import com.nan.redislite.protocol.SimpleString;
import com.nan.redislite.service.KvService;

/**
 * Turns one decoded request into exactly one reply.
 *
 * A request is a non-empty array of bulk strings; the first one names the command and is
 * matched case-insensitively. Every failure the client can cause (bad shape, wrong arity,
 * unknown name) comes back as an error reply; nothing here throws for client input.
 *
 * Holds no per-connection state, so one instance serves all connections.
 */
@Component
public class CommandDispatcher {

    static final String ERR_INVALID_FORMAT = "ERR invalid command format";
    static final String ERR_GET_ARITY = "ERR wrong number of arguments for 'get' command";
    static final String ERR_SYNTAX = "ERR syntax error";

    static final String HELP_TEXT = "PING: Returns PONG\n"
            + "ECHO <message>: Returns the provided message\n"
            + "GET <key>: Returns the value associated with the key\n"
            + "SET <key> <value>: Sets the value for the given key\n"
            + "HELP: Shows this message";

    private final KvService kvService;

    public CommandDispatcher(KvService kvService) {
        this.kvService = kvService;
    }

    public RespValue dispatch(RespValue request) {
        List<BulkString> parts = commandParts(request);
        if (parts == null) {
            return new RespError(ERR_INVALID_FORMAT);
        }

        String name = parts.get(0).asString().toUpperCase(Locale.ROOT);
        switch (name) {
            case "PING":
                return SimpleString.PONG;
            case "ECHO":
                return echo(parts);
            case "GET":
                return get(parts);
            case "SET":
                return set(parts);
            case "HELP":
                return BulkString.of(HELP_TEXT);
            default:
                return new RespError("ERR unknown command '" + name + "'");
        }
    }

    // ------------------ commands ------------------

    private RespValue echo(List<BulkString> parts) {
        if (parts.size() == 1) {
            return BulkString.EMPTY;
        }
        ByteArrayOutputStream joined = new ByteArrayOutputStream();
        for (int i = 1; i < parts.size(); i++) {
            if (i > 1) joined.write(' ');
            joined.writeBytes(parts.get(i).getBytes());
        }
        return BulkString.of(joined.toByteArray());
    }

    private RespValue get(List<BulkString> parts) {
        if (parts.size() != 2) {
            return new RespError(ERR_GET_ARITY);
        }
        byte[] value = kvService.get(parts.get(1).getBytes());
        return value == null ? BulkString.NULL : BulkString.of(value);
    }

    private RespValue set(List<BulkString> parts) {
        if (parts.size() != 3) {
            return new RespError(ERR_SYNTAX);
        }
        kvService.put(parts.get(1).getBytes(), parts.get(2).getBytes());
        return SimpleString.OK;
    }

    // Returns the tokens of a well-formed request, or null if the request has the wrong shape.
    private static List<BulkString> commandParts(RespValue request) {
        if (!(request instanceof RespArray) || request.isNull()) {
            return null;
        }
        List<RespValue> elements = ((RespArray) request).getElements();
        if (elements.isEmpty()) {
            return null;
        }
        List<BulkString> parts = new ArrayList<>(elements.size());
        for (RespValue element : elements) {
            if (!(element instanceof BulkString) || element.isNull()) {
                return null;
            }
            parts.add((BulkString) element);
        }
        return parts;
    }
}
