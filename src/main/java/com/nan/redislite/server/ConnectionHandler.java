package com.nan.redislite.server;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.Socket;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.nan.redislite.command.CommandDispatcher;
import com.nan.redislite.protocol.RespDecoder;
import com.nan.redislite.protocol.RespEncoder;
import com.nan.redislite.protocol.RespProtocolException;
import com.nan.redislite.protocol.RespValue;

/**
 * Serves one client connection: read a request, dispatch it, write and flush the reply, repeat.
 *
 * Requests on one connection are strictly sequential; the next read starts only after the
 * previous reply has been flushed. The loop ends when the client closes the connection, the
 * transport fails, or a request cannot be decoded (the stream cannot be resynchronized after
 * a corrupt frame). Error replies produced by the dispatcher do not end the loop.
 */
public class ConnectionHandler implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(ConnectionHandler.class);

    private final Socket socket;
    private final CommandDispatcher dispatcher;
    private final Runnable onClose;

    public ConnectionHandler(Socket socket, CommandDispatcher dispatcher, Runnable onClose) {
        this.socket = socket;
        this.dispatcher = dispatcher;
        this.onClose = onClose;
    }

    @Override
    public void run() {
        String client = String.valueOf(socket.getRemoteSocketAddress());
        log.debug("Accepted connection from {}", client);
        try (Socket s = socket) {
            serve(new BufferedInputStream(s.getInputStream()),
                    new BufferedOutputStream(s.getOutputStream()), client);
        } catch (IOException e) {
            log.debug("Connection {} failed: {}", client, e.getMessage());
        } finally {
            onClose.run();
            log.debug("Connection {} closed", client);
        }
    }

    // Loops until end of stream or a decode error; transport failures propagate.
    void serve(InputStream in, OutputStream out, String client) throws IOException {
        RespDecoder decoder = new RespDecoder(in);
        while (true) {
            RespValue request;
            try {
                request = decoder.read();
            } catch (EOFException e) {
                return;
            } catch (RespProtocolException e) {
                log.warn("Closing connection {}: {}", client, e.getMessage());
                return;
            }

            log.debug("Received from client {}: {}", client, request);
            RespEncoder.write(dispatcher.dispatch(request), out);
            out.flush();
        }
    }
}
