package com.nan.redislite.client;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.Closeable;
import java.io.IOException;
import java.io.OutputStream;
import java.net.Socket;

import com.nan.redislite.protocol.RespArray;
import com.nan.redislite.protocol.RespDecoder;
import com.nan.redislite.protocol.RespEncoder;
import com.nan.redislite.protocol.RespValue;

/*
  Blocking client for one connection: send() writes a request and waits for its reply.
  Not thread-safe.
*/
public class RespClient implements Closeable {

    private final Socket socket;
    private final RespDecoder decoder;
    private final OutputStream out;

    public RespClient(String host, int port) throws IOException {
        this.socket = new Socket(host, port);
        this.decoder = new RespDecoder(new BufferedInputStream(socket.getInputStream()));
        this.out = new BufferedOutputStream(socket.getOutputStream());
    }

    public RespValue send(RespValue request) throws IOException {
        RespEncoder.write(request, out);
        out.flush();
        return decoder.read();
    }

    // Sends the tokens as an array of bulk strings.
    public RespValue command(String... tokens) throws IOException {
        return send(RespArray.ofBulkStrings(tokens));
    }

    @Override
    public void close() throws IOException {
        socket.close();
    }
}
