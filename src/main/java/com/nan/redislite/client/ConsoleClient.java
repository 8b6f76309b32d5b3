package com.nan.redislite.client;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.nan.redislite.protocol.RespFormatter;
import com.nan.redislite.protocol.RespValue;

/*
  Interactive shell: type a command, see the reply.

    java -cp redis-lite.jar com.nan.redislite.client.ConsoleClient --host localhost --port 5000

  Each input line is split on whitespace and sent as an array of bulk strings.
*/
public class ConsoleClient {

    private static final Logger log = LoggerFactory.getLogger(ConsoleClient.class);

    static final String DEFAULT_HOST = "localhost";
    static final int DEFAULT_PORT = 5000;

    public static void main(String[] args) {
        String host = DEFAULT_HOST;
        int port = DEFAULT_PORT;
        for (int i = 0; i + 1 < args.length; i += 2) {
            if ("--host".equals(args[i])) host = args[i + 1];
            else if ("--port".equals(args[i])) port = parsePort(args[i + 1]);
        }
        if (port < 0) {
            System.exit(2);
        }

        BufferedReader console = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        try (RespClient client = new RespClient(host, port)) {
            log.info("Connected to server: {}:{}", host, port);
            run(console, client, System.out);
        } catch (IOException e) {
            log.error("Connection to {}:{} failed: {}", host, port, e.getMessage());
            System.exit(1);
        }
    }

    // Returns -1 (and logs why) when the value is not a TCP port number.
    static int parsePort(String value) {
        int port;
        try {
            port = Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            log.error("Invalid --port '{}': not a number", value);
            return -1;
        }
        if (port < 1 || port > 65535) {
            log.error("Invalid --port {}: must be between 1 and 65535", port);
            return -1;
        }
        return port;
    }

    // Reads commands until end of input. Blank lines are skipped.
    static void run(BufferedReader console, RespClient client, PrintStream out) throws IOException {
        while (true) {
            out.print("> ");
            out.flush();
            String line = console.readLine();
            if (line == null) return;

            String trimmed = line.trim();
            if (trimmed.isEmpty()) continue;

            RespValue reply = client.command(trimmed.split("\\s+"));
            out.println(RespFormatter.display(reply));
        }
    }
}
