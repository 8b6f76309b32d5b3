package com.nan.redislite.server;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Component;

import com.nan.redislite.command.CommandDispatcher;
import com.nan.redislite.config.RedisLiteProperties;

/**
 * TCP listener for the RESP protocol, started and stopped with the application context.
 *
 * One acceptor thread; each accepted connection gets its own thread from a cached pool and
 * runs a {@link ConnectionHandler}. The number of connections is not limited.
 */
@Component
public class RespServer implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(RespServer.class);

    private final RedisLiteProperties.Server config;
    private final CommandDispatcher dispatcher;
    private final Set<Socket> clients = ConcurrentHashMap.newKeySet();

    private volatile ServerSocket serverSocket;
    private volatile boolean running;
    private ExecutorService connectionPool;
    private Thread acceptor;

    public RespServer(RedisLiteProperties properties, CommandDispatcher dispatcher) {
        this.config = properties.getServer();
        this.dispatcher = dispatcher;
    }

    @Override
    public synchronized void start() {
        if (running) return;
        try {
            ServerSocket socket = new ServerSocket();
            socket.setReuseAddress(true);
            socket.bind(new InetSocketAddress(config.getHost(), config.getPort()));
            serverSocket = socket;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to start RESP server on "
                    + config.getHost() + ":" + config.getPort(), e);
        }

        connectionPool = Executors.newCachedThreadPool(new CustomizableThreadFactory("resp-conn-"));
        acceptor = new Thread(this::acceptLoop, "resp-acceptor");
        acceptor.setDaemon(true);
        running = true;
        acceptor.start();
        log.info("RESP server listening on {}", serverSocket.getLocalSocketAddress());
    }

    @Override
    public synchronized void stop() {
        if (!running) return;
        running = false;
        try {
            serverSocket.close();
        } catch (IOException e) {
            log.warn("Error closing listener: {}", e.getMessage());
        }
        for (Socket client : clients) {
            closeQuietly(client);
        }
        connectionPool.shutdown();
        try {
            if (!connectionPool.awaitTermination(5, TimeUnit.SECONDS)) {
                connectionPool.shutdownNow();
            }
        } catch (InterruptedException e) {
            connectionPool.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("RESP server stopped");
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public boolean isAutoStartup() {
        return config.isEnabled();
    }

    // Bound port; differs from the configured one when that was 0.
    public int getPort() {
        ServerSocket socket = serverSocket;
        if (socket == null) {
            throw new IllegalStateException("RESP server is not started");
        }
        return socket.getLocalPort();
    }

    // ------------------ ACCEPT LOOP ------------------
    private void acceptLoop() {
        while (running) {
            Socket client;
            try {
                client = serverSocket.accept();
            } catch (IOException e) {
                // listener closed by stop()
                if (!running || serverSocket.isClosed()) return;
                log.warn("Failed to accept connection: {}", e.getMessage());
                continue;
            }

            clients.add(client);
            // stop() sets running before it closes clients, so a socket added after
            // that sweep is caught here
            if (!running) {
                clients.remove(client);
                closeQuietly(client);
                return;
            }
            try {
                connectionPool.execute(new ConnectionHandler(client, dispatcher, () -> clients.remove(client)));
            } catch (RejectedExecutionException e) {
                clients.remove(client);
                closeQuietly(client);
            }
        }
    }

    private static void closeQuietly(Socket client) {
        try {
            client.close();
        } catch (IOException e) {
            log.debug("Error closing client socket: {}", e.getMessage());
        }
    }
}
