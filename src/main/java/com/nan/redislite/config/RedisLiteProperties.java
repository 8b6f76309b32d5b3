package com.nan.redislite.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import com.nan.redislite.store.InMemoryKeyValueStore;

/*
  Settings bound from "redislite.*" in application.properties.
  - server: where the RESP listener binds
  - store:  initial bucket count of the shared hash table
*/
@ConfigurationProperties(prefix = "redislite")
public class RedisLiteProperties {

    private final Server server = new Server();
    private final Store store = new Store();

    public Server getServer() { return server; }
    public Store getStore() { return store; }

    public static class Server {
        private boolean enabled = true;
        private String host = "localhost";
        // 0 lets the OS pick a free port
        private int port = 5000;

        public boolean isEnabled() { return enabled; }
        public String getHost() { return host; }
        public int getPort() { return port; }

        public void setEnabled(boolean enabled) { this.enabled = enabled; }
        public void setHost(String host) { this.host = host; }
        public void setPort(int port) { this.port = port; }
    }

    public static class Store {
        private int initialCapacity = InMemoryKeyValueStore.DEFAULT_CAPACITY;

        public int getInitialCapacity() { return initialCapacity; }

        public void setInitialCapacity(int initialCapacity) { this.initialCapacity = initialCapacity; }
    }
}
