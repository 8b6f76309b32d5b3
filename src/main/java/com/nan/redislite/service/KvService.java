package com.nan.redislite.service;

import java.nio.charset.StandardCharsets;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import com.nan.redislite.config.RedisLiteProperties;
import com.nan.redislite.model.StoreStats;
import com.nan.redislite.store.InMemoryKeyValueStore;

/*
  The one store shared by every connection and by the HTTP API.

  Locking: reads take the shared lock, writes take the exclusive lock.
  Each lock covers the whole operation (hashing, chain walk, and any resize),
  so no reader ever sees the bucket array mid-rehash.

  Keys and values are byte arrays. Values are copied on the way in and out, so
  callers never hold a reference into the store. Keys are mapped one byte per
  char (ISO-8859-1), which keeps distinct byte sequences distinct.
*/
@Service
public class KvService {

    private final InMemoryKeyValueStore store;
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    @Autowired
    public KvService(RedisLiteProperties properties) {
        this(properties.getStore().getInitialCapacity());
    }

    public KvService(int initialCapacity) {
        this.store = new InMemoryKeyValueStore(initialCapacity);
    }

    // Returns a copy of the stored value, or null if the key is absent.
    public byte[] get(byte[] key) {
        String k = keyOf(key);
        lock.readLock().lock();
        try {
            byte[] value = store.get(k);
            return value == null ? null : value.clone();
        } finally {
            lock.readLock().unlock();
        }
    }

    public void put(byte[] key, byte[] value) {
        String k = keyOf(key);
        byte[] copy = value.clone();
        lock.writeLock().lock();
        try {
            store.put(k, copy);
        } finally {
            lock.writeLock().unlock();
        }
    }

    // Returns true if the key existed.
    public boolean delete(byte[] key) {
        String k = keyOf(key);
        lock.writeLock().lock();
        try {
            return store.delete(k);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public StoreStats stats() {
        lock.readLock().lock();
        try {
            return new StoreStats(store.size(), store.capacity());
        } finally {
            lock.readLock().unlock();
        }
    }

    static String keyOf(byte[] key) {
        return new String(key, StandardCharsets.ISO_8859_1);
    }
}
