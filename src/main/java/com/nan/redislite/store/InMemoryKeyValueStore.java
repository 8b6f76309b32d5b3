package com.nan.redislite.store;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/*
  Chained hash table from string keys to byte[] values (never null).

  Entries sit in a pool of parallel arrays (key, value, next slot); a bucket holds
  the slot index of its chain head. Resize rewrites heads and next links only,
  entries keep their slots. Deleted slots go on a free list.

  Index = fnv1a64(key) mod capacity. Doubles before linking a new key when
  (size + 1) / capacity would reach LOAD_FACTOR_LIMIT.

  Not thread-safe; KvService guards the shared instance.
*/
public class InMemoryKeyValueStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryKeyValueStore.class);

    public static final int DEFAULT_CAPACITY = 128;
    public static final double LOAD_FACTOR_LIMIT = 0.8;

    private static final int NIL = -1;

    private int[] buckets;
    private int capacity;
    private int size;

    // entry pool
    private String[] keys;
    private byte[][] values;
    private int[] next;
    private int used;
    private int freeHead = NIL;

    public InMemoryKeyValueStore() {
        this(DEFAULT_CAPACITY);
    }

    public InMemoryKeyValueStore(int initialCapacity) {
        if (initialCapacity < 1) {
            throw new IllegalArgumentException("initialCapacity must be positive: " + initialCapacity);
        }
        this.capacity = initialCapacity;
        this.buckets = emptyBuckets(initialCapacity);
        this.keys = new String[initialCapacity];
        this.values = new byte[initialCapacity][];
        this.next = new int[initialCapacity];
    }

    // Returns the value for a key, or null if the key does not exist.
    public byte[] get(String key) {
        int slot = find(key);
        return slot == NIL ? null : values[slot];
    }

    public boolean containsKey(String key) {
        return find(key) != NIL;
    }

    // Saves or overwrites the value for the key.
    public void put(String key, byte[] value) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");

        int bucket = indexFor(key, capacity);
        for (int slot = buckets[bucket]; slot != NIL; slot = next[slot]) {
            if (keys[slot].equals(key)) {
                values[slot] = value;
                return;
            }
        }

        if ((double) (size + 1) / capacity >= LOAD_FACTOR_LIMIT) {
            resize();
            bucket = indexFor(key, capacity);
        }

        int slot = allocateSlot();
        keys[slot] = key;
        values[slot] = value;
        next[slot] = buckets[bucket];
        buckets[bucket] = slot;
        size++;
    }

    // Unlinks the entry; false if the key was absent.
    public boolean delete(String key) {
        Objects.requireNonNull(key, "key");
        int bucket = indexFor(key, capacity);
        int previous = NIL;
        for (int slot = buckets[bucket]; slot != NIL; slot = next[slot]) {
            if (keys[slot].equals(key)) {
                if (previous == NIL) {
                    buckets[bucket] = next[slot];
                } else {
                    next[previous] = next[slot];
                }
                releaseSlot(slot);
                size--;
                return true;
            }
            previous = slot;
        }
        return false;
    }

    // live entries
    public int size() {
        return size;
    }

    // current bucket count
    public int capacity() {
        return capacity;
    }

    // ------------------ internals ------------------

    private int find(String key) {
        Objects.requireNonNull(key, "key");
        for (int slot = buckets[indexFor(key, capacity)]; slot != NIL; slot = next[slot]) {
            if (keys[slot].equals(key)) {
                return slot;
            }
        }
        return NIL;
    }

    private void resize() {
        int newCapacity = capacity * 2;
        int[] newBuckets = emptyBuckets(newCapacity);

        for (int head : buckets) {
            int slot = head;
            while (slot != NIL) {
                int following = next[slot];
                int bucket = indexFor(keys[slot], newCapacity);
                next[slot] = newBuckets[bucket];
                newBuckets[bucket] = slot;
                slot = following;
            }
        }

        buckets = newBuckets;
        capacity = newCapacity;
        log.info("Resized to capacity {} ({} entries)", newCapacity, size);
    }

    private int allocateSlot() {
        if (freeHead != NIL) {
            int slot = freeHead;
            freeHead = next[slot];
            return slot;
        }
        if (used == keys.length) {
            int grown = keys.length * 2;
            keys = Arrays.copyOf(keys, grown);
            values = Arrays.copyOf(values, grown);
            next = Arrays.copyOf(next, grown);
        }
        return used++;
    }

    private void releaseSlot(int slot) {
        keys[slot] = null;
        values[slot] = null;
        next[slot] = freeHead;
        freeHead = slot;
    }

    static int indexFor(String key, int capacity) {
        return (int) Long.remainderUnsigned(Fnv1a.hash64(key), capacity);
    }

    private static int[] emptyBuckets(int capacity) {
        int[] heads = new int[capacity];
        Arrays.fill(heads, NIL);
        return heads;
    }

    // Keys chained in one bucket, head first. Used by tests to inspect collisions.
    List<String> chainKeys(int bucket) {
        List<String> chain = new ArrayList<>();
        for (int slot = buckets[bucket]; slot != NIL; slot = next[slot]) {
            chain.add(keys[slot]);
        }
        return chain;
    }
}
