package com.nan.redislite.store;

import java.nio.charset.StandardCharsets;

/*
  64-bit FNV-1a over the key bytes. Keys hold one byte per char (see KvService.keyOf).
  Deterministic across runs, so bucket layout is reproducible in tests. Not for security.
*/
public final class Fnv1a {

    static final long OFFSET_BASIS = 0xcbf29ce484222325L;
    static final long PRIME = 0x100000001b3L;

    private Fnv1a() {
    }

    public static long hash64(String key) {
        long hash = OFFSET_BASIS;
        for (byte b : key.getBytes(StandardCharsets.ISO_8859_1)) {
            hash ^= (b & 0xff);
            hash *= PRIME;
        }
        return hash;
    }
}
