package com.safar.bot.component;

import java.util.concurrent.locks.ReentrantLock;

/**
 * Fixed set of striped locks. Keys hashing to the same stripe share a lock, so callers
 * must only hold one lock from a given instance at a time.
 */
public class KeyedLocks {

    private final ReentrantLock[] stripes;

    public KeyedLocks(int stripeCount) {
        if (stripeCount <= 0) {
            throw new IllegalArgumentException("stripeCount must be positive");
        }
        this.stripes = new ReentrantLock[stripeCount];
        for (int i = 0; i < stripeCount; i++) {
            stripes[i] = new ReentrantLock();
        }
    }

    public ReentrantLock lockFor(String key) {
        int h = key == null ? 0 : key.hashCode();
        h ^= (h >>> 16);
        return stripes[Math.floorMod(h, stripes.length)];
    }

    public int size() {
        return stripes.length;
    }
}
