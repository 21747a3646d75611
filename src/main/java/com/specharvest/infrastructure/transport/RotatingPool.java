package com.specharvest.infrastructure.transport;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.Random;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Round-robin pool of proxies or credentials.
 * The cursor is guarded by a lock so concurrent workers never corrupt it;
 * two workers may still use the same entry at the same time.
 */
public class RotatingPool<T> {

    private final ReentrantLock lock = new ReentrantLock();
    private List<T> entries;
    private int cursor;

    public RotatingPool(List<T> entries) {
        this.entries = List.copyOf(entries);
    }

    public static <T> RotatingPool<T> empty() {
        return new RotatingPool<>(List.of());
    }

    /**
     * Replaces the pool content, shuffled once, and resets the cursor.
     */
    public void replaceShuffled(List<T> newEntries, Random random) {
        List<T> shuffled = new ArrayList<>(newEntries);
        Collections.shuffle(shuffled, random);
        lock.lock();
        try {
            entries = List.copyOf(shuffled);
            cursor = 0;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns the entry under the cursor and advances it.
     */
    public Optional<T> next() {
        lock.lock();
        try {
            if (entries.isEmpty()) {
                return Optional.empty();
            }
            T entry = entries.get(cursor);
            cursor = (cursor + 1) % entries.size();
            return Optional.of(entry);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns every entry once, starting at the cursor, and advances the cursor by one.
     * Used when a single call must try each credential at most once.
     */
    public List<T> nextCycle() {
        lock.lock();
        try {
            if (entries.isEmpty()) {
                return List.of();
            }
            List<T> cycle = new ArrayList<>(entries.size());
            for (int i = 0; i < entries.size(); i++) {
                cycle.add(entries.get((cursor + i) % entries.size()));
            }
            cursor = (cursor + 1) % entries.size();
            return cycle;
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return entries.size();
        } finally {
            lock.unlock();
        }
    }
}
