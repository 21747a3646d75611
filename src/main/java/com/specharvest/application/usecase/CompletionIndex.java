package com.specharvest.application.usecase;

import java.util.HashSet;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Detail ids already ingested, plus those currently being processed.
 * Claim and complete happen under one lock so two workers can never ingest
 * the same id in the same run.
 */
public class CompletionIndex {

    private final ReentrantLock lock = new ReentrantLock();
    private final Set<String> completed;
    private final Set<String> inFlight = new HashSet<>();

    public CompletionIndex(Set<String> alreadyCompleted) {
        this.completed = new HashSet<>(alreadyCompleted);
    }

    /**
     * Reserves the id for processing.
     *
     * @return false if the id is already complete or claimed by another worker
     */
    public boolean claim(String detailId) {
        lock.lock();
        try {
            if (completed.contains(detailId) || inFlight.contains(detailId)) {
                return false;
            }
            inFlight.add(detailId);
            return true;
        } finally {
            lock.unlock();
        }
    }

    public void complete(String detailId) {
        lock.lock();
        try {
            inFlight.remove(detailId);
            completed.add(detailId);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Gives up a claim after a failure so a later run can retry the id.
     */
    public void release(String detailId) {
        lock.lock();
        try {
            inFlight.remove(detailId);
        } finally {
            lock.unlock();
        }
    }

    public boolean isComplete(String detailId) {
        lock.lock();
        try {
            return completed.contains(detailId);
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return completed.size();
        } finally {
            lock.unlock();
        }
    }
}
