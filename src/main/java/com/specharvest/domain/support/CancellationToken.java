package com.specharvest.domain.support;

import com.specharvest.domain.ports.FetchException;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Shared stop signal for a run. Checked before each fetch and delay;
 * cancelling wakes every thread blocked in {@link #pause(Duration)}.
 */
public class CancellationToken {

    private final CountDownLatch cancelled = new CountDownLatch(1);

    public void cancel() {
        cancelled.countDown();
    }

    public boolean isCancelled() {
        return cancelled.getCount() == 0;
    }

    public void throwIfCancelled() throws FetchException {
        if (isCancelled()) {
            throw FetchException.cancelled();
        }
    }

    /**
     * Sleeps for the given duration unless cancelled first.
     *
     * @return true if the full delay elapsed, false if the run was cancelled
     */
    public boolean pause(Duration delay) {
        if (delay == null || delay.isZero() || delay.isNegative()) {
            return !isCancelled();
        }
        try {
            return !cancelled.await(delay.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
