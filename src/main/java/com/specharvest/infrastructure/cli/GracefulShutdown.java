package com.specharvest.infrastructure.cli;

import com.specharvest.domain.support.CancellationToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Shutdown hook that cancels the run and holds the JVM open until the
 * command has finished and logged its summary, up to a grace period.
 */
public class GracefulShutdown {

    private static final Logger logger = LoggerFactory.getLogger(GracefulShutdown.class);

    private final CancellationToken cancellation;
    private final Duration grace;
    private final CountDownLatch finished = new CountDownLatch(1);

    public GracefulShutdown(CancellationToken cancellation, Duration grace) {
        this.cancellation = cancellation;
        this.grace = grace;
    }

    public void register() {
        Runtime.getRuntime().addShutdownHook(new Thread(this::onShutdown, "harvest-shutdown"));
    }

    /**
     * Called by the command once it has returned, normally or not.
     */
    public void finished() {
        finished.countDown();
    }

    /**
     * Cancels the run and waits for {@link #finished()}.
     *
     * @return true if the command finished within the grace period
     */
    boolean onShutdown() {
        if (finished.getCount() == 0) {
            return true;
        }
        logger.warn("Shutdown requested, finishing current work (up to {}s)", grace.toSeconds());
        cancellation.cancel();
        try {
            if (finished.await(grace.toMillis(), TimeUnit.MILLISECONDS)) {
                return true;
            }
            logger.error("Run did not finish within {}s, exiting with partial results", grace.toSeconds());
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
