package com.specharvest.infrastructure.cli;

import com.specharvest.domain.support.CancellationToken;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for GracefulShutdown.
 */
class GracefulShutdownTest {

    @Test
    void testWaitsForCommandToLogSummary() throws InterruptedException {
        CancellationToken cancellation = new CancellationToken();
        GracefulShutdown shutdown = new GracefulShutdown(cancellation, Duration.ofSeconds(10));
        AtomicBoolean summaryLogged = new AtomicBoolean();
        CountDownLatch started = new CountDownLatch(1);

        Thread command = new Thread(() -> {
            started.countDown();
            // long politeness delay, woken by the cancel
            cancellation.pause(Duration.ofMinutes(5));
            summaryLogged.set(true);
            shutdown.finished();
        });
        command.start();
        assertTrue(started.await(5, TimeUnit.SECONDS));

        assertTrue(shutdown.onShutdown());

        assertTrue(cancellation.isCancelled());
        assertTrue(summaryLogged.get());
        command.join(5000);
    }

    @Test
    void testGivesUpAfterGracePeriod() {
        CancellationToken cancellation = new CancellationToken();
        GracefulShutdown shutdown = new GracefulShutdown(cancellation, Duration.ofMillis(50));

        assertFalse(shutdown.onShutdown());
        assertTrue(cancellation.isCancelled());
    }

    @Test
    void testReturnsAtOnceWhenAlreadyFinished() {
        CancellationToken cancellation = new CancellationToken();
        GracefulShutdown shutdown = new GracefulShutdown(cancellation, Duration.ofSeconds(10));
        shutdown.finished();

        assertTrue(shutdown.onShutdown());
        assertFalse(cancellation.isCancelled());
    }
}
