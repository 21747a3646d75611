package com.specharvest.infrastructure.transport;

import com.specharvest.domain.model.ChannelKind;
import com.specharvest.domain.ports.Channel;
import com.specharvest.domain.ports.FetchException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Uses the primary channel until it reports credential exhaustion, then
 * pins every further fetch of the run to the fallback channel.
 */
public class FailoverChannel implements Channel {

    private static final Logger logger = LoggerFactory.getLogger(FailoverChannel.class);

    private final Channel primary;
    private final Channel fallback;
    private final AtomicBoolean primaryExhausted = new AtomicBoolean(false);

    public FailoverChannel(Channel primary, Channel fallback) {
        this.primary = primary;
        this.fallback = fallback;
    }

    @Override
    public ChannelKind kind() {
        return ChannelKind.FAILOVER;
    }

    @Override
    public String fetch(String url) throws FetchException {
        if (!primaryExhausted.get()) {
            try {
                return primary.fetch(url);
            } catch (FetchException e) {
                if (e.getReason() != FetchException.Reason.CREDENTIALS_EXHAUSTED) {
                    throw e;
                }
                if (primaryExhausted.compareAndSet(false, true)) {
                    logger.warn("{} channel exhausted, switching to {} for the rest of the run",
                        primary.kind(), fallback.kind());
                }
            }
        }
        return fallback.fetch(url);
    }

    @Override
    public boolean rotate() {
        return primaryExhausted.get() ? fallback.rotate() : primary.rotate();
    }

    public boolean isOnFallback() {
        return primaryExhausted.get();
    }
}
