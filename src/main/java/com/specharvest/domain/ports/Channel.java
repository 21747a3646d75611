package com.specharvest.domain.ports;

import com.specharvest.domain.model.ChannelKind;

/**
 * One concrete way of fetching a page body.
 * Implementations must be safe to share between worker threads.
 */
public interface Channel {

    ChannelKind kind();

    /**
     * Fetches the body of the given URL.
     *
     * @throws FetchException on connection failures, non-2xx statuses or credential exhaustion
     */
    String fetch(String url) throws FetchException;

    /**
     * Switches to the next proxy or credential, if this channel rotates.
     *
     * @return true if a rotation happened
     */
    default boolean rotate() {
        return false;
    }
}
