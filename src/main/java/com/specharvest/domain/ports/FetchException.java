package com.specharvest.domain.ports;

import java.io.IOException;

/**
 * Failure of an outbound fetch, tagged with the reason so callers can decide
 * between retrying, rotating, failing over or aborting.
 */
public class FetchException extends IOException {

    public enum Reason {
        /** Connection failure or timeout. */
        NETWORK,
        /** Non-2xx response; see {@link #getStatusCode()}. */
        HTTP_STATUS,
        /** Every credential of the rotating pool was rejected within one call. */
        CREDENTIALS_EXHAUSTED,
        /** The retry budget ran out; the last failure is the cause. */
        RETRIES_EXHAUSTED,
        /** The run was cancelled before or during the fetch. */
        CANCELLED
    }

    private final Reason reason;
    private final int statusCode;

    private FetchException(Reason reason, int statusCode, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
        this.statusCode = statusCode;
    }

    public static FetchException network(String url, Throwable cause) {
        return new FetchException(Reason.NETWORK, 0,
            "Network failure fetching " + url + ": " + cause.getMessage(), cause);
    }

    public static FetchException httpStatus(String url, int statusCode) {
        return new FetchException(Reason.HTTP_STATUS, statusCode,
            "HTTP request failed with status " + statusCode + " for " + url, null);
    }

    public static FetchException credentialsExhausted(int credentialCount) {
        return new FetchException(Reason.CREDENTIALS_EXHAUSTED, 0,
            "All " + credentialCount + " API keys exhausted", null);
    }

    public static FetchException retriesExhausted(int attempts, FetchException last) {
        return new FetchException(Reason.RETRIES_EXHAUSTED, last.getStatusCode(),
            "Failed after " + attempts + " attempts: " + last.getMessage(), last);
    }

    public static FetchException cancelled() {
        return new FetchException(Reason.CANCELLED, 0, "Fetch cancelled", null);
    }

    public Reason getReason() {
        return reason;
    }

    /**
     * HTTP status of the failed response, or 0 when no response was received.
     */
    public int getStatusCode() {
        return statusCode;
    }

    /**
     * True for 403 and 429 responses, the signals that a proxy or key has been
     * blocked or rate limited.
     */
    public boolean isRateLimitedOrBlocked() {
        return reason == Reason.HTTP_STATUS && (statusCode == 403 || statusCode == 429);
    }

    /**
     * True when no further progress is possible and retrying is pointless.
     */
    public boolean isTerminal() {
        return reason == Reason.CREDENTIALS_EXHAUSTED || reason == Reason.CANCELLED;
    }
}
