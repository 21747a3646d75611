package com.specharvest.infrastructure.transport;

import com.specharvest.domain.model.ChannelKind;
import com.specharvest.domain.ports.Channel;
import com.specharvest.domain.ports.FetchException;
import com.specharvest.domain.support.CancellationToken;
import org.apache.hc.core5.net.URIBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URISyntaxException;
import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Delegates fetches to a third-party rendering API (ScrapingBee-compatible
 * query interface) using a pool of rotating API keys.
 *
 * <p>Within one call every key is tried at most once. A 403 or 429 from the
 * API means the key is out of credit or blocked and the next key is tried.
 * Only when every key of the cycle has been rejected does the call fail with
 * {@link FetchException.Reason#CREDENTIALS_EXHAUSTED}; if any key failed for
 * another reason the last failure is thrown and stays retryable.</p>
 */
public class RenderApiChannel implements Channel {

    private static final Logger logger = LoggerFactory.getLogger(RenderApiChannel.class);

    private final String apiUrl;
    private final RotatingPool<String> apiKeys;
    private final boolean renderJs;
    private final Duration keySwitchPause;
    private final CancellationToken cancellation;
    private final HttpClientUtil.ClientOptions options;

    public RenderApiChannel(String apiUrl,
                            RotatingPool<String> apiKeys,
                            boolean renderJs,
                            Duration timeout,
                            Duration keySwitchPause,
                            CancellationToken cancellation) {
        this.apiUrl = apiUrl;
        this.apiKeys = apiKeys;
        this.renderJs = renderJs;
        this.keySwitchPause = keySwitchPause;
        this.cancellation = cancellation;
        this.options = HttpClientUtil.ClientOptions.direct(timeout);
    }

    @Override
    public ChannelKind kind() {
        return ChannelKind.EXTERNAL_RENDER_PROXY;
    }

    @Override
    public String fetch(String url) throws FetchException {
        List<String> keys = apiKeys.nextCycle();
        if (keys.isEmpty()) {
            throw FetchException.credentialsExhausted(0);
        }

        int rejected = 0;
        FetchException lastFailure = null;

        for (int attempt = 1; attempt <= keys.size(); attempt++) {
            cancellation.throwIfCancelled();
            try {
                return HttpClientUtil.getText(options, requestUrl(keys.get(attempt - 1), url), Map.of());
            } catch (FetchException e) {
                // rethrown against the target URL so API keys stay out of messages
                if (e.isRateLimitedOrBlocked()) {
                    rejected++;
                    logger.warn("API key {}/{} exhausted or blocked (status {}), switching to next key",
                        attempt, keys.size(), e.getStatusCode());
                    lastFailure = FetchException.httpStatus(url, e.getStatusCode());
                } else if (e.getReason() == FetchException.Reason.NETWORK) {
                    logger.warn("Render API request failed with key {}/{}: {}",
                        attempt, keys.size(), e.getCause() != null ? e.getCause().getMessage() : "unknown");
                    lastFailure = FetchException.network(url, e.getCause() != null ? e.getCause() : e);
                } else if (e.getReason() == FetchException.Reason.HTTP_STATUS) {
                    throw FetchException.httpStatus(url, e.getStatusCode());
                } else {
                    throw e;
                }
            }

            if (attempt < keys.size() && !cancellation.pause(keySwitchPause)) {
                throw FetchException.cancelled();
            }
        }

        if (rejected == keys.size()) {
            throw FetchException.credentialsExhausted(keys.size());
        }
        // at least one key failed for another reason, so the pool is not proven exhausted
        throw lastFailure;
    }

    @Override
    public boolean rotate() {
        return apiKeys.next().isPresent() && apiKeys.size() > 1;
    }

    String requestUrl(String apiKey, String targetUrl) {
        try {
            return new URIBuilder(apiUrl)
                .addParameter("api_key", apiKey)
                .addParameter("url", targetUrl)
                .addParameter("render_js", String.valueOf(renderJs))
                .build()
                .toString();
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException("Invalid render API URL: " + apiUrl, e);
        }
    }
}
