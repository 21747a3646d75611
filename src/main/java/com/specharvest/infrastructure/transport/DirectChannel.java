package com.specharvest.infrastructure.transport;

import com.specharvest.domain.model.ChannelKind;
import com.specharvest.domain.ports.Channel;
import com.specharvest.domain.ports.FetchException;

import java.time.Duration;

/**
 * Fetches pages without any intermediary.
 */
public class DirectChannel implements Channel {

    private final HttpClientUtil.ClientOptions options;

    public DirectChannel(Duration timeout) {
        this.options = HttpClientUtil.ClientOptions.direct(timeout);
    }

    @Override
    public ChannelKind kind() {
        return ChannelKind.DIRECT;
    }

    @Override
    public String fetch(String url) throws FetchException {
        return HttpClientUtil.getText(options, url, HttpClientUtil.BROWSER_HEADERS);
    }
}
