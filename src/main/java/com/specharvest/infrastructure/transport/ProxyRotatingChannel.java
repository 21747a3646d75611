package com.specharvest.infrastructure.transport;

import com.specharvest.domain.model.ChannelKind;
import com.specharvest.domain.model.ProxyEndpoint;
import com.specharvest.domain.ports.Channel;
import com.specharvest.domain.ports.FetchException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Fetches pages through the current proxy of a rotating pool.
 * A 403 or 429 is reported to the caller unchanged; switching to the next
 * proxy happens through {@link #rotate()}.
 */
public class ProxyRotatingChannel implements Channel {

    private static final Logger logger = LoggerFactory.getLogger(ProxyRotatingChannel.class);

    private final RotatingPool<ProxyEndpoint> proxies;
    private final AtomicReference<ProxyEndpoint> current = new AtomicReference<>();
    private final Duration timeout;
    private final boolean trustAllCertificates;

    public ProxyRotatingChannel(RotatingPool<ProxyEndpoint> proxies, Duration timeout, boolean trustAllCertificates) {
        this.proxies = proxies;
        this.timeout = timeout;
        this.trustAllCertificates = trustAllCertificates;
        proxies.next().ifPresentOrElse(
            current::set,
            () -> logger.warn("Proxy pool is empty, requests will go out without a proxy"));
    }

    @Override
    public ChannelKind kind() {
        return ChannelKind.PROXY_ROTATED;
    }

    @Override
    public String fetch(String url) throws FetchException {
        ProxyEndpoint proxy = current.get();
        HttpClientUtil.ClientOptions options = proxy == null
            ? HttpClientUtil.ClientOptions.direct(timeout)
            : HttpClientUtil.ClientOptions.viaProxy(proxy.toUrl(), timeout, trustAllCertificates);
        return HttpClientUtil.getText(options, url, HttpClientUtil.BROWSER_HEADERS);
    }

    @Override
    public boolean rotate() {
        if (proxies.size() < 2) {
            return false;
        }
        proxies.next().ifPresent(next -> {
            current.set(next);
            logger.info("Rotated to proxy {}", next.toUrl());
        });
        return true;
    }

    ProxyEndpoint currentProxy() {
        return current.get();
    }
}
