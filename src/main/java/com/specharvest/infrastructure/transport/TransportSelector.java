package com.specharvest.infrastructure.transport;

import com.specharvest.domain.model.ChannelKind;
import com.specharvest.domain.model.ProxyEndpoint;
import com.specharvest.domain.ports.Channel;
import com.specharvest.domain.support.CancellationToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Builds the fetch channel for a run from the configured kind and the
 * proxy and credential pools.
 */
public class TransportSelector {

    private static final Logger logger = LoggerFactory.getLogger(TransportSelector.class);

    /**
     * Timeouts and render API settings shared by all channels.
     */
    public record Settings(Duration directTimeout,
                           Duration proxyTimeout,
                           boolean trustAllProxyCertificates,
                           String renderApiUrl,
                           boolean renderJs,
                           Duration renderTimeout,
                           Duration keySwitchPause) {
    }

    private final Settings settings;
    private final RotatingPool<ProxyEndpoint> proxyPool;
    private final RotatingPool<String> apiKeyPool;
    private final CancellationToken cancellation;

    public TransportSelector(Settings settings,
                             RotatingPool<ProxyEndpoint> proxyPool,
                             RotatingPool<String> apiKeyPool,
                             CancellationToken cancellation) {
        this.settings = settings;
        this.proxyPool = proxyPool;
        this.apiKeyPool = apiKeyPool;
        this.cancellation = cancellation;
    }

    /**
     * Returns a channel of the requested kind.
     *
     * @throws IllegalStateException if the render API is requested without any API key
     */
    public Channel acquire(ChannelKind kind) {
        Channel channel = switch (kind) {
            case DIRECT -> direct();
            case PROXY_ROTATED -> new ProxyRotatingChannel(
                proxyPool, settings.proxyTimeout(), settings.trustAllProxyCertificates());
            case EXTERNAL_RENDER_PROXY -> renderApi();
            case FAILOVER -> new FailoverChannel(renderApi(), direct());
        };
        logger.info("Using {} channel", channel.kind());
        return channel;
    }

    private Channel direct() {
        return new DirectChannel(settings.directTimeout());
    }

    private Channel renderApi() {
        if (apiKeyPool.size() == 0) {
            throw new IllegalStateException("Render API channel requires at least one API key");
        }
        logger.info("Loaded {} render API keys", apiKeyPool.size());
        return new RenderApiChannel(
            settings.renderApiUrl(),
            apiKeyPool,
            settings.renderJs(),
            settings.renderTimeout(),
            settings.keySwitchPause(),
            cancellation);
    }
}
