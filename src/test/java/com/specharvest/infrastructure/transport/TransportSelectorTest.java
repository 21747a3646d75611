package com.specharvest.infrastructure.transport;

import com.specharvest.domain.model.ChannelKind;
import com.specharvest.domain.model.ProxyEndpoint;
import com.specharvest.domain.support.CancellationToken;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for TransportSelector.
 */
class TransportSelectorTest {

    private static final TransportSelector.Settings SETTINGS = new TransportSelector.Settings(
        Duration.ofSeconds(30), Duration.ofSeconds(15), true,
        "https://app.scrapingbee.com/api/v1/", false, Duration.ofSeconds(60), Duration.ofMillis(500));

    @Test
    void testAcquireEachKind() {
        TransportSelector selector = new TransportSelector(SETTINGS,
            new RotatingPool<>(List.of(new ProxyEndpoint("10.0.0.1:8080", "http", "active"))),
            new RotatingPool<>(List.of("key")),
            new CancellationToken());

        assertInstanceOf(DirectChannel.class, selector.acquire(ChannelKind.DIRECT));
        assertInstanceOf(ProxyRotatingChannel.class, selector.acquire(ChannelKind.PROXY_ROTATED));
        assertInstanceOf(RenderApiChannel.class, selector.acquire(ChannelKind.EXTERNAL_RENDER_PROXY));
        assertInstanceOf(FailoverChannel.class, selector.acquire(ChannelKind.FAILOVER));
    }

    @Test
    void testRenderApiRequiresKeys() {
        TransportSelector selector = new TransportSelector(SETTINGS,
            RotatingPool.empty(), RotatingPool.empty(), new CancellationToken());

        assertThrows(IllegalStateException.class, () -> selector.acquire(ChannelKind.EXTERNAL_RENDER_PROXY));
        assertThrows(IllegalStateException.class, () -> selector.acquire(ChannelKind.FAILOVER));
    }

    @Test
    void testRenderApiRequestUrl() {
        RenderApiChannel channel = (RenderApiChannel) new TransportSelector(SETTINGS,
            RotatingPool.empty(), new RotatingPool<>(List.of("key")), new CancellationToken())
            .acquire(ChannelKind.EXTERNAL_RENDER_PROXY);

        URI requestUrl = URI.create(channel.requestUrl("abc", "https://www.gsmarena.com/makers.php3"));

        assertEquals("app.scrapingbee.com", requestUrl.getHost());
        assertEquals("/api/v1/", requestUrl.getPath());
        assertEquals("api_key=abc&url=https://www.gsmarena.com/makers.php3&render_js=false", requestUrl.getQuery());
    }
}
