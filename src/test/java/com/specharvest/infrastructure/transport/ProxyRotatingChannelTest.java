package com.specharvest.infrastructure.transport;

import com.specharvest.domain.model.ProxyEndpoint;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ProxyRotatingChannel rotation.
 */
class ProxyRotatingChannelTest {

    private static final ProxyEndpoint FIRST = new ProxyEndpoint("10.0.0.1:8080", "http", "active");
    private static final ProxyEndpoint SECOND = new ProxyEndpoint("10.0.0.2:1080", "socks5", "working");

    @Test
    void testStartsWithFirstProxyAndRotates() {
        ProxyRotatingChannel channel = new ProxyRotatingChannel(
            new RotatingPool<>(List.of(FIRST, SECOND)), Duration.ofSeconds(15), true);

        assertEquals(FIRST, channel.currentProxy());
        assertTrue(channel.rotate());
        assertEquals(SECOND, channel.currentProxy());
        assertTrue(channel.rotate());
        assertEquals(FIRST, channel.currentProxy());
    }

    @Test
    void testSingleProxyCannotRotate() {
        ProxyRotatingChannel channel = new ProxyRotatingChannel(
            new RotatingPool<>(List.of(FIRST)), Duration.ofSeconds(15), true);

        assertFalse(channel.rotate());
        assertEquals(FIRST, channel.currentProxy());
    }

    @Test
    void testEmptyPoolFallsBackToDirect() {
        ProxyRotatingChannel channel = new ProxyRotatingChannel(RotatingPool.empty(), Duration.ofSeconds(15), true);

        assertNull(channel.currentProxy());
        assertFalse(channel.rotate());
    }

    @Test
    void testProxyUrlScheme() {
        assertEquals("http://10.0.0.1:8080", FIRST.toUrl());
        assertEquals("socks5://10.0.0.2:1080", SECOND.toUrl());
        assertEquals("socks4://10.0.0.3:4145", new ProxyEndpoint("10.0.0.3:4145", "SOCKS4", "active").toUrl());
        assertEquals("https://10.0.0.4:443", new ProxyEndpoint("https://10.0.0.4:443", "https", "active").toUrl());
    }
}
