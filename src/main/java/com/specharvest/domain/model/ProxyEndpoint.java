package com.specharvest.domain.model;

import java.util.Locale;

/**
 * Candidate proxy loaded from the proxy source.
 *
 * @param endpoint      proxy address, with or without scheme (e.g. "1.2.3.4:8080", "socks5://1.2.3.4:1080")
 * @param transportType "http", "https", "socks4" or "socks5"
 * @param status        health status reported by the source ("active", "working", "inactive", ...)
 */
public record ProxyEndpoint(String endpoint, String transportType, String status) {

    public boolean isUsable() {
        if (status == null) {
            return false;
        }
        String normalized = status.toLowerCase(Locale.ROOT);
        return normalized.equals("active") || normalized.equals("working");
    }

    /**
     * Returns the endpoint with a scheme matching its transport type.
     */
    public String toUrl() {
        String type = transportType == null ? "" : transportType.toLowerCase(Locale.ROOT);
        return switch (type) {
            case "http", "https" -> endpoint.startsWith("http://") || endpoint.startsWith("https://")
                ? endpoint
                : "http://" + endpoint;
            case "socks4" -> endpoint.startsWith("socks4://") ? endpoint : "socks4://" + endpoint;
            case "socks5" -> endpoint.startsWith("socks5://") ? endpoint : "socks5://" + endpoint;
            default -> endpoint;
        };
    }
}
