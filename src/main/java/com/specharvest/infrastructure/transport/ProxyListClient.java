package com.specharvest.infrastructure.transport;

import com.fasterxml.jackson.databind.JsonNode;
import com.specharvest.domain.model.ProxyEndpoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Loads the candidate proxy list from an Appwrite document collection.
 * Each document carries {@code proxy}, {@code type} and {@code status};
 * only active or working entries are returned.
 */
public class ProxyListClient {

    private static final Logger logger = LoggerFactory.getLogger(ProxyListClient.class);

    private final String endpoint;
    private final String projectId;
    private final String apiKey;
    private final String databaseId;
    private final String collectionId;
    private final Duration timeout;

    public ProxyListClient(String endpoint,
                           String projectId,
                           String apiKey,
                           String databaseId,
                           String collectionId,
                           Duration timeout) {
        this.endpoint = endpoint.endsWith("/") ? endpoint.substring(0, endpoint.length() - 1) : endpoint;
        this.projectId = projectId;
        this.apiKey = apiKey;
        this.databaseId = databaseId;
        this.collectionId = collectionId;
        this.timeout = timeout;
    }

    public List<ProxyEndpoint> fetchUsableProxies() throws IOException {
        String url = String.format("%s/databases/%s/collections/%s/documents", endpoint, databaseId, collectionId);
        logger.info("Fetching proxy list from {}", url);

        JsonNode response = HttpClientUtil.getJson(url, Map.of(
            "X-Appwrite-Project", projectId,
            "X-Appwrite-Key", apiKey,
            "Content-Type", "application/json"
        ), timeout);

        List<ProxyEndpoint> proxies = parseUsableProxies(response);
        logger.info("Loaded {} usable proxies", proxies.size());
        return proxies;
    }

    static List<ProxyEndpoint> parseUsableProxies(JsonNode response) {
        List<ProxyEndpoint> proxies = new ArrayList<>();
        JsonNode documents = response.path("documents");
        if (!documents.isArray()) {
            logger.warn("Proxy list response has no documents array");
            return proxies;
        }

        for (JsonNode document : documents) {
            String proxy = document.path("proxy").asText("");
            if (proxy.isBlank()) {
                continue;
            }
            ProxyEndpoint candidate = new ProxyEndpoint(
                proxy.trim(),
                document.path("type").asText("http"),
                document.path("status").asText(null));
            if (candidate.isUsable()) {
                proxies.add(candidate);
            }
        }
        return proxies;
    }
}
