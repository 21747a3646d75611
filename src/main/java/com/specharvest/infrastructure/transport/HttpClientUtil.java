package com.specharvest.infrastructure.transport;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.specharvest.domain.ports.FetchException;
import org.apache.hc.client5.http.classic.methods.HttpGet;
import org.apache.hc.client5.http.config.ConnectionConfig;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClientBuilder;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManagerBuilder;
import org.apache.hc.client5.http.ssl.NoopHostnameVerifier;
import org.apache.hc.client5.http.ssl.SSLConnectionSocketFactoryBuilder;
import org.apache.hc.client5.http.ssl.TrustAllStrategy;
import org.apache.hc.core5.http.HttpEntity;
import org.apache.hc.core5.http.HttpHost;
import org.apache.hc.core5.http.ParseException;
import org.apache.hc.core5.http.io.SocketConfig;
import org.apache.hc.core5.http.io.entity.EntityUtils;
import org.apache.hc.core5.ssl.SSLContexts;
import org.apache.hc.core5.util.Timeout;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.URI;
import java.security.GeneralSecurityException;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;

/**
 * Utility for issuing GET requests, directly or through a proxy.
 */
public final class HttpClientUtil {

    private static final Logger logger = LoggerFactory.getLogger(HttpClientUtil.class);
    private static final ObjectMapper objectMapper = new ObjectMapper();
    private static final int MAX_LOG_BODY_LENGTH = 500;

    public static final String USER_AGENT =
        "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/124.0.0.0 Safari/537.36";

    public static final Map<String, String> BROWSER_HEADERS = Map.of(
        "accept", "text/html,application/xhtml+xml,application/xml;q=0.9,*/*;q=0.8",
        "accept-language", "en-US,en;q=0.9"
    );

    /**
     * Connection settings for one request.
     *
     * @param timeout              connect, socket and response timeout
     * @param proxyUrl             proxy URL with scheme (http, https, socks4, socks5), or null for a direct request
     * @param trustAllCertificates accept self-signed certificates, as presented by many free proxies
     */
    public record ClientOptions(Duration timeout, String proxyUrl, boolean trustAllCertificates) {

        public static ClientOptions direct(Duration timeout) {
            return new ClientOptions(timeout, null, false);
        }

        public static ClientOptions viaProxy(String proxyUrl, Duration timeout, boolean trustAllCertificates) {
            return new ClientOptions(timeout, proxyUrl, trustAllCertificates);
        }
    }

    private HttpClientUtil() {
    }

    /**
     * Helper method to log response body preview for debugging.
     */
    private static void logResponseBodyPreview(String responseBody) {
        String preview = responseBody.length() > MAX_LOG_BODY_LENGTH
            ? responseBody.substring(0, MAX_LOG_BODY_LENGTH) + "..."
            : responseBody;
        logger.debug("Response body preview: {}", preview);
    }

    /**
     * Makes a GET request and returns the response body as text.
     *
     * @throws FetchException with reason HTTP_STATUS for non-2xx responses and NETWORK for I/O failures
     */
    public static String getText(ClientOptions options, String url, Map<String, String> headers) throws FetchException {
        try (CloseableHttpClient httpClient = createClient(options)) {
            HttpGet request = new HttpGet(url);

            if (headers != null) {
                headers.forEach(request::addHeader);
            }

            return httpClient.execute(request, response -> {
                int statusCode = response.getCode();
                HttpEntity entity = response.getEntity();
                String responseBody;
                try {
                    responseBody = entity != null ? EntityUtils.toString(entity) : "";
                } catch (ParseException e) {
                    throw new IOException("Failed to parse response", e);
                }

                if (statusCode >= 200 && statusCode < 300) {
                    return responseBody;
                }
                logger.debug("HTTP request failed with status {}: {}", statusCode, url);
                logResponseBodyPreview(responseBody);
                throw FetchException.httpStatus(url, statusCode);
            });
        } catch (FetchException e) {
            throw e;
        } catch (IOException e) {
            throw FetchException.network(url, e);
        }
    }

    /**
     * Makes a direct GET request and returns the response as JsonNode.
     */
    public static JsonNode getJson(String url, Map<String, String> headers, Duration timeout) throws IOException {
        String responseBody = getText(ClientOptions.direct(timeout), url, headers);
        try {
            return objectMapper.readTree(responseBody);
        } catch (JsonProcessingException e) {
            logger.error("Failed to parse JSON. URL: {}", url);
            logResponseBodyPreview(responseBody);
            throw new IOException("Failed to parse JSON response: " + e.getOriginalMessage(), e);
        }
    }

    static CloseableHttpClient createClient(ClientOptions options) {
        Timeout timeout = Timeout.of(options.timeout());

        PoolingHttpClientConnectionManagerBuilder connectionManager = PoolingHttpClientConnectionManagerBuilder.create()
            .setDefaultConnectionConfig(ConnectionConfig.custom()
                .setConnectTimeout(timeout)
                .setSocketTimeout(timeout)
                .build());

        // ResilientFetcher owns retries; the client must send each request once
        HttpClientBuilder builder = HttpClients.custom()
            .disableAutomaticRetries()
            .setUserAgent(USER_AGENT)
            .setDefaultRequestConfig(RequestConfig.custom()
                .setConnectionRequestTimeout(timeout)
                .setResponseTimeout(timeout)
                .build());

        if (options.proxyUrl() != null) {
            URI proxy = URI.create(options.proxyUrl());
            String scheme = proxy.getScheme() == null ? "http" : proxy.getScheme().toLowerCase(Locale.ROOT);
            if (scheme.startsWith("socks")) {
                // java.net sockets speak SOCKS5 by default; socks4 endpoints negotiate down
                connectionManager.setDefaultSocketConfig(SocketConfig.custom()
                    .setSocksProxyAddress(new InetSocketAddress(proxy.getHost(), proxy.getPort()))
                    .build());
            } else {
                builder.setProxy(new HttpHost(scheme, proxy.getHost(), proxy.getPort()));
            }
        }

        if (options.trustAllCertificates()) {
            try {
                connectionManager.setSSLSocketFactory(SSLConnectionSocketFactoryBuilder.create()
                    .setSslContext(SSLContexts.custom().loadTrustMaterial(TrustAllStrategy.INSTANCE).build())
                    .setHostnameVerifier(NoopHostnameVerifier.INSTANCE)
                    .build());
            } catch (GeneralSecurityException e) {
                throw new IllegalStateException("Failed to build trust-all SSL context", e);
            }
        }

        return builder.setConnectionManager(connectionManager.build()).build();
    }
}
