package com.specharvest.infrastructure.config;

import com.specharvest.domain.model.ChannelKind;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for the harvester, bound from {@code harvest.*}.
 *
 * <p>application.properties maps the environment variables onto these keys,
 * e.g. {@code harvest.parallelism=${PARALLEL_THREADS:4}}.</p>
 */
@ConfigurationProperties(prefix = "harvest")
public class HarvestProperties {

    /** Process only the first N brands; unset for all. */
    private Integer maxBrands;

    /** Process only the first N listing items per brand; unset for all. */
    private Integer maxItemsPerBrand;

    private boolean skipExisting = true;

    /** Workers per brand; 1 runs items sequentially. */
    private int parallelism = 4;

    private Duration itemDelay = Duration.ofMillis(500);

    private Duration brandDelay = Duration.ofMillis(2000);

    private Duration pageDelay = Duration.ofMillis(200);

    private ChannelKind channel = ChannelKind.DIRECT;

    /** "mongo" or "memory". */
    private String store = "mongo";

    private String siteBaseUrl = "https://www.gsmarena.com/";

    private final Collections collections = new Collections();
    private final Retry retry = new Retry();
    private final Transport transport = new Transport();
    private final RenderApi renderApi = new RenderApi();
    private final ProxySource proxySource = new ProxySource();
    private final Mongo mongo = new Mongo();

    public static class Collections {
        private String records = "gsmarena_phones";
        private String listing = "gsmarena_phone_list";

        public String getRecords() {
            return records;
        }

        public void setRecords(String records) {
            this.records = records;
        }

        public String getListing() {
            return listing;
        }

        public void setListing(String listing) {
            this.listing = listing;
        }
    }

    public static class Retry {
        private int maxAttempts = 3;
        private Duration baseDelay = Duration.ofMillis(1000);

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public Duration getBaseDelay() {
            return baseDelay;
        }

        public void setBaseDelay(Duration baseDelay) {
            this.baseDelay = baseDelay;
        }
    }

    public static class Transport {
        private Duration directTimeout = Duration.ofSeconds(30);
        private Duration proxyTimeout = Duration.ofSeconds(15);
        private boolean trustAllProxyCertificates = true;

        public Duration getDirectTimeout() {
            return directTimeout;
        }

        public void setDirectTimeout(Duration directTimeout) {
            this.directTimeout = directTimeout;
        }

        public Duration getProxyTimeout() {
            return proxyTimeout;
        }

        public void setProxyTimeout(Duration proxyTimeout) {
            this.proxyTimeout = proxyTimeout;
        }

        public boolean isTrustAllProxyCertificates() {
            return trustAllProxyCertificates;
        }

        public void setTrustAllProxyCertificates(boolean trustAllProxyCertificates) {
            this.trustAllProxyCertificates = trustAllProxyCertificates;
        }
    }

    /**
     * ScrapingBee-compatible rendering API.
     */
    public static class RenderApi {
        private String url = "https://app.scrapingbee.com/api/v1/";
        private List<String> keys = new ArrayList<>();
        private boolean renderJs = false;
        private Duration timeout = Duration.ofSeconds(60);
        private Duration keySwitchPause = Duration.ofMillis(500);

        public String getUrl() {
            return url;
        }

        public void setUrl(String url) {
            this.url = url;
        }

        public List<String> getKeys() {
            return keys;
        }

        public void setKeys(List<String> keys) {
            this.keys = keys;
        }

        public boolean isRenderJs() {
            return renderJs;
        }

        public void setRenderJs(boolean renderJs) {
            this.renderJs = renderJs;
        }

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }

        public Duration getKeySwitchPause() {
            return keySwitchPause;
        }

        public void setKeySwitchPause(Duration keySwitchPause) {
            this.keySwitchPause = keySwitchPause;
        }
    }

    /**
     * Appwrite collection holding candidate proxies.
     */
    public static class ProxySource {
        private String endpoint = "https://cloud.appwrite.io/v1";
        private String projectId;
        private String apiKey;
        private String databaseId;
        private String collectionId;

        public String getEndpoint() {
            return endpoint;
        }

        public void setEndpoint(String endpoint) {
            this.endpoint = endpoint;
        }

        public String getProjectId() {
            return projectId;
        }

        public void setProjectId(String projectId) {
            this.projectId = projectId;
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public String getDatabaseId() {
            return databaseId;
        }

        public void setDatabaseId(String databaseId) {
            this.databaseId = databaseId;
        }

        public String getCollectionId() {
            return collectionId;
        }

        public void setCollectionId(String collectionId) {
            this.collectionId = collectionId;
        }

        public boolean isConfigured() {
            return notBlank(projectId) && notBlank(apiKey) && notBlank(databaseId) && notBlank(collectionId);
        }
    }

    public static class Mongo {
        /** Full connection string; when set the parts below are ignored. */
        private String uri;
        private String username;
        private String password;
        private String domain;
        private String database;

        public String getUri() {
            return uri;
        }

        public void setUri(String uri) {
            this.uri = uri;
        }

        public String getUsername() {
            return username;
        }

        public void setUsername(String username) {
            this.username = username;
        }

        public String getPassword() {
            return password;
        }

        public void setPassword(String password) {
            this.password = password;
        }

        public String getDomain() {
            return domain;
        }

        public void setDomain(String domain) {
            this.domain = domain;
        }

        public String getDatabase() {
            return database;
        }

        public void setDatabase(String database) {
            this.database = database;
        }
    }

    private static boolean notBlank(String value) {
        return value != null && !value.isBlank();
    }

    // Getters and setters

    public Integer getMaxBrands() {
        return maxBrands;
    }

    public void setMaxBrands(Integer maxBrands) {
        this.maxBrands = maxBrands;
    }

    public Integer getMaxItemsPerBrand() {
        return maxItemsPerBrand;
    }

    public void setMaxItemsPerBrand(Integer maxItemsPerBrand) {
        this.maxItemsPerBrand = maxItemsPerBrand;
    }

    public boolean isSkipExisting() {
        return skipExisting;
    }

    public void setSkipExisting(boolean skipExisting) {
        this.skipExisting = skipExisting;
    }

    public int getParallelism() {
        return parallelism;
    }

    public void setParallelism(int parallelism) {
        this.parallelism = parallelism;
    }

    public Duration getItemDelay() {
        return itemDelay;
    }

    public void setItemDelay(Duration itemDelay) {
        this.itemDelay = itemDelay;
    }

    public Duration getBrandDelay() {
        return brandDelay;
    }

    public void setBrandDelay(Duration brandDelay) {
        this.brandDelay = brandDelay;
    }

    public Duration getPageDelay() {
        return pageDelay;
    }

    public void setPageDelay(Duration pageDelay) {
        this.pageDelay = pageDelay;
    }

    public ChannelKind getChannel() {
        return channel;
    }

    public void setChannel(ChannelKind channel) {
        this.channel = channel;
    }

    public String getStore() {
        return store;
    }

    public void setStore(String store) {
        this.store = store;
    }

    public String getSiteBaseUrl() {
        return siteBaseUrl;
    }

    public void setSiteBaseUrl(String siteBaseUrl) {
        this.siteBaseUrl = siteBaseUrl;
    }

    public Collections getCollections() {
        return collections;
    }

    public Retry getRetry() {
        return retry;
    }

    public Transport getTransport() {
        return transport;
    }

    public RenderApi getRenderApi() {
        return renderApi;
    }

    public ProxySource getProxySource() {
        return proxySource;
    }

    public Mongo getMongo() {
        return mongo;
    }
}
