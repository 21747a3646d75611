package com.specharvest.infrastructure.config;

import com.specharvest.domain.model.ChannelKind;
import com.specharvest.domain.model.ProxyEndpoint;
import com.specharvest.domain.ports.Channel;
import com.specharvest.domain.ports.DocumentStore;
import com.specharvest.domain.ports.PhoneRepository;
import com.specharvest.domain.support.CancellationToken;
import com.specharvest.infrastructure.persistence.DocumentStorePhoneRepository;
import com.specharvest.infrastructure.persistence.InMemoryDocumentStore;
import com.specharvest.infrastructure.resilience.ResilientFetcher;
import com.specharvest.infrastructure.scraper.gsmarena.BrandCatalogFetcher;
import com.specharvest.infrastructure.scraper.gsmarena.GsmArenaCatalogGateway;
import com.specharvest.infrastructure.scraper.gsmarena.GsmArenaSite;
import com.specharvest.infrastructure.scraper.gsmarena.ListingPaginator;
import com.specharvest.infrastructure.scraper.gsmarena.SpecificationExtractor;
import com.specharvest.infrastructure.transport.ProxyListClient;
import com.specharvest.infrastructure.transport.RotatingPool;
import com.specharvest.infrastructure.transport.TransportSelector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;
import java.security.SecureRandom;
import java.time.Clock;
import java.util.List;

/**
 * Wires transport, scraping and persistence for a harvest run.
 */
@Configuration
@EnableConfigurationProperties(HarvestProperties.class)
public class HarvestConfiguration {

    private static final Logger logger = LoggerFactory.getLogger(HarvestConfiguration.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public CancellationToken cancellationToken() {
        return new CancellationToken();
    }

    @Bean
    public ResilientFetcher resilientFetcher(HarvestProperties properties, CancellationToken cancellationToken) {
        return new ResilientFetcher(
            properties.getRetry().getMaxAttempts(),
            properties.getRetry().getBaseDelay(),
            cancellationToken);
    }

    @Bean
    public GsmArenaSite gsmArenaSite(HarvestProperties properties) {
        return new GsmArenaSite(properties.getSiteBaseUrl());
    }

    @Bean
    public TransportSelector transportSelector(HarvestProperties properties, CancellationToken cancellationToken) {
        HarvestProperties.Transport transport = properties.getTransport();
        HarvestProperties.RenderApi renderApi = properties.getRenderApi();

        List<String> apiKeys = renderApi.getKeys().stream()
            .map(String::trim)
            .filter(key -> !key.isEmpty())
            .toList();

        RotatingPool<ProxyEndpoint> proxyPool = RotatingPool.empty();
        if (properties.getChannel() == ChannelKind.PROXY_ROTATED) {
            proxyPool.replaceShuffled(loadProxies(properties), new SecureRandom());
        }

        TransportSelector.Settings settings = new TransportSelector.Settings(
            transport.getDirectTimeout(),
            transport.getProxyTimeout(),
            transport.isTrustAllProxyCertificates(),
            renderApi.getUrl(),
            renderApi.isRenderJs(),
            renderApi.getTimeout(),
            renderApi.getKeySwitchPause());

        return new TransportSelector(settings, proxyPool, new RotatingPool<>(apiKeys), cancellationToken);
    }

    @Bean
    public Channel channel(TransportSelector transportSelector, HarvestProperties properties) {
        return transportSelector.acquire(properties.getChannel());
    }

    @Bean
    public GsmArenaCatalogGateway gsmArenaCatalogGateway(Channel channel,
                                                         GsmArenaSite site,
                                                         ResilientFetcher resilientFetcher,
                                                         CancellationToken cancellationToken,
                                                         HarvestProperties properties) {
        return new GsmArenaCatalogGateway(
            channel,
            new BrandCatalogFetcher(site, resilientFetcher),
            new ListingPaginator(site, resilientFetcher, cancellationToken, properties.getPageDelay()),
            new SpecificationExtractor(site, resilientFetcher));
    }

    @Bean
    @ConditionalOnProperty(name = "harvest.store", havingValue = "memory")
    public DocumentStore inMemoryDocumentStore(Clock clock) {
        logger.warn("Using in-memory document store, nothing will be persisted");
        return new InMemoryDocumentStore(clock);
    }

    @Bean
    public PhoneRepository phoneRepository(DocumentStore documentStore, HarvestProperties properties) {
        return new DocumentStorePhoneRepository(
            documentStore,
            properties.getCollections().getRecords(),
            properties.getCollections().getListing());
    }

    private List<ProxyEndpoint> loadProxies(HarvestProperties properties) {
        HarvestProperties.ProxySource source = properties.getProxySource();
        if (!source.isConfigured()) {
            logger.warn("Proxy source is not configured, proxy channel will connect directly");
            return List.of();
        }
        ProxyListClient client = new ProxyListClient(
            source.getEndpoint(),
            source.getProjectId(),
            source.getApiKey(),
            source.getDatabaseId(),
            source.getCollectionId(),
            properties.getTransport().getDirectTimeout());
        try {
            return client.fetchUsableProxies();
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load proxy list: " + e.getMessage(), e);
        }
    }
}
