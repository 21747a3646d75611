package com.specharvest.infrastructure.scraper.gsmarena;

import com.specharvest.domain.model.Brand;
import com.specharvest.domain.model.ListingItem;
import com.specharvest.domain.model.RawCategory;
import com.specharvest.domain.ports.CatalogGateway;
import com.specharvest.domain.ports.Channel;
import com.specharvest.domain.ports.FetchException;
import com.specharvest.domain.ports.SpecificationSource;

import java.util.List;

/**
 * Catalog gateway backed by the GSMArena site, fetching through the run's channel.
 */
public class GsmArenaCatalogGateway implements CatalogGateway, SpecificationSource {

    private final Channel channel;
    private final BrandCatalogFetcher brandCatalogFetcher;
    private final ListingPaginator listingPaginator;
    private final SpecificationExtractor specificationExtractor;

    public GsmArenaCatalogGateway(Channel channel,
                                  BrandCatalogFetcher brandCatalogFetcher,
                                  ListingPaginator listingPaginator,
                                  SpecificationExtractor specificationExtractor) {
        this.channel = channel;
        this.brandCatalogFetcher = brandCatalogFetcher;
        this.listingPaginator = listingPaginator;
        this.specificationExtractor = specificationExtractor;
    }

    @Override
    public String getSourceName() {
        return GsmArenaSite.SOURCE_NAME;
    }

    @Override
    public List<Brand> fetchBrands() throws FetchException {
        return brandCatalogFetcher.fetchBrands(channel);
    }

    @Override
    public List<ListingItem> fetchListing(String brandSlug, Integer limit) throws FetchException {
        return listingPaginator.fetchListing(channel, brandSlug, limit);
    }

    @Override
    public List<RawCategory> fetchSpecification(String detailId) throws FetchException {
        return specificationExtractor.fetchSpecification(channel, detailId);
    }
}
