package com.specharvest.domain.ports;

import com.specharvest.domain.model.Brand;
import com.specharvest.domain.model.ListingItem;

import java.util.List;

/**
 * Port for discovering brands and their device listings.
 */
public interface CatalogGateway {

    /**
     * Gets the name of the catalog this gateway reads (stored as the record source).
     */
    String getSourceName();

    List<Brand> fetchBrands() throws FetchException;

    /**
     * Walks the listing pages of a brand.
     *
     * @param limit maximum number of items to return, or null for all
     */
    List<ListingItem> fetchListing(String brandSlug, Integer limit) throws FetchException;
}
