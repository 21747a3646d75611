package com.specharvest.domain.model;

/**
 * Manufacturer entry from the brand catalog.
 *
 * @param name        display name of the brand
 * @param slug        stable path identifier of the brand's listing page (e.g. "apple-phones-48")
 * @param deviceCount advertised number of devices, 0 when the catalog label carries no count
 */
public record Brand(String name, String slug, int deviceCount) {
}
