package com.specharvest.domain.model;

/**
 * One device stub discovered on a brand listing page.
 *
 * @param name         model name as shown on the listing
 * @param detailId     detail page path without extension, primary key of the device
 * @param detailUrl    absolute URL of the detail page
 * @param thumbnailUrl absolute thumbnail URL, or null when the listing has no image
 */
public record ListingItem(String name, String detailId, String detailUrl, String thumbnailUrl) {
}
