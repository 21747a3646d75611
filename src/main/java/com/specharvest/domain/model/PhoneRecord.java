package com.specharvest.domain.model;

import com.fasterxml.jackson.annotation.JsonUnwrapped;

import java.time.Instant;
import java.util.List;

/**
 * Root document persisted per device.
 * Upserts are keyed by {@code detailId}; the normalized sections are stored
 * flat at the top level next to the raw categories they came from.
 */
public class PhoneRecord {

    public static final String KEY_FIELD = "detailId";

    /** Detail page identifier, e.g. "apple_iphone_15-12559". */
    private String detailId;

    private String name;

    /** Brand display name. */
    private String brand;

    /** Absolute detail page URL. */
    private String url;

    private String thumbnailUrl;

    /** Catalog the record was harvested from (e.g. "gsmarena"). */
    private String source;

    @JsonUnwrapped
    private NormalizedSpec specifications = new NormalizedSpec();

    /**
     * Categories exactly as extracted, including titles the normalized
     * schema does not know about.
     */
    private List<RawCategory> rawCategories;

    /** Set once on first insert, never overwritten by later upserts. */
    private Instant firstSeenAt;

    private Instant lastUpdatedAt;

    /** Starts at 1 and is incremented by every subsequent upsert. */
    private Integer version;

    // Getters and setters

    public String getDetailId() {
        return detailId;
    }

    public void setDetailId(String detailId) {
        this.detailId = detailId;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getBrand() {
        return brand;
    }

    public void setBrand(String brand) {
        this.brand = brand;
    }

    public String getUrl() {
        return url;
    }

    public void setUrl(String url) {
        this.url = url;
    }

    public String getThumbnailUrl() {
        return thumbnailUrl;
    }

    public void setThumbnailUrl(String thumbnailUrl) {
        this.thumbnailUrl = thumbnailUrl;
    }

    public String getSource() {
        return source;
    }

    public void setSource(String source) {
        this.source = source;
    }

    public NormalizedSpec getSpecifications() {
        return specifications;
    }

    public void setSpecifications(NormalizedSpec specifications) {
        this.specifications = specifications;
    }

    public List<RawCategory> getRawCategories() {
        return rawCategories;
    }

    public void setRawCategories(List<RawCategory> rawCategories) {
        this.rawCategories = rawCategories;
    }

    public Instant getFirstSeenAt() {
        return firstSeenAt;
    }

    public void setFirstSeenAt(Instant firstSeenAt) {
        this.firstSeenAt = firstSeenAt;
    }

    public Instant getLastUpdatedAt() {
        return lastUpdatedAt;
    }

    public void setLastUpdatedAt(Instant lastUpdatedAt) {
        this.lastUpdatedAt = lastUpdatedAt;
    }

    public Integer getVersion() {
        return version;
    }

    public void setVersion(Integer version) {
        this.version = version;
    }
}
