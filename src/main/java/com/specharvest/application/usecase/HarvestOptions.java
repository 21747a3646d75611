package com.specharvest.application.usecase;

import java.time.Duration;

/**
 * Settings for one harvest run.
 *
 * @param maxBrands        process only the first N brands, or null for all
 * @param maxItemsPerBrand process only the first N listing items per brand, or null for all
 * @param skipExisting     skip items already marked complete by an earlier run
 * @param parallelism      workers per brand; 1 processes items sequentially
 * @param itemDelay        pause before each detail fetch
 * @param brandDelay       pause between brands
 */
public record HarvestOptions(Integer maxBrands,
                             Integer maxItemsPerBrand,
                             boolean skipExisting,
                             int parallelism,
                             Duration itemDelay,
                             Duration brandDelay) {

    public HarvestOptions {
        if (parallelism < 1) {
            throw new IllegalArgumentException("parallelism must be at least 1");
        }
    }
}
