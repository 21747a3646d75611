package com.specharvest.application.usecase;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Counters for one harvest run, safe to update from worker threads.
 */
public class HarvestStatistics {

    private final AtomicInteger brandsProcessed = new AtomicInteger();
    private final AtomicInteger brandsFailed = new AtomicInteger();
    private final AtomicInteger itemsFound = new AtomicInteger();
    private final AtomicInteger itemsStored = new AtomicInteger();
    private final AtomicInteger itemsSkipped = new AtomicInteger();
    private final AtomicInteger itemsFailed = new AtomicInteger();

    public void brandProcessed(int items) {
        brandsProcessed.incrementAndGet();
        itemsFound.addAndGet(items);
    }

    public void brandFailed() {
        brandsFailed.incrementAndGet();
    }

    public void itemStored() {
        itemsStored.incrementAndGet();
    }

    public void itemSkipped() {
        itemsSkipped.incrementAndGet();
    }

    public void itemFailed() {
        itemsFailed.incrementAndGet();
    }

    public int getBrandsProcessed() {
        return brandsProcessed.get();
    }

    public int getBrandsFailed() {
        return brandsFailed.get();
    }

    public int getItemsFound() {
        return itemsFound.get();
    }

    public int getItemsStored() {
        return itemsStored.get();
    }

    public int getItemsSkipped() {
        return itemsSkipped.get();
    }

    public int getItemsFailed() {
        return itemsFailed.get();
    }
}
