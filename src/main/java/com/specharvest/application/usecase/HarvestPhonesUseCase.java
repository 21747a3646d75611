package com.specharvest.application.usecase;

import com.specharvest.domain.model.Brand;
import com.specharvest.domain.model.ListingItem;
import com.specharvest.domain.model.PhoneRecord;
import com.specharvest.domain.model.RawCategory;
import com.specharvest.domain.ports.CatalogGateway;
import com.specharvest.domain.ports.FetchException;
import com.specharvest.domain.ports.PhoneRepository;
import com.specharvest.domain.ports.SpecificationSource;
import com.specharvest.domain.service.SpecificationNormalizer;
import com.specharvest.domain.support.CancellationToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Use case for harvesting every brand's devices into the repository.
 *
 * <p>Brands are processed one after another. Items of a brand are processed
 * sequentially or by a fixed pool of workers, and all of them finish before
 * the next brand starts. Item failures and brand listing failures are counted
 * and skipped; credential exhaustion aborts the remaining brands.</p>
 */
@Service
public class HarvestPhonesUseCase {

    private static final Logger logger = LoggerFactory.getLogger(HarvestPhonesUseCase.class);

    private final CatalogGateway catalog;
    private final SpecificationSource specificationSource;
    private final PhoneRepository repository;
    private final CancellationToken cancellation;
    private final Clock clock;

    public HarvestPhonesUseCase(CatalogGateway catalog,
                                SpecificationSource specificationSource,
                                PhoneRepository repository,
                                CancellationToken cancellation,
                                Clock clock) {
        this.catalog = catalog;
        this.specificationSource = specificationSource;
        this.repository = repository;
        this.cancellation = cancellation;
        this.clock = clock;
    }

    /**
     * Runs the full brand, listing, detail, normalize and persist pipeline.
     *
     * @return Summary of the run, partial if it was aborted or cancelled
     * @throws FetchException if the brand catalog cannot be fetched
     */
    public HarvestSummary execute(HarvestOptions options) throws FetchException {
        Set<String> completed = options.skipExisting() ? repository.loadCompletedIds() : Set.of();
        CompletionIndex completionIndex = new CompletionIndex(completed);
        HarvestStatistics statistics = new HarvestStatistics();

        List<Brand> brands = catalog.fetchBrands();
        if (brands.isEmpty()) {
            logger.warn("No brands found, nothing to harvest");
        }
        List<Brand> selected = options.maxBrands() != null && options.maxBrands() < brands.size()
            ? brands.subList(0, options.maxBrands())
            : brands;
        logger.info("Processing {} of {} brands (parallelism {}, skip existing {})",
            selected.size(), brands.size(), options.parallelism(), options.skipExisting());

        ExecutorService executorService = options.parallelism() > 1
            ? Executors.newFixedThreadPool(options.parallelism())
            : null;
        String abortReason = null;

        try {
            for (int i = 0; i < selected.size(); i++) {
                if (cancellation.isCancelled()) {
                    break;
                }
                Brand brand = selected.get(i);
                logger.info("[{}/{}] Processing brand: {} ({} devices)",
                    i + 1, selected.size(), brand.name(), brand.deviceCount());

                List<ListingItem> items;
                try {
                    items = catalog.fetchListing(brand.slug(), options.maxItemsPerBrand());
                } catch (FetchException e) {
                    if (e.getReason() == FetchException.Reason.CANCELLED) {
                        break;
                    }
                    statistics.brandFailed();
                    if (e.getReason() == FetchException.Reason.CREDENTIALS_EXHAUSTED) {
                        abortReason = e.getMessage();
                        logger.error("Aborting run at brand {}: {}", brand.name(), e.getMessage());
                        break;
                    }
                    logger.error("Failed to fetch listing for brand {}: {}", brand.name(), e.getMessage());
                    continue;
                }

                statistics.brandProcessed(items.size());
                processItems(brand, items, options, completionIndex, statistics, executorService);

                if (i < selected.size() - 1) {
                    cancellation.pause(options.brandDelay());
                }
            }
        } finally {
            if (executorService != null) {
                executorService.shutdownNow();
            }
        }

        HarvestSummary summary = new HarvestSummary(
            statistics.getBrandsProcessed(),
            statistics.getBrandsFailed(),
            statistics.getItemsFound(),
            statistics.getItemsStored(),
            statistics.getItemsSkipped(),
            statistics.getItemsFailed(),
            abortReason,
            cancellation.isCancelled());
        logger.info("Harvest complete: {}", summary);
        return summary;
    }

    /**
     * Fetches and normalizes one device without persisting it.
     */
    public PhoneRecord lookup(ListingItem item, String brandName) throws FetchException {
        List<RawCategory> categories = specificationSource.fetchSpecification(item.detailId());
        return buildRecord(brandName, item, categories);
    }

    /**
     * Fetches and normalizes several devices without persisting them. Devices
     * that cannot be fetched are logged and left out; credential exhaustion and
     * cancellation end the lookup.
     *
     * @return records in request order, without the failed ones
     */
    public List<PhoneRecord> lookupAll(List<ListingItem> items, String brandName) throws FetchException {
        List<PhoneRecord> records = new ArrayList<>(items.size());
        for (ListingItem item : items) {
            try {
                records.add(lookup(item, brandName));
            } catch (FetchException e) {
                if (e.isTerminal()) {
                    throw e;
                }
                logger.warn("Lookup of {} failed: {}", item.detailId(), e.getMessage());
            }
        }
        logger.info("Looked up {} of {} devices", records.size(), items.size());
        return records;
    }

    private void processItems(Brand brand,
                              List<ListingItem> items,
                              HarvestOptions options,
                              CompletionIndex completionIndex,
                              HarvestStatistics statistics,
                              ExecutorService executorService) {
        if (executorService == null) {
            for (int i = 0; i < items.size() && !cancellation.isCancelled(); i++) {
                processItem(brand, items.get(i), i + 1, items.size(), options, completionIndex, statistics);
            }
            return;
        }

        List<CompletableFuture<Void>> futures = new ArrayList<>(items.size());
        for (int i = 0; i < items.size(); i++) {
            ListingItem item = items.get(i);
            int position = i + 1;
            futures.add(CompletableFuture.runAsync(
                () -> processItem(brand, item, position, items.size(), options, completionIndex, statistics),
                executorService));
        }

        // Wait for every item of the brand before moving on
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
    }

    private void processItem(Brand brand,
                             ListingItem item,
                             int position,
                             int total,
                             HarvestOptions options,
                             CompletionIndex completionIndex,
                             HarvestStatistics statistics) {
        if (cancellation.isCancelled()) {
            return;
        }
        String detailId = item.detailId();

        if (options.skipExisting() && !completionIndex.claim(detailId)) {
            statistics.itemSkipped();
            logger.info("[{}/{}] {} ({}) already complete, skipping", position, total, item.name(), detailId);
            return;
        }

        try {
            repository.saveListingStub(item, brand.name());
            if (!cancellation.pause(options.itemDelay())) {
                completionIndex.release(detailId);
                return;
            }

            List<RawCategory> categories = specificationSource.fetchSpecification(detailId);
            PhoneRecord record = buildRecord(brand.name(), item, categories);
            int version = repository.upsert(record);
            repository.markComplete(detailId);

            completionIndex.complete(detailId);
            statistics.itemStored();
            logger.info("[{}/{}] {} ({}) stored, version {}", position, total, item.name(), detailId, version);
        } catch (FetchException e) {
            completionIndex.release(detailId);
            if (e.getReason() == FetchException.Reason.CANCELLED) {
                return;
            }
            statistics.itemFailed();
            logger.warn("[{}/{}] {} / {} ({}) fetch failed: {}",
                position, total, brand.name(), item.name(), detailId, e.getMessage());
        } catch (RuntimeException e) {
            completionIndex.release(detailId);
            statistics.itemFailed();
            logger.error("[{}/{}] {} / {} ({}) failed to store: {}",
                position, total, brand.name(), item.name(), detailId, e.getMessage(), e);
        }
    }

    private PhoneRecord buildRecord(String brandName, ListingItem item, List<RawCategory> categories) {
        PhoneRecord record = new PhoneRecord();
        record.setDetailId(item.detailId());
        record.setName(item.name());
        record.setBrand(brandName);
        record.setUrl(item.detailUrl());
        record.setThumbnailUrl(item.thumbnailUrl());
        record.setSource(catalog.getSourceName());
        record.setSpecifications(SpecificationNormalizer.normalize(categories));
        record.setRawCategories(categories);
        record.setLastUpdatedAt(clock.instant());
        return record;
    }

    public record HarvestSummary(
        int brandsProcessed,
        int brandsFailed,
        int itemsFound,
        int itemsStored,
        int itemsSkipped,
        int itemsFailed,
        String abortReason,
        boolean cancelled
    ) {

        public boolean aborted() {
            return abortReason != null;
        }
    }
}
