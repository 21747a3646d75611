package com.specharvest.application.usecase;

import com.specharvest.application.usecase.HarvestPhonesUseCase.HarvestSummary;
import com.specharvest.domain.model.Brand;
import com.specharvest.domain.model.ListingItem;
import com.specharvest.domain.model.PhoneRecord;
import com.specharvest.domain.model.RawCategory;
import com.specharvest.domain.model.SpecPair;
import com.specharvest.domain.ports.CatalogGateway;
import com.specharvest.domain.ports.FetchException;
import com.specharvest.domain.ports.SpecificationSource;
import com.specharvest.domain.support.CancellationToken;
import com.specharvest.infrastructure.persistence.DocumentStorePhoneRepository;
import com.specharvest.infrastructure.persistence.InMemoryDocumentStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for HarvestPhonesUseCase.
 */
class HarvestPhonesUseCaseTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-03-01T10:00:00Z"), ZoneOffset.UTC);

    private FakeCatalog catalog;
    private FakeSpecificationSource specifications;
    private DocumentStorePhoneRepository repository;
    private CancellationToken cancellation;
    private HarvestPhonesUseCase useCase;

    @BeforeEach
    void setUp() {
        catalog = new FakeCatalog();
        specifications = new FakeSpecificationSource();
        repository = new DocumentStorePhoneRepository(new InMemoryDocumentStore(CLOCK), "phones", "phone_list");
        repository.initialize();
        cancellation = new CancellationToken();
        useCase = new HarvestPhonesUseCase(catalog, specifications, repository, cancellation, CLOCK);
    }

    @Test
    void testStoresEveryItem() throws FetchException {
        catalog.addBrand("Acme", "acme-phones-1", item("Acme X1", "acme_x1-100"), item("Acme X2", "acme_x2-101"));
        catalog.addBrand("Zeta", "zeta-phones-2", item("Zeta Z", "zeta_z-200"));

        HarvestSummary summary = useCase.execute(options(null, true, 1));

        assertEquals(2, summary.brandsProcessed());
        assertEquals(0, summary.brandsFailed());
        assertEquals(3, summary.itemsFound());
        assertEquals(3, summary.itemsStored());
        assertEquals(0, summary.itemsFailed());
        assertFalse(summary.aborted());
        assertFalse(summary.cancelled());
        assertEquals(3, repository.countRecords());
        assertEquals(Set.of("acme_x1-100", "acme_x2-101", "zeta_z-200"), repository.loadCompletedIds());
    }

    @Test
    void testRecordContent() throws FetchException {
        catalog.addBrand("Acme", "acme-phones-1", item("Acme X1", "acme_x1-100"));

        useCase.execute(options(null, true, 1));

        PhoneRecord record = repository.findByDetailId("acme_x1-100").orElseThrow();
        assertEquals("Acme X1", record.getName());
        assertEquals("Acme", record.getBrand());
        assertEquals("https://example.test/acme_x1-100.php", record.getUrl());
        assertEquals("https://example.test/acme_x1-100.jpg", record.getThumbnailUrl());
        assertEquals("fake", record.getSource());
        assertEquals("Android 14", record.getSpecifications().getPlatform().getOs());
        assertNull(record.getSpecifications().getDisplay());
        assertEquals(1, record.getRawCategories().size());
        assertEquals(1, record.getVersion());
        assertEquals(CLOCK.instant(), record.getFirstSeenAt());
    }

    @Test
    void testSkipsItemsCompletedByEarlierRun() throws FetchException {
        ListingItem done = item("Acme X1", "acme_x1-100");
        repository.saveListingStub(done, "Acme");
        repository.markComplete("acme_x1-100");
        catalog.addBrand("Acme", "acme-phones-1", done, item("Acme X2", "acme_x2-101"));

        HarvestSummary summary = useCase.execute(options(null, true, 1));

        assertEquals(1, summary.itemsSkipped());
        assertEquals(1, summary.itemsStored());
        assertEquals(List.of("acme_x2-101"), specifications.requested);
    }

    @Test
    void testRerunWithoutSkipUpdatesRecords() throws FetchException {
        catalog.addBrand("Acme", "acme-phones-1", item("Acme X1", "acme_x1-100"));

        useCase.execute(options(null, false, 1));
        HarvestSummary summary = useCase.execute(options(null, false, 1));

        assertEquals(1, summary.itemsStored());
        assertEquals(0, summary.itemsSkipped());
        assertEquals(1, repository.countRecords());
        assertEquals(2, repository.findByDetailId("acme_x1-100").orElseThrow().getVersion());
    }

    @Test
    void testDuplicateItemWithinRunIsIngestedOnce() throws FetchException {
        catalog.addBrand("Acme", "acme-phones-1", item("Acme X1", "acme_x1-100"));
        catalog.addBrand("Acme Mobile", "acme-mobile-3", item("Acme X1", "acme_x1-100"));

        HarvestSummary summary = useCase.execute(options(null, true, 1));

        assertEquals(1, summary.itemsStored());
        assertEquals(1, summary.itemsSkipped());
        assertEquals(List.of("acme_x1-100"), specifications.requested);
    }

    @Test
    void testItemFailureIsCountedAndRunContinues() throws FetchException {
        catalog.addBrand("Acme", "acme-phones-1", item("Acme X1", "acme_x1-100"), item("Acme X2", "acme_x2-101"));
        specifications.failures.put("acme_x1-100", FetchException.retriesExhausted(3,
            FetchException.httpStatus("https://example.test/acme_x1-100.php", 500)));

        HarvestSummary summary = useCase.execute(options(null, true, 1));

        assertEquals(1, summary.itemsFailed());
        assertEquals(1, summary.itemsStored());
        assertFalse(repository.exists("acme_x1-100"));
        assertEquals(Set.of("acme_x2-101"), repository.loadCompletedIds());
    }

    @Test
    void testFailedItemIsRetriedOnNextRun() throws FetchException {
        catalog.addBrand("Acme", "acme-phones-1", item("Acme X1", "acme_x1-100"));
        specifications.failures.put("acme_x1-100", FetchException.network("https://example.test/acme_x1-100.php",
            new IOException("timeout")));

        assertEquals(1, useCase.execute(options(null, true, 1)).itemsFailed());

        specifications.failures.clear();
        HarvestSummary summary = useCase.execute(options(null, true, 1));

        assertEquals(1, summary.itemsStored());
        assertTrue(repository.exists("acme_x1-100"));
    }

    @Test
    void testBrandListingFailureIsNotFatal() throws FetchException {
        catalog.addBrand("Acme", "acme-phones-1", item("Acme X1", "acme_x1-100"));
        catalog.addBrand("Zeta", "zeta-phones-2", item("Zeta Z", "zeta_z-200"));
        catalog.listingFailures.put("acme-phones-1", FetchException.retriesExhausted(3,
            FetchException.httpStatus("https://example.test/acme-phones-1.php", 503)));

        HarvestSummary summary = useCase.execute(options(null, true, 1));

        assertEquals(1, summary.brandsFailed());
        assertEquals(1, summary.brandsProcessed());
        assertEquals(1, summary.itemsStored());
        assertFalse(summary.aborted());
        assertTrue(repository.exists("zeta_z-200"));
    }

    @Test
    void testCredentialExhaustionAbortsRun() throws FetchException {
        catalog.addBrand("Acme", "acme-phones-1", item("Acme X1", "acme_x1-100"));
        catalog.addBrand("Zeta", "zeta-phones-2", item("Zeta Z", "zeta_z-200"));
        catalog.addBrand("Omni", "omni-phones-3", item("Omni O", "omni_o-300"));
        catalog.listingFailures.put("zeta-phones-2", FetchException.credentialsExhausted(2));

        HarvestSummary summary = useCase.execute(options(null, true, 1));

        assertTrue(summary.aborted());
        assertEquals("All 2 API keys exhausted", summary.abortReason());
        assertEquals(1, summary.brandsProcessed());
        assertEquals(1, summary.itemsStored());
        assertEquals(List.of("acme-phones-1", "zeta-phones-2"), catalog.listingRequests);
    }

    @Test
    void testCredentialExhaustionOnItemIsCountedAndRunContinues() throws FetchException {
        catalog.addBrand("Acme", "acme-phones-1", item("Acme X1", "acme_x1-100"));
        catalog.addBrand("Zeta", "zeta-phones-2", item("Zeta Z", "zeta_z-200"));
        specifications.failures.put("acme_x1-100", FetchException.credentialsExhausted(2));

        HarvestSummary summary = useCase.execute(options(null, true, 1));

        assertFalse(summary.aborted());
        assertEquals(1, summary.itemsFailed());
        assertEquals(1, summary.itemsStored());
        assertEquals(List.of("acme-phones-1", "zeta-phones-2"), catalog.listingRequests);
    }

    @Test
    void testCatalogFailurePropagates() {
        catalog.brandFailure = FetchException.retriesExhausted(3,
            FetchException.httpStatus("https://example.test/makers.php3", 500));

        FetchException e = assertThrows(FetchException.class, () -> useCase.execute(options(null, true, 1)));

        assertEquals(FetchException.Reason.RETRIES_EXHAUSTED, e.getReason());
        assertEquals(0, repository.countRecords());
    }

    @Test
    void testMaxBrandsAndItemLimit() throws FetchException {
        catalog.addBrand("Acme", "acme-phones-1", item("Acme X1", "acme_x1-100"), item("Acme X2", "acme_x2-101"));
        catalog.addBrand("Zeta", "zeta-phones-2", item("Zeta Z", "zeta_z-200"));

        HarvestOptions options = new HarvestOptions(1, 1, true, 1, Duration.ZERO, Duration.ZERO);
        HarvestSummary summary = useCase.execute(options);

        assertEquals(List.of("acme-phones-1"), catalog.listingRequests);
        assertEquals(1, summary.itemsFound());
        assertEquals(1, summary.itemsStored());
    }

    @Test
    void testParallelRunStoresEachItemOnce() throws FetchException {
        List<ListingItem> items = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            items.add(item("Acme X" + i, "acme_x" + i + "-" + (100 + i)));
        }
        catalog.addBrand("Acme", "acme-phones-1", items.toArray(new ListingItem[0]));
        catalog.addBrand("Zeta", "zeta-phones-2", item("Zeta Z", "zeta_z-200"));

        HarvestSummary summary = useCase.execute(options(null, true, 4));

        assertEquals(11, summary.itemsStored());
        assertEquals(0, summary.itemsFailed());
        assertEquals(11, repository.countRecords());
        assertEquals(11, new HashSet<>(specifications.requested).size());
        assertEquals(11, specifications.requested.size());
        assertTrue(specifications.maxConcurrent.get() <= 4);
    }

    @Test
    void testCancelledRunStopsBeforeNextBrand() throws FetchException {
        catalog.addBrand("Acme", "acme-phones-1", item("Acme X1", "acme_x1-100"));
        catalog.addBrand("Zeta", "zeta-phones-2", item("Zeta Z", "zeta_z-200"));
        specifications.onFetch = cancellation::cancel;

        HarvestSummary summary = useCase.execute(options(null, true, 1));

        assertTrue(summary.cancelled());
        assertEquals(List.of("acme-phones-1"), catalog.listingRequests);
        assertEquals(1, summary.itemsStored());
    }

    @Test
    void testLookupDoesNotPersist() throws FetchException {
        PhoneRecord record = useCase.lookup(item("Acme X1", "acme_x1-100"), "Acme");

        assertEquals("acme_x1-100", record.getDetailId());
        assertEquals("Android 14", record.getSpecifications().getPlatform().getOs());
        assertEquals(0, repository.countRecords());
    }

    @Test
    void testLookupAllSkipsFailedDevices() throws FetchException {
        specifications.failures.put("acme_x2-101", FetchException.retriesExhausted(3,
            FetchException.httpStatus("https://example.test/acme_x2-101.php", 404)));

        List<PhoneRecord> records = useCase.lookupAll(List.of(
            item("Acme X1", "acme_x1-100"),
            item("Acme X2", "acme_x2-101"),
            item("Zeta Z", "zeta_z-200")), null);

        assertEquals(List.of("acme_x1-100", "zeta_z-200"), records.stream().map(PhoneRecord::getDetailId).toList());
        assertEquals(0, repository.countRecords());
    }

    @Test
    void testLookupAllStopsOnCredentialExhaustion() {
        specifications.failures.put("acme_x1-100", FetchException.credentialsExhausted(2));

        FetchException e = assertThrows(FetchException.class, () -> useCase.lookupAll(List.of(
            item("Acme X1", "acme_x1-100"),
            item("Zeta Z", "zeta_z-200")), null));

        assertEquals(FetchException.Reason.CREDENTIALS_EXHAUSTED, e.getReason());
        assertEquals(List.of("acme_x1-100"), specifications.requested);
    }

    private static HarvestOptions options(Integer maxBrands, boolean skipExisting, int parallelism) {
        return new HarvestOptions(maxBrands, null, skipExisting, parallelism, Duration.ZERO, Duration.ZERO);
    }

    private static ListingItem item(String name, String detailId) {
        return new ListingItem(name, detailId,
            "https://example.test/" + detailId + ".php",
            "https://example.test/" + detailId + ".jpg");
    }

    /**
     * Catalog serving fixed brands and listings.
     */
    private static class FakeCatalog implements CatalogGateway {
        private final List<Brand> brands = new ArrayList<>();
        private final Map<String, List<ListingItem>> listings = new HashMap<>();
        private final Map<String, FetchException> listingFailures = new HashMap<>();
        private final List<String> listingRequests = new ArrayList<>();
        private FetchException brandFailure;

        void addBrand(String name, String slug, ListingItem... items) {
            brands.add(new Brand(name, slug, items.length));
            listings.put(slug, List.of(items));
        }

        @Override
        public String getSourceName() {
            return "fake";
        }

        @Override
        public List<Brand> fetchBrands() throws FetchException {
            if (brandFailure != null) {
                throw brandFailure;
            }
            return brands;
        }

        @Override
        public List<ListingItem> fetchListing(String brandSlug, Integer limit) throws FetchException {
            listingRequests.add(brandSlug);
            FetchException failure = listingFailures.get(brandSlug);
            if (failure != null) {
                throw failure;
            }
            List<ListingItem> items = listings.getOrDefault(brandSlug, List.of());
            return limit != null && limit < items.size() ? items.subList(0, limit) : items;
        }
    }

    /**
     * Specification source returning one platform category per device.
     */
    private static class FakeSpecificationSource implements SpecificationSource {
        private final List<String> requested = Collections.synchronizedList(new ArrayList<>());
        private final Map<String, FetchException> failures = new LinkedHashMap<>();
        private final AtomicInteger concurrent = new AtomicInteger();
        private final AtomicInteger maxConcurrent = new AtomicInteger();
        private Runnable onFetch = () -> { };

        @Override
        public List<RawCategory> fetchSpecification(String detailId) throws FetchException {
            int now = concurrent.incrementAndGet();
            maxConcurrent.accumulateAndGet(now, Math::max);
            try {
                requested.add(detailId);
                onFetch.run();
                FetchException failure = failures.get(detailId);
                if (failure != null) {
                    throw failure;
                }
                return List.of(new RawCategory("Platform", List.of(new SpecPair("OS", "Android 14"))));
            } finally {
                concurrent.decrementAndGet();
            }
        }
    }
}
