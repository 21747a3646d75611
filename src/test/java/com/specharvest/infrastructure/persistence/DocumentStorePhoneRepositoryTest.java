package com.specharvest.infrastructure.persistence;

import com.specharvest.domain.model.DisplaySpecs;
import com.specharvest.domain.model.ListingItem;
import com.specharvest.domain.model.NormalizedSpec;
import com.specharvest.domain.model.PhoneRecord;
import com.specharvest.domain.model.RawCategory;
import com.specharvest.domain.model.SpecPair;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for DocumentStorePhoneRepository over the in-memory store.
 */
class DocumentStorePhoneRepositoryTest {

    private MutableClock clock;
    private InMemoryDocumentStore store;
    private DocumentStorePhoneRepository repository;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-03-01T10:00:00Z"));
        store = new InMemoryDocumentStore(clock);
        repository = new DocumentStorePhoneRepository(store, "phones", "phone_list");
        repository.initialize();
    }

    @Test
    void testUpsertTwiceKeepsOneRecord() {
        assertEquals(1, repository.upsert(record("acme_x1-100")));
        clock.now = Instant.parse("2024-03-02T10:00:00Z");
        assertEquals(2, repository.upsert(record("acme_x1-100")));

        assertEquals(1, repository.countRecords());
        PhoneRecord stored = repository.findByDetailId("acme_x1-100").orElseThrow();
        assertEquals(2, stored.getVersion());
        assertEquals(Instant.parse("2024-03-01T10:00:00Z"), stored.getFirstSeenAt());
        assertEquals(Instant.parse("2024-03-02T10:00:00Z"), stored.getLastUpdatedAt());
    }

    @Test
    void testRecordRoundTrip() {
        repository.upsert(record("acme_x1-100"));

        PhoneRecord stored = repository.findByDetailId("acme_x1-100").orElseThrow();
        assertEquals("Acme X1", stored.getName());
        assertEquals("Acme", stored.getBrand());
        assertEquals("gsmarena", stored.getSource());
        assertEquals("IPS LCD", stored.getSpecifications().getDisplay().getDisplayType());
        assertNull(stored.getSpecifications().getBattery());
        assertEquals(List.of(new RawCategory("Display", List.of(new SpecPair("Type", "IPS LCD")))),
            stored.getRawCategories());
    }

    @Test
    void testSectionsAreStoredAtTopLevel() {
        repository.upsert(record("acme_x1-100"));

        var document = store.find("phones", PhoneRecord.KEY_FIELD, "acme_x1-100").orElseThrow();
        assertTrue(document.containsKey("display"));
        assertFalse(document.containsKey("specifications"));
        assertEquals(1, document.get("version"));
    }

    @Test
    void testExists() {
        assertFalse(repository.exists("acme_x1-100"));
        repository.upsert(record("acme_x1-100"));
        assertTrue(repository.exists("acme_x1-100"));
    }

    @Test
    void testListingStubsAndCompletion() {
        ListingItem first = new ListingItem("Acme X1", "acme_x1-100", "https://example.test/acme_x1-100.php", null);
        ListingItem second = new ListingItem("Acme X2", "acme_x2-101", "https://example.test/acme_x2-101.php", null);

        repository.saveListingStub(first, "Acme");
        repository.saveListingStub(second, "Acme");
        assertTrue(repository.loadCompletedIds().isEmpty());

        repository.markComplete("acme_x1-100");
        assertEquals(Set.of("acme_x1-100"), repository.loadCompletedIds());

        // seen again in a later listing
        repository.saveListingStub(first, "Acme");
        assertEquals(Set.of("acme_x1-100"), repository.loadCompletedIds());
        assertEquals(2, store.count("phone_list"));
        assertEquals(0, repository.countRecords());
    }

    private static PhoneRecord record(String detailId) {
        DisplaySpecs display = new DisplaySpecs();
        display.setDisplayType("IPS LCD");
        NormalizedSpec spec = new NormalizedSpec();
        spec.setDisplay(display);

        PhoneRecord record = new PhoneRecord();
        record.setDetailId(detailId);
        record.setName("Acme X1");
        record.setBrand("Acme");
        record.setUrl("https://example.test/" + detailId + ".php");
        record.setSource("gsmarena");
        record.setSpecifications(spec);
        record.setRawCategories(List.of(new RawCategory("Display", List.of(new SpecPair("Type", "IPS LCD")))));
        record.setVersion(99);
        return record;
    }

    /**
     * Clock whose instant can be moved by the test.
     */
    private static class MutableClock extends Clock {
        private Instant now;

        MutableClock(Instant now) {
            this.now = now;
        }

        @Override
        public ZoneOffset getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
