package com.specharvest.infrastructure.persistence;

import com.specharvest.domain.model.ListingItem;
import com.specharvest.domain.model.PhoneRecord;
import com.specharvest.domain.ports.DocumentStore;
import com.specharvest.domain.ports.PhoneRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * PhoneRepository on top of a DocumentStore, using one collection for full
 * records and one for listing stubs with their completion flag.
 */
public class DocumentStorePhoneRepository implements PhoneRepository {

    private static final Logger logger = LoggerFactory.getLogger(DocumentStorePhoneRepository.class);

    static final String COMPLETE = "complete";

    private final DocumentStore store;
    private final String recordsCollection;
    private final String listingCollection;

    public DocumentStorePhoneRepository(DocumentStore store, String recordsCollection, String listingCollection) {
        this.store = store;
        this.recordsCollection = recordsCollection;
        this.listingCollection = listingCollection;
    }

    @Override
    public void initialize() {
        store.ensureIndex(recordsCollection, PhoneRecord.KEY_FIELD);
        store.ensureLookupIndex(recordsCollection, "brand");
        store.ensureLookupIndex(recordsCollection, DocumentStore.FIRST_SEEN_AT);
        store.ensureLookupIndex(recordsCollection, "brand", "name");
        store.ensureIndex(listingCollection, PhoneRecord.KEY_FIELD);
        logger.info("Indexes ensured on {} and {}", recordsCollection, listingCollection);
    }

    @Override
    public int upsert(PhoneRecord record) {
        return store.upsert(recordsCollection, PhoneRecord.KEY_FIELD, record.getDetailId(),
            PhoneRecordMapper.toDocument(record));
    }

    @Override
    public Optional<PhoneRecord> findByDetailId(String detailId) {
        return store.find(recordsCollection, PhoneRecord.KEY_FIELD, detailId)
            .map(PhoneRecordMapper::fromDocument);
    }

    @Override
    public boolean exists(String detailId) {
        return store.exists(recordsCollection, PhoneRecord.KEY_FIELD, detailId);
    }

    @Override
    public long countRecords() {
        return store.count(recordsCollection);
    }

    @Override
    public void saveListingStub(ListingItem item, String brandName) {
        boolean complete = store.find(listingCollection, PhoneRecord.KEY_FIELD, item.detailId())
            .map(document -> Boolean.TRUE.equals(document.get(COMPLETE)))
            .orElse(false);

        Map<String, Object> stub = new LinkedHashMap<>();
        stub.put(PhoneRecord.KEY_FIELD, item.detailId());
        stub.put("name", item.name());
        stub.put("brand", brandName);
        stub.put("url", item.detailUrl());
        stub.put("thumbnailUrl", item.thumbnailUrl());
        stub.put(COMPLETE, complete);
        store.upsert(listingCollection, PhoneRecord.KEY_FIELD, item.detailId(), stub);
    }

    @Override
    public void markComplete(String detailId) {
        Map<String, Object> update = new LinkedHashMap<>();
        update.put(COMPLETE, true);
        store.upsert(listingCollection, PhoneRecord.KEY_FIELD, detailId, update);
    }

    @Override
    public Set<String> loadCompletedIds() {
        Set<String> completed = store.findKeys(listingCollection, PhoneRecord.KEY_FIELD, Map.of(COMPLETE, true));
        logger.info("Loaded {} completed items from {}", completed.size(), listingCollection);
        return completed;
    }
}
