package com.specharvest.domain.ports;

import com.specharvest.domain.model.ListingItem;
import com.specharvest.domain.model.PhoneRecord;

import java.util.Optional;
import java.util.Set;

/**
 * Port for persisting harvested devices and their listing stubs.
 */
public interface PhoneRepository {

    /**
     * Creates indexes on both collections. Idempotent.
     */
    void initialize();

    /**
     * Upserts the record by its detail id.
     *
     * @return the record version after the upsert
     */
    int upsert(PhoneRecord record);

    Optional<PhoneRecord> findByDetailId(String detailId);

    boolean exists(String detailId);

    long countRecords();

    /**
     * Records a listing stub as discovered but not yet fully ingested.
     * Stubs already marked complete stay complete.
     */
    void saveListingStub(ListingItem item, String brandName);

    /**
     * Marks a listing stub as fully ingested.
     */
    void markComplete(String detailId);

    /**
     * Loads the detail ids of all stubs marked complete.
     */
    Set<String> loadCompletedIds();
}
