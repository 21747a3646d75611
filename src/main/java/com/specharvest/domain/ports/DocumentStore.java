package com.specharvest.domain.ports;

import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Key-based document persistence.
 *
 * <p>Upserts maintain three lifecycle fields on every document:
 * {@value #FIRST_SEEN_AT} is written on insert only, {@value #LAST_UPDATED_AT}
 * is refreshed on every call and {@value #VERSION} starts at 1 and is
 * incremented on each later upsert. Values for these keys in the supplied
 * document are ignored.</p>
 *
 * <p>Implementations must tolerate concurrent upserts.</p>
 */
public interface DocumentStore {

    String FIRST_SEEN_AT = "firstSeenAt";
    String LAST_UPDATED_AT = "lastUpdatedAt";
    String VERSION = "version";

    /**
     * Creates a unique index on the key field. Safe to call on every run.
     */
    void ensureIndex(String collection, String keyField);

    /**
     * Creates a non-unique ascending index over the given fields, in order.
     */
    void ensureLookupIndex(String collection, String... fields);

    /**
     * Inserts or updates the document identified by {@code keyField == keyValue}.
     *
     * @return the version the document has after this upsert
     */
    int upsert(String collection, String keyField, String keyValue, Map<String, Object> document);

    boolean exists(String collection, String keyField, String keyValue);

    long count(String collection);

    Optional<Map<String, Object>> find(String collection, String keyField, String keyValue);

    /**
     * Returns the key values of all documents whose fields equal the given filter values.
     */
    Set<String> findKeys(String collection, String keyField, Map<String, Object> filter);
}
