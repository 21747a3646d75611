package com.specharvest.infrastructure.persistence;

import com.specharvest.domain.ports.DocumentStore;

import java.time.Clock;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * DocumentStore kept in process memory, for dry runs and tests.
 * Nothing survives a restart.
 */
public class InMemoryDocumentStore implements DocumentStore {

    private final Map<String, Map<String, Map<String, Object>>> collections = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryDocumentStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public void ensureIndex(String collection, String keyField) {
        documents(collection);
    }

    @Override
    public void ensureLookupIndex(String collection, String... fields) {
        documents(collection);
    }

    @Override
    public int upsert(String collection, String keyField, String keyValue, Map<String, Object> document) {
        Instant now = clock.instant();
        Map<String, Object> stored = documents(collection).compute(keyValue, (key, existing) -> {
            Map<String, Object> next = existing == null ? new LinkedHashMap<>() : new LinkedHashMap<>(existing);
            document.forEach((field, value) -> {
                if (!FIRST_SEEN_AT.equals(field) && !LAST_UPDATED_AT.equals(field) && !VERSION.equals(field)) {
                    next.put(field, value);
                }
            });
            next.put(keyField, keyValue);
            next.putIfAbsent(FIRST_SEEN_AT, now);
            next.put(LAST_UPDATED_AT, now);
            next.put(VERSION, existing == null ? 1 : ((Number) existing.get(VERSION)).intValue() + 1);
            return Collections.unmodifiableMap(next);
        });
        return ((Number) stored.get(VERSION)).intValue();
    }

    @Override
    public boolean exists(String collection, String keyField, String keyValue) {
        return documents(collection).containsKey(keyValue);
    }

    @Override
    public long count(String collection) {
        return documents(collection).size();
    }

    @Override
    public Optional<Map<String, Object>> find(String collection, String keyField, String keyValue) {
        return Optional.ofNullable(documents(collection).get(keyValue));
    }

    @Override
    public Set<String> findKeys(String collection, String keyField, Map<String, Object> filter) {
        return documents(collection).entrySet().stream()
            .filter(entry -> filter.entrySet().stream()
                .allMatch(condition -> Objects.equals(entry.getValue().get(condition.getKey()), condition.getValue())))
            .map(Map.Entry::getKey)
            .collect(Collectors.toSet());
    }

    private Map<String, Map<String, Object>> documents(String collection) {
        return collections.computeIfAbsent(collection, name -> new ConcurrentHashMap<>());
    }
}
