package com.specharvest.infrastructure.persistence;

import com.mongodb.MongoException;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.model.Filters;
import com.mongodb.client.model.FindOneAndUpdateOptions;
import com.mongodb.client.model.IndexOptions;
import com.mongodb.client.model.Indexes;
import com.mongodb.client.model.Projections;
import com.mongodb.client.model.ReturnDocument;
import com.mongodb.client.model.Updates;
import com.specharvest.domain.ports.DocumentStore;
import com.specharvest.domain.ports.PersistenceException;
import org.bson.Document;
import org.bson.conversions.Bson;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Date;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * MongoDB implementation of DocumentStore.
 *
 * Each upsert is a single findOneAndUpdate so concurrent writers never lose
 * the version increment:
 * - $set for every supplied field and lastUpdatedAt
 * - $setOnInsert for firstSeenAt
 * - $inc for version
 */
public class MongoDocumentStore implements DocumentStore {

    private static final Logger logger = LoggerFactory.getLogger(MongoDocumentStore.class);
    private static final Set<String> RESERVED_FIELDS = Set.of("_id", FIRST_SEEN_AT, LAST_UPDATED_AT, VERSION);

    private final MongoClient mongoClient;
    private final String databaseName;
    private final Clock clock;

    public MongoDocumentStore(MongoClient mongoClient, String databaseName, Clock clock) {
        this.mongoClient = mongoClient;
        this.databaseName = databaseName;
        this.clock = clock;
    }

    /**
     * Verifies the connection with a ping command.
     */
    public void ping() {
        try {
            mongoClient.getDatabase(databaseName).runCommand(new Document("ping", 1));
            logger.info("Connected to MongoDB database {}", databaseName);
        } catch (MongoException e) {
            throw new PersistenceException("Failed to connect to MongoDB database " + databaseName, e);
        }
    }

    @Override
    public void ensureIndex(String collection, String keyField) {
        try {
            getCollection(collection).createIndex(
                Indexes.ascending(keyField),
                new IndexOptions().unique(true).background(true));
            logger.debug("Unique index on {}.{} ensured", collection, keyField);
        } catch (MongoException e) {
            throw new PersistenceException("Failed to create unique index on " + collection + "." + keyField, e);
        }
    }

    @Override
    public void ensureLookupIndex(String collection, String... fields) {
        try {
            getCollection(collection).createIndex(
                Indexes.ascending(fields),
                new IndexOptions().background(true));
        } catch (MongoException e) {
            // lookup indexes only speed up queries, the harvest works without them
            logger.warn("Failed to create index on {} {}: {}", collection, List.of(fields), e.getMessage());
        }
    }

    @Override
    public int upsert(String collection, String keyField, String keyValue, Map<String, Object> document) {
        Bson update = buildUpsertUpdate(document, clock.instant());
        try {
            Document result = getCollection(collection).findOneAndUpdate(
                Filters.eq(keyField, keyValue),
                update,
                new FindOneAndUpdateOptions().upsert(true).returnDocument(ReturnDocument.AFTER));
            if (result == null || !(result.get(VERSION) instanceof Number version)) {
                throw new PersistenceException("Upsert of " + keyValue + " in " + collection + " returned no version", null);
            }
            return version.intValue();
        } catch (MongoException e) {
            throw new PersistenceException("Failed to upsert " + keyValue + " in " + collection, e);
        }
    }

    static Bson buildUpsertUpdate(Map<String, Object> document, Instant now) {
        List<Bson> updates = new ArrayList<>();
        document.forEach((field, value) -> {
            if (!RESERVED_FIELDS.contains(field)) {
                updates.add(Updates.set(field, value));
            }
        });
        Date timestamp = Date.from(now);
        updates.add(Updates.set(LAST_UPDATED_AT, timestamp));
        updates.add(Updates.setOnInsert(FIRST_SEEN_AT, timestamp));
        updates.add(Updates.inc(VERSION, 1));
        return Updates.combine(updates);
    }

    @Override
    public boolean exists(String collection, String keyField, String keyValue) {
        try {
            return getCollection(collection).countDocuments(Filters.eq(keyField, keyValue)) > 0;
        } catch (MongoException e) {
            throw new PersistenceException("Failed to look up " + keyValue + " in " + collection, e);
        }
    }

    @Override
    public long count(String collection) {
        try {
            return getCollection(collection).countDocuments();
        } catch (MongoException e) {
            throw new PersistenceException("Failed to count documents in " + collection, e);
        }
    }

    @Override
    public Optional<Map<String, Object>> find(String collection, String keyField, String keyValue) {
        try {
            Document document = getCollection(collection).find(Filters.eq(keyField, keyValue)).first();
            return Optional.ofNullable(document);
        } catch (MongoException e) {
            throw new PersistenceException("Failed to read " + keyValue + " from " + collection, e);
        }
    }

    @Override
    public Set<String> findKeys(String collection, String keyField, Map<String, Object> filter) {
        List<Bson> conditions = new ArrayList<>();
        filter.forEach((field, value) -> conditions.add(Filters.eq(field, value)));
        Bson query = conditions.isEmpty() ? new Document() : Filters.and(conditions);

        Set<String> keys = new HashSet<>();
        try {
            getCollection(collection).find(query)
                .projection(Projections.include(keyField))
                .forEach(document -> {
                    String key = document.getString(keyField);
                    if (key != null) {
                        keys.add(key);
                    }
                });
        } catch (MongoException e) {
            throw new PersistenceException("Failed to load keys from " + collection, e);
        }
        return keys;
    }

    private MongoCollection<Document> getCollection(String collection) {
        return mongoClient.getDatabase(databaseName).getCollection(collection);
    }
}
