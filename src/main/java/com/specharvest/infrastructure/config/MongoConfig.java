package com.specharvest.infrastructure.config;

import com.mongodb.ConnectionString;
import com.mongodb.MongoClientSettings;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;
import com.specharvest.domain.ports.DocumentStore;
import com.specharvest.infrastructure.persistence.MongoDocumentStore;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Clock;

/**
 * MongoDB configuration, active unless {@code harvest.store=memory}.
 */
@Configuration
@ConditionalOnProperty(name = "harvest.store", havingValue = "mongo", matchIfMissing = true)
public class MongoConfig {

    @Bean(destroyMethod = "close")
    public MongoClient mongoClient(HarvestProperties properties) {
        ConnectionString connectionString = new ConnectionString(connectionUri(properties.getMongo()));
        MongoClientSettings settings = MongoClientSettings.builder()
            .applyConnectionString(connectionString)
            .build();
        return MongoClients.create(settings);
    }

    @Bean
    public DocumentStore documentStore(MongoClient mongoClient, HarvestProperties properties, Clock clock) {
        String database = properties.getMongo().getDatabase();
        if (database == null || database.isBlank()) {
            throw new IllegalStateException("MONGO_DB_DATABASE_NAME must be set");
        }
        MongoDocumentStore store = new MongoDocumentStore(mongoClient, database, clock);
        store.ping();
        return store;
    }

    /**
     * Uses the explicit URI when present, otherwise builds an Atlas SRV URI
     * from username, password and cluster domain.
     */
    static String connectionUri(HarvestProperties.Mongo mongo) {
        if (mongo.getUri() != null && !mongo.getUri().isBlank()) {
            return mongo.getUri();
        }
        if (isBlank(mongo.getUsername()) || isBlank(mongo.getPassword()) || isBlank(mongo.getDomain())) {
            throw new IllegalStateException(
                "MongoDB credentials missing: set MONGODB_URI or MONGO_DB_USERNAME, MONGO_DB_PASSWORD and MONGO_DB_DOMAIN_NAME");
        }
        return String.format("mongodb+srv://%s:%s@%s.mongodb.net/?retryWrites=true&w=majority",
            URLEncoder.encode(mongo.getUsername(), StandardCharsets.UTF_8),
            URLEncoder.encode(mongo.getPassword(), StandardCharsets.UTF_8),
            mongo.getDomain());
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
