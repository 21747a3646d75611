package com.specharvest.infrastructure.persistence;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.specharvest.domain.model.PhoneRecord;
import com.specharvest.domain.ports.DocumentStore;

import java.time.Instant;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Converts between PhoneRecord and store documents.
 * Lifecycle fields are owned by the store and handled outside Jackson.
 */
final class PhoneRecordMapper {

    private static final ObjectMapper OBJECT_MAPPER;
    private static final TypeReference<Map<String, Object>> DOCUMENT_TYPE = new TypeReference<>() {
    };

    static {
        OBJECT_MAPPER = new ObjectMapper();
        OBJECT_MAPPER.registerModule(new JavaTimeModule());
        OBJECT_MAPPER.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    private PhoneRecordMapper() {
    }

    static Map<String, Object> toDocument(PhoneRecord record) {
        Map<String, Object> document = OBJECT_MAPPER.convertValue(record, DOCUMENT_TYPE);
        document.remove(DocumentStore.FIRST_SEEN_AT);
        document.remove(DocumentStore.LAST_UPDATED_AT);
        document.remove(DocumentStore.VERSION);
        return document;
    }

    static PhoneRecord fromDocument(Map<String, Object> document) {
        Map<String, Object> fields = new LinkedHashMap<>(document);
        fields.remove("_id");
        Object firstSeenAt = fields.remove(DocumentStore.FIRST_SEEN_AT);
        Object lastUpdatedAt = fields.remove(DocumentStore.LAST_UPDATED_AT);
        Object version = fields.remove(DocumentStore.VERSION);

        PhoneRecord record = OBJECT_MAPPER.convertValue(fields, PhoneRecord.class);
        record.setFirstSeenAt(toInstant(firstSeenAt));
        record.setLastUpdatedAt(toInstant(lastUpdatedAt));
        record.setVersion(version instanceof Number number ? number.intValue() : null);
        return record;
    }

    private static Instant toInstant(Object value) {
        if (value instanceof Instant instant) {
            return instant;
        }
        if (value instanceof Date date) {
            return date.toInstant();
        }
        return null;
    }
}
