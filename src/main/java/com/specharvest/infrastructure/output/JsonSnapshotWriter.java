package com.specharvest.infrastructure.output;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes brands, listing items and records as pretty-printed JSON,
 * with timestamps in ISO-8601.
 */
@Component
public class JsonSnapshotWriter {

    private static final Logger logger = LoggerFactory.getLogger(JsonSnapshotWriter.class);
    private static final ObjectMapper OBJECT_MAPPER;

    static {
        OBJECT_MAPPER = new ObjectMapper();
        OBJECT_MAPPER.registerModule(new JavaTimeModule());
        OBJECT_MAPPER.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        OBJECT_MAPPER.enable(SerializationFeature.INDENT_OUTPUT);
    }

    public String toJson(Object value) throws IOException {
        return OBJECT_MAPPER.writeValueAsString(value);
    }

    public void write(Object value, Path target) throws IOException {
        Path parent = target.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        OBJECT_MAPPER.writeValue(target.toFile(), value);
        logger.info("Wrote snapshot to {}", target);
    }

    public void write(Object value, OutputStream out) throws IOException {
        out.write(toJson(value).getBytes(StandardCharsets.UTF_8));
        out.write('\n');
        out.flush();
    }
}
