package com.opssentinel.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * JSON encoding of alerts, executions and status maps.
 *
 * <p>
 * Property names are snake_case and timestamps ISO-8601 strings.
 * </p>
 *
 * @since 1.0.0
 */
public class RecordSerializer {

    private static final Logger LOG = LoggerFactory.getLogger(RecordSerializer.class);

    private final ObjectMapper mapper;

    public RecordSerializer() {
        this.mapper = newObjectMapper();
    }

    /**
     * @return a mapper configured the way every record in the service is
     *         written
     */
    public static ObjectMapper newObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
        mapper.configure(SerializationFeature.WRITE_DURATIONS_AS_TIMESTAMPS, false);
        mapper.setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);
        return mapper;
    }

    /**
     * Serialize a record to UTF-8 JSON bytes.
     *
     * @throws IllegalStateException if the record cannot be serialized
     */
    public byte[] toBytes(Object record) {
        try {
            return mapper.writeValueAsBytes(record);
        } catch (JsonProcessingException e) {
            LOG.error("Failed to serialize {}: {}", record.getClass().getSimpleName(), e.getMessage());
            throw new IllegalStateException("Failed to serialize " + record.getClass().getSimpleName(), e);
        }
    }

    /**
     * Serialize a record to a single-line JSON string.
     *
     * @throws IllegalStateException if the record cannot be serialized
     */
    public String toJson(Object record) {
        try {
            return mapper.writeValueAsString(record);
        } catch (JsonProcessingException e) {
            LOG.error("Failed to serialize {}: {}", record.getClass().getSimpleName(), e.getMessage());
            throw new IllegalStateException("Failed to serialize " + record.getClass().getSimpleName(), e);
        }
    }

    public ObjectMapper mapper() {
        return mapper;
    }
}
