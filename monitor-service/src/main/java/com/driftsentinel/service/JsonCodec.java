package com.driftsentinel.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;

/**
 * JSON encoding for the HTTP surface.
 *
 * <p>
 * One shared {@link ObjectMapper}: ISO-8601 instants, unknown properties
 * ignored on input. Thread-safe once constructed.
 * </p>
 */
public class JsonCodec {

    private final ObjectMapper mapper;

    public JsonCodec() {
        mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    /**
     * Decode a prediction request body.
     *
     * @param body request body
     * @return the decoded request
     * @throws IOException if the body is empty or not valid JSON for a
     *                     {@link PredictionRequest}
     */
    public PredictionRequest readPredictionRequest(InputStream body) throws IOException {
        return mapper.readValue(body, PredictionRequest.class);
    }

    /**
     * @param value any Jackson-serializable value
     * @return UTF-8 JSON bytes
     * @throws UncheckedIOException if the value cannot be serialized
     */
    public byte[] toJson(Object value) {
        try {
            return mapper.writeValueAsBytes(value);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to serialize " + value.getClass().getSimpleName(), e);
        }
    }

    ObjectMapper mapper() {
        return mapper;
    }
}
