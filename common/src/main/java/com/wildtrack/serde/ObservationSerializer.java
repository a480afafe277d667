package com.wildtrack.serde;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.wildtrack.errors.WildtrackException;
import com.wildtrack.model.TransformedObservation;

import java.util.List;

/**
 * Serialises {@link TransformedObservation}s to the JSON shape expected downstream.
 * Timestamps are written as ISO-8601 strings that keep the device's UTC offset.
 */
public class ObservationSerializer {

    private final ObjectMapper objectMapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    public byte[] serializeBatch(List<TransformedObservation> batch) {
        try {
            return objectMapper.writeValueAsBytes(batch);
        } catch (JsonProcessingException e) {
            throw new WildtrackException("Failed to serialise batch of " + batch.size() + " observations", e);
        }
    }

    public String serialize(TransformedObservation observation) {
        try {
            return objectMapper.writeValueAsString(observation);
        } catch (JsonProcessingException e) {
            throw new WildtrackException("Failed to serialise observation from " + observation.getSource(), e);
        }
    }
}
