package com.wildtrack.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Builder;
import lombok.Value;

import java.time.OffsetDateTime;
import java.util.Map;

/**
 * One normalized, offset-corrected location fix ready for downstream ingestion.
 *
 * <p>Every vendor field that is not promoted to a first-class attribute travels in
 * {@code additional}.  Instances are immutable and consumed once by the dispatch step.</p>
 */
@Value
@Builder
@JsonPropertyOrder({"source", "source_name", "type", "recorded_at", "location", "additional"})
public class TransformedObservation {

    public static final String TYPE_TRACKING_DEVICE = "tracking-device";

    @JsonProperty("source")
    String source;

    @JsonProperty("source_name")
    String sourceName;

    @JsonProperty("type")
    @Builder.Default
    String type = TYPE_TRACKING_DEVICE;

    @JsonProperty("recorded_at")
    OffsetDateTime recordedAt;

    @JsonProperty("location")
    Location location;

    @JsonProperty("additional")
    Map<String, Object> additional;

    /**
     * Latitude/longitude pair; either side may be absent when the vendor omitted it.
     */
    @Value
    @JsonInclude(JsonInclude.Include.ALWAYS)
    public static class Location {
        @JsonProperty("lat")
        Double lat;

        @JsonProperty("lon")
        Double lon;
    }
}
