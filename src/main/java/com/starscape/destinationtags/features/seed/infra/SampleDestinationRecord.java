package com.starscape.destinationtags.features.seed.infra;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Destination entry of the sample data resource.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SampleDestinationRecord(
    @JsonProperty("id") String id,
    @JsonProperty("names") Map<String, String> names,
    @JsonProperty("coordinates") Map<String, Double> coordinates,
    @JsonProperty("country_code") String countryCode,
    @JsonProperty("administrative_level") String administrativeLevel,
    @JsonProperty("tags") Map<String, Double> tags,
    @JsonProperty("metadata") Map<String, Object> metadata
) {}
