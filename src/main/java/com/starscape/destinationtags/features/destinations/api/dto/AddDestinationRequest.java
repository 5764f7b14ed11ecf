package com.starscape.destinationtags.features.destinations.api.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.util.Map;

/**
 * Request DTO for adding a destination. Language codes are raw strings; unknown ones are skipped.
 */
public record AddDestinationRequest(
    @NotBlank(message = "Destination ID is required")
    String destinationId,
    
    @NotNull(message = "Names are required")
    Map<String, String> names,
    
    @NotNull(message = "Tags are required")
    Map<String, Double> tags,
    
    @Valid
    CoordinatesRequest coordinates,
    
    @Size(max = 3, message = "Country code must be 3 characters or less")
    String countryCode,
    
    String administrativeLevel,
    
    Map<String, Object> metadata
) {
    
    public record CoordinatesRequest(
        @NotNull Double lat,
        @NotNull Double lng
    ) {}
}
