package com.starscape.destinationtags.features.searchdestinations.api.dto;

import java.util.Map;

/**
 * Destination search hit as presented to hosts. matchScore is rounded to three decimals.
 */
public record DestinationMatchResponse(
    String id,
    String name,
    Map<String, String> names,
    Coordinates coordinates,
    String countryCode,
    String administrativeLevel,
    Map<String, Double> matchedTags,
    double matchScore,
    Map<String, Object> metadata
) {
    
    public record Coordinates(double lat, double lng) {}
}
