package com.starscape.destinationtags.features.destinations.domain;

import com.starscape.destinationtags.common.domain.ValueObject;

public record Coordinates(
    double lat,
    double lng
) implements ValueObject {
    
    public Coordinates {
        if (Double.isNaN(lat) || lat < -90 || lat > 90) {
            throw new IllegalArgumentException("Latitude must be between -90 and 90");
        }
        if (Double.isNaN(lng) || lng < -180 || lng > 180) {
            throw new IllegalArgumentException("Longitude must be between -180 and 180");
        }
    }
}
