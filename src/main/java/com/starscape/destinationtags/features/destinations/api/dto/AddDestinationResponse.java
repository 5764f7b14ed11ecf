package com.starscape.destinationtags.features.destinations.api.dto;

public record AddDestinationResponse(
    boolean success,
    String message,
    String destinationId
) {}
