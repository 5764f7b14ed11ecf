package com.starscape.destinationtags.features.destinations.domain;

import java.util.List;
import java.util.Optional;

/**
 * Repository interface for Destination domain entity.
 */
public interface DestinationRepository {
    Destination save(Destination destination);
    Optional<Destination> findById(String destinationId);
    List<Destination> findAll();
    long count();
}
