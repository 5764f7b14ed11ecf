package com.starscape.destinationtags.features.destinations.infra;

import com.starscape.destinationtags.features.destinations.domain.Destination;
import com.starscape.destinationtags.features.destinations.domain.DestinationRepository;
import org.springframework.stereotype.Repository;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * In-memory destination store keyed by id. An overwrite keeps the first insertion position.
 * Callers hold the engine lock.
 */
@Repository
public class InMemoryDestinationRepository implements DestinationRepository {
    
    private final Map<String, Destination> destinations = new LinkedHashMap<>();
    
    @Override
    public Destination save(Destination destination) {
        destinations.put(destination.getId(), destination);
        return destination;
    }
    
    @Override
    public Optional<Destination> findById(String destinationId) {
        return Optional.ofNullable(destinations.get(destinationId));
    }
    
    @Override
    public List<Destination> findAll() {
        return List.copyOf(destinations.values());
    }
    
    @Override
    public long count() {
        return destinations.size();
    }
}
