package com.starscape.destinationtags.features.destinations.app;

import com.starscape.destinationtags.common.concurrency.EngineLock;
import com.starscape.destinationtags.features.destinations.domain.Destination;
import com.starscape.destinationtags.features.destinations.domain.DestinationRepository;
import org.springframework.stereotype.Service;

import java.util.Optional;

@Service
public class GetDestinationHandler {
    
    private final DestinationRepository destinationRepository;
    private final EngineLock engineLock;
    
    public GetDestinationHandler(DestinationRepository destinationRepository, EngineLock engineLock) {
        this.destinationRepository = destinationRepository;
        this.engineLock = engineLock;
    }
    
    public Optional<Destination> handle(String destinationId) {
        if (destinationId == null) {
            return Optional.empty();
        }
        return engineLock.read(() -> destinationRepository.findById(destinationId));
    }
}
