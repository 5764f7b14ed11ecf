package com.starscape.destinationtags.features.destinations.app;

import com.starscape.destinationtags.common.concurrency.EngineLock;
import com.starscape.destinationtags.features.destinations.domain.Destination;
import com.starscape.destinationtags.features.destinations.domain.DestinationRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Handler for adding a destination. Upserts by id with a full overwrite, no field merge.
 */
@Service
public class AddDestinationHandler {
    
    private static final Logger log = LoggerFactory.getLogger(AddDestinationHandler.class);
    
    private final DestinationRepository destinationRepository;
    private final EngineLock engineLock;
    
    public AddDestinationHandler(DestinationRepository destinationRepository, EngineLock engineLock) {
        this.destinationRepository = destinationRepository;
        this.engineLock = engineLock;
    }
    
    public void handle(Destination destination) {
        if (destination == null) {
            throw new IllegalArgumentException("Destination is required");
        }
        engineLock.write(() -> {
            destinationRepository.save(destination);
        });
        log.debug("Added destination: destinationId={}, tags={}", destination.getId(), destination.getTags().size());
    }
}
