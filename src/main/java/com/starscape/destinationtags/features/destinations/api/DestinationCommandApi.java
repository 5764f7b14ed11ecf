package com.starscape.destinationtags.features.destinations.api;

import com.starscape.destinationtags.common.domain.LanguageCode;
import com.starscape.destinationtags.features.destinations.api.dto.AddDestinationRequest;
import com.starscape.destinationtags.features.destinations.api.dto.AddDestinationResponse;
import com.starscape.destinationtags.features.destinations.app.AddDestinationHandler;
import com.starscape.destinationtags.features.destinations.domain.Coordinates;
import com.starscape.destinationtags.features.destinations.domain.Destination;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import java.util.Map;
import java.util.Optional;

/**
 * Entry point for hosts adding destinations with string-coded names.
 */
@Component
@Validated
public class DestinationCommandApi {
    
    private static final Logger log = LoggerFactory.getLogger(DestinationCommandApi.class);
    
    private final AddDestinationHandler addDestinationHandler;
    
    public DestinationCommandApi(AddDestinationHandler addDestinationHandler) {
        this.addDestinationHandler = addDestinationHandler;
    }
    
    public AddDestinationResponse addDestination(@Valid AddDestinationRequest request) {
        Destination.Builder builder = Destination.builder(request.destinationId());
        
        for (Map.Entry<String, String> entry : request.names().entrySet()) {
            Optional<LanguageCode> language = LanguageCode.find(entry.getKey());
            if (language.isEmpty()) {
                log.warn("Skipping name in unknown language: destinationId={}, language={}",
                    request.destinationId(), entry.getKey());
                continue;
            }
            builder.name(language.get(), entry.getValue());
        }
        
        if (request.coordinates() != null) {
            builder.coordinates(new Coordinates(request.coordinates().lat(), request.coordinates().lng()));
        }
        
        Destination destination = builder
                .countryCode(request.countryCode())
                .administrativeLevel(request.administrativeLevel())
                .tags(request.tags())
                .metadata(request.metadata() != null ? request.metadata() : Map.of())
                .build();
        
        addDestinationHandler.handle(destination);
        
        return new AddDestinationResponse(
            true,
            "Destination '" + destination.getId() + "' added",
            destination.getId()
        );
    }
}
