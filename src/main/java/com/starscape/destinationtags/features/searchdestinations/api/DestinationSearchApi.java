package com.starscape.destinationtags.features.searchdestinations.api;

import com.starscape.destinationtags.common.config.EngineProperties;
import com.starscape.destinationtags.common.domain.LanguageCode;
import com.starscape.destinationtags.features.destinations.domain.Destination;
import com.starscape.destinationtags.features.searchdestinations.api.dto.DestinationMatchResponse;
import com.starscape.destinationtags.features.searchdestinations.app.SearchDestinationsByTagsHandler;
import com.starscape.destinationtags.features.searchdestinations.domain.ScoredDestination;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Entry point for hosts searching destinations with several tag terms.
 * An unknown language code is treated as "not indexed" and yields no results.
 */
@Component
public class DestinationSearchApi {
    
    private static final Logger log = LoggerFactory.getLogger(DestinationSearchApi.class);
    
    private final SearchDestinationsByTagsHandler searchHandler;
    private final EngineProperties properties;
    
    public DestinationSearchApi(SearchDestinationsByTagsHandler searchHandler, EngineProperties properties) {
        this.searchHandler = searchHandler;
        this.properties = properties;
    }
    
    public List<DestinationMatchResponse> search(
            List<String> tags,
            String language,
            Double minMatchScore,
            Integer limit) {
        Optional<LanguageCode> lang = LanguageCode.find(language);
        if (lang.isEmpty()) {
            log.debug("Destination search in unknown language: {}", language);
            return List.of();
        }
        
        double threshold = minMatchScore != null ? minMatchScore : properties.getMinMatchScore();
        int effectiveLimit = limit != null ? limit : properties.getDestinationSearchLimit();
        
        return searchHandler.handle(tags != null ? tags : List.of(), lang.get(), threshold, effectiveLimit).stream()
                .map(hit -> toResponse(hit, lang.get()))
                .toList();
    }
    
    private DestinationMatchResponse toResponse(ScoredDestination hit, LanguageCode language) {
        Destination destination = hit.destination();
        
        Map<String, String> names = new LinkedHashMap<>();
        destination.getNames().forEach((lang, name) -> names.put(lang.getCode(), name));
        
        return new DestinationMatchResponse(
            destination.getId(),
            destination.name(language, properties.getDefaultLanguage()),
            names,
            destination.getCoordinates()
                    .map(c -> new DestinationMatchResponse.Coordinates(c.lat(), c.lng()))
                    .orElse(null),
            destination.getCountryCode().orElse(null),
            destination.getAdministrativeLevel().orElse(null),
            destination.getTags(),
            round(hit.score()),
            destination.getMetadata()
        );
    }
    
    private static double round(double score) {
        return BigDecimal.valueOf(score).setScale(3, RoundingMode.HALF_UP).doubleValue();
    }
}
