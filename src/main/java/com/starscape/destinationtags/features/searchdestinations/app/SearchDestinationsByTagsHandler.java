package com.starscape.destinationtags.features.searchdestinations.app;

import com.starscape.destinationtags.common.concurrency.EngineLock;
import com.starscape.destinationtags.common.domain.LanguageCode;
import com.starscape.destinationtags.features.destinations.domain.Destination;
import com.starscape.destinationtags.features.destinations.domain.DestinationRepository;
import com.starscape.destinationtags.features.searchdestinations.domain.MatchScore;
import com.starscape.destinationtags.features.searchdestinations.domain.ScoredDestination;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Handler for ranking destinations against tag query terms.
 * Scores every destination in the store, keeps those at or above the threshold and sorts them
 * by score, highest first. Ties keep store order.
 */
@Service
public class SearchDestinationsByTagsHandler {
    
    private static final Logger log = LoggerFactory.getLogger(SearchDestinationsByTagsHandler.class);
    
    private final DestinationRepository destinationRepository;
    private final TagMatchScorer scorer;
    private final EngineLock engineLock;
    
    public SearchDestinationsByTagsHandler(
            DestinationRepository destinationRepository,
            TagMatchScorer scorer,
            EngineLock engineLock) {
        this.destinationRepository = destinationRepository;
        this.scorer = scorer;
        this.engineLock = engineLock;
    }
    
    /**
     * @param queries free-text query terms
     * @param language language whose synonyms are matched
     * @param minScore inclusive threshold; scores may exceed 1.0 so this is not a normalized cutoff
     * @param limit maximum number of results
     */
    public List<ScoredDestination> handle(List<String> queries, LanguageCode language, double minScore, int limit) {
        if (limit < 0) {
            throw new IllegalArgumentException("Limit cannot be negative: " + limit);
        }
        if (queries == null || queries.stream().anyMatch(query -> query == null)) {
            throw new IllegalArgumentException("Query terms cannot be null");
        }
        if (language == null || limit == 0) {
            return List.of();
        }
        
        List<ScoredDestination> results = engineLock.read(() -> {
            List<ScoredDestination> scored = new ArrayList<>();
            for (Destination destination : destinationRepository.findAll()) {
                MatchScore matchScore = scorer.score(destination, queries, language);
                if (matchScore.score() >= minScore) {
                    scored.add(new ScoredDestination(destination, matchScore));
                }
            }
            return scored;
        });
        
        results.sort(Comparator.comparingDouble(ScoredDestination::score).reversed());
        
        log.debug("Destination search: queries={}, language={}, minScore={}, matched={}",
            queries, language.getCode(), minScore, results.size());
        
        return results.size() > limit ? List.copyOf(results.subList(0, limit)) : List.copyOf(results);
    }
}
