package com.starscape.destinationtags.features.searchdestinations.app;

import com.starscape.destinationtags.common.domain.LanguageCode;
import com.starscape.destinationtags.features.destinations.domain.Destination;
import com.starscape.destinationtags.features.searchdestinations.domain.MatchScore;
import com.starscape.destinationtags.features.tags.domain.Tag;
import com.starscape.destinationtags.features.tags.domain.TagRepository;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Scores a destination against free-text query terms using its tags' synonyms in one language.
 * 
 * For each term, every resolvable tag of the destination is scanned; the first synonym containing the
 * term (case-insensitive) yields relevance * 2.0 on an exact match and relevance * 1.0 otherwise.
 * The term's score is the best over all tags. Tags without synonyms in the language, and tag ids
 * missing from the registry, contribute nothing.
 * 
 * Reads the tag registry without locking; callers hold the engine read lock.
 */
@Component
public class TagMatchScorer {
    
    static final double EXACT_MATCH_MULTIPLIER = 2.0;
    static final double PARTIAL_MATCH_MULTIPLIER = 1.0;
    
    private final TagRepository tagRepository;
    
    public TagMatchScorer(TagRepository tagRepository) {
        this.tagRepository = tagRepository;
    }
    
    public MatchScore score(Destination destination, List<String> queries, LanguageCode language) {
        if (queries == null || queries.isEmpty()) {
            return MatchScore.none(0);
        }
        if (destination.getTags().isEmpty()) {
            return MatchScore.none(queries.size());
        }
        
        double total = 0.0;
        int matched = 0;
        
        for (String query : queries) {
            double best = bestTagScore(destination, query.toLowerCase(Locale.ROOT), language);
            total += best;
            if (best > 0) {
                matched++;
            }
        }
        
        return MatchScore.of(total, matched, queries.size());
    }
    
    private double bestTagScore(Destination destination, String query, LanguageCode language) {
        double best = 0.0;
        
        for (Map.Entry<String, Double> entry : destination.getTags().entrySet()) {
            Optional<Tag> tag = tagRepository.findById(entry.getKey());
            if (tag.isEmpty()) {
                continue;
            }
            
            double relevance = entry.getValue();
            for (String synonym : tag.get().synonyms(language)) {
                String name = synonym.toLowerCase(Locale.ROOT);
                if (name.contains(query)) {
                    double multiplier = name.equals(query) ? EXACT_MATCH_MULTIPLIER : PARTIAL_MATCH_MULTIPLIER;
                    best = Math.max(best, relevance * multiplier);
                    // first matching synonym decides for this tag
                    break;
                }
            }
        }
        return best;
    }
}
