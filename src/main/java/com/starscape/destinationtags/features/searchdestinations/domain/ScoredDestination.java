package com.starscape.destinationtags.features.searchdestinations.domain;

import com.starscape.destinationtags.features.destinations.domain.Destination;

public record ScoredDestination(
    Destination destination,
    MatchScore matchScore
) {
    
    public double score() {
        return matchScore.score();
    }
}
