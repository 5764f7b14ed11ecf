package com.starscape.destinationtags.features.searchdestinations.domain;

import com.starscape.destinationtags.common.domain.ValueObject;

/**
 * Composite match between one destination and a list of query terms.
 * score = 0.4 * coverage + 0.6 * average. Exact synonym matches count double, so the score
 * can reach 1.6 and is not a probability.
 *
 * @param score final composite score
 * @param coverage share of query terms matched by at least one tag
 * @param average mean of the best per-term tag scores
 * @param matchedTerms number of terms with a positive best score
 * @param totalTerms number of query terms
 */
public record MatchScore(
    double score,
    double coverage,
    double average,
    int matchedTerms,
    int totalTerms
) implements ValueObject {
    
    public static final double COVERAGE_WEIGHT = 0.4;
    public static final double QUALITY_WEIGHT = 0.6;
    
    public static MatchScore none(int totalTerms) {
        return new MatchScore(0.0, 0.0, 0.0, 0, totalTerms);
    }
    
    public static MatchScore of(double bestScoreSum, int matchedTerms, int totalTerms) {
        if (totalTerms <= 0) {
            return none(0);
        }
        double coverage = (double) matchedTerms / totalTerms;
        double average = bestScoreSum / totalTerms;
        return new MatchScore(
            COVERAGE_WEIGHT * coverage + QUALITY_WEIGHT * average,
            coverage,
            average,
            matchedTerms,
            totalTerms
        );
    }
}
