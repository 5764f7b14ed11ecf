package com.starscape.destinationtags.features.stats.domain;

import java.util.List;

/**
 * Summary of the engine contents.
 */
public record EngineStats(
    long tagCount,
    long destinationCount,
    List<String> indexedLanguages,
    List<String> categories
) {}
