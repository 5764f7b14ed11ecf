package com.starscape.destinationtags.features.stats.app;

import com.starscape.destinationtags.common.concurrency.EngineLock;
import com.starscape.destinationtags.common.domain.LanguageCode;
import com.starscape.destinationtags.features.destinations.domain.DestinationRepository;
import com.starscape.destinationtags.features.stats.domain.EngineStats;
import com.starscape.destinationtags.features.tags.domain.TagCategory;
import com.starscape.destinationtags.features.tags.domain.TagPrefixIndex;
import com.starscape.destinationtags.features.tags.domain.TagRepository;
import org.springframework.stereotype.Service;

import java.util.Arrays;

@Service
public class GetEngineStatsHandler {
    
    private final TagRepository tagRepository;
    private final DestinationRepository destinationRepository;
    private final TagPrefixIndex prefixIndex;
    private final EngineLock engineLock;
    
    public GetEngineStatsHandler(
            TagRepository tagRepository,
            DestinationRepository destinationRepository,
            TagPrefixIndex prefixIndex,
            EngineLock engineLock) {
        this.tagRepository = tagRepository;
        this.destinationRepository = destinationRepository;
        this.prefixIndex = prefixIndex;
        this.engineLock = engineLock;
    }
    
    public EngineStats handle() {
        return engineLock.read(() -> new EngineStats(
            tagRepository.count(),
            destinationRepository.count(),
            prefixIndex.indexedLanguages().stream().map(LanguageCode::getCode).toList(),
            Arrays.stream(TagCategory.values()).map(TagCategory::getCode).toList()
        ));
    }
}
