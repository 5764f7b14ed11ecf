package com.starscape.destinationtags.features.tags.app;

import com.starscape.destinationtags.common.concurrency.EngineLock;
import com.starscape.destinationtags.features.tags.domain.TagCategoryIndex;
import com.starscape.destinationtags.features.tags.domain.TagPrefixIndex;
import com.starscape.destinationtags.features.tags.domain.TagRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Handler for emptying the tag registry together with its indices.
 * Destinations are left untouched; their references to removed tags are ignored by scoring.
 */
@Service
public class ClearTagsHandler {
    
    private static final Logger log = LoggerFactory.getLogger(ClearTagsHandler.class);
    
    private final TagRepository tagRepository;
    private final TagPrefixIndex prefixIndex;
    private final TagCategoryIndex categoryIndex;
    private final EngineLock engineLock;
    
    public ClearTagsHandler(
            TagRepository tagRepository,
            TagPrefixIndex prefixIndex,
            TagCategoryIndex categoryIndex,
            EngineLock engineLock) {
        this.tagRepository = tagRepository;
        this.prefixIndex = prefixIndex;
        this.categoryIndex = categoryIndex;
        this.engineLock = engineLock;
    }
    
    public void handle() {
        long removed = engineLock.write(() -> {
            long count = tagRepository.count();
            tagRepository.deleteAll();
            prefixIndex.clear();
            categoryIndex.clear();
            return count;
        });
        log.info("Cleared tag registry: removed={}", removed);
    }
}
