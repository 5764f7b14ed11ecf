package com.starscape.destinationtags.features.tags.app;

import com.starscape.destinationtags.common.concurrency.EngineLock;
import com.starscape.destinationtags.common.domain.LanguageCode;
import com.starscape.destinationtags.features.tags.domain.Tag;
import com.starscape.destinationtags.features.tags.domain.TagPrefixIndex;
import com.starscape.destinationtags.features.tags.domain.TagRepository;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;

/**
 * Handler for prefix search over tag synonyms in one language.
 * Results are sorted by tag weight, highest first; equal weights keep trie traversal order.
 */
@Service
public class SearchTagsByPrefixHandler {
    
    private final TagRepository tagRepository;
    private final TagPrefixIndex prefixIndex;
    private final EngineLock engineLock;
    
    public SearchTagsByPrefixHandler(
            TagRepository tagRepository,
            TagPrefixIndex prefixIndex,
            EngineLock engineLock) {
        this.tagRepository = tagRepository;
        this.prefixIndex = prefixIndex;
        this.engineLock = engineLock;
    }
    
    /**
     * @param prefix case-insensitive prefix; empty matches every tag indexed in the language
     * @param language language whose synonyms are searched, no fallback
     * @param limit maximum number of tags returned
     * @return matching tags, empty when the language is not indexed or nothing matches
     */
    public List<Tag> handle(String prefix, LanguageCode language, int limit) {
        if (limit < 0) {
            throw new IllegalArgumentException("Limit cannot be negative: " + limit);
        }
        if (language == null || limit == 0) {
            return List.of();
        }
        
        return engineLock.read(() -> {
            Set<String> tagIds = prefixIndex.search(prefix == null ? "" : prefix, language);
            if (tagIds.isEmpty()) {
                return List.<Tag>of();
            }
            
            List<Tag> tags = new ArrayList<>(tagRepository.findAllById(tagIds));
            tags.sort(Comparator.comparingDouble(Tag::getWeight).reversed());
            return tags.size() > limit ? List.copyOf(tags.subList(0, limit)) : List.copyOf(tags);
        });
    }
}
