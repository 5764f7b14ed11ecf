package com.starscape.destinationtags.features.tags.app;

import com.starscape.destinationtags.common.concurrency.EngineLock;
import com.starscape.destinationtags.features.tags.domain.Tag;
import com.starscape.destinationtags.features.tags.domain.TagCategoryIndex;
import com.starscape.destinationtags.features.tags.domain.TagPrefixIndex;
import com.starscape.destinationtags.features.tags.domain.TagRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Handler for adding a tag to the registry.
 * Inserts or replaces the tag by id and fans the change out to the prefix and category indices.
 * When a tag with the same id already exists, the entries of the previous version are retracted first,
 * so stale synonyms and categories stop matching.
 */
@Service
public class AddTagHandler {
    
    private static final Logger log = LoggerFactory.getLogger(AddTagHandler.class);
    
    private final TagRepository tagRepository;
    private final TagPrefixIndex prefixIndex;
    private final TagCategoryIndex categoryIndex;
    private final EngineLock engineLock;
    
    public AddTagHandler(
            TagRepository tagRepository,
            TagPrefixIndex prefixIndex,
            TagCategoryIndex categoryIndex,
            EngineLock engineLock) {
        this.tagRepository = tagRepository;
        this.prefixIndex = prefixIndex;
        this.categoryIndex = categoryIndex;
        this.engineLock = engineLock;
    }
    
    public void handle(Tag tag) {
        if (tag == null) {
            throw new IllegalArgumentException("Tag is required");
        }
        
        engineLock.write(() -> {
            Optional<Tag> previous = tagRepository.findById(tag.getId());
            previous.ifPresent(old -> {
                prefixIndex.retract(old);
                categoryIndex.remove(old);
                log.info("Replacing tag: tagId={}, previousCategory={}, category={}",
                    tag.getId(), old.getCategory().getCode(), tag.getCategory().getCode());
            });
            
            tagRepository.save(tag);
            categoryIndex.add(tag);
            prefixIndex.index(tag);
        });
        
        log.debug("Added tag: tagId={}, category={}, languages={}",
            tag.getId(), tag.getCategory().getCode(), tag.getSynonyms().keySet());
    }
}
