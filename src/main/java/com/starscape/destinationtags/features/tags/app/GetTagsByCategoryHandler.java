package com.starscape.destinationtags.features.tags.app;

import com.starscape.destinationtags.common.concurrency.EngineLock;
import com.starscape.destinationtags.features.tags.domain.Tag;
import com.starscape.destinationtags.features.tags.domain.TagCategory;
import com.starscape.destinationtags.features.tags.domain.TagCategoryIndex;
import com.starscape.destinationtags.features.tags.domain.TagRepository;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Handler for listing all tags of a category.
 */
@Service
public class GetTagsByCategoryHandler {
    
    private final TagRepository tagRepository;
    private final TagCategoryIndex categoryIndex;
    private final EngineLock engineLock;
    
    public GetTagsByCategoryHandler(
            TagRepository tagRepository,
            TagCategoryIndex categoryIndex,
            EngineLock engineLock) {
        this.tagRepository = tagRepository;
        this.categoryIndex = categoryIndex;
        this.engineLock = engineLock;
    }
    
    public List<Tag> handle(TagCategory category) {
        if (category == null) {
            return List.of();
        }
        return engineLock.read(() -> tagRepository.findAllById(categoryIndex.get(category)));
    }
}
