package com.starscape.destinationtags.features.tags.infra;

import com.starscape.destinationtags.features.tags.domain.Tag;
import com.starscape.destinationtags.features.tags.domain.TagCategory;
import com.starscape.destinationtags.features.tags.domain.TagCategoryIndex;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * EnumMap-backed category index. Id sets keep insertion order.
 */
@Component
public class InMemoryTagCategoryIndex implements TagCategoryIndex {
    
    private final Map<TagCategory, Set<String>> index = new EnumMap<>(TagCategory.class);
    
    @Override
    public void add(Tag tag) {
        index.computeIfAbsent(tag.getCategory(), key -> new LinkedHashSet<>()).add(tag.getId());
    }
    
    @Override
    public void remove(Tag tag) {
        Set<String> tagIds = index.get(tag.getCategory());
        if (tagIds == null) {
            return;
        }
        tagIds.remove(tag.getId());
        if (tagIds.isEmpty()) {
            index.remove(tag.getCategory());
        }
    }
    
    @Override
    public Set<String> get(TagCategory category) {
        Set<String> tagIds = index.get(category);
        return tagIds == null ? Collections.emptySet() : Collections.unmodifiableSet(tagIds);
    }
    
    @Override
    public void clear() {
        index.clear();
    }
}
