package com.starscape.destinationtags.features.tags.domain;

import java.util.Set;

/**
 * Secondary index from category to tag ids.
 */
public interface TagCategoryIndex {
    void add(Tag tag);
    void remove(Tag tag);
    Set<String> get(TagCategory category);
    void clear();
}
