package com.starscape.destinationtags.features.tags.domain;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Repository interface for the tag registry, the single source of truth for tag content.
 */
public interface TagRepository {
    Tag save(Tag tag);
    Optional<Tag> findById(String tagId);
    List<Tag> findAllById(Collection<String> tagIds);
    List<Tag> findAll();
    long count();
    void deleteAll();
}
