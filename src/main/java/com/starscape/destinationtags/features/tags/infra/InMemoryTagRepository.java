package com.starscape.destinationtags.features.tags.infra;

import com.starscape.destinationtags.features.tags.domain.Tag;
import com.starscape.destinationtags.features.tags.domain.TagRepository;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * In-memory tag registry. Keeps first-insertion order, so exports are stable.
 * Callers hold the engine lock.
 */
@Repository
public class InMemoryTagRepository implements TagRepository {
    
    private final Map<String, Tag> tags = new LinkedHashMap<>();
    
    @Override
    public Tag save(Tag tag) {
        tags.put(tag.getId(), tag);
        return tag;
    }
    
    @Override
    public Optional<Tag> findById(String tagId) {
        return Optional.ofNullable(tags.get(tagId));
    }
    
    @Override
    public List<Tag> findAllById(Collection<String> tagIds) {
        List<Tag> result = new ArrayList<>(tagIds.size());
        for (String tagId : tagIds) {
            Tag tag = tags.get(tagId);
            if (tag != null) {
                result.add(tag);
            }
        }
        return result;
    }
    
    @Override
    public List<Tag> findAll() {
        return List.copyOf(tags.values());
    }
    
    @Override
    public long count() {
        return tags.size();
    }
    
    @Override
    public void deleteAll() {
        tags.clear();
    }
}
