package com.starscape.destinationtags.features.tags.app;

import com.starscape.destinationtags.common.concurrency.EngineLock;
import com.starscape.destinationtags.features.tags.domain.Tag;
import com.starscape.destinationtags.features.tags.domain.TagRepository;
import org.springframework.stereotype.Service;

import java.util.Optional;

@Service
public class GetTagHandler {
    
    private final TagRepository tagRepository;
    private final EngineLock engineLock;
    
    public GetTagHandler(TagRepository tagRepository, EngineLock engineLock) {
        this.tagRepository = tagRepository;
        this.engineLock = engineLock;
    }
    
    public Optional<Tag> handle(String tagId) {
        if (tagId == null) {
            return Optional.empty();
        }
        return engineLock.read(() -> tagRepository.findById(tagId));
    }
}
