package com.starscape.destinationtags.features.tags.api.dto;

import com.starscape.destinationtags.common.domain.LanguageCode;
import com.starscape.destinationtags.features.tags.domain.Tag;

import java.util.List;

/**
 * Tag as presented to hosts, resolved for one language.
 */
public record TagResponse(
    String id,
    String name,
    String category,
    String description,
    List<String> synonyms,
    double weight
) {
    
    public static TagResponse from(Tag tag, LanguageCode language, LanguageCode fallback) {
        return new TagResponse(
            tag.getId(),
            tag.name(language, fallback),
            tag.getCategory().getCode(),
            tag.description(language).orElse(null),
            tag.synonyms(language),
            tag.getWeight()
        );
    }
}
