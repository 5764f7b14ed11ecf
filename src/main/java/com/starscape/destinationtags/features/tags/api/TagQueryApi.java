package com.starscape.destinationtags.features.tags.api;

import com.starscape.destinationtags.common.config.EngineProperties;
import com.starscape.destinationtags.common.domain.LanguageCode;
import com.starscape.destinationtags.features.tags.api.dto.TagResponse;
import com.starscape.destinationtags.features.tags.app.GetTagsByCategoryHandler;
import com.starscape.destinationtags.features.tags.app.SearchTagsByPrefixHandler;
import com.starscape.destinationtags.features.tags.domain.TagCategory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Read-only entry points over the tag registry for hosts that speak in string codes.
 * Unknown language or category codes are treated as "not indexed" and yield empty results.
 */
@Component
public class TagQueryApi {
    
    private static final Logger log = LoggerFactory.getLogger(TagQueryApi.class);
    
    private final SearchTagsByPrefixHandler searchHandler;
    private final GetTagsByCategoryHandler categoryHandler;
    private final EngineProperties properties;
    
    public TagQueryApi(
            SearchTagsByPrefixHandler searchHandler,
            GetTagsByCategoryHandler categoryHandler,
            EngineProperties properties) {
        this.searchHandler = searchHandler;
        this.categoryHandler = categoryHandler;
        this.properties = properties;
    }
    
    /**
     * Search tags whose synonyms start with the prefix, e.g. "bea" finds "beach".
     */
    public List<TagResponse> searchByPrefix(String prefix, String language, Integer limit) {
        Optional<LanguageCode> lang = LanguageCode.find(language);
        if (lang.isEmpty()) {
            log.debug("Prefix search in unknown language: {}", language);
            return List.of();
        }
        
        int effectiveLimit = limit != null ? limit : properties.getPrefixSearchLimit();
        return searchHandler.handle(prefix, lang.get(), effectiveLimit).stream()
                .map(tag -> TagResponse.from(tag, lang.get(), properties.getDefaultLanguage()))
                .toList();
    }
    
    public List<TagResponse> byCategory(String category, String language) {
        Optional<TagCategory> tagCategory = TagCategory.find(category);
        Optional<LanguageCode> lang = LanguageCode.find(language);
        if (tagCategory.isEmpty() || lang.isEmpty()) {
            log.debug("Category lookup with unknown code: category={}, language={}", category, language);
            return List.of();
        }
        
        return categoryHandler.handle(tagCategory.get()).stream()
                .map(tag -> TagResponse.from(tag, lang.get(), properties.getDefaultLanguage()))
                .toList();
    }
    
    public List<String> categories() {
        return Arrays.stream(TagCategory.values())
                .map(TagCategory::getCode)
                .toList();
    }
}
