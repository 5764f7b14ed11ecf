package com.starscape.destinationtags.features.tags.domain;

import com.starscape.destinationtags.common.domain.Entity;
import com.starscape.destinationtags.common.domain.LanguageCode;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Multilingual, categorized label that destinations reference with a relevance score.
 * The first synonym of each language is the canonical display name in that language.
 * Instances are immutable; re-adding a tag with the same id replaces it in the registry.
 */
public class Tag extends Entity<String> {
    
    public static final double DEFAULT_WEIGHT = 1.0;
    
    private final TagCategory category;
    private final Map<LanguageCode, List<String>> synonyms;
    private final Map<LanguageCode, String> description;
    private final double weight;
    private final String parentId;
    
    public Tag(String id, TagCategory category, Map<LanguageCode, List<String>> synonyms) {
        this(id, category, synonyms, Map.of(), DEFAULT_WEIGHT, null);
    }
    
    public Tag(
            String id,
            TagCategory category,
            Map<LanguageCode, List<String>> synonyms,
            Map<LanguageCode, String> description,
            double weight,
            String parentId) {
        super(id);
        validateInput(id, category, synonyms, weight);
        
        this.category = category;
        this.synonyms = copySynonyms(synonyms);
        this.description = description == null || description.isEmpty()
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new EnumMap<>(description));
        this.weight = weight;
        this.parentId = parentId;
    }
    
    private void validateInput(
            String id,
            TagCategory category,
            Map<LanguageCode, List<String>> synonyms,
            double weight) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Tag ID cannot be blank");
        }
        if (category == null) {
            throw new IllegalArgumentException("Tag category is required");
        }
        if (Double.isNaN(weight) || weight < 0) {
            throw new IllegalArgumentException("Tag weight must be non-negative: " + weight);
        }
        if (synonyms != null) {
            synonyms.forEach((language, names) -> {
                if (names == null || names.isEmpty()) {
                    throw new IllegalArgumentException(
                        "Synonym list for language " + language.getCode() + " cannot be empty");
                }
                if (names.stream().anyMatch(name -> name == null)) {
                    throw new IllegalArgumentException(
                        "Synonym list for language " + language.getCode() + " contains null");
                }
            });
        }
    }
    
    private static Map<LanguageCode, List<String>> copySynonyms(Map<LanguageCode, List<String>> source) {
        if (source == null || source.isEmpty()) {
            return Collections.emptyMap();
        }
        Map<LanguageCode, List<String>> copy = new EnumMap<>(LanguageCode.class);
        source.forEach((language, names) -> copy.put(language, List.copyOf(names)));
        return Collections.unmodifiableMap(copy);
    }
    
    /**
     * Display name in the given language, falling back to the fallback language and then to the id.
     */
    public String name(LanguageCode language, LanguageCode fallback) {
        List<String> names = synonyms.get(language);
        if (names != null) {
            return names.get(0);
        }
        names = synonyms.get(fallback);
        if (names != null) {
            return names.get(0);
        }
        return getId();
    }
    
    /**
     * All synonyms in the given language, without fallback.
     */
    public List<String> synonyms(LanguageCode language) {
        return synonyms.getOrDefault(language, List.of());
    }
    
    public Optional<String> description(LanguageCode language) {
        return Optional.ofNullable(description.get(language));
    }
    
    // Getters
    public TagCategory getCategory() { return category; }
    public Map<LanguageCode, List<String>> getSynonyms() { return synonyms; }
    public Map<LanguageCode, String> getDescription() { return description; }
    public double getWeight() { return weight; }
    public Optional<String> getParentId() { return Optional.ofNullable(parentId); }
    
    @Override
    public String toString() {
        return "Tag{id=" + getId() + ", category=" + category.getCode() + ", weight=" + weight + "}";
    }
}
