package com.starscape.destinationtags.features.destinations.domain;

import com.starscape.destinationtags.common.domain.Entity;
import com.starscape.destinationtags.common.domain.LanguageCode;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Travel destination with per-language names and weighted tag references.
 * Tag relevance is expected in [0, 1] but not enforced; references to unknown tag ids are allowed
 * and ignored by matching.
 */
public class Destination extends Entity<String> {
    
    private final Map<LanguageCode, String> names;
    private final Coordinates coordinates;
    private final String countryCode;
    private final String administrativeLevel;
    private final Map<String, Double> tags;
    private final Map<String, Object> metadata;
    
    private Destination(Builder builder) {
        super(builder.id);
        if (builder.id == null || builder.id.isBlank()) {
            throw new IllegalArgumentException("Destination ID cannot be blank");
        }
        builder.tags.forEach((tagId, relevance) -> {
            if (tagId == null || tagId.isBlank()) {
                throw new IllegalArgumentException("Tag ID cannot be blank");
            }
            if (relevance == null) {
                throw new IllegalArgumentException("Relevance is required for tag " + tagId);
            }
        });

        this.names = builder.names.isEmpty()
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new EnumMap<>(builder.names));
        this.coordinates = builder.coordinates;
        this.countryCode = builder.countryCode;
        this.administrativeLevel = builder.administrativeLevel;
        this.tags = Collections.unmodifiableMap(new LinkedHashMap<>(builder.tags));
        this.metadata = Collections.unmodifiableMap(new LinkedHashMap<>(builder.metadata));
    }
    
    public static Builder builder(String id) {
        return new Builder(id);
    }
    
    /**
     * Display name in the given language, falling back to the fallback language and then to the id.
     */
    public String name(LanguageCode language, LanguageCode fallback) {
        String name = names.get(language);
        if (name == null || name.isEmpty()) {
            name = names.get(fallback);
        }
        return name == null || name.isEmpty() ? getId() : name;
    }
    
    // Getters
    public Map<LanguageCode, String> getNames() { return names; }
    public Optional<Coordinates> getCoordinates() { return Optional.ofNullable(coordinates); }
    public Optional<String> getCountryCode() { return Optional.ofNullable(countryCode); }
    public Optional<String> getAdministrativeLevel() { return Optional.ofNullable(administrativeLevel); }
    public Map<String, Double> getTags() { return tags; }
    public Map<String, Object> getMetadata() { return metadata; }
    
    @Override
    public String toString() {
        return "Destination{id=" + getId() + ", tags=" + tags + "}";
    }
    
    public static final class Builder {
        
        private final String id;
        private final Map<LanguageCode, String> names = new EnumMap<>(LanguageCode.class);
        private final Map<String, Double> tags = new LinkedHashMap<>();
        private final Map<String, Object> metadata = new LinkedHashMap<>();
        private Coordinates coordinates;
        private String countryCode;
        private String administrativeLevel;
        
        private Builder(String id) {
            this.id = id;
        }
        
        public Builder name(LanguageCode language, String name) {
            this.names.put(language, name);
            return this;
        }
        
        public Builder names(Map<LanguageCode, String> names) {
            this.names.putAll(names);
            return this;
        }
        
        public Builder coordinates(Coordinates coordinates) {
            this.coordinates = coordinates;
            return this;
        }
        
        public Builder countryCode(String countryCode) {
            this.countryCode = countryCode;
            return this;
        }
        
        public Builder administrativeLevel(String administrativeLevel) {
            this.administrativeLevel = administrativeLevel;
            return this;
        }
        
        public Builder tag(String tagId, double relevance) {
            this.tags.put(tagId, relevance);
            return this;
        }
        
        public Builder tags(Map<String, Double> tags) {
            this.tags.putAll(tags);
            return this;
        }
        
        public Builder metadata(Map<String, Object> metadata) {
            this.metadata.putAll(metadata);
            return this;
        }
        
        public Destination build() {
            return new Destination(this);
        }
    }
}
