package com.starscape.destinationtags.features.tags.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.starscape.destinationtags.common.exception.DecodeException;

import java.util.Locale;
import java.util.Optional;

public enum TagCategory {
    SCENERY("scenery"),
    ACTIVITY("activity"),
    CULTURE("culture"),
    CLIMATE("climate"),
    CROWD("crowd"),
    BUDGET("budget"),
    TRANSPORT("transport"),
    FACILITY("facility");
    
    private final String code;
    
    TagCategory(String code) {
        this.code = code;
    }
    
    @JsonValue
    public String getCode() {
        return code;
    }
    
    @JsonCreator
    public static TagCategory fromCode(String value) {
        return find(value)
                .orElseThrow(() -> new DecodeException("category", value));
    }
    
    public static Optional<TagCategory> find(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (TagCategory category : values()) {
            if (category.code.equals(normalized)) {
                return Optional.of(category);
            }
        }
        return Optional.empty();
    }
}
