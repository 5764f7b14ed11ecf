package com.starscape.destinationtags.features.tagtransfer.infra.document;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Serialized tag. Category and language codes stay raw strings so that unknown codes can be
 * reported per record instead of failing the whole document.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TagRecord(
    @JsonProperty("id") String id,
    @JsonProperty("category") String category,
    @JsonProperty("synonyms") Map<String, List<String>> synonyms,
    @JsonProperty("description") Map<String, String> description,
    @JsonProperty("weight") Double weight,
    @JsonProperty("parent_id") String parentId
) {}
