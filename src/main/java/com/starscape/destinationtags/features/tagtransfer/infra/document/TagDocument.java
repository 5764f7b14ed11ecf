package com.starscape.destinationtags.features.tagtransfer.infra.document;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Top-level structure of an exported tag file: records keyed by tag id.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TagDocument(
    @JsonProperty("tags") Map<String, TagRecord> tags
) {
    
    public TagDocument {
        tags = tags == null ? new LinkedHashMap<>() : tags;
    }
}
