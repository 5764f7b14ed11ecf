package com.starscape.destinationtags.features.tagtransfer.infra;

import com.starscape.destinationtags.common.domain.LanguageCode;
import com.starscape.destinationtags.common.exception.DecodeException;
import com.starscape.destinationtags.features.tags.domain.Tag;
import com.starscape.destinationtags.features.tags.domain.TagCategory;
import com.starscape.destinationtags.features.tagtransfer.infra.document.TagRecord;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Converts between {@link Tag} and its serialized form.
 */
@Component
public class TagRecordMapper {
    
    public TagRecord toRecord(Tag tag) {
        Map<String, List<String>> synonyms = new LinkedHashMap<>();
        tag.getSynonyms().forEach((language, names) -> synonyms.put(language.getCode(), names));
        
        Map<String, String> description = new LinkedHashMap<>();
        tag.getDescription().forEach((language, text) -> description.put(language.getCode(), text));
        
        return new TagRecord(
            tag.getId(),
            tag.getCategory().getCode(),
            synonyms,
            description,
            tag.getWeight(),
            tag.getParentId().orElse(null)
        );
    }
    
    /**
     * Decode one record. The record's id wins over its key; the key is used when the id is absent.
     * @throws DecodeException naming the record and the offending field
     */
    public Tag toTag(String recordKey, TagRecord record) {
        if (record == null) {
            throw new DecodeException("record", recordKey, "Tag " + recordKey + ": record is empty");
        }
        String id = record.id() == null || record.id().isBlank() ? recordKey : record.id();
        
        if (record.category() == null) {
            throw new DecodeException("category", null, "Tag " + recordKey + ": category is required");
        }
        TagCategory category = TagCategory.find(record.category())
                .orElseThrow(() -> new DecodeException("category", record.category(),
                    "Tag " + recordKey + ": unknown category code: " + record.category()));
        
        Map<LanguageCode, List<String>> synonyms = new EnumMap<>(LanguageCode.class);
        if (record.synonyms() != null) {
            for (Map.Entry<String, List<String>> entry : record.synonyms().entrySet()) {
                LanguageCode language = decodeLanguage(recordKey, entry.getKey());
                if (entry.getValue() == null || entry.getValue().isEmpty()) {
                    throw new DecodeException("synonyms", entry.getKey(),
                        "Tag " + recordKey + ": synonym list for " + entry.getKey() + " is empty");
                }
                synonyms.put(language, entry.getValue());
            }
        }
        
        Map<LanguageCode, String> description = new EnumMap<>(LanguageCode.class);
        if (record.description() != null) {
            for (Map.Entry<String, String> entry : record.description().entrySet()) {
                description.put(decodeLanguage(recordKey, entry.getKey()), entry.getValue());
            }
        }
        
        double weight = Optional.ofNullable(record.weight()).orElse(Tag.DEFAULT_WEIGHT);
        
        try {
            return new Tag(id, category, synonyms, description, weight, record.parentId());
        } catch (IllegalArgumentException e) {
            throw new DecodeException("record", recordKey, "Tag " + recordKey + ": " + e.getMessage(), e);
        }
    }
    
    private LanguageCode decodeLanguage(String recordKey, String code) {
        return LanguageCode.find(code)
                .orElseThrow(() -> new DecodeException("language", code,
                    "Tag " + recordKey + ": unknown language code: " + code));
    }
}
