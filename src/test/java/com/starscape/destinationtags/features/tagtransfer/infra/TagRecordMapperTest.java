package com.starscape.destinationtags.features.tagtransfer.infra;

import com.starscape.destinationtags.TestEngine;
import com.starscape.destinationtags.common.domain.LanguageCode;
import com.starscape.destinationtags.common.exception.DecodeException;
import com.starscape.destinationtags.features.tags.domain.Tag;
import com.starscape.destinationtags.features.tags.domain.TagCategory;
import com.starscape.destinationtags.features.tagtransfer.infra.document.TagRecord;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class TagRecordMapperTest {
    
    private final TagRecordMapper mapper = new TagRecordMapper();
    
    @Test
    void toRecordShouldUseWireCodes() {
        TagRecord record = mapper.toRecord(TestEngine.beach());
        
        assertEquals("beach", record.id());
        assertEquals("scenery", record.category());
        assertThat(record.synonyms()).containsOnlyKeys("zh", "en", "ja");
        assertEquals(List.of("beach", "seaside", "coast"), record.synonyms().get("en"));
        assertEquals("Sandy or pebbly shore by the ocean or sea", record.description().get("en"));
        assertEquals(1.0, record.weight().doubleValue());
        assertNull(record.parentId());
    }
    
    @Test
    void toTagShouldDecodeCodesCaseInsensitively() {
        TagRecord record = new TagRecord("lake", "SCENERY", Map.of("EN", List.of("lake")),
            Map.of("en", "Inland body of water"), 0.5, "water");
        
        Tag tag = mapper.toTag("lake", record);
        
        assertEquals(TagCategory.SCENERY, tag.getCategory());
        assertEquals(List.of("lake"), tag.synonyms(LanguageCode.EN));
        assertEquals("Inland body of water", tag.description(LanguageCode.EN).orElseThrow());
        assertEquals(0.5, tag.getWeight());
        assertEquals("water", tag.getParentId().orElseThrow());
    }
    
    @Test
    void toTagShouldDefaultIdAndWeight() {
        TagRecord record = new TagRecord(null, "activity", null, null, null, null);
        
        Tag tag = mapper.toTag("hiking", record);
        
        assertEquals("hiking", tag.getId());
        assertEquals(Tag.DEFAULT_WEIGHT, tag.getWeight());
        assertTrue(tag.getSynonyms().isEmpty());
    }
    
    @Test
    void toTagShouldNameTheOffendingField() {
        DecodeException missingCategory = assertThrows(DecodeException.class,
            () -> mapper.toTag("a", new TagRecord("a", null, null, null, null, null)));
        DecodeException unknownLanguage = assertThrows(DecodeException.class,
            () -> mapper.toTag("b", new TagRecord("b", "culture", Map.of("xx", List.of("x")), null, null, null)));
        DecodeException emptySynonyms = assertThrows(DecodeException.class,
            () -> mapper.toTag("c", new TagRecord("c", "culture", Map.of("en", List.of()), null, null, null)));
        DecodeException negativeWeight = assertThrows(DecodeException.class,
            () -> mapper.toTag("d", new TagRecord("d", "culture", null, null, -1.0, null)));
        DecodeException nullSynonym = assertThrows(DecodeException.class,
            () -> mapper.toTag("e", new TagRecord("e", "culture",
                Map.of("en", Arrays.asList("x", null)), null, null, null)));
        
        assertEquals("category", missingCategory.getField());
        assertEquals("language", unknownLanguage.getField());
        assertEquals("xx", unknownLanguage.getValue());
        assertEquals("synonyms", emptySynonyms.getField());
        assertEquals("record", negativeWeight.getField());
        assertThat(negativeWeight.getMessage()).startsWith("Tag d:");
        assertEquals("record", nullSynonym.getField());
    }
    
    @Test
    void nullRecordShouldFail() {
        DecodeException exception = assertThrows(DecodeException.class, () -> mapper.toTag("x", null));
        
        assertEquals("record", exception.getField());
    }
}
