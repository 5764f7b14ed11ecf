package com.starscape.destinationtags.features.searchdestinations.api;

import com.starscape.destinationtags.TestEngine;
import com.starscape.destinationtags.common.domain.LanguageCode;
import com.starscape.destinationtags.features.destinations.domain.Coordinates;
import com.starscape.destinationtags.features.destinations.domain.Destination;
import com.starscape.destinationtags.features.searchdestinations.api.dto.DestinationMatchResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class DestinationSearchApiTest {
    
    private TestEngine engine;
    private DestinationSearchApi api;
    
    @BeforeEach
    void setUp() {
        engine = new TestEngine();
        engine.addTag.handle(TestEngine.historical());
        engine.addTag.handle(TestEngine.mountain());
        engine.addTag.handle(TestEngine.beach());
        
        engine.addDestination.handle(Destination.builder("geoname:1808926")
                .name(LanguageCode.EN, "Hangzhou")
                .name(LanguageCode.ZH, "杭州")
                .coordinates(new Coordinates(30.29, 120.16))
                .countryCode("CN")
                .tag("historical", 0.9)
                .tag("mountain", 0.7)
                .metadata(Map.of("population", 12_200_000))
                .build());
        engine.addDestination.handle(Destination.builder("geoname:1850147")
                .name(LanguageCode.JA, "東京")
                .tag("beach", 0.2)
                .build());
        
        api = new DestinationSearchApi(engine.searchDestinations, engine.properties);
    }
    
    @Test
    void shouldRoundScoreAndCopyDestinationFields() {
        List<DestinationMatchResponse> results = api.search(List.of("histor", "mount", "family"), "en", null, null);
        
        assertEquals(1, results.size());
        DestinationMatchResponse hit = results.get(0);
        assertEquals("geoname:1808926", hit.id());
        assertEquals("Hangzhou", hit.name());
        assertEquals(Map.of("en", "Hangzhou", "zh", "杭州"), hit.names());
        assertEquals(30.29, hit.coordinates().lat());
        assertEquals("CN", hit.countryCode());
        assertNull(hit.administrativeLevel());
        assertEquals(Map.of("historical", 0.9, "mountain", 0.7), hit.matchedTags());
        assertEquals(0.587, hit.matchScore());
        assertEquals(12_200_000, hit.metadata().get("population"));
    }
    
    @Test
    void nameShouldFallBackToDefaultLanguageThenId() {
        List<DestinationMatchResponse> zh = api.search(List.of("古迹"), "zh", null, null);
        List<DestinationMatchResponse> ja = api.search(List.of("ビーチ"), "ja", 0.0, null);
        
        assertEquals("杭州", zh.get(0).name());
        assertEquals("東京", ja.get(0).name());
        
        engine.properties.setDefaultLanguage(LanguageCode.JA);
        List<DestinationMatchResponse> en = api.search(List.of("beach"), "en", 0.0, null);
        assertEquals("東京", en.get(0).name());
    }
    
    @Test
    void explicitThresholdAndLimitShouldOverrideDefaults() {
        // tokyo scores 0.4 + 0.6 * 0.4 = 0.64 for an exact "beach"
        assertThat(api.search(List.of("beach"), "en", null, null))
                .extracting(DestinationMatchResponse::id)
                .containsExactly("geoname:1850147");
        assertTrue(api.search(List.of("beach"), "en", 0.7, null).isEmpty());
        
        engine.properties.setDestinationSearchLimit(1);
        assertEquals(1, api.search(List.of("a"), "en", 0.0, null).size());
        assertEquals(2, api.search(List.of("a"), "en", 0.0, 5).size());
    }
    
    @Test
    void unknownLanguageShouldYieldNoResults() {
        assertTrue(api.search(List.of("historical"), "xx", 0.0, null).isEmpty());
        assertTrue(api.search(List.of("historical"), null, 0.0, null).isEmpty());
    }
    
    @Test
    void emptyTermListShouldMatchNothingAboveThreshold() {
        assertTrue(api.search(List.of(), "en", null, null).isEmpty());
        assertTrue(api.search(null, "en", null, null).isEmpty());
    }
}
