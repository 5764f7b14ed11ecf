package com.starscape.destinationtags.features.destinations.domain;

import com.starscape.destinationtags.common.domain.LanguageCode;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DestinationTest {
    
    @Test
    void nameShouldFallBackToDefaultLanguageThenId() {
        Destination hangzhou = Destination.builder("geoname:1808926")
                .name(LanguageCode.EN, "Hangzhou")
                .name(LanguageCode.ZH, "杭州")
                .build();
        Destination unnamed = Destination.builder("test:1").build();
        
        assertEquals("杭州", hangzhou.name(LanguageCode.ZH, LanguageCode.EN));
        assertEquals("Hangzhou", hangzhou.name(LanguageCode.FR, LanguageCode.EN));
        assertEquals("test:1", unnamed.name(LanguageCode.FR, LanguageCode.EN));
    }
    
    @Test
    void shouldKeepTagOrderAndAllowUnvalidatedRelevance() {
        Destination destination = Destination.builder("d")
                .tag("historical", 0.9)
                .tag("mountain", 1.5)
                .build();
        
        assertEquals(List.of("historical", "mountain"), List.copyOf(destination.getTags().keySet()));
        assertEquals(1.5, destination.getTags().get("mountain").doubleValue());
    }
    
    @Test
    void shouldRejectBlankId() {
        assertThrows(IllegalArgumentException.class, () -> Destination.builder(" ").build());
    }
    
    @Test
    void coordinatesShouldBeRangeChecked() {
        assertThrows(IllegalArgumentException.class, () -> new Coordinates(91, 0));
        assertThrows(IllegalArgumentException.class, () -> new Coordinates(0, -181));
        assertEquals(30.25, new Coordinates(30.25, 120.16).lat());
    }
}
