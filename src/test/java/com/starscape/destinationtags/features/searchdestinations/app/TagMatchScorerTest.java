package com.starscape.destinationtags.features.searchdestinations.app;

import com.starscape.destinationtags.TestEngine;
import com.starscape.destinationtags.common.domain.LanguageCode;
import com.starscape.destinationtags.features.destinations.domain.Destination;
import com.starscape.destinationtags.features.searchdestinations.domain.MatchScore;
import com.starscape.destinationtags.features.tags.domain.TagCategory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TagMatchScorerTest {
    
    private static final double EPSILON = 1e-4;
    
    private TestEngine engine;
    private TagMatchScorer scorer;
    private Destination hangzhou;
    
    @BeforeEach
    void setUp() {
        engine = new TestEngine();
        engine.addTag.handle(TestEngine.historical());
        engine.addTag.handle(TestEngine.mountain());
        engine.addTag.handle(TestEngine.beach());
        scorer = engine.scorer;
        
        hangzhou = Destination.builder("geoname:1808926")
                .name(LanguageCode.EN, "Hangzhou")
                .tag("historical", 0.9)
                .tag("mountain", 0.7)
                .build();
    }
    
    @Test
    void emptyQueryOrTaglessDestinationShouldScoreZero() {
        Destination tagless = Destination.builder("empty").build();
        
        assertEquals(0.0, scorer.score(hangzhou, List.of(), LanguageCode.EN).score());
        assertEquals(0.0, scorer.score(tagless, List.of("beach"), LanguageCode.EN).score());
    }
    
    @Test
    void partialMatchesShouldCombineCoverageAndAverage() {
        MatchScore match = scorer.score(hangzhou, List.of("histor", "mount", "family"), LanguageCode.EN);
        
        assertEquals(2, match.matchedTerms());
        assertEquals(3, match.totalTerms());
        assertEquals(2.0 / 3, match.coverage(), EPSILON);
        assertEquals((0.9 + 0.7) / 3, match.average(), EPSILON);
        assertEquals(0.5867, match.score(), EPSILON);
    }
    
    @Test
    void exactMatchesShouldCountDouble() {
        MatchScore match = scorer.score(hangzhou, List.of("historical", "mountain", "family"), LanguageCode.EN);
        
        assertEquals(2, match.matchedTerms());
        assertEquals((1.8 + 1.4) / 3, match.average(), EPSILON);
        assertEquals(0.4 * 2 / 3 + 0.6 * 3.2 / 3, match.score(), EPSILON);
    }
    
    @Test
    void exactMatchShouldBeatSubstringMatch() {
        Destination seaside = Destination.builder("d").tag("beach", 0.5).build();
        
        double exact = scorer.score(seaside, List.of("beach"), LanguageCode.EN).score();
        double partial = scorer.score(seaside, List.of("bea"), LanguageCode.EN).score();
        
        assertTrue(exact > partial);
        assertEquals(0.4 + 0.6 * 1.0, exact, EPSILON);
        assertEquals(0.4 + 0.6 * 0.5, partial, EPSILON);
    }
    
    @Test
    void scoreShouldNotBeClampedToOne() {
        Destination perfect = Destination.builder("d").tag("beach", 1.0).build();
        
        double score = scorer.score(perfect, List.of("Beach"), LanguageCode.EN).score();
        
        assertEquals(1.6, score, EPSILON);
    }
    
    @Test
    void firstMatchingSynonymShouldDecideForEachTag() {
        engine.addTag.handle(TestEngine.englishTag("sea", TagCategory.SCENERY, "seaside view", "sea"));
        Destination destination = Destination.builder("d").tag("sea", 0.5).build();
        
        MatchScore match = scorer.score(destination, List.of("sea"), LanguageCode.EN);
        
        // "seaside view" matches first as a substring, so the exact "sea" is never reached
        assertEquals(0.5, match.average(), EPSILON);
    }
    
    @Test
    void bestTagShouldWinAcrossTags() {
        engine.addTag.handle(TestEngine.englishTag("old_town", TagCategory.CULTURE, "ancient town"));
        Destination destination = Destination.builder("d")
                .tag("old_town", 0.9)
                .tag("historical", 0.3)
                .build();
        
        MatchScore match = scorer.score(destination, List.of("ancient"), LanguageCode.EN);
        
        // old_town: substring 0.9, historical: exact 0.6
        assertEquals(0.9, match.average(), EPSILON);
    }
    
    @Test
    void unknownTagIdsAndMissingLanguagesShouldContributeNothing() {
        Destination destination = Destination.builder("d")
                .tag("culture", 0.9)
                .tag("beach", 0.8)
                .build();
        
        assertEquals(0.0, scorer.score(destination, List.of("culture"), LanguageCode.EN).score());
        // beach has no Korean synonyms and there is no fallback
        assertEquals(0.0, scorer.score(destination, List.of("beach"), LanguageCode.KO).score());
    }
    
    @Test
    void queryMatchingShouldIgnoreCase() {
        MatchScore match = scorer.score(hangzhou, List.of("HERITAGE"), LanguageCode.EN);
        
        assertEquals(0.4 + 0.6 * 1.8, match.score(), EPSILON);
    }
}
