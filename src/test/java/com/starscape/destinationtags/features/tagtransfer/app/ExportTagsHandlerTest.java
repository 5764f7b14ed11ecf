package com.starscape.destinationtags.features.tagtransfer.app;

import com.fasterxml.jackson.databind.JsonNode;
import com.starscape.destinationtags.TestEngine;
import com.starscape.destinationtags.common.exception.TagTransferException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class ExportTagsHandlerTest {
    
    @TempDir
    Path tempDir;
    
    private TestEngine engine;
    
    @BeforeEach
    void setUp() {
        engine = new TestEngine();
        engine.addTag.handle(TestEngine.beach());
        engine.addTag.handle(TestEngine.historical());
    }
    
    @Test
    void shouldWriteTagsKeyedByIdInRegistryOrder() throws Exception {
        Path file = tempDir.resolve("nested/dir/tags.json");
        
        engine.exportTags.handle(file);
        
        JsonNode root = engine.objectMapper.readTree(file.toFile());
        List<String> keys = new ArrayList<>();
        root.get("tags").fieldNames().forEachRemaining(keys::add);
        assertEquals(List.of("beach", "historical"), keys);
        
        JsonNode beach = root.get("tags").get("beach");
        assertEquals("scenery", beach.get("category").asText());
        assertEquals("海滩", beach.get("synonyms").get("zh").get(0).asText());
        assertEquals("beach", beach.get("synonyms").get("en").get(0).asText());
        assertEquals(1.0, beach.get("weight").asDouble());
        assertTrue(beach.get("parent_id").isNull());
    }
    
    @Test
    void shouldWriteReadableUtf8() throws Exception {
        Path file = tempDir.resolve("tags.json");
        
        engine.exportTags.handle(file);
        
        String content = Files.readString(file, StandardCharsets.UTF_8);
        assertThat(content).contains("历史古迹").contains(System.lineSeparator());
    }
    
    @Test
    void exportingTwiceShouldGiveIdenticalFiles() throws Exception {
        Path first = tempDir.resolve("first.json");
        Path second = tempDir.resolve("second.json");
        
        engine.exportTags.handle(first);
        engine.exportTags.handle(second);
        
        assertEquals(Files.readString(first), Files.readString(second));
    }
    
    @Test
    void emptyRegistryShouldExportEmptyDocument() throws Exception {
        engine.clearTags.handle();
        Path file = tempDir.resolve("empty.json");
        
        engine.exportTags.handle(file);
        
        assertEquals(0, engine.objectMapper.readTree(file.toFile()).get("tags").size());
    }
    
    @Test
    void unwritableTargetShouldRaiseTransferException() throws Exception {
        Path directory = Files.createDirectory(tempDir.resolve("taken"));
        
        TagTransferException exception = assertThrows(TagTransferException.class,
            () -> engine.exportTags.handle(directory));
        
        assertEquals("export", exception.getOperation());
        assertEquals(directory, exception.getPath());
    }
}
