package com.starscape.destinationtags.features.tagtransfer.app;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.starscape.destinationtags.common.concurrency.EngineLock;
import com.starscape.destinationtags.common.exception.TagTransferException;
import com.starscape.destinationtags.features.tags.domain.Tag;
import com.starscape.destinationtags.features.tags.domain.TagRepository;
import com.starscape.destinationtags.features.tagtransfer.infra.TagRecordMapper;
import com.starscape.destinationtags.features.tagtransfer.infra.document.TagDocument;
import com.starscape.destinationtags.features.tagtransfer.infra.document.TagRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Handler for exporting the tag registry to a pretty-printed UTF-8 JSON file.
 * Tags are written in registry order, so exporting an unchanged registry twice gives identical files.
 */
@Service
public class ExportTagsHandler {
    
    private static final Logger log = LoggerFactory.getLogger(ExportTagsHandler.class);
    
    private final TagRepository tagRepository;
    private final TagRecordMapper mapper;
    private final ObjectMapper objectMapper;
    private final EngineLock engineLock;
    
    public ExportTagsHandler(
            TagRepository tagRepository,
            TagRecordMapper mapper,
            ObjectMapper objectMapper,
            EngineLock engineLock) {
        this.tagRepository = tagRepository;
        this.mapper = mapper;
        this.objectMapper = objectMapper;
        this.engineLock = engineLock;
    }
    
    public TagDocument snapshot() {
        return engineLock.read(() -> {
            Map<String, TagRecord> records = new LinkedHashMap<>();
            for (Tag tag : tagRepository.findAll()) {
                records.put(tag.getId(), mapper.toRecord(tag));
            }
            return new TagDocument(records);
        });
    }
    
    public void handle(Path path) {
        TagDocument document = snapshot();
        
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
                objectMapper.writerWithDefaultPrettyPrinter().writeValue(writer, document);
            }
        } catch (IOException e) {
            log.error("Failed to export tags: path={}", path, e);
            throw new TagTransferException("export", path, e);
        }
        
        log.info("Exported tags: path={}, count={}", path, document.tags().size());
    }
}
