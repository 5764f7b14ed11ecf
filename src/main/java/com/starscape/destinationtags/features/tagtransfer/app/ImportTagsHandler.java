package com.starscape.destinationtags.features.tagtransfer.app;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.starscape.destinationtags.common.concurrency.EngineLock;
import com.starscape.destinationtags.common.config.EngineProperties;
import com.starscape.destinationtags.common.exception.DecodeException;
import com.starscape.destinationtags.common.exception.TagTransferException;
import com.starscape.destinationtags.features.tags.app.AddTagHandler;
import com.starscape.destinationtags.features.tags.app.ClearTagsHandler;
import com.starscape.destinationtags.features.tags.domain.Tag;
import com.starscape.destinationtags.features.tagtransfer.domain.ImportPolicy;
import com.starscape.destinationtags.features.tagtransfer.domain.ImportReport;
import com.starscape.destinationtags.features.tagtransfer.infra.TagRecordMapper;
import com.starscape.destinationtags.features.tagtransfer.infra.document.TagDocument;
import com.starscape.destinationtags.features.tagtransfer.infra.document.TagRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Handler for importing tags from a JSON file written by {@link ExportTagsHandler}.
 * 
 * Every decoded record goes through {@link AddTagHandler}, so an imported id replaces the existing tag.
 * With {@code replace} the registry is cleared first. A record is only added once it is fully decoded.
 * The configured {@link ImportPolicy} decides whether a bad record aborts the import or is skipped.
 */
@Service
public class ImportTagsHandler {
    
    private static final Logger log = LoggerFactory.getLogger(ImportTagsHandler.class);
    
    private final AddTagHandler addTagHandler;
    private final ClearTagsHandler clearTagsHandler;
    private final TagRecordMapper mapper;
    private final ObjectMapper objectMapper;
    private final EngineLock engineLock;
    private final EngineProperties properties;
    
    public ImportTagsHandler(
            AddTagHandler addTagHandler,
            ClearTagsHandler clearTagsHandler,
            TagRecordMapper mapper,
            ObjectMapper objectMapper,
            EngineLock engineLock,
            EngineProperties properties) {
        this.addTagHandler = addTagHandler;
        this.clearTagsHandler = clearTagsHandler;
        this.mapper = mapper;
        this.objectMapper = objectMapper;
        this.engineLock = engineLock;
        this.properties = properties;
    }
    
    public ImportReport handle(Path path) {
        return handle(path, false);
    }
    
    public ImportReport handle(Path path, boolean replace) {
        TagDocument document = read(path);
        ImportReport report = importDocument(document, replace, properties.getImportPolicy());
        log.info("Imported tags: path={}, imported={}, failed={}", path, report.imported(), report.failures().size());
        return report;
    }
    
    /**
     * Import an already parsed document.
     * @throws DecodeException under {@link ImportPolicy#STRICT} when any record cannot be decoded
     */
    public ImportReport importDocument(TagDocument document, boolean replace, ImportPolicy policy) {
        List<Tag> decoded = new ArrayList<>();
        List<ImportReport.RecordFailure> failures = new ArrayList<>();
        
        for (Map.Entry<String, TagRecord> entry : document.tags().entrySet()) {
            try {
                decoded.add(mapper.toTag(entry.getKey(), entry.getValue()));
            } catch (DecodeException e) {
                if (policy == ImportPolicy.STRICT) {
                    log.error("Aborting tag import: record={}, field={}, value={}",
                        entry.getKey(), e.getField(), e.getValue());
                    throw e;
                }
                log.warn("Skipping tag record: record={}, reason={}", entry.getKey(), e.getMessage());
                failures.add(new ImportReport.RecordFailure(entry.getKey(), e.getField(), e.getValue(), e.getMessage()));
            }
        }
        
        engineLock.write(() -> {
            if (replace) {
                clearTagsHandler.handle();
            }
            decoded.forEach(addTagHandler::handle);
        });
        
        return new ImportReport(decoded.size(), failures);
    }
    
    private TagDocument read(Path path) {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            TagDocument document = objectMapper.readValue(reader, TagDocument.class);
            return document != null ? document : new TagDocument(null);
        } catch (JsonProcessingException e) {
            throw new DecodeException("document", path.toString(),
                "Malformed tag document " + path + ": " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            log.error("Failed to read tag document: path={}", path, e);
            throw new TagTransferException("import", path, e);
        }
    }
}
