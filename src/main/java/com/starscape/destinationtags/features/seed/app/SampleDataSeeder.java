package com.starscape.destinationtags.features.seed.app;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.starscape.destinationtags.common.config.SeedProperties;
import com.starscape.destinationtags.common.domain.LanguageCode;
import com.starscape.destinationtags.features.destinations.app.AddDestinationHandler;
import com.starscape.destinationtags.features.destinations.domain.Coordinates;
import com.starscape.destinationtags.features.destinations.domain.Destination;
import com.starscape.destinationtags.features.seed.infra.SampleDestinationRecord;
import com.starscape.destinationtags.features.tagtransfer.app.ImportTagsHandler;
import com.starscape.destinationtags.features.tagtransfer.domain.ImportPolicy;
import com.starscape.destinationtags.features.tagtransfer.domain.ImportReport;
import com.starscape.destinationtags.features.tagtransfer.infra.document.TagDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.annotation.Order;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.Map;

/**
 * Loads the default tag library and the sample destinations at startup.
 * The tag resource uses the export format and is imported strictly: a broken seed file fails startup.
 * 
 * Only enabled when app.seed.enabled=true (the default).
 */
@Component
@Order(SampleDataSeeder.ORDER)
@ConditionalOnProperty(name = "app.seed.enabled", havingValue = "true", matchIfMissing = true)
public class SampleDataSeeder implements ApplicationRunner {
    
    public static final int ORDER = 0;
    
    private static final Logger log = LoggerFactory.getLogger(SampleDataSeeder.class);
    
    private final ImportTagsHandler importTagsHandler;
    private final AddDestinationHandler addDestinationHandler;
    private final ObjectMapper objectMapper;
    private final ResourceLoader resourceLoader;
    private final SeedProperties properties;
    
    public SampleDataSeeder(
            ImportTagsHandler importTagsHandler,
            AddDestinationHandler addDestinationHandler,
            ObjectMapper objectMapper,
            ResourceLoader resourceLoader,
            SeedProperties properties) {
        this.importTagsHandler = importTagsHandler;
        this.addDestinationHandler = addDestinationHandler;
        this.objectMapper = objectMapper;
        this.resourceLoader = resourceLoader;
        this.properties = properties;
    }
    
    @Override
    public void run(ApplicationArguments args) {
        seed();
    }
    
    public void seed() {
        TagDocument tags = readResource(properties.getTagsResource(), new TypeReference<TagDocument>() {});
        ImportReport report = importTagsHandler.importDocument(tags, false, ImportPolicy.STRICT);
        log.info("Loaded default tags: count={}", report.imported());
        
        List<SampleDestinationRecord> destinations = readResource(
            properties.getDestinationsResource(), new TypeReference<List<SampleDestinationRecord>>() {});
        destinations.stream()
                .map(this::toDestination)
                .forEach(addDestinationHandler::handle);
        log.info("Loaded sample destinations: count={}", destinations.size());
    }
    
    private Destination toDestination(SampleDestinationRecord record) {
        Destination.Builder builder = Destination.builder(record.id());
        
        if (record.names() != null) {
            // Seed data is curated, so an unknown language code is a broken resource
            record.names().forEach((code, name) -> builder.name(LanguageCode.fromCode(code), name));
        }
        
        Map<String, Double> coordinates = record.coordinates();
        if (coordinates != null && coordinates.get("lat") != null && coordinates.get("lng") != null) {
            builder.coordinates(new Coordinates(coordinates.get("lat"), coordinates.get("lng")));
        }
        
        return builder
                .countryCode(record.countryCode())
                .administrativeLevel(record.administrativeLevel())
                .tags(record.tags() != null ? record.tags() : Map.of())
                .metadata(record.metadata() != null ? record.metadata() : Map.of())
                .build();
    }
    
    private <T> T readResource(String location, TypeReference<T> type) {
        Resource resource = resourceLoader.getResource(location);
        try (InputStream in = resource.getInputStream()) {
            return objectMapper.readValue(in, type);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read seed resource: " + location, e);
        }
    }
}
