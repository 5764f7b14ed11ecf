package com.starscape.destinationtags.features.tagtransfer.api;

import com.starscape.destinationtags.features.tagtransfer.app.ExportTagsHandler;
import com.starscape.destinationtags.features.tagtransfer.app.ImportTagsHandler;
import com.starscape.destinationtags.features.tagtransfer.domain.ImportReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.List;

/**
 * Command-line tag transfer, run after seeding.
 * 
 * Options:
 * - --import-tags=PATH  import a tag document (applied before any export)
 * - --replace-tags      clear the registry before importing
 * - --export-tags=PATH  export the registry
 */
@Component
@Order(TagTransferRunner.ORDER)
public class TagTransferRunner implements ApplicationRunner {
    
    public static final int ORDER = 100;
    
    static final String IMPORT_OPTION = "import-tags";
    static final String EXPORT_OPTION = "export-tags";
    static final String REPLACE_OPTION = "replace-tags";
    
    private static final Logger log = LoggerFactory.getLogger(TagTransferRunner.class);
    
    private final ImportTagsHandler importHandler;
    private final ExportTagsHandler exportHandler;
    
    public TagTransferRunner(ImportTagsHandler importHandler, ExportTagsHandler exportHandler) {
        this.importHandler = importHandler;
        this.exportHandler = exportHandler;
    }
    
    @Override
    public void run(ApplicationArguments args) {
        boolean replace = args.containsOption(REPLACE_OPTION);
        
        for (String value : optionValues(args, IMPORT_OPTION)) {
            ImportReport report = importHandler.handle(Path.of(value), replace);
            report.failures().forEach(failure ->
                log.warn("Tag record not imported: record={}, field={}, value={}",
                    failure.recordKey(), failure.field(), failure.value()));
        }
        
        for (String value : optionValues(args, EXPORT_OPTION)) {
            exportHandler.handle(Path.of(value));
        }
    }
    
    private static List<String> optionValues(ApplicationArguments args, String option) {
        List<String> values = args.getOptionValues(option);
        return values == null ? List.of() : values.stream().filter(v -> !v.isBlank()).toList();
    }
}
