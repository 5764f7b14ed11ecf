package com.starscape.destinationtags.common.config;

import com.starscape.destinationtags.common.domain.LanguageCode;
import com.starscape.destinationtags.features.tagtransfer.domain.ImportPolicy;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the tag engine.
 * Binds to app.engine.* properties from application.yml
 */
@Validated
@ConfigurationProperties(prefix = "app.engine")
public class EngineProperties {
    
    @NotNull
    private LanguageCode defaultLanguage = LanguageCode.EN;
    
    @Min(0)
    private int prefixSearchLimit = 10;
    
    // Scores can exceed 1.0, so there is no upper bound
    @DecimalMin("0.0")
    private double minMatchScore = 0.3;
    
    @Min(0)
    private int destinationSearchLimit = 20;
    
    @NotNull
    private ImportPolicy importPolicy = ImportPolicy.LENIENT;
    
    public LanguageCode getDefaultLanguage() {
        return defaultLanguage;
    }
    
    public void setDefaultLanguage(LanguageCode defaultLanguage) {
        this.defaultLanguage = defaultLanguage;
    }
    
    public int getPrefixSearchLimit() {
        return prefixSearchLimit;
    }
    
    public void setPrefixSearchLimit(int prefixSearchLimit) {
        this.prefixSearchLimit = prefixSearchLimit;
    }
    
    public double getMinMatchScore() {
        return minMatchScore;
    }
    
    public void setMinMatchScore(double minMatchScore) {
        this.minMatchScore = minMatchScore;
    }
    
    public int getDestinationSearchLimit() {
        return destinationSearchLimit;
    }
    
    public void setDestinationSearchLimit(int destinationSearchLimit) {
        this.destinationSearchLimit = destinationSearchLimit;
    }
    
    public ImportPolicy getImportPolicy() {
        return importPolicy;
    }
    
    public void setImportPolicy(ImportPolicy importPolicy) {
        this.importPolicy = importPolicy;
    }
}
