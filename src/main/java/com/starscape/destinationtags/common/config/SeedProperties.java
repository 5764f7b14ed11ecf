package com.starscape.destinationtags.common.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for startup sample data.
 * Binds to app.seed.* properties from application.yml
 */
@ConfigurationProperties(prefix = "app.seed")
public class SeedProperties {
    
    private boolean enabled = true;
    private String tagsResource = "classpath:seed/default-tags.json";
    private String destinationsResource = "classpath:seed/sample-destinations.json";
    
    public boolean isEnabled() {
        return enabled;
    }
    
    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }
    
    public String getTagsResource() {
        return tagsResource;
    }
    
    public void setTagsResource(String tagsResource) {
        this.tagsResource = tagsResource;
    }
    
    public String getDestinationsResource() {
        return destinationsResource;
    }
    
    public void setDestinationsResource(String destinationsResource) {
        this.destinationsResource = destinationsResource;
    }
}
