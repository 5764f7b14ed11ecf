package com.starscape.destinationtags;

import com.starscape.destinationtags.common.config.EngineProperties;
import com.starscape.destinationtags.common.config.SeedProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({EngineProperties.class, SeedProperties.class})
public class DestinationTagsApplication {

    public static void main(String[] args) {
        SpringApplication.run(DestinationTagsApplication.class, args);
    }
}
