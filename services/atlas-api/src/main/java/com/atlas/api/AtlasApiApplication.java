package com.atlas.api;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * PipelineAtlas control-plane API.
 *
 * <p>Serves authentication, webhook ingestion, billing and admin endpoints, and, when enabled,
 * runs the usage worker that folds stream events into per-tenant counters.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class AtlasApiApplication {

    private static final Logger log = LoggerFactory.getLogger(AtlasApiApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(AtlasApiApplication.class, args);
        log.info("Atlas API started");
    }
}
