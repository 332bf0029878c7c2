package com.heronix.directory.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.heronix.directory.model.domain.RegionCatalog;
import com.heronix.directory.service.RegionFanout;
import com.heronix.directory.service.StaticInfoCache;

import lombok.extern.slf4j.Slf4j;

/**
 * Core directory beans.
 *
 * The region catalog is fixed at startup and the static cache lives as long as
 * the application context.
 */
@Configuration
@Slf4j
public class DirectoryConfig {

    @Bean
    public RegionCatalog regionCatalog(DirectoryProperties properties) {
        RegionCatalog catalog = RegionCatalog.of(properties.getRegions());
        log.info("DIRECTORY: Region catalog {}", catalog);
        return catalog;
    }

    /**
     * Shared worker pool; each request fans out to at most max-parallelism regions.
     */
    @Bean(destroyMethod = "shutdown")
    public RegionFanout regionFanout(DirectoryProperties properties, RegionCatalog catalog) {
        DirectoryProperties.FanoutConfig fanout = properties.getFanout();
        int parallelism = Math.min(fanout.getMaxParallelism(), catalog.size());
        log.info("DIRECTORY: Fan-out pool of {} workers, {} region calls per request",
                fanout.getPoolSize(), parallelism);
        return new RegionFanout(fanout.getPoolSize(), parallelism, fanout.getRegionTimeout());
    }

    @Bean
    public StaticInfoCache staticInfoCache() {
        return new StaticInfoCache();
    }
}
