package com.heronix.directory.config;

import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import com.heronix.directory.model.domain.RegionCatalog;
import com.heronix.directory.service.RegionFanout;
import com.heronix.directory.service.StaticInfoCache;

import lombok.RequiredArgsConstructor;

/**
 * Spring Boot Actuator health indicator for the device directory.
 *
 * Reports DOWN only when no provider credential is configured, since every
 * provider call would then fail as unauthenticated. Region reachability is not
 * probed here; regional outages degrade to warnings at request time.
 */
@Component
@RequiredArgsConstructor
public class DirectoryHealthIndicator implements HealthIndicator {

    private final DirectoryProperties properties;
    private final RegionCatalog catalog;
    private final RegionFanout fanout;
    private final StaticInfoCache cache;

    @Override
    public Health health() {
        String token = properties.getProvider().getAuthToken();
        Health.Builder builder = (token == null || token.isBlank())
                ? Health.down().withDetail("credentials", "missing")
                : Health.up().withDetail("credentials", "configured");

        return builder
                .withDetail("regions", catalog.regions().stream().map(r -> r.code()).toList())
                .withDetail("fanoutPoolSize", fanout.getPoolSize())
                .withDetail("fanoutParallelism", fanout.getMaxParallelism())
                .withDetail("regionTimeout", fanout.getRegionTimeout().toString())
                .withDetail("cachedDevices", cache.size())
                .build();
    }
}
