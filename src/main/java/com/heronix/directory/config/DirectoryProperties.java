package com.heronix.directory.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import com.heronix.directory.model.enums.DeduplicationPolicy;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

/**
 * Configuration properties for the Heronix Device Directory.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "heronix.directory")
public class DirectoryProperties {

    /**
     * Regions the provider exposes the service in. Order is the probe order
     * for device identifiers that carry no region.
     */
    @NotEmpty
    private List<String> regions = new ArrayList<>(List.of(
            "us-east-1", "us-west-1", "us-west-2", "eu-west-2", "eu-north-1"));

    /**
     * Region fan-out configuration
     */
    @Valid
    private FanoutConfig fanout = new FanoutConfig();

    /**
     * Device listing configuration
     */
    @Valid
    private ListingConfig listing = new ListingConfig();

    /**
     * Provider endpoint configuration
     */
    @Valid
    private ProviderConfig provider = new ProviderConfig();

    /**
     * API security configuration
     */
    private SecurityConfig security = new SecurityConfig();

    @Data
    public static class FanoutConfig {
        /**
         * Worker threads shared by all concurrent requests.
         */
        @Min(1)
        private int poolSize = 32;

        /**
         * Upper bound on concurrent region calls of one request. Never exceeds the
         * region count.
         */
        @Min(1)
        private int maxParallelism = 5;

        /**
         * Deadline for a single region call, measured from the moment a worker
         * starts it.
         */
        @NotNull
        private Duration regionTimeout = Duration.ofSeconds(15);
    }

    @Data
    public static class ListingConfig {
        /**
         * How devices echoed by more than one region are merged
         */
        @NotNull
        private DeduplicationPolicy deduplication = DeduplicationPolicy.NONE;
    }

    @Data
    public static class ProviderConfig {
        /**
         * Regional endpoint, {region} is replaced with the region code
         */
        @NotBlank
        private String endpointTemplate = "https://braket.{region}.amazonaws.com";

        /**
         * Header carrying the pre-signed credential
         */
        @NotBlank
        private String authHeader = "Authorization";

        /**
         * Credential value. Requests fail as unauthenticated when unset.
         * In production, use environment variable: HERONIX_DIRECTORY_PROVIDER_AUTH_TOKEN
         */
        private String authToken;

        /**
         * Devices requested per search page
         */
        @Min(1)
        private int pageSize = 100;
    }

    @Data
    public static class SecurityConfig {
        /**
         * API key required in the X-Api-Key header under the prod profile
         */
        private String apiKey;
    }
}
