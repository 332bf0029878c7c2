package com.heronix.directory;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

import com.heronix.directory.config.DirectoryProperties;

/**
 * Heronix Device Directory - Multi-Region Compute Device Aggregator
 *
 * Presents one consistent view of the quantum devices a provider exposes across
 * its regional endpoints. Regional outages degrade the listing to warnings instead
 * of failing it, and expensive static device metadata is cached for the lifetime
 * of the process while device status is always fetched fresh.
 */
@SpringBootApplication
@EnableConfigurationProperties(DirectoryProperties.class)
public class DirectoryApplication {

    public static void main(String[] args) {
        SpringApplication.run(DirectoryApplication.class, args);
    }
}
