package com.heronix.directory.model.domain;

import com.heronix.directory.exception.DirectoryException;

/**
 * Parsed device identifier.
 *
 * Format: {@code arn:aws:braket:<region>:<account>:device/<kind>/<provider>/<name>}.
 * Simulators leave the region segment empty and have to be probed across regions.
 */
public record DeviceArn(String value, String regionCode) {

    public static final String PREFIX = "arn:aws:braket:";

    private static final int REGION_SEGMENT = 3;

    /**
     * Validate the prefix and extract the region segment.
     *
     * @throws DirectoryException with kind VALIDATION when the prefix is missing
     */
    public static DeviceArn parse(String value) {
        if (value == null || !value.startsWith(PREFIX)) {
            throw DirectoryException.validation("Invalid device ARN format: " + value);
        }
        String[] segments = value.split(":", -1);
        String region = segments.length > REGION_SEGMENT ? segments[REGION_SEGMENT].trim() : "";
        return new DeviceArn(value, region.isEmpty() ? null : region);
    }

    public boolean isRegionless() {
        return regionCode == null;
    }

    @Override
    public String toString() {
        return value;
    }
}
