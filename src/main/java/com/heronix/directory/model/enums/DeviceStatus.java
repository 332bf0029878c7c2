package com.heronix.directory.model.enums;

import java.util.Locale;

/**
 * Availability status reported by the provider for a device.
 */
public enum DeviceStatus {

    ONLINE,
    OFFLINE,
    RETIRED,
    UNKNOWN;

    /**
     * Parse a provider status string. Anything unrecognised maps to UNKNOWN.
     */
    public static DeviceStatus fromProvider(String value) {
        if (value == null || value.isBlank()) {
            return UNKNOWN;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return UNKNOWN;
        }
    }

    /**
     * Whether a listing may return a device in this status.
     */
    public boolean isListable() {
        return this == ONLINE || this == OFFLINE;
    }
}
