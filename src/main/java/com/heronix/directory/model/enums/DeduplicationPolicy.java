package com.heronix.directory.model.enums;

/**
 * How a listing merges devices reported by more than one region.
 */
public enum DeduplicationPolicy {

    /**
     * Keep every regional record, duplicates included
     */
    NONE,

    /**
     * Keep the first record seen for an id in merge order
     */
    FIRST_SEEN
}
