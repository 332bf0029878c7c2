package com.heronix.directory.service;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import com.heronix.directory.model.domain.CacheEntry;

import lombok.extern.slf4j.Slf4j;

/**
 * Process-wide store of static device fields, keyed by device id.
 *
 * Write-once: the first entry stored for an id wins and is never replaced, so a
 * reader never sees fields assembled from two different provider responses.
 * Entries are never evicted.
 *
 * @author Heronix Educational Systems LLC
 * @since October 2026
 */
@Slf4j
public class StaticInfoCache {

    private final Map<String, CacheEntry> entries = new ConcurrentHashMap<>();

    public Optional<CacheEntry> get(String deviceId) {
        return Optional.ofNullable(entries.get(deviceId));
    }

    /**
     * Store {@code entry} unless an entry for the id exists.
     *
     * @return the entry held by the cache after the call: {@code entry} if it won,
     *         otherwise the earlier winner
     */
    public CacheEntry putIfAbsent(String deviceId, CacheEntry entry) {
        CacheEntry existing = entries.putIfAbsent(deviceId, entry);
        if (existing != null) {
            log.debug("CACHE: Discarded concurrent entry for {}", deviceId);
            return existing;
        }
        log.debug("CACHE: Stored static info for {} ({} entries)", deviceId, entries.size());
        return entry;
    }

    public int size() {
        return entries.size();
    }
}
