package com.heronix.directory.model.domain;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * The fixed, ordered set of regions the provider serves devices from.
 *
 * Iteration order is the probe order used for device ids that do not encode a region.
 */
public final class RegionCatalog {

    private final List<Region> regions;

    private RegionCatalog(List<Region> regions) {
        this.regions = List.copyOf(regions);
    }

    /**
     * Build a catalog from region codes. Duplicates keep their first position.
     */
    public static RegionCatalog of(List<String> codes) {
        Set<Region> ordered = new LinkedHashSet<>();
        for (String code : codes) {
            ordered.add(Region.of(code));
        }
        if (ordered.isEmpty()) {
            throw new IllegalArgumentException("Region catalog must contain at least one region");
        }
        return new RegionCatalog(List.copyOf(ordered));
    }

    public static RegionCatalog of(String... codes) {
        return of(List.of(codes));
    }

    public List<Region> regions() {
        return regions;
    }

    public int size() {
        return regions.size();
    }

    public Optional<Region> find(String code) {
        return regions.stream()
                .filter(region -> region.code().equals(code))
                .findFirst();
    }

    @Override
    public String toString() {
        return regions.toString();
    }
}
