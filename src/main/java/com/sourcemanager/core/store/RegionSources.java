package com.sourcemanager.core.store;

import java.util.List;

/**
 * Sources visible to a caller together with the region they were read from.
 */
public record RegionSources(String regionName, List<SourceRecord> sources) {

    public RegionSources {
        sources = List.copyOf(sources);
    }
}
