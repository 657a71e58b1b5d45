package com.sourcemanager.core.store;

import com.sourcemanager.core.region.SourceScope;

/**
 * One row of the region listing.
 */
public record RegionSummary(
    String regionName,
    String displayName,
    String description,
    SourceScope scope,
    int sourceCount,
    String sourceFile
) {}
