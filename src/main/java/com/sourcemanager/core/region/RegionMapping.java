package com.sourcemanager.core.region;

import com.sourcemanager.core.config.SourceManagerProperties;

import java.util.List;

/**
 * Immutable view of one configured region.
 *
 * @param regionName        stable key, also written into the region document metadata
 * @param directoryPatterns glob patterns tested against absolute project paths
 * @param sourceFile        document file name under the master-sources root
 * @param displayName       user-facing label
 * @param description       free text shown next to the label
 * @param priority          higher wins when several regions match
 * @param scope             visibility of the region's sources
 */
public record RegionMapping(
    String regionName,
    List<String> directoryPatterns,
    String sourceFile,
    String displayName,
    String description,
    int priority,
    SourceScope scope
) {

    /** Pattern that matches every path; marks the catch-all region. */
    public static final String MATCH_ALL = "**";

    public RegionMapping {
        directoryPatterns = List.copyOf(directoryPatterns);
    }

    public boolean isCatchAll() {
        return directoryPatterns.contains(MATCH_ALL);
    }

    public static RegionMapping from(SourceManagerProperties.Region region) {
        return new RegionMapping(
                region.getRegionName(),
                region.getDirectoryPatterns() == null ? List.of() : region.getDirectoryPatterns(),
                region.getSourceFile(),
                region.getDisplayName() != null ? region.getDisplayName() : region.getRegionName(),
                region.getDescription() != null ? region.getDescription() : "",
                region.getPriority(),
                region.getScope() != null ? region.getScope() : SourceScope.REGIONAL
        );
    }
}
