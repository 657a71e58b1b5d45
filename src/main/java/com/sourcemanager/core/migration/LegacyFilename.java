package com.sourcemanager.core.migration;

import java.util.Arrays;

/**
 * Fields encoded in a legacy project filename,
 * {@code "<facility-id> - <suffix> - <project-type> - <year>.json"}.
 * <p>
 * Names with fewer than four segments parse to empty fields with
 * {@code conventional == false}; segments past the fourth are ignored.
 */
public record LegacyFilename(
    String filename,
    String facilityId,
    String suffix,
    String projectType,
    String year,
    boolean conventional
) {

    static final String SEPARATOR = " - ";

    public static LegacyFilename parse(String filename) {
        String stem = stem(filename);
        String[] parts = Arrays.stream(stem.split(SEPARATOR, -1)).map(String::trim).toArray(String[]::new);
        if (parts.length < 4) {
            return new LegacyFilename(filename, "", "", "", "", false);
        }
        return new LegacyFilename(filename, parts[0], parts[1], parts[2], parts[3], true);
    }

    /** {@code filename} without its last extension. */
    public static String stem(String filename) {
        int dot = filename.lastIndexOf('.');
        return dot > 0 ? filename.substring(0, dot) : filename;
    }
}
