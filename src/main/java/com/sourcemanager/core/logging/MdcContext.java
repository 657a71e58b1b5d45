package com.sourcemanager.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing Source Manager MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setRegion(String region) {
        MDC.put("region", region);
    }

    public static void setSource(String region, String sourceId) {
        MDC.put("region", region);
        MDC.put("sourceId", sourceId);
    }

    public static void setMigrationFile(String filename) {
        MDC.put("migrationFile", filename);
    }

    public static void clear() {
        MDC.remove("region");
        MDC.remove("sourceId");
        MDC.remove("migrationFile");
    }
}
