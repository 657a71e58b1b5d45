package com.sourcemanager.core.config;

import com.sourcemanager.core.region.SourceScope;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Bound from {@code sourcemanager.*}. Every default here matches what the
 * desktop tool shipped with, so an empty {@code application.yml} still yields
 * a complete region table and a usable master-sources root.
 */
@Component
@ConfigurationProperties(prefix = "sourcemanager")
public class SourceManagerProperties {

    static final String WINDOWS_MASTER_SOURCES_DIR = "C:\\Program Files\\SourceManager\\MasterSources";
    static final String UNIX_MASTER_SOURCES_DIR = "/opt/sourcemanager/master_sources";

    private String masterSourcesDir = defaultMasterSourcesDir();
    private int ioTimeoutSeconds = 10;
    private String documentVersion = "1.0";
    private List<Region> regions = defaultRegions();
    private Migration migration = new Migration();

    // -- Derived accessors --
    public Path getMasterSourcesPath() { return Path.of(masterSourcesDir); }
    public Duration getIoTimeout() { return Duration.ofSeconds(ioTimeoutSeconds); }

    public String getMasterSourcesDir() { return masterSourcesDir; }
    public void setMasterSourcesDir(String masterSourcesDir) { this.masterSourcesDir = masterSourcesDir; }
    public int getIoTimeoutSeconds() { return ioTimeoutSeconds; }
    public void setIoTimeoutSeconds(int ioTimeoutSeconds) { this.ioTimeoutSeconds = ioTimeoutSeconds; }
    public String getDocumentVersion() { return documentVersion; }
    public void setDocumentVersion(String documentVersion) { this.documentVersion = documentVersion; }
    public List<Region> getRegions() { return regions; }
    public void setRegions(List<Region> regions) { this.regions = regions; }
    public Migration getMigration() { return migration; }
    public void setMigration(Migration migration) { this.migration = migration; }

    static String defaultMasterSourcesDir() {
        String os = System.getProperty("os.name", "").toLowerCase();
        return os.startsWith("windows") ? WINDOWS_MASTER_SOURCES_DIR : UNIX_MASTER_SOURCES_DIR;
    }

    static List<Region> defaultRegions() {
        var defaults = new ArrayList<Region>();
        defaults.add(new Region("ROW",
                List.of("**/ROW/**", "**/Right_of_Way/**", "**/ROW_Projects/**"),
                "ROW_sources.json", "Right of Way",
                "Sources specific to Right of Way projects", 10, SourceScope.REGIONAL));
        defaults.add(new Region("Other",
                List.of("**/Other_Projects/**", "**/Other/**", "**/Miscellaneous/**"),
                "Other_sources.json", "Other Projects",
                "General project sources", 5, SourceScope.REGIONAL));
        defaults.add(new Region("Downtown",
                List.of("**/Downtown/**", "**/Downtown_Projects/**", "**/Urban/**"),
                "Downtown_sources.json", "Downtown Projects",
                "Urban and downtown development sources", 8, SourceScope.REGIONAL));
        defaults.add(new Region("Regional",
                List.of("**/Regional/**", "**/Regional_Projects/**"),
                "Regional_sources.json", "Regional Standards",
                "Regional standards and specifications", 7, SourceScope.REGIONAL));
        defaults.add(new Region("General",
                List.of("**"),
                "General_sources.json", "General Sources",
                "Default sources for unclassified projects", 1, SourceScope.GLOBAL));
        return defaults;
    }

    public static class Region {
        private String regionName;
        private List<String> directoryPatterns = List.of();
        private String sourceFile;
        private String displayName;
        private String description = "";
        private int priority;
        private SourceScope scope = SourceScope.REGIONAL;

        public Region() {
        }

        public Region(String regionName, List<String> directoryPatterns, String sourceFile,
                      String displayName, String description, int priority, SourceScope scope) {
            this.regionName = regionName;
            this.directoryPatterns = directoryPatterns;
            this.sourceFile = sourceFile;
            this.displayName = displayName;
            this.description = description;
            this.priority = priority;
            this.scope = scope;
        }

        public String getRegionName() { return regionName; }
        public void setRegionName(String regionName) { this.regionName = regionName; }
        public List<String> getDirectoryPatterns() { return directoryPatterns; }
        public void setDirectoryPatterns(List<String> directoryPatterns) { this.directoryPatterns = directoryPatterns; }
        public String getSourceFile() { return sourceFile; }
        public void setSourceFile(String sourceFile) { this.sourceFile = sourceFile; }
        public String getDisplayName() { return displayName; }
        public void setDisplayName(String displayName) { this.displayName = displayName; }
        public String getDescription() { return description; }
        public void setDescription(String description) { this.description = description; }
        public int getPriority() { return priority; }
        public void setPriority(int priority) { this.priority = priority; }
        public SourceScope getScope() { return scope; }
        public void setScope(SourceScope scope) { this.scope = scope; }
    }

    public static class Migration {
        private String extension = ".json";
        private boolean recursive = false;
        private boolean backupExisting = true;
        private int parallelism = 1;

        public String getExtension() { return extension; }
        public void setExtension(String extension) { this.extension = extension; }
        public boolean isRecursive() { return recursive; }
        public void setRecursive(boolean recursive) { this.recursive = recursive; }
        public boolean isBackupExisting() { return backupExisting; }
        public void setBackupExisting(boolean backupExisting) { this.backupExisting = backupExisting; }
        public int getParallelism() { return parallelism; }
        public void setParallelism(int parallelism) { this.parallelism = parallelism; }
    }
}
