package com.sourcemanager.core.region;

import com.sourcemanager.core.config.SourceManagerProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.nio.file.FileSystems;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.PatternSyntaxException;

/**
 * Resolves the region that owns a project path.
 * <p>
 * Regions are tried in descending priority; ties keep declaration order.
 * The first region with any matching glob wins. Exactly one region must carry
 * the {@code **} pattern at the strictly lowest priority, which makes
 * {@link #resolveRegion(String)} total. The configuration is checked once here
 * and a violation fails construction.
 */
@Service
public class RegionRouter {

    private static final Logger log = LoggerFactory.getLogger(RegionRouter.class);

    private final List<RegionMapping> declared;
    private final List<RegionMapping> byPriority;
    private final Map<String, List<PathMatcher>> matchers = new LinkedHashMap<>();
    private final RegionMapping catchAll;

    @Autowired
    public RegionRouter(SourceManagerProperties properties) {
        this(properties.getRegions().stream().map(RegionMapping::from).toList());
    }

    public RegionRouter(List<RegionMapping> regions) {
        this.declared = List.copyOf(regions);
        this.catchAll = validate(declared);

        var sorted = new ArrayList<>(declared);
        // List.sort is stable, so equal priorities keep declaration order
        sorted.sort(Comparator.comparingInt(RegionMapping::priority).reversed());
        this.byPriority = List.copyOf(sorted);

        for (RegionMapping region : declared) {
            matchers.put(region.regionName(), compile(region));
        }
        log.debug("Region router ready: {} regions, catch-all '{}'", declared.size(), catchAll.regionName());
    }

    /**
     * Returns the name of the region owning {@code projectPath}. Never fails.
     */
    public String resolveRegion(String projectPath) {
        try {
            return resolve(Path.of(projectPath)).regionName();
        } catch (InvalidPathException e) {
            log.warn("Unparsable project path '{}': {}; routing to '{}'",
                    projectPath, e.getMessage(), catchAll.regionName());
            return catchAll.regionName();
        }
    }

    public RegionMapping resolve(Path projectPath) {
        Path normalized = projectPath.toAbsolutePath().normalize();
        for (RegionMapping region : byPriority) {
            for (PathMatcher matcher : matchers.get(region.regionName())) {
                if (matcher.matches(normalized)) {
                    return region;
                }
            }
        }
        // Unreachable with a validated table; kept so routing stays total
        log.warn("No region pattern matched {}; falling back to '{}'", normalized, catchAll.regionName());
        return catchAll;
    }

    /** Regions in declaration order. */
    public List<RegionMapping> regions() {
        return declared;
    }

    public Optional<RegionMapping> findRegion(String regionName) {
        return declared.stream()
                .filter(r -> r.regionName().equals(regionName))
                .findFirst();
    }

    public RegionMapping catchAll() {
        return catchAll;
    }

    private static List<PathMatcher> compile(RegionMapping region) {
        var compiled = new ArrayList<PathMatcher>();
        for (String pattern : region.directoryPatterns()) {
            try {
                compiled.add(FileSystems.getDefault().getPathMatcher("glob:" + pattern));
            } catch (PatternSyntaxException e) {
                throw new IllegalStateException("Region '" + region.regionName()
                        + "' has an invalid directory pattern: " + pattern, e);
            }
        }
        return compiled;
    }

    private static RegionMapping validate(List<RegionMapping> regions) {
        if (regions.isEmpty()) {
            throw new IllegalStateException("No regions configured");
        }
        var names = new HashSet<String>();
        var sourceFiles = new HashSet<String>();
        for (RegionMapping region : regions) {
            if (region.regionName() == null || region.regionName().isBlank()) {
                throw new IllegalStateException("Region without a name in configuration");
            }
            if (!names.add(region.regionName())) {
                throw new IllegalStateException("Duplicate region name: " + region.regionName());
            }
            if (region.sourceFile() == null || region.sourceFile().isBlank()) {
                throw new IllegalStateException("Region '" + region.regionName() + "' has no source file");
            }
            if (!sourceFiles.add(region.sourceFile())) {
                throw new IllegalStateException("Source file " + region.sourceFile()
                        + " is shared by more than one region");
            }
        }

        List<RegionMapping> catchAlls = regions.stream().filter(RegionMapping::isCatchAll).toList();
        if (catchAlls.size() != 1) {
            throw new IllegalStateException("Exactly one catch-all region (pattern '"
                    + RegionMapping.MATCH_ALL + "') is required, found " + catchAlls.size());
        }
        RegionMapping fallback = catchAlls.get(0);
        for (RegionMapping region : regions) {
            if (region != fallback && region.priority() <= fallback.priority()) {
                throw new IllegalStateException("Catch-all region '" + fallback.regionName()
                        + "' must have the lowest priority, but '" + region.regionName()
                        + "' has priority " + region.priority());
            }
        }
        return fallback;
    }
}
