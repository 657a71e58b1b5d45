package com.sourcemanager.core.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Set;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Generates {@code src_xxxxxxxx} ids that are unique within one region document.
 * <p>
 * A random candidate is checked against the ids already present, up to
 * {@link #MAX_ATTEMPTS} times. After that a timestamp id is used, suffixed
 * with a counter if even that collides.
 */
public class SourceIdGenerator {

    private static final Logger log = LoggerFactory.getLogger(SourceIdGenerator.class);

    public static final String PREFIX = "src_";
    public static final int MAX_ATTEMPTS = 10;

    private final Supplier<String> randomPart;
    private final Clock clock;

    public SourceIdGenerator(Clock clock) {
        this(() -> UUID.randomUUID().toString().replace("-", "").substring(0, 8), clock);
    }

    public SourceIdGenerator(Supplier<String> randomPart, Clock clock) {
        this.randomPart = randomPart;
        this.clock = clock;
    }

    /** Result of one generation: the id and whether the timestamp fallback was needed. */
    public record GeneratedId(String id, boolean fallback) {}

    public GeneratedId generate(Set<String> existingIds) {
        for (int attempt = 0; attempt < MAX_ATTEMPTS; attempt++) {
            String candidate = PREFIX + randomPart.get();
            if (!existingIds.contains(candidate)) {
                return new GeneratedId(candidate, false);
            }
        }

        String base = PREFIX + clock.instant().getEpochSecond();
        String candidate = base;
        for (int n = 1; existingIds.contains(candidate); n++) {
            candidate = base + "_" + n;
        }
        log.warn("Random source id collided {} times; using timestamp id {}", MAX_ATTEMPTS, candidate);
        return new GeneratedId(candidate, true);
    }
}
