package com.sourcemanager.core.migration;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.sourcemanager.core.metrics.SourceManagerMetrics;
import com.sourcemanager.core.project.CanonicalProject;
import com.sourcemanager.core.project.CanonicalProjectMetadata;
import com.sourcemanager.core.project.ProjectSourceLink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Converts one legacy project record into the canonical schema.
 * <p>
 * The conversion is pure: nothing is read from or written to disk here.
 * Input that is already canonical is rejected rather than converted a second
 * time.
 */
@Service
public class SchemaMigrator {

    private static final Logger log = LoggerFactory.getLogger(SchemaMigrator.class);

    static final String SITE_FACILITY_NAME = "Facility Name";
    static final String SITE_SURROGATE_KEY = "Facility Surrogate Key";

    /** Legacy site properties that are not carried into facility_information (lower case). */
    private static final Set<String> DROPPED_SITE_KEYS = Set.of(
            "classification", "access_date", "access date", "benjamin", "oscar",
            CanonicalProject.FACILITY_ID, CanonicalProject.FACILITY_CODE);

    private final ObjectMapper objectMapper;
    private final SourceManagerMetrics metrics;
    private final Supplier<String> projectIds;

    @Autowired
    public SchemaMigrator(ObjectMapper objectMapper, SourceManagerMetrics metrics) {
        this(objectMapper, metrics, () -> UUID.randomUUID().toString());
    }

    public SchemaMigrator(ObjectMapper objectMapper, SourceManagerMetrics metrics, Supplier<String> projectIds) {
        this.objectMapper = objectMapper;
        this.metrics = metrics;
        this.projectIds = projectIds;
    }

    /** True when {@code record} already has the canonical top-level shape. */
    public static boolean isCanonical(JsonNode record) {
        return record != null && (record.has("project_metadata") || record.has("facility_information"));
    }

    /**
     * Migrates {@code legacy}, read from a file named {@code filename}.
     *
     * @throws MigrationValidationException if the result lacks required content
     * @throws MigrationException           if the input is not a legacy record
     */
    public CanonicalProject migrate(JsonNode legacy, String filename) throws MigrationException {
        if (legacy == null || !legacy.isObject()) {
            throw new MigrationException(filename + " does not contain a JSON object");
        }
        if (isCanonical(legacy)) {
            throw new MigrationException(filename + " is already in the canonical schema");
        }

        LegacyFilename parsed = LegacyFilename.parse(filename);
        if (!parsed.conventional()) {
            log.warn("Filename '{}' does not match '<facility-id> - <suffix> - <type> - <year>'; "
                    + "facility id, suffix, project type and year left empty", filename);
            metrics.recordFilenameFallback();
        }

        var metadata = new CanonicalProjectMetadata(
                projectIds.get(),
                parsed.projectType(),
                LegacyFilename.stem(filename),
                filePath(parsed, filename),
                text(legacy, "requestor", ""),
                parsed.year(),
                legacy.path("relook").asBoolean(false));

        JsonNode slideData = legacy.has("slide_data") ? legacy.get("slide_data").deepCopy() : deriveSlideData(legacy);

        var canonical = new CanonicalProject(
                metadata,
                copyOf(legacy.get("team")),
                copyOf(legacy.get("key_cites")),
                facilityInformation(legacy.path("site_properties"), parsed),
                slideData,
                sourceLinks(legacy.path("sources")),
                text(legacy, "powerpoint_file", ""),
                legacy.path("number_header_citations").asInt(0));

        List<String> errors = validate(canonical);
        if (!errors.isEmpty()) {
            throw new MigrationValidationException(filename, errors);
        }
        log.debug("Migrated {} to project {}", filename, metadata.projectId());
        return canonical;
    }

    /** Problems that make a migrated record unusable; empty when valid. */
    public List<String> validate(CanonicalProject project) {
        var errors = new ArrayList<String>();
        CanonicalProjectMetadata metadata = project.projectMetadata();
        if (metadata == null) {
            errors.add("Missing project_metadata");
            return errors;
        }
        if (isBlank(metadata.projectId())) {
            errors.add("Missing project_id");
        }
        if (isBlank(metadata.title())) {
            errors.add("Missing title");
        }
        if (isBlank(metadata.filePath())) {
            errors.add("Missing file_path");
        } else if (!metadata.filePath().endsWith(".json")) {
            errors.add("Project file_path must end with .json");
        }
        for (int i = 0; i < project.sources().size(); i++) {
            ProjectSourceLink link = project.sources().get(i);
            if (isBlank(link.uuid())) {
                errors.add("Source " + i + " missing uuid");
            }
            if (link.order() < 1) {
                errors.add("Source " + i + " has invalid order: " + link.order());
            }
        }
        return errors;
    }

    /**
     * Rebuilds slide data from {@code slide_refs}, a map of slide id to bit
     * string, and {@code slide_refs_citation_ordering}. Bit {@code i} set means the
     * slide cites the {@code i}-th source of the ordering. Slides citing nothing
     * are left out.
     */
    ObjectNode deriveSlideData(JsonNode legacy) {
        ObjectNode slides = objectMapper.createObjectNode();
        JsonNode ordering = legacy.path("slide_refs_citation_ordering");
        if (!ordering.isArray() || ordering.isEmpty()) {
            return slides;
        }
        Iterator<Map.Entry<String, JsonNode>> refs = legacy.path("slide_refs").fields();
        while (refs.hasNext()) {
            Map.Entry<String, JsonNode> ref = refs.next();
            String bits = ref.getValue().asText("");
            ArrayNode cited = objectMapper.createArrayNode();
            for (int i = 0; i < bits.length() && i < ordering.size(); i++) {
                if (bits.charAt(i) == '1') {
                    cited.add(ordering.get(i).asText());
                }
            }
            if (!cited.isEmpty()) {
                slides.set(ref.getKey(), cited);
            }
        }
        return slides;
    }

    private Map<String, Object> facilityInformation(JsonNode siteProperties, LegacyFilename parsed) {
        var facility = new LinkedHashMap<String, Object>();
        facility.put(CanonicalProject.FACILITY_ID, parsed.facilityId());
        facility.put(CanonicalProject.FACILITY_CODE, parsed.suffix());
        facility.put(CanonicalProject.FACILITY_NAME, text(siteProperties, SITE_FACILITY_NAME, ""));
        facility.put(CanonicalProject.FACILITY_SURROGATE_KEY, text(siteProperties, SITE_SURROGATE_KEY, ""));

        Iterator<Map.Entry<String, JsonNode>> entries = siteProperties.fields();
        while (entries.hasNext()) {
            Map.Entry<String, JsonNode> entry = entries.next();
            String key = entry.getKey();
            if (key.equals(SITE_FACILITY_NAME) || key.equals(SITE_SURROGATE_KEY)
                    || DROPPED_SITE_KEYS.contains(key.toLowerCase(Locale.ROOT))) {
                continue;
            }
            facility.put(key, objectMapper.convertValue(entry.getValue(), Object.class));
        }
        return facility;
    }

    private static List<ProjectSourceLink> sourceLinks(JsonNode sources) {
        var links = new ArrayList<ProjectSourceLink>();
        if (!sources.isArray()) {
            return links;
        }
        for (int i = 0; i < sources.size(); i++) {
            JsonNode source = sources.get(i);
            links.add(new ProjectSourceLink(text(source, "uuid", ""), i + 1, text(source, "comment", "")));
        }
        return links;
    }

    private static String filePath(LegacyFilename parsed, String filename) {
        String name = LegacyFilename.stem(filename) + ".json";
        if (parsed.facilityId().isEmpty() || parsed.year().isEmpty()) {
            return name;
        }
        return parsed.year() + "/" + parsed.facilityId() + "/" + name;
    }

    private static JsonNode copyOf(JsonNode node) {
        return node == null || node.isNull() ? null : node.deepCopy();
    }

    private static String text(JsonNode node, String field, String fallback) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? fallback : value.asText();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
