package com.sourcemanager.core.store;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Field-by-field update for a {@link SourceRecord}.
 * <p>
 * A {@code null} member leaves the stored value untouched; a non-null member
 * replaces it. {@code extraFields} carries free-form citation fields with the
 * same rule. The record id can never be patched.
 */
public record SourcePatch(
    String title,
    String sourceType,
    List<String> authors,
    Integer year,
    String publisher,
    String url,
    String citation,
    String description,
    Map<String, Object> extraFields
) {

    public SourcePatch {
        var extras = new LinkedHashMap<String, Object>();
        if (extraFields != null) {
            extraFields.forEach((k, v) -> putIfSet(extras, k, v));
        }
        extraFields = Collections.unmodifiableMap(extras);
        if (extraFields.containsKey("id")) {
            throw new IllegalArgumentException("The id of a source record cannot be patched");
        }
        authors = authors == null ? null : List.copyOf(authors);
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean isEmpty() {
        return asFieldMap().isEmpty();
    }

    /** Non-null members keyed by their JSON field name, typed members first. */
    public Map<String, Object> asFieldMap() {
        var map = new LinkedHashMap<String, Object>();
        putIfSet(map, SourceRecord.TITLE, title);
        putIfSet(map, SourceRecord.SOURCE_TYPE, sourceType);
        putIfSet(map, "authors", authors);
        putIfSet(map, "year", year);
        putIfSet(map, "publisher", publisher);
        putIfSet(map, "url", url);
        putIfSet(map, "citation", citation);
        putIfSet(map, "description", description);
        extraFields.forEach((k, v) -> putIfSet(map, k, v));
        return map;
    }

    /** Returns a merged copy of {@code record}; the argument is not modified. */
    public SourceRecord applyTo(SourceRecord record) {
        SourceRecord merged = record.copy();
        asFieldMap().forEach(merged::setField);
        return merged;
    }

    private static void putIfSet(Map<String, Object> map, String key, Object value) {
        if (value != null) {
            map.put(key, value);
        }
    }

    public static final class Builder {
        private String title;
        private String sourceType;
        private List<String> authors;
        private Integer year;
        private String publisher;
        private String url;
        private String citation;
        private String description;
        private final Map<String, Object> extraFields = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder title(String title) { this.title = title; return this; }
        public Builder sourceType(String sourceType) { this.sourceType = sourceType; return this; }
        public Builder authors(List<String> authors) { this.authors = authors; return this; }
        public Builder year(Integer year) { this.year = year; return this; }
        public Builder publisher(String publisher) { this.publisher = publisher; return this; }
        public Builder url(String url) { this.url = url; return this; }
        public Builder citation(String citation) { this.citation = citation; return this; }
        public Builder description(String description) { this.description = description; return this; }
        public Builder field(String name, Object value) { this.extraFields.put(name, value); return this; }

        public SourcePatch build() {
            return new SourcePatch(title, sourceType, authors, year, publisher, url, citation,
                    description, extraFields);
        }
    }
}
