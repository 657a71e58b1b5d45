package com.sourcemanager.core.store;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A citation shared by every project of a region.
 * <p>
 * Only {@code id} is interpreted by the store. All other JSON members are kept
 * as-is, in document order, so a record survives a read/write cycle unchanged.
 */
@JsonPropertyOrder({"id"})
public class SourceRecord {

    public static final String TITLE = "title";
    public static final String SOURCE_TYPE = "source_type";

    private String id;
    private final Map<String, Object> fields = new LinkedHashMap<>();

    public SourceRecord() {
    }

    public SourceRecord(String id, Map<String, ?> fields) {
        this.id = id;
        if (fields != null) {
            fields.forEach(this::setField);
        }
    }

    public static SourceRecord withoutId(Map<String, ?> fields) {
        return new SourceRecord(null, fields);
    }

    @JsonProperty("id")
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public String getId() {
        return id;
    }

    @JsonProperty("id")
    public void setId(String id) {
        this.id = id;
    }

    public boolean hasId() {
        return id != null && !id.isBlank();
    }

    @JsonAnyGetter
    public Map<String, Object> getFields() {
        return Collections.unmodifiableMap(fields);
    }

    @JsonAnySetter
    public void setField(String name, Object value) {
        if ("id".equals(name)) {
            this.id = value == null ? null : String.valueOf(value);
            return;
        }
        fields.put(name, value);
    }

    public Object getField(String name) {
        return fields.get(name);
    }

    /** Convenience accessor; not a bean getter so {@code title} stays a free-form field. */
    public String title() {
        Object title = fields.get(TITLE);
        return title == null ? null : String.valueOf(title);
    }

    /** Copy with the same id and an independent field map. */
    public SourceRecord copy() {
        return new SourceRecord(id, fields);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SourceRecord that)) return false;
        return Objects.equals(id, that.id) && fields.equals(that.fields);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, fields);
    }

    @Override
    public String toString() {
        return "SourceRecord{id=" + id + ", fields=" + fields + "}";
    }
}
