package com.sourcemanager.core.region;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Visibility of the sources held by a region.
 */
public enum SourceScope {
    REGIONAL("regional"),   // bound to the directories a region's patterns match
    GLOBAL("global"),       // offered to every project
    PROJECT("project");     // owned by a single project file

    private final String value;

    SourceScope(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static SourceScope fromValue(String value) {
        for (SourceScope scope : values()) {
            if (scope.value.equalsIgnoreCase(value) || scope.name().equalsIgnoreCase(value)) {
                return scope;
            }
        }
        throw new IllegalArgumentException("No SourceScope with value: " + value);
    }
}
