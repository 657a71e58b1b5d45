package com.sourcemanager.core.project;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Customer block of a project record. {@code suffix} is omitted from JSON when unset.
 */
public record CustomerInfo(
    String key,
    String name,
    String number,
    @JsonInclude(JsonInclude.Include.NON_NULL) String suffix
) {

    public CustomerInfo(String key, String name, String number) {
        this(key, name, number, null);
    }
}
