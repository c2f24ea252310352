package com.bizlaw.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

/**
 * Governmental level a legal source or analysis section pertains to.
 * Declaration order is the canonical Federal, State, Local order.
 */
public enum Jurisdiction {

    FEDERAL("Federal"),
    STATE("State"),
    LOCAL("Local");

    private final String displayName;

    Jurisdiction(String displayName) {
        this.displayName = displayName;
    }

    @JsonValue
    public String getDisplayName() {
        return displayName;
    }

    public static Optional<Jurisdiction> lookup(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String trimmed = name.trim();
        return Arrays.stream(values())
                .filter(j -> j.displayName.equalsIgnoreCase(trimmed) || j.name().equalsIgnoreCase(trimmed))
                .findFirst();
    }

    @JsonCreator
    public static Jurisdiction fromName(String name) {
        return lookup(name).orElseThrow(() -> new IllegalArgumentException("Unknown jurisdiction: " + name));
    }
}
