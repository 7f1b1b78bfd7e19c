package de.bsommerfeld.recall.core.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Visibility of an observation. {@code PROJECT} memories belong to a codebase,
 * {@code PERSONAL} ones to the user across projects.
 */
public enum Scope {

    PROJECT("project"),
    PERSONAL("personal");

    private final String wire;

    Scope(String wire) {
        this.wire = wire;
    }

    /** Lower-case form stored in the {@code scope} column and the export file. */
    @JsonValue
    public String wire() {
        return wire;
    }

    /**
     * Normalizes free-form input. Only {@code personal} (any case, surrounding
     * whitespace ignored) maps to {@link #PERSONAL}; empty, {@code null} and
     * unknown values map to {@link #PROJECT}.
     */
    @JsonCreator
    public static Scope parse(String raw) {
        if (raw == null) {
            return PROJECT;
        }
        return "personal".equals(raw.trim().toLowerCase(Locale.ROOT)) ? PERSONAL : PROJECT;
    }
}
