package com.example.interviewcoach.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Severity grades of the gibberish detector, ordered from harmless to severe.
 */
public enum GibberishSeverity {
    NONE(0),
    MINOR(1),
    MODERATE(2),
    SEVERE(3);

    private final int level;

    GibberishSeverity(int level) {
        this.level = level;
    }

    @JsonValue
    public int level() {
        return level;
    }

    /** Returns the more severe of the two grades. */
    public GibberishSeverity max(GibberishSeverity other) {
        return other.level > level ? other : this;
    }

    public boolean isAtLeast(GibberishSeverity other) {
        return level >= other.level;
    }
}
