package com.sandy.aiot.vision.pipeline.model;

import java.util.Locale;

/**
 * Field-bus quality attached to a reading.
 */
public enum Quality {
    GOOD,
    BAD,
    UNCERTAIN,
    SUBSTITUTE;

    /**
     * Parses an adapter-supplied quality string. Missing values mean {@link #GOOD},
     * anything unrecognised is treated as {@link #UNCERTAIN}.
     */
    public static Quality parse(String raw) {
        if (raw == null || raw.isBlank()) return GOOD;
        try {
            return Quality.valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return UNCERTAIN;
        }
    }
}
