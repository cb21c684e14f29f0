package com.trainrelay.selection;

import java.util.Locale;

public enum SelectionMode {
    AUTO,
    MANUAL;

    public static SelectionMode parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Selection mode must not be blank");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown selection mode '" + value + "', expected auto or manual", e);
        }
    }
}
