package com.aycom.explore.model;

import java.util.Locale;

public enum Filter {
    ALL("all"),
    FOLLOWING("following"),
    VERIFIED("verified");

    private final String wireValue;

    Filter(String wireValue) {
        this.wireValue = wireValue;
    }

    public String getWireValue() {
        return wireValue;
    }

    public static Filter fromString(String value) {
        if (value == null || value.isBlank()) {
            return ALL;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (Filter filter : values()) {
            if (filter.wireValue.equals(normalized)) {
                return filter;
            }
        }
        return ALL;
    }
}
