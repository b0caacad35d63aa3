package com.aycom.explore.model;

import java.util.Locale;

public enum MediaType {
    IMAGE,
    VIDEO,
    GIF;

    public static MediaType fromString(String value, String url) {
        if (value != null) {
            String normalized = value.trim().toLowerCase(Locale.ROOT);
            if (normalized.startsWith("video")) {
                return VIDEO;
            }
            if (normalized.contains("gif")) {
                return GIF;
            }
            if (normalized.startsWith("image") || normalized.equals("photo")) {
                return IMAGE;
            }
        }
        if (url != null) {
            String lower = url.toLowerCase(Locale.ROOT);
            if (lower.endsWith(".gif")) {
                return GIF;
            }
            if (lower.endsWith(".mp4") || lower.endsWith(".webm") || lower.endsWith(".mov")) {
                return VIDEO;
            }
        }
        return IMAGE;
    }
}
