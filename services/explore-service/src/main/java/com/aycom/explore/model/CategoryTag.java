package com.aycom.explore.model;

import java.util.List;

/**
 * Result tab of the explore page. TRENDING and LATEST render the same stream.
 */
public enum CategoryTag {
    TRENDING,
    LATEST,
    PEOPLE,
    MEDIA,
    COMMUNITIES,
    TOP;

    private static final List<CategoryTag> STREAMS = List.of(LATEST, PEOPLE, MEDIA, COMMUNITIES, TOP);

    public CategoryTag stream() {
        return this == TRENDING ? LATEST : this;
    }

    public static List<CategoryTag> streams() {
        return STREAMS;
    }
}
