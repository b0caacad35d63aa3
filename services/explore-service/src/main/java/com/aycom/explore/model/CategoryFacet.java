package com.aycom.explore.model;

import java.util.Objects;

/**
 * Content category offered in the category filter dropdown.
 */
public final class CategoryFacet {
    private final String id;
    private final String name;
    private final String description;
    private final String slug;
    private final long threadCount;

    public CategoryFacet(String id, String name, String description, String slug, long threadCount) {
        this.id = Objects.requireNonNull(id, "id");
        this.name = name == null ? "" : name;
        this.description = description;
        this.slug = slug;
        this.threadCount = Math.max(0L, threadCount);
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    public String getSlug() {
        return slug;
    }

    public long getThreadCount() {
        return threadCount;
    }
}
