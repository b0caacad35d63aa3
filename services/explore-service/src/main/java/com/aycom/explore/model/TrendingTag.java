package com.aycom.explore.model;

import java.util.Objects;

public final class TrendingTag {
    private final String id;
    private final String title;
    private final String category;
    private final long postCount;
    private final String query;

    public TrendingTag(String id, String title, String category, long postCount, String query) {
        this.id = Objects.requireNonNull(id, "id");
        this.title = title == null ? "" : title;
        this.category = category;
        this.postCount = Math.max(0L, postCount);
        this.query = query == null || query.isBlank() ? this.title : query;
    }

    public String getId() {
        return id;
    }

    public String getTitle() {
        return title;
    }

    public String getCategory() {
        return category;
    }

    public long getPostCount() {
        return postCount;
    }

    public String getQuery() {
        return query;
    }
}
