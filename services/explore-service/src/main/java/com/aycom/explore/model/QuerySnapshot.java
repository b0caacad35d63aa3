package com.aycom.explore.model;

/**
 * Immutable view of the query inputs at the moment an execution was issued.
 */
public final class QuerySnapshot {
    private final String text;
    private final Filter filter;
    private final CategoryTag tab;
    private final String contentCategory;
    private final String hashtag;

    public QuerySnapshot(String text, Filter filter, CategoryTag tab, String contentCategory, String hashtag) {
        this.text = text == null ? "" : text;
        this.filter = filter == null ? Filter.ALL : filter;
        this.tab = tab == null ? CategoryTag.TRENDING : tab;
        this.contentCategory = contentCategory == null || contentCategory.isBlank() ? null : contentCategory;
        this.hashtag = hashtag == null || hashtag.isBlank() ? null : hashtag;
    }

    public static QuerySnapshot empty() {
        return new QuerySnapshot("", Filter.ALL, CategoryTag.TRENDING, null, null);
    }

    public String getText() {
        return text;
    }

    public String getTrimmedText() {
        return text.trim();
    }

    public Filter getFilter() {
        return filter;
    }

    public CategoryTag getTab() {
        return tab;
    }

    public String getContentCategory() {
        return contentCategory;
    }

    public String getHashtag() {
        return hashtag;
    }

    @Override
    public String toString() {
        return "QuerySnapshot{text='" + text + "', filter=" + filter + ", tab=" + tab
            + ", contentCategory=" + contentCategory + ", hashtag=" + hashtag + "}";
    }
}
