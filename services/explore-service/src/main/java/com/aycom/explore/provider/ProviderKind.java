package com.aycom.explore.provider;

public enum ProviderKind {
    PROFILE_SEARCH("profile_search"),
    PROFILE_LIST("profile_list"),
    THREAD_SEARCH_TOP("thread_search_top"),
    THREAD_SEARCH_LATEST("thread_search_latest"),
    MEDIA_SEARCH("media_search"),
    COMMUNITY_SEARCH("community_search"),
    COMMUNITY_LIST("community_list"),
    TRENDING_TAGS("trending_tags"),
    HASHTAG_THREADS("hashtag_threads"),
    CATEGORIES("categories");

    private final String metricName;

    ProviderKind(String metricName) {
        this.metricName = metricName;
    }

    public String getMetricName() {
        return metricName;
    }
}
