package com.aycom.explore.provider;

import com.aycom.explore.model.Filter;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Upstream calls the explore engine fans out to. Implementations return the raw payload;
 * shape differences are resolved by the normalizer. Any method may throw or hang.
 */
public interface ExploreProviders {
    JsonNode searchProfiles(String query, int page, int perPage, Filter filter, String sort);

    /** All users, newest first. Backs the People tab before anything is searched. */
    JsonNode listProfiles(int page, int perPage);

    JsonNode searchThreads(String query, int page, int perPage, Filter filter, String category, ThreadSort sortBy);

    JsonNode searchThreadsWithMedia(String query, int page, int perPage, Filter filter, String category);

    JsonNode searchCommunities(String query, int page, int perPage);

    JsonNode listCommunities(int page, int perPage);

    JsonNode getTrendingTags(int limit);

    JsonNode getThreadsByHashtag(String tag, int page, int perPage);

    JsonNode getCategories();
}
