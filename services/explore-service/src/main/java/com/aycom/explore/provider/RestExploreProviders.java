package com.aycom.explore.provider;

import com.aycom.explore.collab.AuthStateProvider;
import com.aycom.explore.collab.CurrentUser;
import com.aycom.explore.model.Filter;
import com.aycom.explore.normalize.MalformedResponseException;
import com.fasterxml.jackson.databind.JsonNode;
import java.net.URI;
import java.util.List;
import java.util.Optional;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

@Component
public class RestExploreProviders implements ExploreProviders {
    private final RestTemplate restTemplate;
    private final UpstreamProperties properties;
    private final AuthStateProvider authStateProvider;

    public RestExploreProviders(
        @Qualifier("upstreamRestTemplate") RestTemplate restTemplate,
        UpstreamProperties properties,
        AuthStateProvider authStateProvider
    ) {
        this.restTemplate = restTemplate;
        this.properties = properties;
        this.authStateProvider = authStateProvider;
    }

    @Override
    public JsonNode searchProfiles(String query, int page, int perPage, Filter filter, String sort) {
        UriComponentsBuilder uri = builder("/users/search")
            .queryParam("query", truncate(query, properties.getMaxProfileQueryLength()))
            .queryParam("page", page)
            .queryParam("limit", perPage);
        if (filter != null) {
            uri.queryParam("filter", filter.getWireValue());
        }
        if (sort != null && !sort.isBlank()) {
            uri.queryParam("sort", sort);
        }
        return get(uri, "profile search");
    }

    @Override
    public JsonNode listProfiles(int page, int perPage) {
        UriComponentsBuilder uri = builder("/users")
            .queryParam("page", page)
            .queryParam("limit", perPage)
            .queryParam("sort_by", "created_at")
            .queryParam("ascending", false);
        return get(uri, "profile list");
    }

    @Override
    public JsonNode searchThreads(
        String query,
        int page,
        int perPage,
        Filter filter,
        String category,
        ThreadSort sortBy
    ) {
        UriComponentsBuilder uri = threadQuery("/threads/search", query, page, perPage, filter, category);
        if (sortBy != null) {
            uri.queryParam("sort", sortBy.getWireValue());
        }
        return get(uri, "thread search");
    }

    @Override
    public JsonNode searchThreadsWithMedia(String query, int page, int perPage, Filter filter, String category) {
        return get(threadQuery("/threads/search/media", query, page, perPage, filter, category), "media search");
    }

    @Override
    public JsonNode searchCommunities(String query, int page, int perPage) {
        UriComponentsBuilder uri = builder("/communities/search")
            .queryParam("q", query)
            .queryParam("page", page)
            .queryParam("limit", perPage);
        return get(uri, "community search");
    }

    @Override
    public JsonNode listCommunities(int page, int perPage) {
        UriComponentsBuilder uri = builder("/communities")
            .queryParam("page", page)
            .queryParam("limit", perPage);
        return get(uri, "community list");
    }

    @Override
    public JsonNode getTrendingTags(int limit) {
        return get(builder("/trends").queryParam("limit", limit), "trending tags");
    }

    @Override
    public JsonNode getThreadsByHashtag(String tag, int page, int perPage) {
        String normalized = tag == null ? "" : tag.trim();
        if (normalized.startsWith("#")) {
            normalized = normalized.substring(1);
        }
        UriComponentsBuilder uri = builder("/threads/hashtag")
            .pathSegment(normalized)
            .queryParam("page", page)
            .queryParam("limit", perPage);
        return get(uri, "hashtag threads");
    }

    @Override
    public JsonNode getCategories() {
        return get(builder("/communities/categories"), "categories");
    }

    private UriComponentsBuilder threadQuery(
        String path,
        String query,
        int page,
        int perPage,
        Filter filter,
        String category
    ) {
        UriComponentsBuilder uri = builder(path)
            .queryParam("q", query)
            .queryParam("page", page)
            .queryParam("limit", perPage);
        if (filter != null) {
            uri.queryParam("filter", filter.getWireValue());
        }
        if (category != null && !category.isBlank()) {
            uri.queryParam("category", category);
        }
        return uri;
    }

    private JsonNode get(UriComponentsBuilder uri, String operation) {
        URI target = uri.encode().build().toUri();
        HttpEntity<Void> entity = new HttpEntity<>(headers());
        try {
            ResponseEntity<JsonNode> response = restTemplate.exchange(target, HttpMethod.GET, entity, JsonNode.class);
            return response.getBody();
        } catch (ResourceAccessException e) {
            throw new ProviderException(operation + " unavailable", e);
        } catch (HttpStatusCodeException e) {
            throw new ProviderException(operation + " error: " + e.getStatusCode(), e.getStatusCode().value(), e);
        } catch (RestClientException e) {
            throw new MalformedResponseException(operation + " returned an unreadable payload", e);
        }
    }

    private HttpHeaders headers() {
        HttpHeaders headers = new HttpHeaders();
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        Optional<CurrentUser> user = authStateProvider.getCurrentUser();
        if (user.isPresent() && user.get().hasAccessToken()) {
            headers.setBearerAuth(user.get().getAccessToken());
        }
        return headers;
    }

    private UriComponentsBuilder builder(String path) {
        String base = properties.getBaseUrl();
        if (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return UriComponentsBuilder.fromHttpUrl(base + path);
    }

    private static String truncate(String value, int maxLength) {
        if (value == null || maxLength <= 0 || value.length() <= maxLength) {
            return value;
        }
        return value.substring(0, maxLength);
    }
}
