package com.aycom.explore.session;

import com.aycom.explore.fanout.ProviderCall;
import com.aycom.explore.model.CategoryFacet;
import com.aycom.explore.model.CategoryTag;
import com.aycom.explore.model.CommunityResult;
import com.aycom.explore.model.PageState;
import com.aycom.explore.model.ProfileResult;
import com.aycom.explore.model.QuerySnapshot;
import com.aycom.explore.model.ThreadResult;
import com.aycom.explore.model.TrendingTag;
import com.aycom.explore.normalize.ResultNormalizer;
import com.aycom.explore.normalize.ResultPage;
import com.aycom.explore.provider.ExploreProviders;
import com.aycom.explore.provider.ProviderKind;
import com.aycom.explore.provider.ThreadSort;
import com.aycom.explore.provider.UpstreamProperties;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Maps a result stream and query onto the upstream call that fills it.
 */
public class ProviderCallFactory {
    static final String PROFILE_SORT = "relevance";

    private final ExploreProviders providers;
    private final ResultNormalizer normalizer;
    private final UpstreamProperties upstream;

    public ProviderCallFactory(ExploreProviders providers, ResultNormalizer normalizer, UpstreamProperties upstream) {
        this.providers = providers;
        this.normalizer = normalizer;
        this.upstream = upstream;
    }

    public ProviderCall<?> searchCall(CategoryTag category, QuerySnapshot query, PageState page) {
        String text = query.getTrimmedText();
        switch (category.stream()) {
            case PEOPLE:
                return profiles(ProviderKind.PROFILE_SEARCH, page, () -> providers.searchProfiles(
                    text, page.getPage(), page.getPerPage(), query.getFilter(), PROFILE_SORT
                ));
            case TOP:
                return threads(ProviderKind.THREAD_SEARCH_TOP, CategoryTag.TOP, page, () -> providers.searchThreads(
                    text, page.getPage(), page.getPerPage(), query.getFilter(), query.getContentCategory(),
                    ThreadSort.POPULAR
                ));
            case LATEST:
                return threads(ProviderKind.THREAD_SEARCH_LATEST, CategoryTag.LATEST, page, () -> providers.searchThreads(
                    text, page.getPage(), page.getPerPage(), query.getFilter(), query.getContentCategory(),
                    ThreadSort.RECENT
                ));
            case MEDIA:
                return threads(ProviderKind.MEDIA_SEARCH, CategoryTag.MEDIA, page, () -> providers.searchThreadsWithMedia(
                    text, page.getPage(), page.getPerPage(), query.getFilter(), query.getContentCategory()
                ));
            case COMMUNITIES:
                return communities(ProviderKind.COMMUNITY_SEARCH, page, () -> providers.searchCommunities(
                    text, page.getPage(), page.getPerPage()
                ));
            default:
                throw new IllegalArgumentException("no search call for " + category);
        }
    }

    /**
     * Browse-mode call for a stream, or null when the stream has no default data.
     */
    public ProviderCall<?> defaultCall(CategoryTag category, QuerySnapshot query, PageState page) {
        switch (category.stream()) {
            case PEOPLE:
                return profiles(ProviderKind.PROFILE_LIST, page,
                    () -> providers.listProfiles(page.getPage(), page.getPerPage()));
            case COMMUNITIES:
                return communities(ProviderKind.COMMUNITY_LIST, page,
                    () -> providers.listCommunities(page.getPage(), page.getPerPage()));
            case LATEST:
                if (query.getHashtag() == null) {
                    return null;
                }
                return threads(ProviderKind.HASHTAG_THREADS, CategoryTag.LATEST, page,
                    () -> providers.getThreadsByHashtag(query.getHashtag(), page.getPage(), page.getPerPage()));
            default:
                return null;
        }
    }

    public ProviderCall<List<TrendingTag>> trendingTags(int limit) {
        return auxiliary(ProviderKind.TRENDING_TAGS, () -> providers.getTrendingTags(limit), normalizer::trendingTags);
    }

    public ProviderCall<List<CategoryFacet>> categories() {
        return auxiliary(ProviderKind.CATEGORIES, providers::getCategories, normalizer::categories);
    }

    private ProviderCall<ResultPage<ProfileResult>> profiles(
        ProviderKind kind,
        PageState page,
        Supplier<JsonNode> invocation
    ) {
        return new ProviderCall<>(kind, CategoryTag.PEOPLE, page, invocation,
            body -> normalizer.profiles(body, page), ResultPage.empty(), timeoutMs(kind));
    }

    private ProviderCall<ResultPage<ThreadResult>> threads(
        ProviderKind kind,
        CategoryTag category,
        PageState page,
        Supplier<JsonNode> invocation
    ) {
        return new ProviderCall<>(kind, category, page, invocation,
            body -> normalizer.threads(body, page), ResultPage.empty(), timeoutMs(kind));
    }

    private ProviderCall<ResultPage<CommunityResult>> communities(
        ProviderKind kind,
        PageState page,
        Supplier<JsonNode> invocation
    ) {
        return new ProviderCall<>(kind, CategoryTag.COMMUNITIES, page, invocation,
            body -> normalizer.communities(body, page), ResultPage.empty(), timeoutMs(kind));
    }

    private <T> ProviderCall<List<T>> auxiliary(
        ProviderKind kind,
        Supplier<JsonNode> invocation,
        Function<JsonNode, List<T>> normalize
    ) {
        return new ProviderCall<>(kind, null, null, invocation, normalize, List.of(), timeoutMs(kind));
    }

    private long timeoutMs(ProviderKind kind) {
        return upstream.resolveCallTimeoutMs(kind);
    }
}
