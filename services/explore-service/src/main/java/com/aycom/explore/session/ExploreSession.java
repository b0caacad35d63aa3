package com.aycom.explore.session;

import com.aycom.explore.cache.CategoryResultCache;
import com.aycom.explore.collab.ToastNotifier;
import com.aycom.explore.fanout.FanOutExecution;
import com.aycom.explore.fanout.FanOutExecutor;
import com.aycom.explore.fanout.ProviderCall;
import com.aycom.explore.fanout.ProviderOutcome;
import com.aycom.explore.model.CategoryFacet;
import com.aycom.explore.model.CategoryResultSet;
import com.aycom.explore.model.CategoryTag;
import com.aycom.explore.model.CommunityResult;
import com.aycom.explore.model.ErrorKind;
import com.aycom.explore.model.Filter;
import com.aycom.explore.model.MembershipStatus;
import com.aycom.explore.model.PageState;
import com.aycom.explore.model.ProfileResult;
import com.aycom.explore.model.QuerySnapshot;
import com.aycom.explore.model.RecentSearchEntry;
import com.aycom.explore.model.SearchToken;
import com.aycom.explore.model.ThreadResult;
import com.aycom.explore.model.TrendingTag;
import com.aycom.explore.normalize.ResultPage;
import com.aycom.explore.paging.PaginationManager;
import com.aycom.explore.query.Debouncer;
import com.aycom.explore.query.ExecutionHandler;
import com.aycom.explore.query.QueryCoordinator;
import com.aycom.explore.query.RecentSearches;
import com.aycom.explore.query.SearchTokenSequence;
import com.aycom.explore.relevance.RelevanceScorer;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One explore page, holding the query inputs and the five result streams plus browse data.
 *
 * <p>State changes are serialized on the session lock. Input events go through the
 * {@link QueryCoordinator} first, which may call back into this session; the session never
 * calls the coordinator while holding its own lock. Listener callbacks are queued under the
 * lock and delivered in order after it is released, by one thread at a time.
 */
public class ExploreSession implements ExecutionHandler, AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ExploreSession.class);

    private final Object lock = new Object();
    private final ProviderCallFactory calls;
    private final FanOutExecutor fanOut;
    private final SearchTokenSequence tokens;
    private final CategoryResultCache cache;
    private final PaginationManager pagination;
    private final RelevanceScorer scorer;
    private final ToastNotifier toastNotifier;
    private final Debouncer debouncer;
    private final QueryCoordinator coordinator;
    private final int trendingLimit;

    private final EntityStatusStore<Boolean> followStatus = new EntityStatusStore<>();
    private final EntityStatusStore<MembershipStatus> membershipStatus = new EntityStatusStore<>();
    private final List<ExploreStateListener> listeners = new CopyOnWriteArrayList<>();
    private final Map<CategoryTag, StreamRequest> lastRequests = new EnumMap<>(CategoryTag.class);
    private final Map<CategoryTag, SearchToken> appendTokens = new EnumMap<>(CategoryTag.class);
    private final Deque<Runnable> pendingNotifications = new ArrayDeque<>();

    private List<ProfileResult> recommendations = List.of();
    private List<TrendingTag> trendingTags = List.of();
    private List<CategoryFacet> contentCategories = List.of();
    private QuerySnapshot currentQuery = QuerySnapshot.empty();
    private boolean searchMode;
    private boolean closed;
    private boolean dispatching;

    public ExploreSession(
        ProviderCallFactory calls,
        FanOutExecutor fanOut,
        SearchTokenSequence tokens,
        CategoryResultCache cache,
        PaginationManager pagination,
        RelevanceScorer scorer,
        Debouncer debouncer,
        RecentSearches recentSearches,
        ToastNotifier toastNotifier,
        int minQueryLength,
        int trendingLimit
    ) {
        this.calls = calls;
        this.fanOut = fanOut;
        this.tokens = tokens;
        this.cache = cache;
        this.pagination = pagination;
        this.scorer = scorer;
        this.toastNotifier = toastNotifier;
        this.debouncer = debouncer;
        this.trendingLimit = trendingLimit;
        this.coordinator = new QueryCoordinator(this, tokens, debouncer, recentSearches, toastNotifier, minQueryLength);
    }

    /**
     * Loads the content category facets and the default data of the initial tab.
     */
    public void open() {
        synchronized (lock) {
            submitAuxiliary(calls.categories());
        }
        loadDefaults(coordinator.snapshot());
    }

    // input events

    public void onInput(String text) {
        coordinator.onInput(text);
    }

    public void onSubmit() {
        coordinator.onSubmit();
    }

    public void onFilterChange(Filter filter) {
        coordinator.onFilterChange(filter);
    }

    public void onCategoryChange(CategoryTag tab) {
        coordinator.onCategoryChange(tab);
    }

    public void onContentCategoryChange(String categoryId) {
        coordinator.onContentCategoryChange(categoryId);
    }

    public void onHashtagSelect(String hashtag) {
        coordinator.onHashtagSelect(hashtag);
    }

    public void onClear() {
        coordinator.onClear();
    }

    public QuerySnapshot query() {
        return coordinator.snapshot();
    }

    public boolean isSearchActive() {
        return coordinator.isSearchActive();
    }

    public List<RecentSearchEntry> recentSearches() {
        return coordinator.recentSearches();
    }

    public void clearRecentSearches() {
        coordinator.clearRecentSearches();
    }

    // paging

    /**
     * Refetches one stream at {@code page}, clamped to the known page count.
     *
     * @return false when the stream is already loading or has nothing to fetch
     */
    public boolean changePage(CategoryTag tab, int page) {
        try {
            synchronized (lock) {
                CategoryTag stream = tab.stream();
                if (cache.isLoading(stream)) {
                    log.debug("page change ignored while loading stream={}", stream);
                    return false;
                }
                return refetch(stream, lastRequestOrCurrent(stream).withPage(pagination.requestPage(stream, page)));
            }
        } finally {
            dispatchNotifications();
        }
    }

    public boolean changePerPage(CategoryTag tab, int perPage) {
        try {
            synchronized (lock) {
                CategoryTag stream = tab.stream();
                if (cache.isLoading(stream)) {
                    log.debug("per-page change ignored while loading stream={}", stream);
                    return false;
                }
                return refetch(stream, lastRequestOrCurrent(stream).withPage(pagination.requestPerPage(stream, perPage)));
            }
        } finally {
            dispatchNotifications();
        }
    }

    /**
     * Fetches the next media page and appends it. Only applies to a settled media search
     * that still has unloaded items.
     */
    public boolean loadMoreMedia() {
        try {
            synchronized (lock) {
                if (cache.isLoading(CategoryTag.MEDIA)) {
                    log.debug("media load more ignored while loading");
                    return false;
                }
                StreamRequest last = lastRequests.get(CategoryTag.MEDIA);
                if (last == null || !last.search || !cache.get(CategoryTag.MEDIA).hasMore()) {
                    return false;
                }
                return refetch(CategoryTag.MEDIA, new StreamRequest(last.query, pagination.nextMediaPage(), true, true));
            }
        } finally {
            dispatchNotifications();
        }
    }

    /**
     * Re-issues the last call of one stream with its original query and page.
     */
    public boolean retry(CategoryTag tab) {
        try {
            synchronized (lock) {
                CategoryTag stream = tab.stream();
                StreamRequest last = lastRequests.get(stream);
                if (last == null || cache.isLoading(stream)) {
                    return false;
                }
                return refetch(stream, last);
            }
        } finally {
            dispatchNotifications();
        }
    }

    // entity status

    public void markFollowing(String userId, boolean following) {
        try {
            synchronized (lock) {
                followStatus.set(userId, following);
                notifyResults(CategoryTag.PEOPLE);
                notifyRecommendations();
            }
        } finally {
            dispatchNotifications();
        }
    }

    public void markMembership(String communityId, MembershipStatus status) {
        try {
            synchronized (lock) {
                membershipStatus.set(communityId, status);
                notifyResults(CategoryTag.COMMUNITIES);
            }
        } finally {
            dispatchNotifications();
        }
    }

    // read accessors

    public CategoryResultSet<ProfileResult> people() {
        synchronized (lock) {
            CategoryResultSet<ProfileResult> people = cache.get(CategoryTag.PEOPLE);
            return people.mapItems(this::overlayFollow);
        }
    }

    public CategoryResultSet<ThreadResult> latest() {
        return cache.get(CategoryTag.LATEST);
    }

    /**
     * Same stream as {@link #latest()}.
     */
    public CategoryResultSet<ThreadResult> trending() {
        return cache.get(CategoryTag.TRENDING);
    }

    public CategoryResultSet<ThreadResult> top() {
        return cache.get(CategoryTag.TOP);
    }

    public CategoryResultSet<ThreadResult> media() {
        return cache.get(CategoryTag.MEDIA);
    }

    public CategoryResultSet<CommunityResult> communities() {
        synchronized (lock) {
            CategoryResultSet<CommunityResult> communities = cache.get(CategoryTag.COMMUNITIES);
            return communities.mapItems(this::overlayMembership);
        }
    }

    public CategoryResultSet<?> results(CategoryTag tab) {
        switch (tab.stream()) {
            case PEOPLE:
                return people();
            case COMMUNITIES:
                return communities();
            default:
                return cache.get(tab);
        }
    }

    public PageState pagination(CategoryTag tab) {
        return pagination.get(tab);
    }

    public List<ProfileResult> recommendedProfiles() {
        synchronized (lock) {
            return overlayFollowAll(recommendations);
        }
    }

    public List<TrendingTag> trendingTags() {
        synchronized (lock) {
            return trendingTags;
        }
    }

    public List<CategoryFacet> contentCategories() {
        synchronized (lock) {
            return contentCategories;
        }
    }

    int pendingAppendCount() {
        synchronized (lock) {
            return appendTokens.size();
        }
    }

    public ExploreSubscription subscribe(ExploreStateListener listener) {
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    @Override
    public void close() {
        debouncer.cancel();
        synchronized (lock) {
            closed = true;
            listeners.clear();
            pendingNotifications.clear();
        }
    }

    // execution handler

    @Override
    public void executeSearch(SearchToken token, QuerySnapshot query) {
        FanOutExecution execution;
        try {
            synchronized (lock) {
                currentQuery = query;
                searchMode = true;
                pagination.resetAll();
                appendTokens.clear();
                List<ProviderCall<?>> batch = new ArrayList<>();
                for (CategoryTag stream : CategoryTag.streams()) {
                    PageState page = pagination.get(stream);
                    lastRequests.put(stream, new StreamRequest(query, page, true, false));
                    cache.markLoading(stream, token);
                    batch.add(calls.searchCall(stream, query, page));
                }
                CategoryTag.streams().forEach(this::notifyResults);
                try {
                    execution = fanOut.execute(token, batch, this::applyOutcome);
                } catch (RuntimeException e) {
                    for (CategoryTag stream : CategoryTag.streams()) {
                        if (cache.applyFailure(stream, token, ErrorKind.NETWORK)) {
                            notifyResults(stream);
                        }
                    }
                    throw e;
                }
            }
        } finally {
            dispatchNotifications();
        }
        log.debug("search issued token={} query={} calls={}", token, query, execution.size());
        execution.whenAll().thenRun(() -> coordinator.onExecutionSettled(token, query));
    }

    @Override
    public void loadDefaults(QuerySnapshot query) {
        try {
            synchronized (lock) {
                currentQuery = query;
                searchMode = false;
                CategoryTag stream = query.getTab().stream();
                switch (stream) {
                    case PEOPLE:
                    case COMMUNITIES:
                        refetch(stream, new StreamRequest(query, pagination.firstPage(stream), false, false));
                        break;
                    case LATEST:
                        submitAuxiliary(calls.trendingTags(trendingLimit));
                        if (query.getHashtag() != null) {
                            refetch(stream, new StreamRequest(query, pagination.firstPage(stream), false, false));
                        }
                        break;
                    case TOP:
                        submitAuxiliary(calls.trendingTags(trendingLimit));
                        break;
                    default:
                        log.debug("no default data stream={}", stream);
                        break;
                }
            }
        } finally {
            dispatchNotifications();
        }
    }

    @Override
    public void onSearchInactive() {
        try {
            synchronized (lock) {
                searchMode = false;
                if (!recommendations.isEmpty()) {
                    recommendations = List.of();
                    notifyRecommendations();
                }
            }
        } finally {
            dispatchNotifications();
        }
    }

    // outcome handling

    void applyOutcome(ProviderOutcome<?> outcome) {
        try {
            synchronized (lock) {
                if (closed) {
                    return;
                }
                CategoryTag stream = outcome.getCategory();
                if (stream == null) {
                    applyAuxiliary(outcome);
                    return;
                }
                SearchToken token = outcome.getToken();
                boolean append = token.equals(appendTokens.get(stream));
            if (append) {
                appendTokens.remove(stream);
            }
                if (!outcome.isSuccess()) {
                    if (cache.applyFailure(stream, token, outcome.getError())) {
                        notifyResults(stream);
                    }
                    return;
                }
                ResultPage<?> page = (ResultPage<?>) outcome.getValue();
                PageState requested = outcome.getRequested();
                PageState applied = PageState.of(requested.getPage(), requested.getPerPage(), page.getTotalCount());
                if (stream == CategoryTag.PEOPLE) {
                    applyPeople(token, page, applied);
                    return;
                }
                boolean accepted = append
                    ? cache.applyAppend(stream, token, page.getItems(), applied)
                    : cache.applySuccess(stream, token, page.getItems(), applied);
                if (accepted) {
                    pagination.applyTotal(stream, requested, page.getTotalCount());
                    notifyResults(stream);
                }
            }
        } finally {
            dispatchNotifications();
        }
    }

    @SuppressWarnings("unchecked")
    private void applyPeople(SearchToken token, ResultPage<?> page, PageState applied) {
        List<ProfileResult> profiles = (List<ProfileResult>) page.getItems();
        StreamRequest request = lastRequests.get(CategoryTag.PEOPLE);
        boolean scored = request != null && request.search;
        String text = scored ? request.query.getTrimmedText() : "";
        if (scored) {
            profiles = scorer.annotate(text, profiles);
        }
        if (!cache.applySuccess(CategoryTag.PEOPLE, token, profiles, applied)) {
            return;
        }
        pagination.applyTotal(CategoryTag.PEOPLE, applied, page.getTotalCount());
        notifyResults(CategoryTag.PEOPLE);
        if (scored && searchMode) {
            recommendations = scorer.rank(text, profiles);
            notifyRecommendations();
        }
    }

    @SuppressWarnings("unchecked")
    private void applyAuxiliary(ProviderOutcome<?> outcome) {
        if (!outcome.isSuccess()) {
            log.debug(
                "keeping previous {} after {} message={}",
                outcome.getProvider().getMetricName(),
                outcome.getError(),
                outcome.getErrorMessage()
            );
            return;
        }
        switch (outcome.getProvider()) {
            case TRENDING_TAGS:
                List<TrendingTag> tags = List.copyOf((List<TrendingTag>) outcome.getValue());
                trendingTags = tags;
                enqueue(listener -> listener.onTrendingTagsChanged(tags));
                break;
            case CATEGORIES:
                List<CategoryFacet> facets = List.copyOf((List<CategoryFacet>) outcome.getValue());
                contentCategories = facets;
                enqueue(listener -> listener.onContentCategoriesChanged(facets));
                break;
            default:
                log.warn("unexpected auxiliary outcome provider={}", outcome.getProvider());
                break;
        }
    }

    private boolean refetch(CategoryTag stream, StreamRequest request) {
        ProviderCall<?> call = request.search
            ? calls.searchCall(stream, request.query, request.page)
            : calls.defaultCall(stream, request.query, request.page);
        if (call == null) {
            return false;
        }
        SearchToken token = tokens.issue(List.of(stream));
        lastRequests.put(stream, request);
        cache.markLoading(stream, token);
        if (request.append) {
            appendTokens.put(stream, token);
        } else {
            appendTokens.remove(stream);
        }
        notifyResults(stream);
        try {
            fanOut.execute(token, List.of(call), this::applyOutcome);
            return true;
        } catch (RuntimeException e) {
            log.error("refetch could not be scheduled stream={} token={}", stream, token, e);
            appendTokens.remove(stream);
            if (cache.applyFailure(stream, token, ErrorKind.NETWORK)) {
                notifyResults(stream);
            }
            toastNotifier.error(QueryCoordinator.SEARCH_FAILED_MESSAGE);
            return false;
        }
    }

    private void submitAuxiliary(ProviderCall<?> call) {
        SearchToken token = tokens.issue(List.of());
        try {
            fanOut.execute(token, List.of(call), this::applyOutcome);
        } catch (RuntimeException e) {
            log.error("lookup could not be scheduled provider={}", call.getProvider().getMetricName(), e);
        }
    }

    private StreamRequest lastRequestOrCurrent(CategoryTag stream) {
        StreamRequest last = lastRequests.get(stream);
        if (last != null) {
            return last;
        }
        return new StreamRequest(currentQuery, pagination.get(stream), searchMode, false);
    }

    private ProfileResult overlayFollow(ProfileResult profile) {
        return followStatus.get(profile.getId()).map(profile::withFollowing).orElse(profile);
    }

    private List<ProfileResult> overlayFollowAll(List<ProfileResult> profiles) {
        return profiles.stream().map(this::overlayFollow).toList();
    }

    private CommunityResult overlayMembership(CommunityResult community) {
        return membershipStatus.get(community.getId()).map(community::withMembership).orElse(community);
    }

    private void notifyResults(CategoryTag stream) {
        if (listeners.isEmpty()) {
            return;
        }
        CategoryResultSet<?> snapshot = results(stream);
        enqueue(listener -> listener.onResultsChanged(stream, snapshot));
    }

    private void notifyRecommendations() {
        if (listeners.isEmpty()) {
            return;
        }
        List<ProfileResult> snapshot = overlayFollowAll(recommendations);
        enqueue(listener -> listener.onRecommendationsChanged(snapshot));
    }

    // caller holds the lock
    private void enqueue(Consumer<ExploreStateListener> callback) {
        for (ExploreStateListener listener : listeners) {
            pendingNotifications.add(() -> callback.accept(listener));
        }
    }

    /**
     * Delivers queued callbacks outside the session lock. A thread that finds another one
     * already delivering leaves its callbacks to that thread, which drains until the queue is
     * empty, so a listener may call back into the session or the coordinator.
     */
    private void dispatchNotifications() {
        synchronized (lock) {
            if (dispatching || pendingNotifications.isEmpty()) {
                return;
            }
            dispatching = true;
        }
        boolean drained = false;
        try {
            while (!drained) {
                Runnable next;
                synchronized (lock) {
                    next = pendingNotifications.poll();
                    if (next == null) {
                        dispatching = false;
                        drained = true;
                        continue;
                    }
                }
                notifySafely(next);
            }
        } finally {
            if (!drained) {
                synchronized (lock) {
                    dispatching = false;
                }
            }
        }
    }

    private static void notifySafely(Runnable callback) {
        try {
            callback.run();
        } catch (RuntimeException e) {
            log.error("explore listener failed", e);
        }
    }

    private static final class StreamRequest {
        private final QuerySnapshot query;
        private final PageState page;
        private final boolean search;
        private final boolean append;

        private StreamRequest(QuerySnapshot query, PageState page, boolean search, boolean append) {
            this.query = query;
            this.page = page;
            this.search = search;
            this.append = append;
        }

        private StreamRequest withPage(PageState next) {
            return new StreamRequest(query, next, search, false);
        }
    }
}
