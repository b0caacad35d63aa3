package com.aycom.explore.query;

import com.aycom.explore.collab.ToastNotifier;
import com.aycom.explore.model.CategoryTag;
import com.aycom.explore.model.Filter;
import com.aycom.explore.model.QuerySnapshot;
import com.aycom.explore.model.RecentSearchEntry;
import com.aycom.explore.model.SearchToken;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns the current query inputs and decides when an input event becomes an execution.
 *
 * <p>Typing is debounced. Submit executes immediately, and so do facet changes once a search is
 * active or a keystroke is waiting on its timer. Otherwise tab and filter changes only reload
 * default browse data.
 * Calls into the {@link ExecutionHandler} happen while this coordinator's monitor is held, so
 * the handler must never call back into the coordinator from another lock.
 */
public class QueryCoordinator {
    private static final Logger log = LoggerFactory.getLogger(QueryCoordinator.class);

    public static final String SEARCH_FAILED_MESSAGE = "Search failed";

    private final ExecutionHandler handler;
    private final SearchTokenSequence tokens;
    private final Debouncer debouncer;
    private final RecentSearches recentSearches;
    private final ToastNotifier toastNotifier;
    private final int minQueryLength;

    private String text = "";
    private Filter filter = Filter.ALL;
    private CategoryTag tab = CategoryTag.TRENDING;
    private String contentCategory;
    private String hashtag;
    private boolean searchActive;
    private long inputVersion;
    private SearchToken lastSearchToken = SearchToken.NONE;

    public QueryCoordinator(
        ExecutionHandler handler,
        SearchTokenSequence tokens,
        Debouncer debouncer,
        RecentSearches recentSearches,
        ToastNotifier toastNotifier,
        int minQueryLength
    ) {
        this.handler = Objects.requireNonNull(handler, "handler");
        this.tokens = tokens;
        this.debouncer = debouncer;
        this.recentSearches = recentSearches;
        this.toastNotifier = toastNotifier;
        this.minQueryLength = Math.max(1, minQueryLength);
    }

    public synchronized void onInput(String value) {
        text = value == null ? "" : value;
        long version = ++inputVersion;
        if (!isSearchable(text)) {
            debouncer.cancel();
            if (searchActive) {
                searchActive = false;
                handler.onSearchInactive();
            }
            return;
        }
        debouncer.schedule(() -> fireDebounced(version));
    }

    public synchronized void onSubmit() {
        debouncer.cancel();
        inputVersion++;
        execute();
    }

    public synchronized void onFilterChange(Filter value) {
        Filter next = value == null ? Filter.ALL : value;
        if (next == filter) {
            return;
        }
        filter = next;
        refresh();
    }

    public synchronized void onCategoryChange(CategoryTag value) {
        CategoryTag next = value == null ? CategoryTag.TRENDING : value;
        if (next == tab) {
            return;
        }
        tab = next;
        refresh();
    }

    public synchronized void onContentCategoryChange(String value) {
        String next = value == null || value.isBlank() ? null : value.trim();
        if (Objects.equals(next, contentCategory)) {
            return;
        }
        contentCategory = next;
        refresh();
    }

    /**
     * Browses threads for a trending hashtag. Any active search is left, since hashtag browsing
     * is a default-mode view of the shared Trending/Latest stream.
     */
    public synchronized void onHashtagSelect(String value) {
        String next = value == null ? null : value.trim();
        debouncer.cancel();
        inputVersion++;
        hashtag = next == null || next.isEmpty() ? null : next;
        tab = CategoryTag.TRENDING;
        if (searchActive) {
            leaveSearch();
        }
        handler.loadDefaults(snapshot());
    }

    public synchronized void onClear() {
        debouncer.cancel();
        inputVersion++;
        text = "";
        hashtag = null;
        if (searchActive) {
            leaveSearch();
        }
        handler.loadDefaults(snapshot());
    }

    /**
     * Records the query as a recent search once its fan-out has settled, unless a newer full
     * search has been issued in the meantime.
     */
    public synchronized void onExecutionSettled(SearchToken token, QuerySnapshot query) {
        if (token == null || !token.equals(lastSearchToken) || !searchActive) {
            return;
        }
        if (isSearchable(query.getText())) {
            recentSearches.push(query.getTrimmedText());
        }
    }

    public synchronized QuerySnapshot snapshot() {
        return new QuerySnapshot(text, filter, tab, contentCategory, hashtag);
    }

    public synchronized boolean isSearchActive() {
        return searchActive;
    }

    public synchronized SearchToken getLastSearchToken() {
        return lastSearchToken;
    }

    public List<RecentSearchEntry> recentSearches() {
        return recentSearches.list();
    }

    public void clearRecentSearches() {
        recentSearches.clear();
    }

    private void fireDebounced(long version) {
        synchronized (this) {
            if (version != inputVersion) {
                log.debug("debounced input superseded version={} current={}", version, inputVersion);
                return;
            }
            execute();
        }
    }

    /**
     * Applies a facet change. Pending keystrokes are folded into this execution instead of
     * firing a second one when their timer expires.
     */
    private void refresh() {
        boolean typing = debouncer.isPending();
        debouncer.cancel();
        inputVersion++;
        if ((searchActive || typing) && isSearchable(text)) {
            execute();
        } else {
            handler.loadDefaults(snapshot());
        }
    }

    private void execute() {
        if (!isSearchable(text)) {
            log.debug("query below threshold minLength={} length={}", minQueryLength, text.trim().length());
            return;
        }
        hashtag = null;
        searchActive = true;
        SearchToken token = tokens.issue(CategoryTag.streams());
        lastSearchToken = token;
        QuerySnapshot query = snapshot();
        try {
            handler.executeSearch(token, query);
        } catch (RuntimeException e) {
            log.error("search execution failed token={} query={}", token, query, e);
            toastNotifier.error(SEARCH_FAILED_MESSAGE);
        }
    }

    private void leaveSearch() {
        searchActive = false;
        handler.onSearchInactive();
    }

    private boolean isSearchable(String value) {
        return value != null && value.trim().length() >= minQueryLength;
    }
}
