package com.aycom.explore.cache;

import com.aycom.explore.model.CategoryResultSet;
import com.aycom.explore.model.CategoryTag;
import com.aycom.explore.model.ErrorKind;
import com.aycom.explore.model.PageState;
import com.aycom.explore.model.SearchToken;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Last known good result set per stream. Writers present the token of the execution that
 * produced the data; anything older than the token already applied to that stream is
 * ignored, so a slow response can never overwrite a fresher one.
 */
public class CategoryResultCache {
    private static final Logger log = LoggerFactory.getLogger(CategoryResultCache.class);

    private final Map<CategoryTag, CategoryResultSet<?>> sets = new EnumMap<>(CategoryTag.class);
    private final Map<CategoryTag, SearchToken> lastApplied = new EnumMap<>(CategoryTag.class);
    private final Map<CategoryTag, SearchToken> pending = new EnumMap<>(CategoryTag.class);

    public CategoryResultCache(Map<CategoryTag, Integer> perPageByStream) {
        for (CategoryTag stream : CategoryTag.streams()) {
            Integer perPage = perPageByStream == null ? null : perPageByStream.get(stream);
            sets.put(stream, CategoryResultSet.empty(perPage == null ? 10 : perPage));
            lastApplied.put(stream, SearchToken.NONE);
            pending.put(stream, SearchToken.NONE);
        }
    }

    @SuppressWarnings("unchecked")
    public synchronized <T> CategoryResultSet<T> get(CategoryTag category) {
        return (CategoryResultSet<T>) sets.get(category.stream());
    }

    public synchronized boolean isLoading(CategoryTag category) {
        return sets.get(category.stream()).isLoading();
    }

    public synchronized boolean markLoading(CategoryTag category, SearchToken token) {
        CategoryTag stream = category.stream();
        if (isStale(stream, token)) {
            return false;
        }
        if (pending.get(stream).isOlderThan(token)) {
            pending.put(stream, token);
        }
        sets.put(stream, sets.get(stream).markLoading());
        return true;
    }

    /**
     * Replaces the stream's items and clears its error.
     *
     * @return false when the token lost the ordering race
     */
    public synchronized <T> boolean applySuccess(
        CategoryTag category,
        SearchToken token,
        List<T> items,
        PageState pagination
    ) {
        CategoryTag stream = category.stream();
        if (isStale(stream, token)) {
            log.debug("ignored stale result stream={} token={} applied={}", stream, token, lastApplied.get(stream));
            return false;
        }
        lastApplied.put(stream, token);
        sets.put(stream, new CategoryResultSet<>(items, pagination, stillLoading(stream, token), null, token));
        return true;
    }

    /**
     * Appends to the stream's items, used by infinite scroll.
     */
    public synchronized <T> boolean applyAppend(
        CategoryTag category,
        SearchToken token,
        List<T> items,
        PageState pagination
    ) {
        CategoryTag stream = category.stream();
        if (isStale(stream, token)) {
            log.debug("ignored stale append stream={} token={} applied={}", stream, token, lastApplied.get(stream));
            return false;
        }
        CategoryResultSet<T> current = get(stream);
        List<T> merged = new ArrayList<>(current.getItems().size() + items.size());
        merged.addAll(current.getItems());
        merged.addAll(items);
        lastApplied.put(stream, token);
        sets.put(stream, new CategoryResultSet<>(merged, pagination, stillLoading(stream, token), null, token));
        return true;
    }

    /**
     * Keeps the previous items and pagination, records the error and clears the loading flag.
     */
    public synchronized boolean applyFailure(CategoryTag category, SearchToken token, ErrorKind error) {
        CategoryTag stream = category.stream();
        if (isStale(stream, token)) {
            log.debug("ignored stale failure stream={} token={} applied={}", stream, token, lastApplied.get(stream));
            return false;
        }
        lastApplied.put(stream, token);
        CategoryResultSet<?> failed = sets.get(stream).failed(error, token);
        if (stillLoading(stream, token)) {
            failed = failed.markLoading();
        }
        sets.put(stream, failed);
        return true;
    }

    private boolean isStale(CategoryTag stream, SearchToken token) {
        return token == null || token.isOlderThan(lastApplied.get(stream));
    }

    private boolean stillLoading(CategoryTag stream, SearchToken token) {
        return token.isOlderThan(pending.get(stream));
    }
}
