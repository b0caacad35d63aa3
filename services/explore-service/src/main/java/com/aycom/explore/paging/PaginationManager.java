package com.aycom.explore.paging;

import com.aycom.explore.model.CategoryTag;
import com.aycom.explore.model.PageState;
import java.util.EnumMap;
import java.util.Map;

/**
 * Owns the page state of each result stream. Page changes are clamped to the last known
 * page count; results recompute the count and clamp again.
 *
 * <p>The media stream scrolls instead of paging: {@link #nextMediaPage()} advances a counter
 * whose results are appended by the caller.
 */
public class PaginationManager {
    private final Map<CategoryTag, Integer> defaultPerPage;
    private final Map<CategoryTag, PageState> states = new EnumMap<>(CategoryTag.class);

    public PaginationManager(Map<CategoryTag, Integer> defaultPerPage) {
        this.defaultPerPage = new EnumMap<>(CategoryTag.class);
        for (CategoryTag stream : CategoryTag.streams()) {
            Integer perPage = defaultPerPage == null ? null : defaultPerPage.get(stream);
            this.defaultPerPage.put(stream, perPage == null ? 10 : Math.max(1, perPage));
        }
        resetAll();
    }

    public synchronized PageState get(CategoryTag category) {
        return states.get(category.stream());
    }

    public synchronized int defaultPerPage(CategoryTag category) {
        return defaultPerPage.get(category.stream());
    }

    /**
     * Target state for a page change; the page is clamped to the known page count.
     */
    public synchronized PageState requestPage(CategoryTag category, int page) {
        return get(category).withPage(page);
    }

    /**
     * Changing the page size always returns to the first page.
     */
    public synchronized PageState requestPerPage(CategoryTag category, int perPage) {
        PageState next = get(category).withPerPage(perPage);
        states.put(category.stream(), next);
        return next;
    }

    /**
     * Records a response for {@code requested}, returning the state with the recomputed page
     * count.
     */
    public synchronized PageState applyTotal(CategoryTag category, PageState requested, long totalCount) {
        PageState applied = PageState.of(requested.getPage(), requested.getPerPage(), totalCount);
        states.put(category.stream(), applied);
        return applied;
    }

    /**
     * Media scroll position after one more page is appended. The stored page is the last
     * page successfully loaded.
     */
    public synchronized PageState nextMediaPage() {
        PageState current = states.get(CategoryTag.MEDIA);
        return PageState.of(current.getPage() + 1, current.getPerPage(), Math.max(
            current.getTotalCount(),
            (long) (current.getPage() + 1) * current.getPerPage()
        ));
    }

    public synchronized PageState firstPage(CategoryTag category) {
        PageState current = states.get(category.stream());
        PageState first = PageState.first(current == null ? defaultPerPage(category) : current.getPerPage());
        states.put(category.stream(), first);
        return first;
    }

    public synchronized void resetAll() {
        for (CategoryTag stream : CategoryTag.streams()) {
            PageState current = states.get(stream);
            int perPage = current == null ? defaultPerPage.get(stream) : current.getPerPage();
            states.put(stream, PageState.first(perPage));
        }
    }
}
