package com.aycom.explore.normalize;

import java.util.List;

/**
 * One normalized page of a provider response.
 */
public final class ResultPage<T> {
    private final List<T> items;
    private final long totalCount;

    public ResultPage(List<T> items, long totalCount) {
        this.items = items == null ? List.of() : List.copyOf(items);
        this.totalCount = Math.max(this.items.size(), Math.max(0L, totalCount));
    }

    public static <T> ResultPage<T> empty() {
        return new ResultPage<>(List.of(), 0L);
    }

    public List<T> getItems() {
        return items;
    }

    public long getTotalCount() {
        return totalCount;
    }

    public boolean isEmpty() {
        return items.isEmpty();
    }
}
