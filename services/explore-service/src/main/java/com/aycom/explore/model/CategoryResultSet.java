package com.aycom.explore.model;

import java.util.List;
import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * Last known state of one result stream. Instances are immutable; the result cache swaps
 * them as responses arrive.
 */
public final class CategoryResultSet<T> {
    private final List<T> items;
    private final PageState pagination;
    private final boolean loading;
    private final ErrorKind lastError;
    private final SearchToken token;

    public CategoryResultSet(
        List<T> items,
        PageState pagination,
        boolean loading,
        ErrorKind lastError,
        SearchToken token
    ) {
        this.items = items == null ? List.of() : List.copyOf(items);
        this.pagination = Objects.requireNonNull(pagination, "pagination");
        this.loading = loading;
        this.lastError = lastError;
        this.token = token == null ? SearchToken.NONE : token;
    }

    public static <T> CategoryResultSet<T> empty(int perPage) {
        return new CategoryResultSet<>(List.of(), PageState.first(perPage), false, null, SearchToken.NONE);
    }

    public CategoryResultSet<T> markLoading() {
        return new CategoryResultSet<>(items, pagination, true, lastError, token);
    }

    public CategoryResultSet<T> failed(ErrorKind error, SearchToken failedToken) {
        return new CategoryResultSet<>(items, pagination, false, error, failedToken);
    }

    public CategoryResultSet<T> mapItems(UnaryOperator<T> mapper) {
        return new CategoryResultSet<>(items.stream().map(mapper).toList(), pagination, loading, lastError, token);
    }

    public List<T> getItems() {
        return items;
    }

    public PageState getPagination() {
        return pagination;
    }

    public boolean isLoading() {
        return loading;
    }

    public ErrorKind getLastError() {
        return lastError;
    }

    public SearchToken getToken() {
        return token;
    }

    public boolean hasMore() {
        return items.size() < pagination.getTotalCount();
    }
}
