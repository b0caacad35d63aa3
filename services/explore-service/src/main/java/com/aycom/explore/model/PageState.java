package com.aycom.explore.model;

public final class PageState {
    private final int page;
    private final int perPage;
    private final long totalCount;
    private final int totalPages;

    private PageState(int page, int perPage, long totalCount, int totalPages) {
        this.page = page;
        this.perPage = perPage;
        this.totalCount = totalCount;
        this.totalPages = totalPages;
    }

    /**
     * Builds a state that satisfies {@code totalPages = max(1, ceil(totalCount / perPage))} and
     * {@code 1 <= page <= totalPages}; out-of-range inputs are clamped.
     */
    public static PageState of(int page, int perPage, long totalCount) {
        int safePerPage = Math.max(1, perPage);
        long safeTotal = Math.max(0L, totalCount);
        int totalPages = totalPages(safeTotal, safePerPage);
        int safePage = Math.min(Math.max(1, page), totalPages);
        return new PageState(safePage, safePerPage, safeTotal, totalPages);
    }

    public static PageState first(int perPage) {
        return of(1, perPage, 0L);
    }

    public static int totalPages(long totalCount, int perPage) {
        if (totalCount <= 0) {
            return 1;
        }
        long pages = (totalCount + perPage - 1) / perPage;
        return (int) Math.min(Integer.MAX_VALUE, Math.max(1L, pages));
    }

    public PageState withPage(int newPage) {
        return of(newPage, perPage, totalCount);
    }

    public PageState withPerPage(int newPerPage) {
        return of(1, newPerPage, totalCount);
    }

    public PageState withTotalCount(long newTotalCount) {
        return of(page, perPage, newTotalCount);
    }

    public int getPage() {
        return page;
    }

    public int getPerPage() {
        return perPage;
    }

    public long getTotalCount() {
        return totalCount;
    }

    public int getTotalPages() {
        return totalPages;
    }

    public boolean hasNextPage() {
        return page < totalPages;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof PageState that)) {
            return false;
        }
        return page == that.page && perPage == that.perPage
            && totalCount == that.totalCount && totalPages == that.totalPages;
    }

    @Override
    public int hashCode() {
        int result = Integer.hashCode(page);
        result = 31 * result + Integer.hashCode(perPage);
        result = 31 * result + Long.hashCode(totalCount);
        return 31 * result + Integer.hashCode(totalPages);
    }

    @Override
    public String toString() {
        return "PageState{page=" + page + ", perPage=" + perPage + ", totalCount=" + totalCount
            + ", totalPages=" + totalPages + "}";
    }
}
