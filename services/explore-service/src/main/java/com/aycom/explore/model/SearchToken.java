package com.aycom.explore.model;

/**
 * Identifies one execution against one or more result streams. Issued from a strictly
 * increasing sequence, so a larger value always belongs to a newer execution.
 */
public final class SearchToken implements Comparable<SearchToken> {
    public static final SearchToken NONE = new SearchToken(0L);

    private final long value;

    public SearchToken(long value) {
        if (value < 0) {
            throw new IllegalArgumentException("token must be non-negative");
        }
        this.value = value;
    }

    public long getValue() {
        return value;
    }

    public boolean isOlderThan(SearchToken other) {
        return other != null && value < other.value;
    }

    @Override
    public int compareTo(SearchToken other) {
        return Long.compare(value, other.value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SearchToken that)) {
            return false;
        }
        return value == that.value;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(value);
    }

    @Override
    public String toString() {
        return "T" + value;
    }
}
