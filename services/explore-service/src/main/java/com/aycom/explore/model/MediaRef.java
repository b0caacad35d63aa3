package com.aycom.explore.model;

import java.util.Objects;

public final class MediaRef {
    private final String url;
    private final MediaType type;

    public MediaRef(String url, MediaType type) {
        this.url = Objects.requireNonNull(url, "url");
        this.type = type == null ? MediaType.IMAGE : type;
    }

    public String getUrl() {
        return url;
    }

    public MediaType getType() {
        return type;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof MediaRef that)) {
            return false;
        }
        return url.equals(that.url) && type == that.type;
    }

    @Override
    public int hashCode() {
        return Objects.hash(url, type);
    }
}
