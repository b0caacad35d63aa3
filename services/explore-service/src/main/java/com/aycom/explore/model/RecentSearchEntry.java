package com.aycom.explore.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.util.Objects;

public final class RecentSearchEntry {
    private final String text;
    private final Instant savedAt;

    @JsonCreator
    public RecentSearchEntry(
        @JsonProperty("text") String text,
        @JsonProperty("saved_at") Instant savedAt
    ) {
        this.text = Objects.requireNonNull(text, "text");
        this.savedAt = savedAt == null ? Instant.EPOCH : savedAt;
    }

    @JsonProperty("text")
    public String getText() {
        return text;
    }

    @JsonProperty("saved_at")
    public Instant getSavedAt() {
        return savedAt;
    }
}
