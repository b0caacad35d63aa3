package com.aycom.explore.model;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

public final class ThreadResult {
    private final String id;
    private final String content;
    private final String authorUsername;
    private final String authorDisplayName;
    private final String authorAvatarUrl;
    private final Instant createdAt;
    private final long likeCount;
    private final long replyCount;
    private final long repostCount;
    private final List<MediaRef> media;

    public ThreadResult(
        String id,
        String content,
        String authorUsername,
        String authorDisplayName,
        String authorAvatarUrl,
        Instant createdAt,
        long likeCount,
        long replyCount,
        long repostCount,
        List<MediaRef> media
    ) {
        this.id = Objects.requireNonNull(id, "id");
        this.content = content == null ? "" : content;
        this.authorUsername = authorUsername == null ? "" : authorUsername;
        this.authorDisplayName = authorDisplayName == null ? "" : authorDisplayName;
        this.authorAvatarUrl = authorAvatarUrl;
        this.createdAt = createdAt == null ? Instant.now() : createdAt;
        this.likeCount = Math.max(0L, likeCount);
        this.replyCount = Math.max(0L, replyCount);
        this.repostCount = Math.max(0L, repostCount);
        this.media = media == null ? List.of() : List.copyOf(media);
    }

    public String getId() {
        return id;
    }

    public String getContent() {
        return content;
    }

    public String getAuthorUsername() {
        return authorUsername;
    }

    public String getAuthorDisplayName() {
        return authorDisplayName;
    }

    public String getAuthorAvatarUrl() {
        return authorAvatarUrl;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public long getLikeCount() {
        return likeCount;
    }

    public long getReplyCount() {
        return replyCount;
    }

    public long getRepostCount() {
        return repostCount;
    }

    public List<MediaRef> getMedia() {
        return media;
    }

    public boolean hasMedia() {
        return !media.isEmpty();
    }
}
