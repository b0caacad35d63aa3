package com.aycom.explore.model;

import java.util.Objects;

public final class ProfileResult {
    private final String id;
    private final String username;
    private final String displayName;
    private final String avatarUrl;
    private final String bio;
    private final boolean verified;
    private final long followerCount;
    private final boolean following;
    private final Double relevanceScore;

    public ProfileResult(
        String id,
        String username,
        String displayName,
        String avatarUrl,
        String bio,
        boolean verified,
        long followerCount,
        boolean following,
        Double relevanceScore
    ) {
        this.id = Objects.requireNonNull(id, "id");
        this.username = username == null ? "" : username;
        this.displayName = displayName == null ? "" : displayName;
        this.avatarUrl = avatarUrl;
        this.bio = bio;
        this.verified = verified;
        this.followerCount = Math.max(0L, followerCount);
        this.following = following;
        this.relevanceScore = relevanceScore;
    }

    public ProfileResult withRelevanceScore(double score) {
        return new ProfileResult(id, username, displayName, avatarUrl, bio, verified, followerCount, following, score);
    }

    public ProfileResult withFollowing(boolean value) {
        if (value == following) {
            return this;
        }
        return new ProfileResult(id, username, displayName, avatarUrl, bio, verified, followerCount, value, relevanceScore);
    }

    public String getId() {
        return id;
    }

    public String getUsername() {
        return username;
    }

    public String getDisplayName() {
        return displayName;
    }

    public String getAvatarUrl() {
        return avatarUrl;
    }

    public String getBio() {
        return bio;
    }

    public boolean isVerified() {
        return verified;
    }

    public long getFollowerCount() {
        return followerCount;
    }

    public boolean isFollowing() {
        return following;
    }

    public Double getRelevanceScore() {
        return relevanceScore;
    }

    @Override
    public String toString() {
        return "ProfileResult{id=" + id + ", username=" + username + ", score=" + relevanceScore + "}";
    }
}
