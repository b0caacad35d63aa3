package com.aycom.explore.model;

import java.util.Objects;

public final class CommunityResult {
    private final String id;
    private final String name;
    private final String description;
    private final String logoUrl;
    private final long memberCount;
    private final boolean joined;
    private final boolean pending;

    public CommunityResult(
        String id,
        String name,
        String description,
        String logoUrl,
        long memberCount,
        boolean joined,
        boolean pending
    ) {
        this.id = Objects.requireNonNull(id, "id");
        this.name = name == null ? "" : name;
        this.description = description;
        this.logoUrl = logoUrl;
        this.memberCount = Math.max(0L, memberCount);
        this.joined = joined;
        this.pending = pending;
    }

    public CommunityResult withMembership(MembershipStatus status) {
        if (status == null) {
            return this;
        }
        boolean isJoined = status == MembershipStatus.JOINED;
        boolean isPending = status == MembershipStatus.PENDING;
        if (isJoined == joined && isPending == pending) {
            return this;
        }
        return new CommunityResult(id, name, description, logoUrl, memberCount, isJoined, isPending);
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    public String getLogoUrl() {
        return logoUrl;
    }

    public long getMemberCount() {
        return memberCount;
    }

    public boolean isJoined() {
        return joined;
    }

    public boolean isPending() {
        return pending;
    }
}
