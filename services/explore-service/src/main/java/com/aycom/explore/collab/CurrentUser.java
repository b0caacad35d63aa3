package com.aycom.explore.collab;

import java.util.Objects;

public final class CurrentUser {
    private final String id;
    private final String username;
    private final String accessToken;

    public CurrentUser(String id, String username, String accessToken) {
        this.id = Objects.requireNonNull(id, "id");
        this.username = username;
        this.accessToken = accessToken;
    }

    public String getId() {
        return id;
    }

    public String getUsername() {
        return username;
    }

    public String getAccessToken() {
        return accessToken;
    }

    public boolean hasAccessToken() {
        return accessToken != null && !accessToken.isBlank();
    }
}
