package com.aycom.explore.collab;

import java.util.Optional;

public interface AuthStateProvider {
    Optional<CurrentUser> getCurrentUser();

    static AuthStateProvider anonymous() {
        return Optional::empty;
    }
}
