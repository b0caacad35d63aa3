package com.aycom.explore.collab;

import java.util.Optional;

/**
 * Client-side key-value persistence (browser storage or equivalent).
 */
public interface KeyValueStore {
    Optional<String> get(String key);

    void set(String key, String value);
}
