package com.aycom.explore.collab;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryKeyValueStore implements KeyValueStore {
    private final ConcurrentHashMap<String, String> values = new ConcurrentHashMap<>();

    @Override
    public Optional<String> get(String key) {
        if (key == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(values.get(key));
    }

    @Override
    public void set(String key, String value) {
        if (key == null) {
            return;
        }
        if (value == null) {
            values.remove(key);
            return;
        }
        values.put(key, value);
    }
}
