package com.aycom.explore.session;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Client-side status overrides keyed by entity id, such as a follow toggled after the
 * results were fetched. Read accessors overlay these onto the cached items.
 */
public class EntityStatusStore<S> {
    private final Map<String, S> statuses = new ConcurrentHashMap<>();

    public Optional<S> get(String id) {
        if (id == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(statuses.get(id));
    }

    public void set(String id, S status) {
        if (id == null) {
            return;
        }
        if (status == null) {
            statuses.remove(id);
        } else {
            statuses.put(id, status);
        }
    }
}
