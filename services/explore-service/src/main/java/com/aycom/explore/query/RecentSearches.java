package com.aycom.explore.query;

import com.aycom.explore.collab.AuthStateProvider;
import com.aycom.explore.collab.CurrentUser;
import com.aycom.explore.collab.KeyValueStore;
import com.aycom.explore.model.RecentSearchEntry;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Most recent search texts, newest first, deduplicated ignoring case and capped at
 * {@value #MAX_ENTRIES}. Persisted as JSON through the key-value store, one key per user.
 */
public class RecentSearches {
    private static final Logger log = LoggerFactory.getLogger(RecentSearches.class);
    private static final TypeReference<List<RecentSearchEntry>> LIST_TYPE = new TypeReference<>() {};

    public static final int MAX_ENTRIES = 3;
    static final String STORAGE_KEY = "explore.recent_searches";

    private final KeyValueStore store;
    private final ObjectMapper objectMapper;
    private final AuthStateProvider authStateProvider;
    private final Clock clock;

    public RecentSearches(
        KeyValueStore store,
        ObjectMapper objectMapper,
        AuthStateProvider authStateProvider,
        Clock clock
    ) {
        this.store = store;
        this.objectMapper = objectMapper;
        this.authStateProvider = authStateProvider;
        this.clock = clock;
    }

    public synchronized List<RecentSearchEntry> list() {
        Optional<String> payload = store.get(storageKey());
        if (payload.isEmpty() || payload.get().isBlank()) {
            return List.of();
        }
        try {
            List<RecentSearchEntry> entries = objectMapper.readValue(payload.get(), LIST_TYPE);
            if (entries == null) {
                return List.of();
            }
            return List.copyOf(entries.subList(0, Math.min(MAX_ENTRIES, entries.size())));
        } catch (JsonProcessingException e) {
            log.warn("recent searches unreadable key={} error={}", storageKey(), e.getMessage());
            return List.of();
        }
    }

    public synchronized List<RecentSearchEntry> push(String text) {
        String normalized = text == null ? "" : text.trim();
        if (normalized.isEmpty()) {
            return list();
        }
        String dedupKey = normalized.toLowerCase(Locale.ROOT);
        List<RecentSearchEntry> updated = new ArrayList<>(MAX_ENTRIES);
        updated.add(new RecentSearchEntry(normalized, clock.instant()));
        for (RecentSearchEntry entry : list()) {
            if (updated.size() >= MAX_ENTRIES) {
                break;
            }
            if (!entry.getText().trim().toLowerCase(Locale.ROOT).equals(dedupKey)) {
                updated.add(entry);
            }
        }
        persist(updated);
        return List.copyOf(updated);
    }

    public synchronized void clear() {
        persist(List.of());
    }

    private void persist(List<RecentSearchEntry> entries) {
        try {
            store.set(storageKey(), objectMapper.writeValueAsString(entries));
        } catch (JsonProcessingException e) {
            log.warn("recent searches not persisted key={} error={}", storageKey(), e.getMessage());
        }
    }

    String storageKey() {
        Optional<CurrentUser> user = authStateProvider.getCurrentUser();
        return user.map(current -> STORAGE_KEY + ":" + current.getId()).orElse(STORAGE_KEY);
    }
}
