package com.aycom.explore.query;

import static org.assertj.core.api.Assertions.assertThat;

import com.aycom.explore.collab.AuthStateProvider;
import com.aycom.explore.collab.CurrentUser;
import com.aycom.explore.collab.InMemoryKeyValueStore;
import com.aycom.explore.model.RecentSearchEntry;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class RecentSearchesTest {
    private final ObjectMapper mapper = JsonMapper.builder().findAndAddModules().build();
    private final Clock clock = Clock.fixed(Instant.parse("2024-05-01T12:00:00Z"), ZoneOffset.UTC);
    private final InMemoryKeyValueStore store = new InMemoryKeyValueStore();

    @Test
    void keepsNewestThreeWithoutCaseInsensitiveDuplicates() {
        RecentSearches recent = new RecentSearches(store, mapper, AuthStateProvider.anonymous(), clock);

        recent.push("rust");
        recent.push("java");
        recent.push("go");
        recent.push("RUST ");
        List<RecentSearchEntry> entries = recent.push("kotlin");

        assertThat(entries).extracting(RecentSearchEntry::getText).containsExactly("kotlin", "RUST", "go");
        assertThat(recent.list()).extracting(RecentSearchEntry::getText).containsExactly("kotlin", "RUST", "go");
    }

    @Test
    void persistsJsonUnderUserScopedKey() {
        AuthStateProvider auth = () -> Optional.of(new CurrentUser("42", "ferris", "token"));
        RecentSearches recent = new RecentSearches(store, mapper, auth, clock);

        recent.push("rust");

        assertThat(store.get(RecentSearches.STORAGE_KEY + ":42")).hasValueSatisfying(json ->
            assertThat(json).contains("\"text\":\"rust\"").contains("\"saved_at\""));
        assertThat(store.get(RecentSearches.STORAGE_KEY)).isEmpty();
        assertThat(recent.list().get(0).getSavedAt()).isEqualTo(clock.instant());
    }

    @Test
    void unreadableStorageIsTreatedAsEmpty() {
        store.set(RecentSearches.STORAGE_KEY, "{not json");
        RecentSearches recent = new RecentSearches(store, mapper, AuthStateProvider.anonymous(), clock);

        assertThat(recent.list()).isEmpty();
        assertThat(recent.push("rust")).hasSize(1);
    }

    @Test
    void clearEmptiesTheList() {
        RecentSearches recent = new RecentSearches(store, mapper, AuthStateProvider.anonymous(), clock);
        recent.push("rust");

        recent.clear();

        assertThat(recent.list()).isEmpty();
    }
}
