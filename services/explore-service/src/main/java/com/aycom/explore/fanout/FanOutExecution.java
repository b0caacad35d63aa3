package com.aycom.explore.fanout;

import com.aycom.explore.model.CategoryTag;
import com.aycom.explore.model.SearchToken;
import com.aycom.explore.provider.ProviderKind;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Handle on one fan-out. Each provider completes independently; {@link #whenAll()} is the
 * fan-in. Futures never complete exceptionally.
 */
public final class FanOutExecution {
    private final SearchToken token;
    private final Map<ProviderKind, CompletableFuture<ProviderOutcome<?>>> outcomes;
    private final Map<ProviderKind, CategoryTag> categories;
    private final CompletableFuture<List<ProviderOutcome<?>>> all;

    FanOutExecution(
        SearchToken token,
        Map<ProviderKind, CompletableFuture<ProviderOutcome<?>>> outcomes,
        Map<ProviderKind, CategoryTag> categories
    ) {
        this.token = token;
        this.outcomes = Collections.unmodifiableMap(new LinkedHashMap<>(outcomes));
        this.categories = Collections.unmodifiableMap(new LinkedHashMap<>(categories));
        CompletableFuture<?>[] futures = this.outcomes.values().toArray(new CompletableFuture<?>[0]);
        this.all = CompletableFuture.allOf(futures).thenApply(ignored -> {
            List<ProviderOutcome<?>> collected = new ArrayList<>(this.outcomes.size());
            for (CompletableFuture<ProviderOutcome<?>> future : this.outcomes.values()) {
                collected.add(future.join());
            }
            return collected;
        });
    }

    public SearchToken getToken() {
        return token;
    }

    public Optional<CompletableFuture<ProviderOutcome<?>>> forProvider(ProviderKind provider) {
        return Optional.ofNullable(outcomes.get(provider));
    }

    public Optional<CompletableFuture<ProviderOutcome<?>>> forCategory(CategoryTag category) {
        for (Map.Entry<ProviderKind, CategoryTag> entry : categories.entrySet()) {
            if (entry.getValue() == category.stream()) {
                return Optional.of(outcomes.get(entry.getKey()));
            }
        }
        return Optional.empty();
    }

    public CompletableFuture<List<ProviderOutcome<?>>> whenAll() {
        return all;
    }

    public int size() {
        return outcomes.size();
    }
}
