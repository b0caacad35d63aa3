package com.aycom.explore.fanout;

import com.aycom.explore.model.CategoryTag;
import com.aycom.explore.model.PageState;
import com.aycom.explore.provider.ProviderKind;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.Objects;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * One upstream request together with its normalizer and the value used in place of a failed
 * response. {@code category} is null for auxiliary lookups (trending tags, facet list) that do
 * not back a result stream.
 */
public final class ProviderCall<T> {
    private final ProviderKind provider;
    private final CategoryTag category;
    private final PageState requested;
    private final Supplier<JsonNode> invocation;
    private final Function<JsonNode, T> normalizer;
    private final T emptyDefault;
    private final long timeoutMs;

    public ProviderCall(
        ProviderKind provider,
        CategoryTag category,
        PageState requested,
        Supplier<JsonNode> invocation,
        Function<JsonNode, T> normalizer,
        T emptyDefault,
        long timeoutMs
    ) {
        this.provider = Objects.requireNonNull(provider, "provider");
        this.category = category == null ? null : category.stream();
        this.requested = requested;
        this.invocation = Objects.requireNonNull(invocation, "invocation");
        this.normalizer = Objects.requireNonNull(normalizer, "normalizer");
        this.emptyDefault = emptyDefault;
        this.timeoutMs = timeoutMs;
    }

    public ProviderKind getProvider() {
        return provider;
    }

    public CategoryTag getCategory() {
        return category;
    }

    public PageState getRequested() {
        return requested;
    }

    public Supplier<JsonNode> getInvocation() {
        return invocation;
    }

    public Function<JsonNode, T> getNormalizer() {
        return normalizer;
    }

    public T getEmptyDefault() {
        return emptyDefault;
    }

    public long getTimeoutMs() {
        return timeoutMs;
    }
}
