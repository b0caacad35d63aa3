package com.aycom.explore.fanout;

import com.aycom.explore.model.CategoryTag;
import com.aycom.explore.model.ErrorKind;
import com.aycom.explore.model.PageState;
import com.aycom.explore.model.SearchToken;
import com.aycom.explore.provider.ProviderKind;

public final class ProviderOutcome<T> {
    private final ProviderKind provider;
    private final CategoryTag category;
    private final SearchToken token;
    private final PageState requested;
    private final T value;
    private final ErrorKind error;
    private final String errorMessage;
    private final boolean stale;
    private final long tookMs;

    private ProviderOutcome(
        ProviderKind provider,
        CategoryTag category,
        SearchToken token,
        PageState requested,
        T value,
        ErrorKind error,
        String errorMessage,
        boolean stale,
        long tookMs
    ) {
        this.provider = provider;
        this.category = category;
        this.token = token;
        this.requested = requested;
        this.value = value;
        this.error = error;
        this.errorMessage = errorMessage;
        this.stale = stale;
        this.tookMs = tookMs;
    }

    public static <T> ProviderOutcome<T> success(ProviderCall<T> call, SearchToken token, T value, long tookMs) {
        return new ProviderOutcome<>(
            call.getProvider(),
            call.getCategory(),
            token,
            call.getRequested(),
            value,
            null,
            null,
            false,
            tookMs
        );
    }

    /**
     * A failed call still carries the call's empty default so fan-in consumers never see null.
     */
    public static <T> ProviderOutcome<T> failure(
        ProviderCall<T> call,
        SearchToken token,
        ErrorKind error,
        String errorMessage,
        long tookMs
    ) {
        return new ProviderOutcome<>(
            call.getProvider(),
            call.getCategory(),
            token,
            call.getRequested(),
            call.getEmptyDefault(),
            error,
            errorMessage,
            false,
            tookMs
        );
    }

    public ProviderOutcome<T> asStale() {
        return new ProviderOutcome<>(provider, category, token, requested, value, error, errorMessage, true, tookMs);
    }

    public ProviderKind getProvider() {
        return provider;
    }

    public CategoryTag getCategory() {
        return category;
    }

    public SearchToken getToken() {
        return token;
    }

    public PageState getRequested() {
        return requested;
    }

    public T getValue() {
        return value;
    }

    public ErrorKind getError() {
        return error;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public boolean isSuccess() {
        return error == null;
    }

    public boolean isStale() {
        return stale;
    }

    public long getTookMs() {
        return tookMs;
    }
}
