package com.aycom.explore.fanout;

import com.aycom.explore.model.CategoryTag;
import com.aycom.explore.model.ErrorKind;
import com.aycom.explore.model.SearchToken;
import com.aycom.explore.normalize.EmptyResponseException;
import com.aycom.explore.normalize.MalformedResponseException;
import com.aycom.explore.provider.ProviderKind;
import com.aycom.explore.query.SearchTokenSequence;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs provider calls concurrently on the provider pool. Every call is isolated: any
 * exception or timeout turns into a failed {@link ProviderOutcome} carrying
 * the call's empty default. Outcomes whose token has been superseded for their stream are
 * dropped before they reach the listener.
 */
public class FanOutExecutor {
    private static final Logger log = LoggerFactory.getLogger(FanOutExecutor.class);

    private final ExecutorService providerExecutor;
    private final SearchTokenSequence tokens;
    private final MeterRegistry meterRegistry;

    public FanOutExecutor(ExecutorService providerExecutor, SearchTokenSequence tokens, MeterRegistry meterRegistry) {
        this.providerExecutor = providerExecutor;
        this.tokens = tokens;
        this.meterRegistry = meterRegistry;
    }

    /**
     * Submits every call and returns immediately.
     *
     * @throws java.util.concurrent.RejectedExecutionException if the provider pool refuses work
     */
    public FanOutExecution execute(SearchToken token, List<ProviderCall<?>> calls, OutcomeListener listener) {
        Map<ProviderKind, CompletableFuture<ProviderOutcome<?>>> outcomes = new LinkedHashMap<>();
        Map<ProviderKind, CategoryTag> categories = new LinkedHashMap<>();
        for (ProviderCall<?> call : calls) {
            outcomes.put(call.getProvider(), submit(token, call, listener));
            categories.put(call.getProvider(), call.getCategory());
        }
        return new FanOutExecution(token, outcomes, categories);
    }

    private <T> CompletableFuture<ProviderOutcome<?>> submit(
        SearchToken token,
        ProviderCall<T> call,
        OutcomeListener listener
    ) {
        long started = System.nanoTime();
        CompletableFuture<JsonNode> payload = CompletableFuture.supplyAsync(call.getInvocation(), providerExecutor);
        if (call.getTimeoutMs() > 0) {
            payload = payload.orTimeout(call.getTimeoutMs(), TimeUnit.MILLISECONDS);
        }
        return payload
            .thenApply(body -> normalize(call, body))
            .handle((value, error) -> {
                long tookMs = (System.nanoTime() - started) / 1_000_000L;
                if (error == null) {
                    return ProviderOutcome.success(call, token, value, tookMs);
                }
                ErrorKind kind = classify(error);
                log.warn(
                    "provider call failed provider={} token={} kind={} tookMs={} error={}",
                    call.getProvider().getMetricName(),
                    token,
                    kind,
                    tookMs,
                    errorMessage(error)
                );
                return ProviderOutcome.failure(call, token, kind, errorMessage(error), tookMs);
            })
            .thenApply(outcome -> deliver(outcome, listener));
    }

    private <T> T normalize(ProviderCall<T> call, JsonNode body) {
        if (body == null || body.isNull() || body.isMissingNode()) {
            throw new EmptyResponseException(call.getProvider().getMetricName() + " returned no payload");
        }
        return call.getNormalizer().apply(body);
    }

    private ProviderOutcome<?> deliver(ProviderOutcome<?> outcome, OutcomeListener listener) {
        String provider = outcome.getProvider().getMetricName();
        if (outcome.getCategory() != null && !tokens.isCurrent(outcome.getCategory(), outcome.getToken())) {
            meterRegistry.counter("explore.provider.stale_discarded", "provider", provider).increment();
            log.debug(
                "discarded stale outcome provider={} token={} latest={} tookMs={}",
                provider,
                outcome.getToken(),
                tokens.latest(outcome.getCategory()),
                outcome.getTookMs()
            );
            return outcome.asStale();
        }
        String result = outcome.isSuccess() ? "success" : outcome.getError().name().toLowerCase(Locale.ROOT);
        meterRegistry.counter("explore.provider.calls", "provider", provider, "outcome", result).increment();
        if (listener != null) {
            try {
                listener.onOutcome(outcome);
            } catch (RuntimeException e) {
                log.error("outcome listener failed provider={} token={}", provider, outcome.getToken(), e);
            }
        }
        return outcome;
    }

    static ErrorKind classify(Throwable error) {
        Throwable cause = unwrap(error);
        if (cause instanceof TimeoutException) {
            return ErrorKind.UPSTREAM_TIMEOUT;
        }
        if (cause instanceof EmptyResponseException) {
            return ErrorKind.EMPTY_RESPONSE;
        }
        if (cause instanceof MalformedResponseException
            || cause instanceof JsonProcessingException
            || cause instanceof ClassCastException
            || cause instanceof IllegalArgumentException) {
            return ErrorKind.MALFORMED_RESPONSE;
        }
        return ErrorKind.NETWORK;
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
            && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static String errorMessage(Throwable error) {
        Throwable cause = unwrap(error);
        if (cause == null) {
            return null;
        }
        String message = cause.getMessage();
        return message == null ? cause.getClass().getSimpleName() : message;
    }
}
