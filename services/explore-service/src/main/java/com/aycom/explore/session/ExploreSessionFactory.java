package com.aycom.explore.session;

import com.aycom.explore.cache.CategoryResultCache;
import com.aycom.explore.collab.AuthStateProvider;
import com.aycom.explore.collab.KeyValueStore;
import com.aycom.explore.collab.ToastNotifier;
import com.aycom.explore.config.ExploreProperties;
import com.aycom.explore.fanout.FanOutExecutor;
import com.aycom.explore.model.CategoryTag;
import com.aycom.explore.normalize.ResultNormalizer;
import com.aycom.explore.paging.PaginationManager;
import com.aycom.explore.provider.ExploreProviders;
import com.aycom.explore.provider.UpstreamProperties;
import com.aycom.explore.query.Debouncer;
import com.aycom.explore.query.RecentSearches;
import com.aycom.explore.query.SearchTokenSequence;
import com.aycom.explore.relevance.RelevanceScorer;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ScheduledExecutorService;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * Opens independent explore sessions that share the provider pool, the debounce scheduler and
 * the upstream gateway.
 */
@Component
public class ExploreSessionFactory {
    private final ProviderCallFactory callFactory;
    private final ExploreProperties properties;
    private final ExecutorService providerExecutor;
    private final ScheduledExecutorService debounceScheduler;
    private final KeyValueStore keyValueStore;
    private final AuthStateProvider authStateProvider;
    private final ToastNotifier toastNotifier;
    private final ObjectMapper objectMapper;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    public ExploreSessionFactory(
        ExploreProviders providers,
        ResultNormalizer normalizer,
        ExploreProperties properties,
        UpstreamProperties upstreamProperties,
        @Qualifier("providerExecutor") ExecutorService providerExecutor,
        @Qualifier("debounceScheduler") ScheduledExecutorService debounceScheduler,
        KeyValueStore keyValueStore,
        AuthStateProvider authStateProvider,
        ToastNotifier toastNotifier,
        ObjectMapper objectMapper,
        MeterRegistry meterRegistry,
        Clock clock
    ) {
        this.callFactory = new ProviderCallFactory(providers, normalizer, upstreamProperties);
        this.properties = properties;
        this.providerExecutor = providerExecutor;
        this.debounceScheduler = debounceScheduler;
        this.keyValueStore = keyValueStore;
        this.authStateProvider = authStateProvider;
        this.toastNotifier = toastNotifier;
        this.objectMapper = objectMapper;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
    }

    public ExploreSession open() {
        Map<CategoryTag, Integer> perPage = properties.getPaging().perPageByStream();
        SearchTokenSequence tokens = new SearchTokenSequence();
        ExploreSession session = new ExploreSession(
            callFactory,
            new FanOutExecutor(providerExecutor, tokens, meterRegistry),
            tokens,
            new CategoryResultCache(perPage),
            new PaginationManager(perPage),
            new RelevanceScorer(properties.getRecommendations().getLimit()),
            new Debouncer(debounceScheduler, properties.getQuery().getDebounceMs()),
            new RecentSearches(keyValueStore, objectMapper, authStateProvider, clock),
            toastNotifier,
            properties.getQuery().getMinLength(),
            properties.getTrending().getLimit()
        );
        session.open();
        return session;
    }
}
