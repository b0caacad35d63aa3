package com.aycom.explore.config;

import com.aycom.explore.collab.AuthStateProvider;
import com.aycom.explore.collab.InMemoryKeyValueStore;
import com.aycom.explore.collab.KeyValueStore;
import com.aycom.explore.collab.LoggingToastNotifier;
import com.aycom.explore.collab.ToastNotifier;
import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(ExploreProperties.class)
public class ExploreConfig {

    @Bean(destroyMethod = "shutdown")
    public ExecutorService providerExecutor(ExploreProperties properties) {
        return Executors.newFixedThreadPool(Math.max(2, properties.getExecution().getPoolSize()));
    }

    @Bean(destroyMethod = "shutdown")
    public ScheduledExecutorService debounceScheduler() {
        return Executors.newSingleThreadScheduledExecutor();
    }

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean
    public KeyValueStore keyValueStore() {
        return new InMemoryKeyValueStore();
    }

    @Bean
    @ConditionalOnMissingBean
    public AuthStateProvider authStateProvider() {
        return AuthStateProvider.anonymous();
    }

    @Bean
    @ConditionalOnMissingBean
    public ToastNotifier toastNotifier() {
        return new LoggingToastNotifier();
    }
}
