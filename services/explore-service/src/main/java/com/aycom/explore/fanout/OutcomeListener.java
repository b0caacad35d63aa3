package com.aycom.explore.fanout;

@FunctionalInterface
public interface OutcomeListener {
    void onOutcome(ProviderOutcome<?> outcome);
}
