package com.aycom.explore.session;

@FunctionalInterface
public interface ExploreSubscription {
    void cancel();
}
