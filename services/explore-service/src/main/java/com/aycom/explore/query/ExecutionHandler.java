package com.aycom.explore.query;

import com.aycom.explore.model.QuerySnapshot;
import com.aycom.explore.model.SearchToken;

/**
 * Receives the executions decided by {@link QueryCoordinator}.
 */
public interface ExecutionHandler {
    /**
     * Full fan-out for {@code query}. Throwing means the execution could not be scheduled.
     */
    void executeSearch(SearchToken token, QuerySnapshot query);

    /**
     * Cheap default-data load for the query's tab while nothing is being searched.
     */
    void loadDefaults(QuerySnapshot query);

    void onSearchInactive();
}
