package com.aycom.explore.session;

import com.aycom.explore.model.CategoryFacet;
import com.aycom.explore.model.CategoryResultSet;
import com.aycom.explore.model.CategoryTag;
import com.aycom.explore.model.ProfileResult;
import com.aycom.explore.model.TrendingTag;
import java.util.List;

/**
 * Observer of session state. Callbacks receive immutable snapshots and run after the session
 * lock is released, so they may call back into the session. Delivery happens on a session or
 * provider thread; implementations should hand off slow work.
 */
public interface ExploreStateListener {
    default void onResultsChanged(CategoryTag stream, CategoryResultSet<?> results) {
    }

    default void onRecommendationsChanged(List<ProfileResult> recommendations) {
    }

    default void onTrendingTagsChanged(List<TrendingTag> tags) {
    }

    default void onContentCategoriesChanged(List<CategoryFacet> categories) {
    }
}
