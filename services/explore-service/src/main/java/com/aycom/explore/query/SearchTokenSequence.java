package com.aycom.explore.query;

import com.aycom.explore.model.CategoryTag;
import com.aycom.explore.model.SearchToken;
import java.util.Collection;
import java.util.EnumMap;
import java.util.Map;

/**
 * Issues strictly increasing tokens and remembers the newest token issued per result stream.
 * A full search registers its token for every stream; a page change or retry only for the
 * stream it refetches, so it never invalidates sibling streams still in flight.
 */
public class SearchTokenSequence {
    private final Map<CategoryTag, SearchToken> latestByStream = new EnumMap<>(CategoryTag.class);
    private long counter;
    private SearchToken latest = SearchToken.NONE;

    public synchronized SearchToken issue(Collection<CategoryTag> categories) {
        counter++;
        SearchToken token = new SearchToken(counter);
        latest = token;
        for (CategoryTag category : categories) {
            latestByStream.put(category.stream(), token);
        }
        return token;
    }

    public synchronized boolean isCurrent(CategoryTag category, SearchToken token) {
        if (token == null) {
            return false;
        }
        SearchToken newest = latestByStream.get(category.stream());
        return newest == null || !token.isOlderThan(newest);
    }

    public synchronized SearchToken latest() {
        return latest;
    }

    public synchronized SearchToken latest(CategoryTag category) {
        SearchToken newest = latestByStream.get(category.stream());
        return newest == null ? SearchToken.NONE : newest;
    }
}
