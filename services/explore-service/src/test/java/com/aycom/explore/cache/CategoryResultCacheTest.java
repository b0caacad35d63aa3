package com.aycom.explore.cache;

import static org.assertj.core.api.Assertions.assertThat;

import com.aycom.explore.model.CategoryResultSet;
import com.aycom.explore.model.CategoryTag;
import com.aycom.explore.model.ErrorKind;
import com.aycom.explore.model.PageState;
import com.aycom.explore.model.SearchToken;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class CategoryResultCacheTest {
    private final CategoryResultCache cache = new CategoryResultCache(Map.of(CategoryTag.MEDIA, 2));

    @Test
    void successReplacesItemsAndClearsError() {
        SearchToken t1 = new SearchToken(1);
        SearchToken t2 = new SearchToken(2);
        cache.markLoading(CategoryTag.TOP, t1);
        cache.applyFailure(CategoryTag.TOP, t1, ErrorKind.NETWORK);
        cache.markLoading(CategoryTag.TOP, t2);

        assertThat(cache.applySuccess(CategoryTag.TOP, t2, List.of("a", "b"), PageState.of(1, 10, 2))).isTrue();

        CategoryResultSet<String> top = cache.get(CategoryTag.TOP);
        assertThat(top.getItems()).containsExactly("a", "b");
        assertThat(top.getLastError()).isNull();
        assertThat(top.isLoading()).isFalse();
        assertThat(top.getToken()).isEqualTo(t2);
    }

    @Test
    void failureKeepsPreviousItems() {
        SearchToken t1 = new SearchToken(1);
        SearchToken t2 = new SearchToken(2);
        cache.applySuccess(CategoryTag.COMMUNITIES, t1, List.of("c1"), PageState.of(1, 10, 1));
        cache.markLoading(CategoryTag.COMMUNITIES, t2);

        cache.applyFailure(CategoryTag.COMMUNITIES, t2, ErrorKind.UPSTREAM_TIMEOUT);

        CategoryResultSet<String> communities = cache.get(CategoryTag.COMMUNITIES);
        assertThat(communities.getItems()).containsExactly("c1");
        assertThat(communities.getLastError()).isEqualTo(ErrorKind.UPSTREAM_TIMEOUT);
        assertThat(communities.isLoading()).isFalse();
    }

    @Test
    void olderTokenNeverOverwritesNewerData() {
        SearchToken t1 = new SearchToken(1);
        SearchToken t2 = new SearchToken(2);
        cache.markLoading(CategoryTag.PEOPLE, t1);
        cache.markLoading(CategoryTag.PEOPLE, t2);
        cache.applySuccess(CategoryTag.PEOPLE, t2, List.of("new"), PageState.of(1, 10, 1));

        assertThat(cache.applySuccess(CategoryTag.PEOPLE, t1, List.of("old"), PageState.of(1, 10, 1))).isFalse();
        assertThat(cache.applyFailure(CategoryTag.PEOPLE, t1, ErrorKind.NETWORK)).isFalse();

        CategoryResultSet<String> people = cache.get(CategoryTag.PEOPLE);
        assertThat(people.getItems()).containsExactly("new");
        assertThat(people.getLastError()).isNull();
    }

    @Test
    void loadingStaysSetUntilNewestPendingTokenLands() {
        SearchToken t1 = new SearchToken(1);
        SearchToken t2 = new SearchToken(2);
        cache.markLoading(CategoryTag.LATEST, t1);
        cache.markLoading(CategoryTag.LATEST, t2);

        cache.applySuccess(CategoryTag.LATEST, t1, List.of("x"), PageState.of(1, 10, 1));
        assertThat(cache.isLoading(CategoryTag.TRENDING)).isTrue();

        cache.applySuccess(CategoryTag.LATEST, t2, List.of("y"), PageState.of(1, 10, 1));
        assertThat(cache.isLoading(CategoryTag.TRENDING)).isFalse();
    }

    @Test
    void appendAccumulatesMedia() {
        cache.applySuccess(CategoryTag.MEDIA, new SearchToken(1), List.of("m1", "m2"), PageState.of(1, 2, 5));
        cache.applyAppend(CategoryTag.MEDIA, new SearchToken(2), List.of("m3", "m4"), PageState.of(2, 2, 5));

        CategoryResultSet<String> media = cache.get(CategoryTag.MEDIA);
        assertThat(media.getItems()).containsExactly("m1", "m2", "m3", "m4");
        assertThat(media.hasMore()).isTrue();
        assertThat(media.getPagination().getPage()).isEqualTo(2);
    }

    @Test
    void startsEmptyWithConfiguredPageSize() {
        CategoryResultSet<String> media = cache.get(CategoryTag.MEDIA);

        assertThat(media.getItems()).isEmpty();
        assertThat(media.getPagination()).isEqualTo(PageState.first(2));
        assertThat(media.hasMore()).isFalse();
        assertThat(media.isLoading()).isFalse();
    }
}
