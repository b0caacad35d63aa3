package com.aycom.explore.query;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.after;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

import com.aycom.explore.collab.ToastNotifier;
import com.aycom.explore.model.CategoryTag;
import com.aycom.explore.model.Filter;
import com.aycom.explore.model.QuerySnapshot;
import com.aycom.explore.model.SearchToken;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class QueryCoordinatorTest {

    @Mock
    private ExecutionHandler handler;

    @Mock
    private RecentSearches recentSearches;

    @Mock
    private ToastNotifier toastNotifier;

    private ScheduledExecutorService scheduler;
    private SearchTokenSequence tokens;

    @BeforeEach
    void setUp() {
        scheduler = Executors.newSingleThreadScheduledExecutor();
        tokens = new SearchTokenSequence();
    }

    @AfterEach
    void tearDown() {
        scheduler.shutdownNow();
    }

    @Test
    void subThresholdQueriesNeverReachProviders() {
        QueryCoordinator coordinator = coordinator(50);

        coordinator.onInput("r");
        coordinator.onInput(" r ");
        coordinator.onInput("");
        coordinator.onSubmit();

        verify(handler, after(300).never()).executeSearch(any(), any());
        assertThat(coordinator.isSearchActive()).isFalse();
        assertThat(tokens.latest()).isEqualTo(SearchToken.NONE);
    }

    @Test
    void keystrokesWithinQuietWindowCoalesceIntoOneExecution() {
        QueryCoordinator coordinator = coordinator(150);

        coordinator.onInput("ru");
        coordinator.onInput("rus");
        coordinator.onInput("rust");

        verify(handler, timeout(1000)).executeSearch(any(), argThat(query -> query.getText().equals("rust")));
        verify(handler, after(400).times(1)).executeSearch(any(), any());
        assertThat(coordinator.isSearchActive()).isTrue();
    }

    @Test
    void submitExecutesImmediatelyAndCancelsPendingTimer() {
        QueryCoordinator coordinator = coordinator(10_000);
        coordinator.onInput("rust");

        coordinator.onSubmit();

        verify(handler).executeSearch(eq(new SearchToken(1)), argThat(query -> query.getText().equals("rust")));
        assertThat(coordinator.getLastSearchToken()).isEqualTo(tokens.latest(CategoryTag.PEOPLE));
    }

    @Test
    void shrinkingBelowThresholdLeavesSearch() {
        QueryCoordinator coordinator = coordinator(10_000);
        coordinator.onInput("rust");
        coordinator.onSubmit();

        coordinator.onInput("r");

        verify(handler).onSearchInactive();
        assertThat(coordinator.isSearchActive()).isFalse();
    }

    @Test
    void filterChangeReExecutesActiveSearch() {
        QueryCoordinator coordinator = coordinator(10_000);
        coordinator.onInput("rust");
        coordinator.onSubmit();

        coordinator.onFilterChange(Filter.VERIFIED);

        ArgumentCaptor<SearchToken> tokenCaptor = ArgumentCaptor.forClass(SearchToken.class);
        ArgumentCaptor<QuerySnapshot> queryCaptor = ArgumentCaptor.forClass(QuerySnapshot.class);
        verify(handler, times(2)).executeSearch(tokenCaptor.capture(), queryCaptor.capture());
        assertThat(tokenCaptor.getAllValues().get(0)).isLessThan(tokenCaptor.getAllValues().get(1));
        assertThat(queryCaptor.getValue().getFilter()).isEqualTo(Filter.VERIFIED);
    }

    @Test
    void tabChangeWithoutSearchLoadsDefaults() {
        QueryCoordinator coordinator = coordinator(10_000);

        coordinator.onCategoryChange(CategoryTag.PEOPLE);

        verify(handler).loadDefaults(argThat(query -> query.getTab() == CategoryTag.PEOPLE));
        verify(handler, never()).executeSearch(any(), any());
    }

    @Test
    void sameTabIsIgnored() {
        QueryCoordinator coordinator = coordinator(10_000);

        coordinator.onCategoryChange(CategoryTag.TRENDING);

        verifyNoInteractions(handler);
    }

    @Test
    void contentCategoryChangeIsCarriedIntoNextExecution() {
        QueryCoordinator coordinator = coordinator(10_000);
        coordinator.onInput("rust");
        coordinator.onSubmit();

        coordinator.onContentCategoryChange(" 7 ");
        coordinator.onContentCategoryChange("7");

        verify(handler, times(2)).executeSearch(any(), any());
        verify(handler).executeSearch(any(), argThat(query -> "7".equals(query.getContentCategory())));

        coordinator.onContentCategoryChange("");

        verify(handler, times(3)).executeSearch(any(), any());
        assertThat(coordinator.snapshot().getContentCategory()).isNull();
    }

    @Test
    void clearRecentSearchesDelegatesToStore() {
        QueryCoordinator coordinator = coordinator(10_000);

        coordinator.clearRecentSearches();

        verify(recentSearches).clear();
        verifyNoInteractions(handler);
    }

    @Test
    void hashtagSelectionBrowsesTrending() {
        QueryCoordinator coordinator = coordinator(10_000);
        coordinator.onCategoryChange(CategoryTag.MEDIA);

        coordinator.onHashtagSelect("#rust");

        verify(handler).loadDefaults(argThat(query ->
            query.getTab() == CategoryTag.TRENDING && "#rust".equals(query.getHashtag())));
    }

    @Test
    void filterChangeAbsorbsPendingKeystroke() {
        QueryCoordinator coordinator = coordinator(150);
        coordinator.onInput("rust");
        coordinator.onSubmit();
        coordinator.onInput("rusty");

        coordinator.onFilterChange(Filter.VERIFIED);

        ArgumentCaptor<QuerySnapshot> queryCaptor = ArgumentCaptor.forClass(QuerySnapshot.class);
        verify(handler, after(500).times(2)).executeSearch(any(), queryCaptor.capture());
        assertThat(queryCaptor.getValue().getText()).isEqualTo("rusty");
        assertThat(queryCaptor.getValue().getFilter()).isEqualTo(Filter.VERIFIED);
    }

    @Test
    void tabChangeWhileTypingSearchesOnce() {
        QueryCoordinator coordinator = coordinator(150);
        coordinator.onInput("rust");

        coordinator.onCategoryChange(CategoryTag.PEOPLE);

        verify(handler, after(500).times(1)).executeSearch(any(), argThat(query ->
            query.getTab() == CategoryTag.PEOPLE && query.getText().equals("rust")));
        verify(handler, never()).loadDefaults(any());
    }

    @Test
    void hashtagSelectionCancelsPendingKeystroke() {
        QueryCoordinator coordinator = coordinator(150);
        coordinator.onInput("rust");

        coordinator.onHashtagSelect("#java");

        verify(handler, after(500).never()).executeSearch(any(), any());
        verify(handler).loadDefaults(argThat(query -> "#java".equals(query.getHashtag())));
        assertThat(coordinator.snapshot().getHashtag()).isEqualTo("#java");
        assertThat(coordinator.isSearchActive()).isFalse();
    }

    @Test
    void clearReturnsToBrowsing() {
        QueryCoordinator coordinator = coordinator(10_000);
        coordinator.onInput("rust");
        coordinator.onSubmit();

        coordinator.onClear();

        verify(handler).onSearchInactive();
        verify(handler).loadDefaults(argThat(query -> query.getText().isEmpty()));
        assertThat(coordinator.isSearchActive()).isFalse();
    }

    @Test
    void schedulingFailureShowsOneToast() {
        doThrow(new RejectedExecutionException("pool saturated")).when(handler).executeSearch(any(), any());
        QueryCoordinator coordinator = coordinator(10_000);
        coordinator.onInput("rust");

        coordinator.onSubmit();

        verify(toastNotifier, times(1)).error(QueryCoordinator.SEARCH_FAILED_MESSAGE);
    }

    @Test
    void onlyTheLatestSettledSearchIsRemembered() {
        QueryCoordinator coordinator = coordinator(10_000);
        coordinator.onInput("rus");
        coordinator.onSubmit();
        QuerySnapshot first = coordinator.snapshot();
        coordinator.onInput(" rust ");
        coordinator.onSubmit();

        coordinator.onExecutionSettled(new SearchToken(1), first);
        verify(recentSearches, never()).push(any());

        coordinator.onExecutionSettled(new SearchToken(2), coordinator.snapshot());
        verify(recentSearches).push("rust");
    }

    private QueryCoordinator coordinator(long debounceMs) {
        return new QueryCoordinator(
            handler,
            tokens,
            new Debouncer(scheduler, debounceMs),
            recentSearches,
            toastNotifier,
            2
        );
    }
}
