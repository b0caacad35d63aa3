package com.aycom.explore.paging;

import static org.assertj.core.api.Assertions.assertThat;

import com.aycom.explore.model.CategoryTag;
import com.aycom.explore.model.PageState;
import java.util.Map;
import org.junit.jupiter.api.Test;

class PaginationManagerTest {
    private final PaginationManager pagination = new PaginationManager(Map.of(
        CategoryTag.PEOPLE, 25,
        CategoryTag.MEDIA, 12
    ));

    @Test
    void defaultsApplyPerStream() {
        assertThat(pagination.get(CategoryTag.PEOPLE)).isEqualTo(PageState.first(25));
        assertThat(pagination.get(CategoryTag.MEDIA)).isEqualTo(PageState.first(12));
        assertThat(pagination.get(CategoryTag.TOP)).isEqualTo(PageState.first(10));
        assertThat(pagination.get(CategoryTag.TRENDING)).isSameAs(pagination.get(CategoryTag.LATEST));
    }

    @Test
    void pageRequestsAreClampedToKnownTotal() {
        pagination.applyTotal(CategoryTag.TOP, PageState.first(10), 35);

        assertThat(pagination.requestPage(CategoryTag.TOP, 9).getPage()).isEqualTo(4);
        assertThat(pagination.requestPage(CategoryTag.TOP, 0).getPage()).isEqualTo(1);
        assertThat(pagination.get(CategoryTag.TOP).getPage()).isEqualTo(1);
    }

    @Test
    void perPageChangeResetsToFirstPage() {
        pagination.applyTotal(CategoryTag.PEOPLE, PageState.of(3, 25, 100), 100);

        PageState next = pagination.requestPerPage(CategoryTag.PEOPLE, 50);

        assertThat(next.getPage()).isEqualTo(1);
        assertThat(next.getTotalPages()).isEqualTo(2);
        assertThat(pagination.get(CategoryTag.PEOPLE)).isEqualTo(next);
    }

    @Test
    void responsesRecomputePagesAndClamp() {
        PageState applied = pagination.applyTotal(CategoryTag.COMMUNITIES, PageState.of(4, 10, 100), 15);

        assertThat(applied.getTotalPages()).isEqualTo(2);
        assertThat(applied.getPage()).isEqualTo(2);
    }

    @Test
    void mediaScrollAdvancesPastLoadedPage() {
        pagination.applyTotal(CategoryTag.MEDIA, PageState.first(12), 30);

        PageState next = pagination.nextMediaPage();

        assertThat(next.getPage()).isEqualTo(2);
        assertThat(next.getPerPage()).isEqualTo(12);
        assertThat(pagination.get(CategoryTag.MEDIA).getPage()).isEqualTo(1);
    }

    @Test
    void resetKeepsChosenPageSize() {
        pagination.requestPerPage(CategoryTag.TOP, 20);
        pagination.applyTotal(CategoryTag.TOP, PageState.of(2, 20, 100), 100);

        pagination.resetAll();

        assertThat(pagination.get(CategoryTag.TOP)).isEqualTo(PageState.first(20));
    }
}
