package com.aycom.explore;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.aycom.explore.collab.LoggingToastNotifier;
import com.aycom.explore.collab.ToastNotifier;
import com.aycom.explore.config.ExploreProperties;
import com.aycom.explore.model.CategoryTag;
import com.aycom.explore.provider.ExploreProviders;
import com.aycom.explore.session.ExploreSession;
import com.aycom.explore.session.ExploreSessionFactory;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;

@SpringBootTest
class ExploreServiceApplicationTest {

    @Autowired
    private ExploreSessionFactory sessionFactory;

    @Autowired
    private ExploreProperties properties;

    @Autowired
    private ToastNotifier toastNotifier;

    @Autowired
    private ObjectMapper objectMapper;

    @MockBean
    private ExploreProviders providers;

    @Test
    void bindsDefaultsFromApplicationYaml() {
        assertThat(properties.getQuery().getDebounceMs()).isEqualTo(300);
        assertThat(properties.getQuery().getMinLength()).isEqualTo(2);
        assertThat(properties.getPaging().getPeoplePerPage()).isEqualTo(25);
        assertThat(properties.getPaging().getMediaPerPage()).isEqualTo(12);
        assertThat(properties.getRecommendations().getLimit()).isEqualTo(3);
        assertThat(toastNotifier).isInstanceOf(LoggingToastNotifier.class);
    }

    @Test
    void opensSessionAndLoadsBrowseData() {
        when(providers.getCategories()).thenReturn(objectMapper.createArrayNode());
        when(providers.getTrendingTags(10)).thenReturn(objectMapper.createArrayNode());

        try (ExploreSession session = sessionFactory.open()) {
            verify(providers, timeout(2000)).getCategories();
            verify(providers, timeout(2000)).getTrendingTags(10);

            assertThat(session.isSearchActive()).isFalse();
            assertThat(session.query().getTab()).isEqualTo(CategoryTag.TRENDING);
            assertThat(session.pagination(CategoryTag.PEOPLE).getPerPage()).isEqualTo(25);
            assertThat(session.pagination(CategoryTag.MEDIA).getPerPage()).isEqualTo(12);
        }
    }
}
