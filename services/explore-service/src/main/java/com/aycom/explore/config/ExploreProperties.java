package com.aycom.explore.config;

import com.aycom.explore.model.CategoryTag;
import java.util.EnumMap;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "explore")
public class ExploreProperties {
    private Query query = new Query();
    private Paging paging = new Paging();
    private Recommendations recommendations = new Recommendations();
    private Trending trending = new Trending();
    private Execution execution = new Execution();

    public Query getQuery() {
        return query;
    }

    public void setQuery(Query query) {
        this.query = query;
    }

    public Paging getPaging() {
        return paging;
    }

    public void setPaging(Paging paging) {
        this.paging = paging;
    }

    public Recommendations getRecommendations() {
        return recommendations;
    }

    public void setRecommendations(Recommendations recommendations) {
        this.recommendations = recommendations;
    }

    public Trending getTrending() {
        return trending;
    }

    public void setTrending(Trending trending) {
        this.trending = trending;
    }

    public Execution getExecution() {
        return execution;
    }

    public void setExecution(Execution execution) {
        this.execution = execution;
    }

    public static class Query {
        private long debounceMs = 300L;
        private int minLength = 2;

        public long getDebounceMs() {
            return debounceMs;
        }

        public void setDebounceMs(long debounceMs) {
            this.debounceMs = debounceMs;
        }

        public int getMinLength() {
            return minLength;
        }

        public void setMinLength(int minLength) {
            this.minLength = minLength;
        }
    }

    public static class Paging {
        private int defaultPerPage = 10;
        private int peoplePerPage = 25;
        private int mediaPerPage = 12;

        public int getDefaultPerPage() {
            return defaultPerPage;
        }

        public void setDefaultPerPage(int defaultPerPage) {
            this.defaultPerPage = defaultPerPage;
        }

        public int getPeoplePerPage() {
            return peoplePerPage;
        }

        public void setPeoplePerPage(int peoplePerPage) {
            this.peoplePerPage = peoplePerPage;
        }

        public int getMediaPerPage() {
            return mediaPerPage;
        }

        public void setMediaPerPage(int mediaPerPage) {
            this.mediaPerPage = mediaPerPage;
        }

        public Map<CategoryTag, Integer> perPageByStream() {
            Map<CategoryTag, Integer> perPage = new EnumMap<>(CategoryTag.class);
            for (CategoryTag stream : CategoryTag.streams()) {
                perPage.put(stream, defaultPerPage);
            }
            perPage.put(CategoryTag.PEOPLE, peoplePerPage);
            perPage.put(CategoryTag.MEDIA, mediaPerPage);
            return perPage;
        }
    }

    public static class Recommendations {
        private int limit = 3;

        public int getLimit() {
            return limit;
        }

        public void setLimit(int limit) {
            this.limit = limit;
        }
    }

    public static class Trending {
        private int limit = 10;

        public int getLimit() {
            return limit;
        }

        public void setLimit(int limit) {
            this.limit = limit;
        }
    }

    public static class Execution {
        private int poolSize = 6;

        public int getPoolSize() {
            return poolSize;
        }

        public void setPoolSize(int poolSize) {
            this.poolSize = poolSize;
        }
    }
}
