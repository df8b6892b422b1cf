package com.reelhub.discovery.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.reelhub.discovery.model.CandidateItem;
import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public class SearchResponse {
    private List<CandidateItem> results = List.of();
    private Pagination pagination;
    private String query;
    private AppliedFilters filters;

    @JsonProperty("sort_by")
    private String sortBy;

    @JsonProperty("took_ms")
    private Long tookMs;

    public List<CandidateItem> getResults() {
        return results;
    }

    public void setResults(List<CandidateItem> results) {
        this.results = results;
    }

    public Pagination getPagination() {
        return pagination;
    }

    public void setPagination(Pagination pagination) {
        this.pagination = pagination;
    }

    public String getQuery() {
        return query;
    }

    public void setQuery(String query) {
        this.query = query;
    }

    public AppliedFilters getFilters() {
        return filters;
    }

    public void setFilters(AppliedFilters filters) {
        this.filters = filters;
    }

    public String getSortBy() {
        return sortBy;
    }

    public void setSortBy(String sortBy) {
        this.sortBy = sortBy;
    }

    public Long getTookMs() {
        return tookMs;
    }

    public void setTookMs(Long tookMs) {
        this.tookMs = tookMs;
    }

    public static class AppliedFilters {
        @JsonProperty("media_type")
        private String mediaType;

        @JsonProperty("year_start")
        private Integer yearStart;

        @JsonProperty("year_end")
        private Integer yearEnd;

        @JsonProperty("min_rating")
        private Double minRating;

        private List<Integer> genres = List.of();

        public String getMediaType() {
            return mediaType;
        }

        public void setMediaType(String mediaType) {
            this.mediaType = mediaType;
        }

        public Integer getYearStart() {
            return yearStart;
        }

        public void setYearStart(Integer yearStart) {
            this.yearStart = yearStart;
        }

        public Integer getYearEnd() {
            return yearEnd;
        }

        public void setYearEnd(Integer yearEnd) {
            this.yearEnd = yearEnd;
        }

        public Double getMinRating() {
            return minRating;
        }

        public void setMinRating(Double minRating) {
            this.minRating = minRating;
        }

        public List<Integer> getGenres() {
            return genres;
        }

        public void setGenres(List<Integer> genres) {
            this.genres = genres;
        }
    }
}
