package com.reelhub.discovery.search;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.reelhub.discovery.api.dto.SearchResponse;
import com.reelhub.discovery.api.dto.SuggestionsResponse;
import com.reelhub.discovery.cache.CacheResult;
import com.reelhub.discovery.cache.ComputeCache;
import com.reelhub.discovery.cache.DiscoveryCacheProperties;
import com.reelhub.discovery.model.CandidateItem;
import com.reelhub.discovery.model.MediaType;
import com.reelhub.discovery.service.InvalidDiscoveryRequestException;
import com.reelhub.discovery.upstream.MetadataGateway;
import com.reelhub.discovery.upstream.TmdbConfigurationException;
import com.reelhub.discovery.upstream.TmdbUnavailableException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class SearchServiceTest {
    @Mock
    private MetadataGateway gateway;

    private SearchQueryTracker tracker;
    private SearchService service;

    @BeforeEach
    void setUp() {
        DiscoveryCacheProperties cacheProperties = new DiscoveryCacheProperties();
        SearchProperties properties = new SearchProperties();
        Clock clock = Clock.fixed(Instant.parse("2025-06-01T00:00:00Z"), ZoneOffset.UTC);
        tracker = new SearchQueryTracker(properties, clock);
        service = new SearchService(
            gateway,
            new ComputeCache(cacheProperties, new SimpleMeterRegistry()),
            cacheProperties,
            properties,
            new RelevanceScorer(properties, clock),
            tracker
        );
    }

    @Test
    void blankQueryReturnsEmptyShapeWithoutProviderCall() {
        CacheResult<SearchResponse> result = service.search("   ", null, null, null, null);

        assertThat(result.fromCache()).isFalse();
        assertThat(result.value().getResults()).isEmpty();
        assertThat(result.value().getPagination().getPage()).isEqualTo(1);
        assertThat(result.value().getPagination().getTotal()).isZero();
        assertThat(result.value().getPagination().isHasMore()).isFalse();
        verifyNoInteractions(gateway);
    }

    @Test
    void yearRangeKeepsOnlyReleasesInsideIt() {
        when(gateway.searchMulti("inception", 1)).thenReturn(page(
            hit(MediaType.MOVIE, 1, "Inception", "2010-07-15"),
            hit(MediaType.MOVIE, 2, "Inception Revisited", "2016-03-01"),
            hit(MediaType.TV, 3, "Inception Files", "2020-12-31"),
            hit(MediaType.MOVIE, 4, "Inception Again", "2021-01-01"),
            hit(MediaType.MOVIE, 5, "Inception Undated", null)
        ));

        SearchResponse response = service.search(
            "inception",
            new SearchFilters(null, 2015, 2020, null, List.of()),
            SearchSort.RELEVANCE,
            1,
            10
        ).value();

        assertThat(response.getResults()).extracting(CandidateItem::getId).containsExactlyInAnyOrder(2L, 3L);
        assertThat(response.getFilters().getYearStart()).isEqualTo(2015);
        assertThat(response.getFilters().getMediaType()).isEqualTo("all");
        assertThat(response.getSortBy()).isEqualTo("relevance");
        assertThat(response.getTookMs()).isNotNull();
    }

    @Test
    void mediaTypeRatingAndGenreFiltersCombine() {
        CandidateItem keep = hit(MediaType.TV, 1, "Dark", "2017-12-01");
        keep.setVoteAverage(8.4);
        keep.setGenreIds(List.of(18, 9648));
        CandidateItem lowRated = hit(MediaType.TV, 2, "Dark Matter", "2015-06-12");
        lowRated.setVoteAverage(6.1);
        lowRated.setGenreIds(List.of(9648));
        CandidateItem movie = hit(MediaType.MOVIE, 3, "Dark City", "1998-02-27");
        movie.setVoteAverage(7.6);
        movie.setGenreIds(List.of(9648));
        when(gateway.searchMulti("dark", 1)).thenReturn(page(keep, lowRated, movie));

        SearchResponse response = service.search(
            "dark",
            new SearchFilters(MediaType.TV, null, null, 7.0, List.of(9648, 10765)),
            SearchSort.RELEVANCE,
            1,
            5
        ).value();

        assertThat(response.getResults()).extracting(CandidateItem::getId).containsExactly(1L);
        assertThat(response.getFilters().getMediaType()).isEqualTo("tv");
    }

    @Test
    void duplicatesAcrossPagesAreCollapsedButMediaTypesStayDistinct() {
        when(gateway.searchMulti("alien", 1)).thenReturn(page(
            hit(MediaType.MOVIE, 348, "Alien", "1979-05-25"),
            hit(MediaType.TV, 348, "Alien Worlds", "2020-12-02")
        ));
        when(gateway.searchMulti("alien", 2)).thenReturn(page(
            hit(MediaType.MOVIE, 348, "Alien", "1979-05-25"),
            hit(MediaType.MOVIE, 679, "Aliens", "1986-07-18")
        ));

        SearchResponse response = service.search("alien", null, null, 1, 20).value();

        assertThat(response.getResults()).extracting(CandidateItem::key)
            .doesNotHaveDuplicates()
            .hasSize(3);
        assertThat(response.getResults().get(0).getTitle()).isEqualTo("Alien");
        assertThat(response.getPagination().getTotal()).isEqualTo(3);
    }

    @Test
    void paginatesMatchedResults() {
        List<CandidateItem> items = new ArrayList<>();
        for (int id = 1; id <= 25; id++) {
            items.add(hit(MediaType.MOVIE, id, "Star " + id, null));
        }
        when(gateway.searchMulti("star", 1)).thenReturn(CompletableFuture.completedFuture(items));

        SearchResponse second = service.search("star", null, SearchSort.RELEVANCE, 2, 10).value();
        SearchResponse third = service.search("star", null, SearchSort.RELEVANCE, 3, 10).value();

        assertThat(second.getResults()).hasSize(10);
        assertThat(second.getPagination().getTotal()).isEqualTo(25);
        assertThat(second.getPagination().getTotalPages()).isEqualTo(3);
        assertThat(second.getPagination().isHasMore()).isTrue();
        assertThat(third.getResults()).hasSize(5);
        assertThat(third.getPagination().isHasMore()).isFalse();
    }

    @Test
    void relevanceFloorOnlyAppliesToRelevanceSort() {
        CandidateItem unrelated = hit(MediaType.TV, 2, "Zzz", null);
        unrelated.setPopularity(200.0);
        when(gateway.searchMulti("inception", 1)).thenReturn(page(
            hit(MediaType.MOVIE, 1, "Inception", "2010-07-15"),
            unrelated
        ));

        SearchResponse relevance = service.search("inception", null, SearchSort.RELEVANCE, 1, 10).value();
        SearchResponse popular = service.search("inception", null, SearchSort.POPULAR, 1, 10).value();

        assertThat(relevance.getResults()).extracting(CandidateItem::getId).containsExactly(1L);
        assertThat(popular.getResults()).extracting(CandidateItem::getId).containsExactly(2L, 1L);
    }

    @Test
    void recentSortPutsUndatedLast() {
        when(gateway.searchMulti("dune", 1)).thenReturn(page(
            hit(MediaType.MOVIE, 1, "Dune", "1984-12-14"),
            hit(MediaType.MOVIE, 2, "Dune Undated", null),
            hit(MediaType.MOVIE, 3, "Dune Part Two", "2024-02-27")
        ));

        SearchResponse response = service.search("dune", null, SearchSort.RECENT, 1, 10).value();

        assertThat(response.getResults()).extracting(CandidateItem::getId).containsExactly(3L, 1L, 2L);
    }

    @Test
    void repeatedSearchIsServedFromCacheAndTracked() {
        when(gateway.searchMulti(anyString(), anyInt())).thenReturn(page(hit(MediaType.MOVIE, 1, "Inception", "2010-07-15")));

        CacheResult<SearchResponse> first = service.search("Inception", null, null, 1, 10);
        CacheResult<SearchResponse> second = service.search("inception ", null, null, 1, 10);

        assertThat(first.fromCache()).isFalse();
        assertThat(second.fromCache()).isTrue();
        verify(gateway, times(1)).searchMulti(anyString(), anyInt());
        assertThat(tracker.trending()).extracting(TrendingQuery::count).containsExactly(2L);
    }

    @Test
    void invalidFiltersAreRejected() {
        assertThatThrownBy(() -> service.search("x", new SearchFilters(null, 2020, 2010, null, null), null, 1, 10))
            .isInstanceOf(InvalidDiscoveryRequestException.class);
        assertThatThrownBy(() -> service.search("x", new SearchFilters(null, null, null, 11.0, null), null, 1, 10))
            .isInstanceOf(InvalidDiscoveryRequestException.class);
        verifyNoInteractions(gateway);
    }

    @Test
    void partialPageFailureKeepsRemainingPages() {
        when(gateway.searchMulti("alien", 1)).thenReturn(page(hit(MediaType.MOVIE, 348, "Alien", "1979-05-25")));
        when(gateway.searchMulti("alien", 2)).thenReturn(CompletableFuture.failedFuture(new TmdbUnavailableException("tmdb_unavailable")));

        SearchResponse response = service.search("alien", null, null, 1, 20).value();

        assertThat(response.getResults()).extracting(CandidateItem::getId).containsExactly(348L);
    }

    @Test
    void failureOfEveryPagePropagates() {
        when(gateway.searchMulti(anyString(), anyInt()))
            .thenReturn(CompletableFuture.failedFuture(new TmdbUnavailableException("tmdb_circuit_open")));

        assertThatThrownBy(() -> service.search("alien", null, null, 1, 20))
            .isInstanceOf(TmdbUnavailableException.class)
            .hasMessage("tmdb_circuit_open");
    }

    @Test
    void shortSuggestionInputReturnsTrendingQueries() {
        tracker.track("dune");

        SuggestionsResponse response = service.suggestions("d").value();

        assertThat(response.getType()).isEqualTo(SuggestionsResponse.TYPE_TRENDING);
        assertThat(response.getSuggestions()).containsExactly("dune");
        verifyNoInteractions(gateway);
    }

    @Test
    void suggestionsAreDistinctPopularTitlesWithEnoughVotes() {
        CandidateItem popular = suggestion(1, "Batman Begins", 120.0, 20_000);
        CandidateItem obscure = suggestion(2, "Batman Unknown", 500.0, 3);
        CandidateItem remake = suggestion(3, "Batman", 80.0, 9_000);
        CandidateItem sameTitle = suggestion(4, "Batman", 40.0, 1_000);
        when(gateway.searchMulti("bat", 1)).thenReturn(page(remake, obscure, popular, sameTitle));

        CacheResult<SuggestionsResponse> first = service.suggestions("bat");
        CacheResult<SuggestionsResponse> second = service.suggestions("BAT");

        assertThat(first.value().getType()).isEqualTo(SuggestionsResponse.TYPE_RESULTS);
        assertThat(first.value().getSuggestions()).containsExactly("Batman Begins", "Batman");
        assertThat(second.fromCache()).isTrue();
    }

    @Test
    void suggestionProviderFailureYieldsErrorType() {
        when(gateway.searchMulti("bat", 1)).thenReturn(CompletableFuture.failedFuture(new TmdbUnavailableException("down")));

        SuggestionsResponse response = service.suggestions("bat").value();

        assertThat(response.getType()).isEqualTo(SuggestionsResponse.TYPE_ERROR);
        assertThat(response.getSuggestions()).isEmpty();
    }

    @Test
    void missingCredentialsAreNotHiddenBySuggestions() {
        when(gateway.searchMulti("bat", 1))
            .thenReturn(CompletableFuture.failedFuture(new TmdbConfigurationException("tmdb_api_key_missing")));

        assertThatThrownBy(() -> service.suggestions("bat")).isInstanceOf(TmdbConfigurationException.class);
    }

    private static CompletableFuture<List<CandidateItem>> page(CandidateItem... items) {
        return CompletableFuture.completedFuture(List.of(items));
    }

    private static CandidateItem hit(MediaType type, long id, String title, String releaseDate) {
        CandidateItem item = new CandidateItem();
        item.setId(id);
        item.setMediaType(type);
        item.setTitle(title);
        item.setReleaseDate(releaseDate);
        return item;
    }

    private static CandidateItem suggestion(long id, String title, double popularity, int votes) {
        CandidateItem item = hit(MediaType.MOVIE, id, title, null);
        item.setPopularity(popularity);
        item.setVoteCount(votes);
        return item;
    }
}
