package com.reelhub.discovery.service;

import static com.reelhub.discovery.Candidates.movie;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.reelhub.discovery.api.dto.RecommendationResponse;
import com.reelhub.discovery.cache.ComputeCache;
import com.reelhub.discovery.cache.DiscoveryCacheProperties;
import com.reelhub.discovery.model.CandidateItem;
import com.reelhub.discovery.model.ItemDetail;
import com.reelhub.discovery.model.ItemKey;
import com.reelhub.discovery.model.ListItem;
import com.reelhub.discovery.model.MediaType;
import com.reelhub.discovery.model.WatchHistoryItem;
import com.reelhub.discovery.profile.PreferenceExtractor;
import com.reelhub.discovery.profile.PreferenceProperties;
import com.reelhub.discovery.ranking.RankingEngine;
import com.reelhub.discovery.ranking.RankingProperties;
import com.reelhub.discovery.retrieval.RetrievalOrchestrator;
import com.reelhub.discovery.retrieval.RetrievalProperties;
import com.reelhub.discovery.upstream.MetadataGateway;
import com.reelhub.discovery.upstream.TmdbRequestException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class RecommendationServiceTest {
    private static final ItemKey WATCHED = ItemKey.of(MediaType.MOVIE, 10);
    private static final ItemKey INCEPTION = ItemKey.of(MediaType.MOVIE, 27205);

    private MetadataGateway gateway;
    private ComputeCache computeCache;
    private DiscoveryCacheProperties cacheProperties;

    @BeforeEach
    void setUp() {
        gateway = mock(MetadataGateway.class);
        cacheProperties = new DiscoveryCacheProperties();
        computeCache = new ComputeCache(cacheProperties, new SimpleMeterRegistry());
        when(gateway.trending()).thenReturn(done(movie(500, 28), movie(501, 35)));
        when(gateway.similar(any())).thenReturn(done());
        when(gateway.recommendations(any())).thenReturn(done());
        when(gateway.collectionParts(anyLong())).thenReturn(done());
        when(gateway.discover(any(), anyMap())).thenReturn(done());
        when(gateway.details(any())).thenAnswer(invocation -> CompletableFuture.completedFuture(
            detail(invocation.getArgument(0), null)
        ));
    }

    @Test
    void noSignalsServesTrendingFromCacheOnRepeat() {
        RecommendationService service = service(realOrchestrator());

        RecommendationResponse first = service.home("u1", List.of(), null);
        RecommendationResponse second = service.home(null, null, null);

        assertThat(first.getStrategy()).isEqualTo(RecommendationResponse.STRATEGY_TRENDING);
        assertThat(first.isFromCache()).isFalse();
        assertThat(second.isFromCache()).isTrue();
        assertThat(second.getResults()).extracting(CandidateItem::getId).containsExactly(500L, 501L);
        verify(gateway, times(1)).trending();
    }

    @Test
    void personalizedFeedExcludesWatchedItemsAndIsCachedPerSignals() {
        when(gateway.recommendations(WATCHED)).thenReturn(done(movie(10, 18), movie(20, 18), movie(21, 18)));
        when(gateway.similar(WATCHED)).thenReturn(done(movie(20, 18)));
        RecommendationService service = service(realOrchestrator());
        List<WatchHistoryItem> history = List.of(new WatchHistoryItem(10, MediaType.MOVIE, List.of(18)));

        RecommendationResponse first = service.home("u1", history, List.of());
        RecommendationResponse second = service.home("u1", history, List.of());

        assertThat(first.getStrategy()).isEqualTo(RecommendationResponse.STRATEGY_PERSONALIZED);
        assertThat(first.getResults()).extracting(CandidateItem::getId).containsExactly(20L, 21L);
        assertThat(first.isFromCache()).isFalse();
        assertThat(second.isFromCache()).isTrue();
    }

    @Test
    void emptyPersonalizedResultFallsBackToTrending() {
        RecommendationService service = service(realOrchestrator());

        RecommendationResponse response = service.home(
            "u1",
            List.of(new WatchHistoryItem(10, MediaType.MOVIE, List.of(18))),
            List.of()
        );

        assertThat(response.getStrategy()).isEqualTo(RecommendationResponse.STRATEGY_FALLBACK);
        assertThat(response.getResults()).extracting(CandidateItem::getId).containsExactly(500L, 501L);
        assertThat(computeCache.size()).isEqualTo(1);
    }

    @Test
    void personalizationFailureFallsBackToTrending() {
        RetrievalOrchestrator failing = mock(RetrievalOrchestrator.class);
        when(failing.retrieveHome(any(), any(), any())).thenThrow(new IllegalStateException("boom"));
        RecommendationService service = service(failing);

        RecommendationResponse response = service.home(
            "u1",
            List.of(new WatchHistoryItem(10, MediaType.MOVIE, List.of(18))),
            List.of()
        );

        assertThat(response.getStrategy()).isEqualTo(RecommendationResponse.STRATEGY_FALLBACK);
        assertThat(response.getResults()).hasSize(2);
    }

    @Test
    void itemRecommendationsLeadWithFranchiseMembers() {
        when(gateway.details(INCEPTION)).thenReturn(CompletableFuture.completedFuture(detail(INCEPTION, 263L)));
        when(gateway.collectionParts(263L)).thenReturn(done(movie(27205, 28), movie(100, 28)));
        List<CandidateItem> similar = new ArrayList<>();
        for (int id = 1; id <= 10; id++) {
            similar.add(movie(id, 878));
        }
        when(gateway.similar(INCEPTION)).thenReturn(CompletableFuture.completedFuture(similar));
        RecommendationService service = service(realOrchestrator());

        RecommendationResponse response = service.forItem(INCEPTION, null, List.of(), List.of());

        assertThat(response.getStrategy()).isEqualTo(RecommendationResponse.STRATEGY_ITEM);
        assertThat(response.getResults().subList(0, 3)).extracting(CandidateItem::getId).contains(100L);
        assertThat(response.getResults()).extracting(CandidateItem::key).doesNotContain(INCEPTION);
        assertThat(service.forItem(INCEPTION, null, null, null).isFromCache()).isTrue();
    }

    @Test
    void savedListItemIsBoostedOnItemPage() {
        when(gateway.similar(INCEPTION)).thenReturn(done(movie(1, 878), movie(2, 878)));
        RecommendationService service = service(realOrchestrator());

        RecommendationResponse response = service.forItem(
            INCEPTION,
            "u1",
            List.of(),
            List.of(new ListItem(2, MediaType.MOVIE, List.of(878)))
        );

        assertThat(response.getResults()).extracting(CandidateItem::getId).containsExactly(2L, 1L);
    }

    @Test
    void itemRecommendationsFavorTheUsersTopGenre() {
        when(gateway.similar(INCEPTION)).thenReturn(done(movie(1, 878), movie(2, 18)));
        RecommendationService service = service(realOrchestrator());
        List<WatchHistoryItem> dramaFan = List.of(
            new WatchHistoryItem(10, MediaType.MOVIE, List.of(18)),
            new WatchHistoryItem(11, MediaType.MOVIE, List.of(18, 35))
        );

        RecommendationResponse guest = service.forItem(INCEPTION, null, List.of(), List.of());
        RecommendationResponse personal = service.forItem(INCEPTION, "u1", dramaFan, List.of());

        assertThat(guest.getResults()).extracting(CandidateItem::getId).containsExactly(1L, 2L);
        assertThat(personal.getResults()).extracting(CandidateItem::getId).containsExactly(2L, 1L);
        assertThat(personal.isFromCache()).isFalse();
        assertThat(service.forItem(INCEPTION, "u1", dramaFan, List.of()).isFromCache()).isTrue();
        assertThat(service.forItem(INCEPTION, "u1", dramaFan.subList(0, 1), List.of()).isFromCache()).isFalse();
    }

    @Test
    void missingReferenceItemPropagates() {
        when(gateway.details(INCEPTION))
            .thenReturn(CompletableFuture.failedFuture(new TmdbRequestException(404, "tmdb_http_404", "")));
        RecommendationService service = service(realOrchestrator());

        assertThatThrownBy(() -> service.forItem(INCEPTION, null, List.of(), List.of()))
            .isInstanceOfSatisfying(TmdbRequestException.class, e -> assertThat(e.isNotFound()).isTrue());
    }

    @Test
    void invalidatingUserDropsOnlyTheirEntries() {
        when(gateway.recommendations(WATCHED)).thenReturn(done(movie(20, 18)));
        RecommendationService service = service(realOrchestrator());
        List<WatchHistoryItem> history = List.of(new WatchHistoryItem(10, MediaType.MOVIE, List.of(18)));
        service.home("u1", history, List.of());
        service.home("u2", history, List.of());

        int removed = service.invalidateUser("u1");

        assertThat(removed).isEqualTo(1);
        assertThat(service.home("u1", history, List.of()).isFromCache()).isFalse();
        assertThat(service.home("u2", history, List.of()).isFromCache()).isTrue();
        assertThatThrownBy(() -> service.invalidateUser(" ")).isInstanceOf(InvalidDiscoveryRequestException.class);
    }

    @Test
    void invalidatingUserLeavesUsersWithLongerIdsAlone() {
        when(gateway.recommendations(WATCHED)).thenReturn(done(movie(20, 18)));
        RecommendationService service = service(realOrchestrator());
        List<WatchHistoryItem> history = List.of(new WatchHistoryItem(10, MediaType.MOVIE, List.of(18)));
        service.home("a", history, List.of());
        service.home("a_b", history, List.of());

        assertThat(service.invalidateUser("a")).isEqualTo(1);
        assertThat(service.home("a_b", history, List.of()).isFromCache()).isTrue();
    }

    private RetrievalOrchestrator realOrchestrator() {
        return new RetrievalOrchestrator(gateway, new RetrievalProperties());
    }

    private RecommendationService service(RetrievalOrchestrator orchestrator) {
        return new RecommendationService(
            gateway,
            computeCache,
            cacheProperties,
            new PreferenceExtractor(new PreferenceProperties()),
            orchestrator,
            new RankingEngine(new RankingProperties()),
            new ObjectMapper().findAndRegisterModules()
        );
    }

    private static ItemDetail detail(ItemKey key, Long collectionId) {
        return new ItemDetail(key, "en", "2010-07-15", List.of(28, 878), List.of(), List.of(), List.of(), List.of(), collectionId);
    }

    private static CompletableFuture<List<CandidateItem>> done(CandidateItem... items) {
        return CompletableFuture.completedFuture(List.of(items));
    }
}
