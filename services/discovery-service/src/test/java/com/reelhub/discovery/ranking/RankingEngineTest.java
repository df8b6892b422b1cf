package com.reelhub.discovery.ranking;

import static com.reelhub.discovery.Candidates.movie;
import static com.reelhub.discovery.Candidates.series;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import com.reelhub.discovery.model.CandidateItem;
import com.reelhub.discovery.model.ItemKey;
import com.reelhub.discovery.model.MediaType;
import com.reelhub.discovery.model.SourceResult;
import com.reelhub.discovery.model.TasteProfile;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;

class RankingEngineTest {
    private static final int DRAMA = 18;

    private final RankingProperties properties = new RankingProperties();
    private final RankingEngine engine = new RankingEngine(properties);

    @Test
    void itemsFoundBySeveralSourcesOutrankSingleSourceItems() {
        List<SourceResult> sources = List.of(
            new SourceResult("similar", List.of(movie(1, 28), movie(2, 35))),
            new SourceResult("recommendations", List.of(movie(2, 35)))
        );

        List<ScoredCandidate> ranked = engine.rankScored(sources, RankingContext.homeFeed(TasteProfile.empty(), Set.of(), Set.of()));

        assertThat(ranked).extracting(candidate -> candidate.item().getId()).containsExactly(2L, 1L);
        assertThat(ranked.get(0).score()).isCloseTo(15 + 2 + 5 + 2, within(1e-9));
        assertThat(ranked.get(0).sources()).containsExactly("similar", "recommendations");
    }

    @Test
    void duplicateWithinOneSourceCountsOnce() {
        List<SourceResult> sources = List.of(new SourceResult("franchise", List.of(movie(1), movie(1))));

        List<ScoredCandidate> ranked = engine.rankScored(sources, RankingContext.homeFeed(null, Set.of(), Set.of()));

        assertThat(ranked).hasSize(1);
        assertThat(ranked.get(0).score()).isCloseTo(27.0, within(1e-9));
    }

    @Test
    void sameIdDifferentMediaTypeAreDistinct() {
        List<SourceResult> sources = List.of(new SourceResult("similar", List.of(movie(7), series(7))));

        List<CandidateItem> ranked = engine.rank(sources, RankingContext.homeFeed(null, Set.of(), Set.of()));

        assertThat(ranked).extracting(CandidateItem::key)
            .containsExactly(ItemKey.of(MediaType.MOVIE, 7), ItemKey.of(MediaType.TV, 7));
    }

    @Test
    void rankingIsDeterministicAndIndependentOfSourceOrder() {
        SourceResult similar = new SourceResult("similar", List.of(movie(1, 28), movie(2, 35), movie(3, 18)));
        SourceResult era = new SourceResult("era", List.of(movie(3, 18), movie(4, 99)));
        SourceResult keyword = new SourceResult("keyword", List.of(movie(4, 99), movie(1, 28)));
        RankingContext context = RankingContext.homeFeed(TasteProfile.genresOnly(List.of(18)), Set.of(), Set.of());

        List<ScoredCandidate> first = engine.rankScored(List.of(similar, era, keyword), context);
        List<ScoredCandidate> again = engine.rankScored(List.of(similar, era, keyword), context);
        List<ScoredCandidate> reordered = engine.rankScored(List.of(keyword, era, similar), context);

        assertThat(again).extracting(candidate -> candidate.item().getId())
            .containsExactlyElementsOf(first.stream().map(candidate -> candidate.item().getId()).collect(Collectors.toList()));
        assertThat(scores(reordered)).isEqualTo(scores(first));
    }

    @Test
    void homeFeedExcludesWatchedItemsAndItemsWithoutImages() {
        CandidateItem noImage = movie(3);
        noImage.setPosterPath(null);
        List<SourceResult> sources = List.of(new SourceResult("similar", List.of(movie(1), movie(2), noImage)));

        List<CandidateItem> ranked = engine.rank(
            sources,
            RankingContext.homeFeed(null, Set.of(ItemKey.of(MediaType.MOVIE, 1)), Set.of())
        );

        assertThat(ranked).extracting(CandidateItem::getId).containsExactly(2L);
    }

    @Test
    void backdropAloneCountsAsImage() {
        CandidateItem backdropOnly = movie(3);
        backdropOnly.setPosterPath("");
        backdropOnly.setBackdropPath("/b3.jpg");

        List<CandidateItem> ranked = engine.rank(
            List.of(new SourceResult("similar", List.of(backdropOnly))),
            RankingContext.homeFeed(null, Set.of(), Set.of())
        );

        assertThat(ranked).hasSize(1);
    }

    @Test
    void itemDetailExcludesReferenceButKeepsWatchedItems() {
        ItemKey reference = ItemKey.of(MediaType.MOVIE, 27205);
        List<SourceResult> sources = List.of(new SourceResult("similar", List.of(movie(27205), movie(1), movie(2))));

        List<CandidateItem> ranked = engine.rank(sources, RankingContext.itemDetail(reference, null, Set.of()));

        assertThat(ranked).extracting(CandidateItem::getId).containsExactly(1L, 2L);
    }

    @Test
    void savedListItemsArePenalizedOnHomeAndBoostedOnItemDetail() {
        ItemKey saved = ItemKey.of(MediaType.MOVIE, 2);
        List<SourceResult> sources = List.of(new SourceResult("similar", List.of(movie(1), movie(2))));

        List<ScoredCandidate> home = engine.rankScored(sources, RankingContext.homeFeed(null, Set.of(), Set.of(saved)));
        List<ScoredCandidate> item = engine.rankScored(sources, RankingContext.itemDetail(null, null, Set.of(saved)));
        List<ScoredCandidate> ignored = engine.rankScored(
            sources,
            RankingContext.homeFeed(null, Set.of(), Set.of(saved)).withSavedListPolicy(SavedListPolicy.IGNORE)
        );

        assertThat(home).extracting(candidate -> candidate.item().getId()).containsExactly(1L, 2L);
        assertThat(home.get(1).score()).isCloseTo(12.0, within(1e-9));
        assertThat(item).extracting(candidate -> candidate.item().getId()).containsExactly(2L, 1L);
        assertThat(item.get(0).score()).isCloseTo(27.0, within(1e-9));
        assertThat(scores(ignored).get(ItemKey.of(MediaType.MOVIE, 2))).isCloseTo(17.0, within(1e-9));
    }

    @Test
    void profileBoostsApplyForGenreForeignLanguageAndEra() {
        CandidateItem match = movie(1, 35, DRAMA);
        match.setOriginalLanguage("ko");
        match.setReleaseDate("1997-05-01");
        match.setVoteAverage(7.5);
        CandidateItem plain = movie(2, 35);
        plain.setVoteAverage(Double.NaN);
        TasteProfile profile = new TasteProfile(List.of(DRAMA), List.of(), "ko", List.of(), 1990);
        List<SourceResult> sources = List.of(new SourceResult("similar", List.of(plain, match)));

        Map<ItemKey, Double> home = scores(engine.rankScored(sources, RankingContext.homeFeed(profile, Set.of(), Set.of())));
        Map<ItemKey, Double> item = scores(engine.rankScored(sources, RankingContext.itemDetail(null, profile, Set.of())));

        assertThat(home.get(ItemKey.of(MediaType.MOVIE, 1))).isCloseTo(17 + 7.5 + 2 + 3 + 3, within(1e-9));
        assertThat(home.get(ItemKey.of(MediaType.MOVIE, 2))).isCloseTo(17.0, within(1e-9));
        assertThat(item.get(ItemKey.of(MediaType.MOVIE, 1))).isCloseTo(17 + 7.5 + 3 + 3 + 3, within(1e-9));
    }

    @Test
    void platformLanguageIsNeverBoosted() {
        CandidateItem english = movie(1);
        english.setOriginalLanguage("en");
        TasteProfile profile = new TasteProfile(List.of(), List.of(), "en", List.of(), null);

        List<ScoredCandidate> ranked = engine.rankScored(
            List.of(new SourceResult("similar", List.of(english))),
            RankingContext.homeFeed(profile, Set.of(), Set.of())
        );

        assertThat(ranked.get(0).score()).isCloseTo(17.0, within(1e-9));
    }

    @Test
    void diversityCapsPrimaryGenreAndBackfillsWhenShort() {
        List<CandidateItem> sameGenre = new ArrayList<>();
        for (int id = 1; id <= 15; id++) {
            sameGenre.add(movie(id, DRAMA));
        }
        List<CandidateItem> mixed = new ArrayList<>(sameGenre);
        for (int id = 16; id <= 25; id++) {
            mixed.add(movie(id, 1000 + id));
        }
        List<SourceResult> sources = List.of(
            new SourceResult("similar", mixed),
            new SourceResult("franchise", List.of(movie(1, DRAMA), movie(2, DRAMA)))
        );

        List<CandidateItem> ranked = engine.rank(sources, RankingContext.homeFeed(null, Set.of(), Set.of()));

        assertThat(ranked).hasSize(20);
        assertThat(ranked.subList(0, 2)).extracting(CandidateItem::getId).containsExactly(1L, 2L);
        assertThat(ranked.subList(0, 13)).filteredOn(item -> item.primaryGenre() == DRAMA).hasSize(3);
        assertThat(ranked.subList(13, 20)).extracting(CandidateItem::getId)
            .containsExactly(4L, 5L, 6L, 7L, 8L, 9L, 10L);
    }

    @Test
    void outliersBypassGenreCap() {
        List<CandidateItem> strong = new ArrayList<>();
        for (int id = 1; id <= 5; id++) {
            strong.add(movie(id, DRAMA));
        }
        List<SourceResult> sources = List.of(
            new SourceResult("similar", strong),
            new SourceResult("franchise", strong),
            new SourceResult("era", List.of(movie(6, DRAMA), movie(7, 35)))
        );

        List<CandidateItem> ranked = engine.rank(sources, RankingContext.homeFeed(null, Set.of(), Set.of()).withLimit(6));

        assertThat(ranked).extracting(CandidateItem::getId).containsExactly(1L, 2L, 3L, 4L, 5L, 7L);
    }

    @Test
    void itemDetailTruncatesWithoutDiversity() {
        List<CandidateItem> items = new ArrayList<>();
        for (int id = 1; id <= 15; id++) {
            items.add(movie(id, DRAMA));
        }

        List<CandidateItem> ranked = engine.rank(
            List.of(new SourceResult("similar", items)),
            RankingContext.itemDetail(null, null, Set.of())
        );

        assertThat(ranked).hasSize(12).allMatch(item -> item.primaryGenre() == DRAMA);
    }

    @Test
    void numberedTagsShareTheirSourceWeightAndUnknownTagsScoreZero() {
        assertThat(engine.sourceWeight("history_recent_2")).isEqualTo(15.0);
        assertThat(engine.sourceWeight("mylist_intent_0")).isEqualTo(12.0);
        assertThat(engine.sourceWeight("popular_genre_1")).isEqualTo(4.5);
        assertThat(engine.sourceWeight("quality_genre_2")).isEqualTo(3.0);
        assertThat(engine.sourceWeight("mystery")).isZero();
    }

    @Test
    void unknownSourceStillContributesBaseWeight() {
        List<ScoredCandidate> ranked = engine.rankScored(
            List.of(new SourceResult("mystery", List.of(movie(1)))),
            RankingContext.homeFeed(null, Set.of(), Set.of())
        );

        assertThat(ranked.get(0).score()).isCloseTo(2.0, within(1e-9));
    }

    private static Map<ItemKey, Double> scores(List<ScoredCandidate> ranked) {
        return ranked.stream().collect(Collectors.toMap(candidate -> candidate.item().key(), ScoredCandidate::score));
    }
}
