package com.moviegraph.service.ranking;

import com.moviegraph.config.RecommendationProperties;
import com.moviegraph.model.recommendation.Movie;
import com.moviegraph.model.recommendation.OverlapCandidate;
import com.moviegraph.model.recommendation.RecommendationStrategy;
import com.moviegraph.model.recommendation.ScoredCandidate;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RankingEngineTest {

    private final RankingEngine engine = new RankingEngine(new ScoringPolicy(2.0, 3.0));

    @Test
    void should_OrderGenreStrategy_ByScoreThenTitle() {
        List<OverlapCandidate> candidates = List.of(
            candidate("Zodiac", 1, 4),
            candidate("Alien", 1, 0),
            candidate("Memento", 3, 0));

        List<ScoredCandidate> ranked = engine.rank(candidates, RecommendationStrategy.GENRE, 10);

        assertThat(titles(ranked)).containsExactly("Memento", "Alien", "Zodiac");
        assertThat(ranked.get(0).getCompositeScore()).isEqualTo(3.0);
    }

    @Test
    void should_OrderCastStrategy_ByActorCountThenTitle() {
        List<OverlapCandidate> candidates = List.of(
            candidate("Beta", 5, 1),
            candidate("Alpha", 0, 1),
            candidate("Gamma", 0, 2));

        List<ScoredCandidate> ranked = engine.rank(candidates, RecommendationStrategy.CAST, 10);

        assertThat(titles(ranked)).containsExactly("Gamma", "Alpha", "Beta");
    }

    @Test
    void should_BreakCombinedTies_ByActorCountBeforeTitle() {
        // Both score 6: three genres versus two actors
        List<OverlapCandidate> candidates = List.of(
            candidate("Aardvark", 3, 0),
            candidate("Zebra", 0, 2),
            candidate("Top", 2, 2));

        List<ScoredCandidate> ranked = engine.rank(candidates, RecommendationStrategy.COMBINED, 10);

        assertThat(titles(ranked)).containsExactly("Top", "Zebra", "Aardvark");
        assertThat(ranked).extracting(ScoredCandidate::getCompositeScore).containsExactly(10.0, 6.0, 6.0);
    }

    @Test
    void should_TruncateToLimit_AndNeverPad() {
        List<OverlapCandidate> candidates = List.of(
            candidate("A", 1, 0),
            candidate("B", 2, 0),
            candidate("C", 3, 0));

        assertThat(engine.rank(candidates, RecommendationStrategy.GENRE, 2)).hasSize(2);
        assertThat(engine.rank(candidates, RecommendationStrategy.GENRE, 5)).hasSize(3);
        assertThat(engine.rank(List.of(), RecommendationStrategy.GENRE, 5)).isEmpty();
    }

    @Test
    void should_ProduceSameOrdering_RegardlessOfArrivalOrder() {
        List<OverlapCandidate> candidates = new ArrayList<>(List.of(
            candidate("E", 1, 1),
            candidate("D", 1, 1),
            candidate("C", 2, 0),
            candidate("B", 0, 2),
            candidate("A", 4, 0)));
        List<String> expected = titles(engine.rank(candidates, RecommendationStrategy.COMBINED, 10));

        Collections.reverse(candidates);
        assertThat(titles(engine.rank(candidates, RecommendationStrategy.COMBINED, 10))).isEqualTo(expected);
        Collections.shuffle(candidates, new java.util.Random(42));
        assertThat(titles(engine.rank(candidates, RecommendationStrategy.COMBINED, 10))).isEqualTo(expected);
    }

    @Test
    void should_CarryOverlapCountsIntoScoredCandidates() {
        ScoredCandidate scored = engine.rank(List.of(candidate("Solo", 2, 1)), RecommendationStrategy.COMBINED, 1).get(0);

        assertThat(scored.getMovie().getTitle()).isEqualTo("Solo");
        assertThat(scored.getSharedGenreCount()).isEqualTo(2);
        assertThat(scored.getSharedActorCount()).isEqualTo(1);
        assertThat(scored.getCompositeScore()).isEqualTo(7.0);
    }

    @Test
    void should_ReadWeightsFromProperties() {
        RecommendationProperties properties = new RecommendationProperties();
        properties.setGenreWeight(1.0);
        properties.setActorWeight(10.0);
        RankingEngine configured = new RankingEngine(properties);

        List<ScoredCandidate> ranked = configured.rank(
            List.of(candidate("Genres", 5, 0), candidate("Actors", 0, 1)), RecommendationStrategy.COMBINED, 5);

        assertThat(titles(ranked)).containsExactly("Actors", "Genres");
    }

    @Test
    void should_RejectNonPositiveLimit() {
        assertThatThrownBy(() -> engine.rank(List.of(), RecommendationStrategy.GENRE, 0))
            .isInstanceOf(IllegalArgumentException.class);
    }

    private static OverlapCandidate candidate(String title, int genres, int actors) {
        return OverlapCandidate.builder()
            .movie(Movie.builder().title(title).year(2000).build())
            .sharedGenreCount(genres)
            .sharedActorCount(actors)
            .build();
    }

    private static List<String> titles(List<ScoredCandidate> ranked) {
        return ranked.stream().map(candidate -> candidate.getMovie().getTitle()).toList();
    }
}
