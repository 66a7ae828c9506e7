package com.moviegraph.service.ranking;

import com.moviegraph.config.RecommendationProperties;
import com.moviegraph.model.recommendation.OverlapCandidate;
import com.moviegraph.model.recommendation.RecommendationStrategy;
import com.moviegraph.model.recommendation.ScoredCandidate;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Comparator;
import java.util.List;

/**
 * Scores overlap candidates, orders them and keeps the top {@code limit}.
 *
 * <p>Ordering is total: descending score, then (combined only) descending shared
 * actor count, then ascending title. The result never depends on the order the
 * candidates arrived in.
 */
@Component
@Slf4j
public class RankingEngine {

    private static final Comparator<ScoredCandidate> BY_SCORE =
        Comparator.comparingDouble(ScoredCandidate::getCompositeScore).reversed();
    private static final Comparator<ScoredCandidate> BY_ACTORS =
        Comparator.comparingInt(ScoredCandidate::getSharedActorCount).reversed();
    private static final Comparator<ScoredCandidate> BY_TITLE =
        Comparator.comparing(candidate -> candidate.getMovie().getTitle());

    private final ScoringPolicy scoringPolicy;

    @Autowired
    public RankingEngine(RecommendationProperties properties) {
        this(new ScoringPolicy(properties.getGenreWeight(), properties.getActorWeight()));
    }

    public RankingEngine(ScoringPolicy scoringPolicy) {
        this.scoringPolicy = scoringPolicy;
    }

    public List<ScoredCandidate> rank(Collection<OverlapCandidate> candidates, RecommendationStrategy strategy, int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive, got " + limit);
        }
        List<ScoredCandidate> ranked = candidates.stream()
            .map(candidate -> ScoredCandidate.builder()
                .movie(candidate.getMovie())
                .sharedGenreCount(candidate.getSharedGenreCount())
                .sharedActorCount(candidate.getSharedActorCount())
                .compositeScore(scoringPolicy.score(candidate, strategy))
                .build())
            .sorted(comparatorFor(strategy))
            .limit(limit)
            .toList();
        log.debug("Ranked {} candidates under {}, kept {}", candidates.size(), strategy, ranked.size());
        return ranked;
    }

    static Comparator<ScoredCandidate> comparatorFor(RecommendationStrategy strategy) {
        if (strategy == RecommendationStrategy.COMBINED) {
            return BY_SCORE.thenComparing(BY_ACTORS).thenComparing(BY_TITLE);
        }
        return BY_SCORE.thenComparing(BY_TITLE);
    }
}
