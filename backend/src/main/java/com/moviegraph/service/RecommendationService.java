package com.moviegraph.service;

import com.moviegraph.config.RecommendationProperties;
import com.moviegraph.exception.InvalidArgumentException;
import com.moviegraph.model.recommendation.OverlapCandidate;
import com.moviegraph.model.recommendation.RecommendationStrategy;
import com.moviegraph.model.recommendation.ScoredCandidate;
import com.moviegraph.service.ranking.RankingEngine;
import com.moviegraph.service.similarity.SimilarityQueryService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;

// ========== Recommendation Service ==========
@Service
@RequiredArgsConstructor
@Slf4j
public class RecommendationService {

    private final SimilarityQueryService similarityQueryService;
    private final RankingEngine rankingEngine;
    private final RecommendationProperties properties;

    public List<ScoredCandidate> recommend(String title, RecommendationStrategy strategy) {
        return recommend(title, strategy, properties.getDefaultLimit());
    }

    public List<ScoredCandidate> recommend(String title, String strategy, int limit) {
        return recommend(title, RecommendationStrategy.fromValue(strategy), limit);
    }

    /**
     * Entry point for callers holding raw request values; a null limit or timeout
     * falls back to the configured default.
     */
    public List<ScoredCandidate> recommend(String title, String strategy, Integer limit, Duration timeout) {
        return recommend(
            title,
            RecommendationStrategy.fromValue(strategy),
            limit != null ? limit : properties.getDefaultLimit(),
            timeout != null ? timeout : properties.getQueryTimeout());
    }

    public List<ScoredCandidate> recommend(String title, RecommendationStrategy strategy, int limit) {
        return recommend(title, strategy, limit, properties.getQueryTimeout());
    }

    /**
     * Recommends movies similar to {@code title}.
     *
     * @return at most {@code limit} candidates, best first; empty when the movie is
     *         unknown or shares nothing with any other movie
     * @throws InvalidArgumentException for a blank title, missing strategy, non-positive
     *         limit or non-positive timeout
     * @throws com.moviegraph.exception.StoreUnavailableException when the graph store cannot be reached
     * @throws com.moviegraph.exception.StoreTimeoutException when the store misses the deadline
     */
    public List<ScoredCandidate> recommend(String title, RecommendationStrategy strategy, int limit, Duration timeout) {
        validate(title, strategy, limit, timeout);
        log.info("Recommending for '{}' using {} strategy (limit {})", title, strategy, limit);

        List<OverlapCandidate> candidates = similarityQueryService.findCandidates(title, strategy.signals(), timeout);
        if (candidates.isEmpty()) {
            log.warn("No candidates found for '{}' using {} strategy", title, strategy);
            return List.of();
        }

        List<ScoredCandidate> ranked = rankingEngine.rank(candidates, strategy, limit);
        log.info("Returning {} of {} candidates for '{}'", ranked.size(), candidates.size(), title);
        return ranked;
    }

    private static void validate(String title, RecommendationStrategy strategy, int limit, Duration timeout) {
        if (title == null || title.isBlank()) {
            throw new InvalidArgumentException("Movie title is required");
        }
        if (strategy == null) {
            throw new InvalidArgumentException("Strategy is required");
        }
        if (limit <= 0) {
            throw new InvalidArgumentException("Limit must be a positive integer, got " + limit);
        }
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            throw new InvalidArgumentException("Timeout must be positive, got " + timeout);
        }
    }
}
