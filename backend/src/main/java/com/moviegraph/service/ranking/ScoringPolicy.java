package com.moviegraph.service.ranking;

import com.moviegraph.model.recommendation.OverlapCandidate;
import com.moviegraph.model.recommendation.RecommendationStrategy;
import lombok.Getter;

/**
 * Turns raw overlap counts into a single score.
 *
 * <p>Weights are non-negative, so the combined score never decreases when either
 * count grows.
 */
@Getter
public class ScoringPolicy {

    private final double genreWeight;
    private final double actorWeight;

    public ScoringPolicy(double genreWeight, double actorWeight) {
        if (genreWeight < 0 || actorWeight < 0 || Double.isNaN(genreWeight) || Double.isNaN(actorWeight)) {
            throw new IllegalArgumentException(
                "Scoring weights must be non-negative, got genre=" + genreWeight + ", actor=" + actorWeight);
        }
        this.genreWeight = genreWeight;
        this.actorWeight = actorWeight;
    }

    public double score(OverlapCandidate candidate, RecommendationStrategy strategy) {
        return switch (strategy) {
            case GENRE -> candidate.getSharedGenreCount();
            case CAST -> candidate.getSharedActorCount();
            case COMBINED -> candidate.getSharedGenreCount() * genreWeight
                + candidate.getSharedActorCount() * actorWeight;
        };
    }
}
