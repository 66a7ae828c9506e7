package com.moviegraph.model.recommendation;

import com.fasterxml.jackson.annotation.JsonUnwrapped;
import lombok.Builder;
import lombok.Value;

/**
 * One ranked recommendation. Lives only for the duration of a single request.
 */
@Value
@Builder
public class ScoredCandidate {
    @JsonUnwrapped
    Movie movie;

    int sharedGenreCount;
    int sharedActorCount;
    double compositeScore;
}
