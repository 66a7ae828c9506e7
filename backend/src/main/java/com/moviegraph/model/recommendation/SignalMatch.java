package com.moviegraph.model.recommendation;

import lombok.Builder;
import lombok.Value;

/**
 * A candidate movie reached through one signal, with the number of distinct
 * shared entities (genres or actors) linking it to the reference movie.
 */
@Value
@Builder
public class SignalMatch {
    Movie movie;
    int sharedCount;
}
