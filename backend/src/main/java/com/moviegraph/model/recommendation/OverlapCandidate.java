package com.moviegraph.model.recommendation;

import lombok.Builder;
import lombok.Value;

/**
 * Raw overlap counts for one candidate, before scoring. A signal that was not
 * extracted, or did not reach this candidate, counts as zero.
 */
@Value
@Builder(toBuilder = true)
public class OverlapCandidate {
    Movie movie;
    int sharedGenreCount;
    int sharedActorCount;
}
