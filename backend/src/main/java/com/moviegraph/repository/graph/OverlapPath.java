package com.moviegraph.repository.graph;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Two-hop path linking the reference movie to a candidate through a shared node:
 * {@code (reference) -[relationship]- (shared:sharedLabel) -[relationship]- (candidate)}.
 * {@code outgoing} is the direction of the relationship as seen from a movie.
 */
@Getter
@RequiredArgsConstructor
public enum OverlapPath {
    SHARED_GENRE("IN_GENRE", "Genre", true),
    SHARED_ACTOR("ACTED_IN", "Person", false);

    private final String relationshipType;
    private final String sharedLabel;
    private final boolean outgoing;
}
