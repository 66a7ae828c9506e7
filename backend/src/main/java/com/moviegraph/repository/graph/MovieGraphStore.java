package com.moviegraph.repository.graph;

import com.moviegraph.model.recommendation.SignalMatch;

import java.time.Duration;
import java.util.List;

/**
 * Read-only access to the movie knowledge graph for similarity traversals.
 *
 * <p>Implementations match the reference movie by title, follow {@code path} to the
 * shared nodes and back out to other movies, and count distinct shared nodes per
 * candidate. The reference movie is never part of the result. An unknown title
 * yields an empty list.
 */
public interface MovieGraphStore {

    /**
     * @param title   reference movie title
     * @param path    relationship pattern that defines "shared"
     * @param timeout deadline for the store to answer
     * @return one match per reachable candidate, in no guaranteed order
     * @throws com.moviegraph.exception.StoreUnavailableException if the store cannot be reached
     * @throws com.moviegraph.exception.StoreTimeoutException if the deadline passes
     */
    List<SignalMatch> findOverlap(String title, OverlapPath path, Duration timeout);
}
