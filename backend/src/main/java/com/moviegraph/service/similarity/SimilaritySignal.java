package com.moviegraph.service.similarity;

import com.moviegraph.model.recommendation.SignalMatch;
import com.moviegraph.model.recommendation.SignalType;

import java.time.Duration;
import java.util.List;

/**
 * One kind of structural overlap between a reference movie and the rest of the graph.
 */
public interface SimilaritySignal {

    SignalType type();

    /**
     * Candidates sharing at least one related entity with {@code title}, excluding
     * {@code title} itself. Empty when the movie is unknown or has no such relationships.
     */
    List<SignalMatch> extract(String title, Duration timeout);
}
