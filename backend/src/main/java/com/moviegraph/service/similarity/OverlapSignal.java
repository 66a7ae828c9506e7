package com.moviegraph.service.similarity;

import com.moviegraph.model.recommendation.SignalMatch;
import com.moviegraph.model.recommendation.SignalType;
import com.moviegraph.repository.graph.MovieGraphStore;
import com.moviegraph.repository.graph.OverlapPath;
import lombok.RequiredArgsConstructor;

import java.time.Duration;
import java.util.List;

/**
 * Signal backed by a single two-hop overlap path in the graph store.
 */
@RequiredArgsConstructor
abstract class OverlapSignal implements SimilaritySignal {

    private final MovieGraphStore graphStore;
    private final SignalType type;
    private final OverlapPath path;

    @Override
    public SignalType type() {
        return type;
    }

    @Override
    public List<SignalMatch> extract(String title, Duration timeout) {
        return graphStore.findOverlap(title, path, timeout);
    }
}
