package com.moviegraph.service.similarity;

import com.moviegraph.model.recommendation.SignalType;
import com.moviegraph.repository.graph.MovieGraphStore;
import com.moviegraph.repository.graph.OverlapPath;
import org.springframework.stereotype.Component;

/**
 * Movies sharing actors with the reference movie, counted by distinct actor.
 */
@Component
public class CastSignal extends OverlapSignal {

    public CastSignal(MovieGraphStore graphStore) {
        super(graphStore, SignalType.CAST, OverlapPath.SHARED_ACTOR);
    }
}
