package com.moviegraph.service.similarity;

import com.moviegraph.model.recommendation.SignalType;
import com.moviegraph.repository.graph.MovieGraphStore;
import com.moviegraph.repository.graph.OverlapPath;
import org.springframework.stereotype.Component;

/**
 * Movies sharing genres with the reference movie, counted by distinct genre.
 */
@Component
public class GenreSignal extends OverlapSignal {

    public GenreSignal(MovieGraphStore graphStore) {
        super(graphStore, SignalType.GENRE, OverlapPath.SHARED_GENRE);
    }
}
