package com.moviegraph.service.similarity;

import com.moviegraph.config.RecommendationProperties;
import com.moviegraph.model.recommendation.OverlapCandidate;
import com.moviegraph.model.recommendation.SignalMatch;
import com.moviegraph.model.recommendation.SignalType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Runs the similarity traversals for a reference movie and normalizes their rows
 * into one candidate per movie.
 */
@Service
@Slf4j
public class SimilarityQueryService {

    private final Map<SignalType, SimilaritySignal> signals = new EnumMap<>(SignalType.class);
    private final RecommendationProperties properties;

    public SimilarityQueryService(List<SimilaritySignal> signals, RecommendationProperties properties) {
        for (SimilaritySignal signal : signals) {
            if (this.signals.put(signal.type(), signal) != null) {
                throw new IllegalStateException("Duplicate similarity signal for " + signal.type());
            }
        }
        this.properties = properties;
    }

    public List<SignalMatch> findByGenreOverlap(String title) {
        return findByGenreOverlap(title, properties.getQueryTimeout());
    }

    public List<SignalMatch> findByGenreOverlap(String title, Duration timeout) {
        return signal(SignalType.GENRE).extract(title, timeout);
    }

    public List<SignalMatch> findByCastOverlap(String title) {
        return findByCastOverlap(title, properties.getQueryTimeout());
    }

    public List<SignalMatch> findByCastOverlap(String title, Duration timeout) {
        return signal(SignalType.CAST).extract(title, timeout);
    }

    public List<OverlapCandidate> findCombined(String title) {
        return findCombined(title, properties.getQueryTimeout());
    }

    public List<OverlapCandidate> findCombined(String title, Duration timeout) {
        return findCandidates(title, EnumSet.allOf(SignalType.class), timeout);
    }

    /**
     * Union of the candidates reached by the requested signals. A signal that does
     * not reach a candidate contributes zero to that candidate's count.
     */
    public List<OverlapCandidate> findCandidates(String title, Set<SignalType> types, Duration timeout) {
        Map<String, OverlapCandidate> byTitle = new TreeMap<>();
        for (SignalType type : EnumSet.copyOf(types)) {
            List<SignalMatch> matches = signal(type).extract(title, timeout);
            log.debug("Signal {} reached {} candidates for '{}'", type, matches.size(), title);
            for (SignalMatch match : matches) {
                byTitle.merge(match.getMovie().getTitle(), toCandidate(type, match), (current, added) -> merge(type, current, added));
            }
        }
        return new ArrayList<>(byTitle.values());
    }

    private SimilaritySignal signal(SignalType type) {
        SimilaritySignal signal = signals.get(type);
        if (signal == null) {
            throw new IllegalStateException("No similarity signal registered for " + type);
        }
        return signal;
    }

    private static OverlapCandidate toCandidate(SignalType type, SignalMatch match) {
        OverlapCandidate.OverlapCandidateBuilder builder = OverlapCandidate.builder().movie(match.getMovie());
        switch (type) {
            case GENRE -> builder.sharedGenreCount(match.getSharedCount());
            case CAST -> builder.sharedActorCount(match.getSharedCount());
        }
        return builder.build();
    }

    private static OverlapCandidate merge(SignalType type, OverlapCandidate current, OverlapCandidate added) {
        return switch (type) {
            case GENRE -> current.toBuilder().sharedGenreCount(added.getSharedGenreCount()).build();
            case CAST -> current.toBuilder().sharedActorCount(added.getSharedActorCount()).build();
        };
    }
}
