package com.moviegraph.model.recommendation;

import com.moviegraph.exception.InvalidArgumentException;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

public enum RecommendationStrategy {
    GENRE(EnumSet.of(SignalType.GENRE)),
    CAST(EnumSet.of(SignalType.CAST)),
    COMBINED(EnumSet.of(SignalType.GENRE, SignalType.CAST));

    private final Set<SignalType> signals;

    RecommendationStrategy(Set<SignalType> signals) {
        this.signals = signals;
    }

    /**
     * Signals that must be extracted from the graph to rank under this strategy.
     */
    public Set<SignalType> signals() {
        return EnumSet.copyOf(signals);
    }

    /**
     * Parses "genre", "cast" or "combined", ignoring case and surrounding blanks.
     *
     * @throws InvalidArgumentException for null or unknown values
     */
    public static RecommendationStrategy fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new InvalidArgumentException("Strategy is required, expected one of " + allowedValues());
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        return Arrays.stream(values())
            .filter(strategy -> strategy.name().equals(normalized))
            .findFirst()
            .orElseThrow(() -> new InvalidArgumentException(
                "Unknown strategy '" + value + "', expected one of " + allowedValues()));
    }

    private static String allowedValues() {
        return Arrays.stream(values())
            .map(strategy -> strategy.name().toLowerCase(Locale.ROOT))
            .collect(Collectors.joining(", "));
    }
}
