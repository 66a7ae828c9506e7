package com.moviegraph.model.recommendation;

/**
 * Structural overlap signals between two movies.
 */
public enum SignalType {
    GENRE,
    CAST
}
