package com.moviegraph.model.recommendation;

import lombok.Builder;
import lombok.Value;

/**
 * A movie as seen by the recommendation core. Title is the identity.
 */
@Value
@Builder
public class Movie {
    String title;
    Integer year;
    Double rating; // optional
}
