package com.moviegraph.model.neo4j;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.neo4j.core.schema.*;

import java.util.HashSet;
import java.util.Set;

// ========== Movie Node ==========
@Node("Movie")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MovieNode {
    @Id
    private String title; // Unique across the corpus

    @Property("year")
    private Integer year;

    @Property("rating")
    private Double rating;

    @Property("tagline")
    private String tagline;

    @Property("description")
    private String description;

    @Relationship(type = "IN_GENRE", direction = Relationship.Direction.OUTGOING)
    @Builder.Default
    private Set<GenreNode> genres = new HashSet<>();

    @Relationship(type = "ACTED_IN", direction = Relationship.Direction.INCOMING)
    @Builder.Default
    private Set<PersonNode> actors = new HashSet<>();

    @Relationship(type = "DIRECTED", direction = Relationship.Direction.INCOMING)
    @Builder.Default
    private Set<PersonNode> directors = new HashSet<>();
}
