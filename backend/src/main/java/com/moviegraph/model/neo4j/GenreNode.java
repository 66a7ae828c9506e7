package com.moviegraph.model.neo4j;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.neo4j.core.schema.Id;
import org.springframework.data.neo4j.core.schema.Node;

// ========== Genre Node ==========
@Node("Genre")
@Data
@NoArgsConstructor
@AllArgsConstructor
public class GenreNode {
    @Id
    private String name;
}
