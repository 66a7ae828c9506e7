package com.moviegraph.repository.neo4j;

import com.moviegraph.model.neo4j.MovieNode;
import org.springframework.data.neo4j.repository.Neo4jRepository;
import org.springframework.data.neo4j.repository.query.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

// ========== Movie Node Repository ==========
@Repository
public interface MovieNodeRepository extends Neo4jRepository<MovieNode, String> {

    Optional<MovieNode> findByTitle(String title);

    // Plain properties only, relationships are not needed for listings
    @Query("MATCH (m:Movie) RETURN m ORDER BY m.title")
    List<MovieNode> findAllOrderByTitle();

    @Query("MATCH (p:Person {name: $name})-[:ACTED_IN]->(m:Movie) " +
           "OPTIONAL MATCH (m)-[r:IN_GENRE]->(g:Genre) " +
           "RETURN m, collect(r), collect(g)")
    List<MovieNode> findByActorName(@Param("name") String name);

    @Query("MATCH (p:Person {name: $name})-[:DIRECTED]->(m:Movie) " +
           "OPTIONAL MATCH (m)-[r:IN_GENRE]->(g:Genre) " +
           "RETURN m, collect(r), collect(g)")
    List<MovieNode> findByDirectorName(@Param("name") String name);

    @Query("MATCH (p:Person) RETURN count(p)")
    long countPeople();

    @Query("MATCH (g:Genre) RETURN count(g)")
    long countGenres();

    @Query("MATCH ()-[r]->() RETURN count(r)")
    long countRelationships();
}
