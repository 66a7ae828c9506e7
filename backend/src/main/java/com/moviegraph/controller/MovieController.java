package com.moviegraph.controller;

import com.moviegraph.dto.catalog.GraphStatistics;
import com.moviegraph.dto.catalog.MovieDetails;
import com.moviegraph.dto.catalog.MovieListing;
import com.moviegraph.model.recommendation.Movie;
import com.moviegraph.service.CatalogService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

// ========== Movie Controller ==========
@RestController
@RequestMapping("/api/movies")
@RequiredArgsConstructor
@Tag(name = "Movies", description = "Movie catalog lookups")
public class MovieController {

    private final CatalogService catalogService;

    @GetMapping
    @Operation(summary = "List all movies ordered by title")
    public ResponseEntity<List<Movie>> getAllMovies() {
        return ResponseEntity.ok(catalogService.getAllMovies());
    }

    @GetMapping("/statistics")
    @Operation(summary = "Node and relationship counts")
    public ResponseEntity<GraphStatistics> getStatistics() {
        return ResponseEntity.ok(catalogService.getStatistics());
    }

    @GetMapping("/by-actor/{name}")
    @Operation(summary = "Movies featuring an actor, newest first")
    public ResponseEntity<List<MovieListing>> getMoviesByActor(@PathVariable String name) {
        return ResponseEntity.ok(catalogService.getMoviesByActor(name));
    }

    @GetMapping("/by-director/{name}")
    @Operation(summary = "Movies directed by a person, newest first")
    public ResponseEntity<List<MovieListing>> getMoviesByDirector(@PathVariable String name) {
        return ResponseEntity.ok(catalogService.getMoviesByDirector(name));
    }

    @GetMapping("/{title}")
    @Operation(summary = "Movie details with directors, cast and genres")
    public ResponseEntity<MovieDetails> getMovieDetails(@PathVariable String title) {
        return catalogService.getMovieDetails(title)
            .map(ResponseEntity::ok)
            .orElse(ResponseEntity.notFound().build());
    }
}
