package com.moviegraph.service;

import com.moviegraph.dto.catalog.GraphStatistics;
import com.moviegraph.dto.catalog.MovieDetails;
import com.moviegraph.dto.catalog.MovieListing;
import com.moviegraph.model.neo4j.GenreNode;
import com.moviegraph.model.neo4j.MovieNode;
import com.moviegraph.model.neo4j.PersonNode;
import com.moviegraph.model.recommendation.Movie;
import com.moviegraph.repository.neo4j.MovieNodeRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Read-only lookups over the movie graph: listings, details and counts.
 */
@Service
@RequiredArgsConstructor
@Slf4j
@Transactional(readOnly = true, transactionManager = "neo4jTransactionManager")
public class CatalogService {

    private static final Comparator<MovieListing> NEWEST_FIRST =
        Comparator.comparing(MovieListing::getYear, Comparator.nullsLast(Comparator.reverseOrder()))
            .thenComparing(MovieListing::getTitle);

    private final MovieNodeRepository movieNodeRepository;

    public List<Movie> getAllMovies() {
        return movieNodeRepository.findAllOrderByTitle().stream()
            .map(node -> Movie.builder()
                .title(node.getTitle())
                .year(node.getYear())
                .rating(node.getRating())
                .build())
            .toList();
    }

    public Optional<MovieDetails> getMovieDetails(String title) {
        log.info("Fetching details for movie: {}", title);
        Optional<MovieDetails> details = movieNodeRepository.findByTitle(title).map(this::toDetails);
        if (details.isEmpty()) {
            log.warn("Movie '{}' not found", title);
        }
        return details;
    }

    public List<MovieListing> getMoviesByActor(String name) {
        log.info("Fetching movies featuring actor: {}", name);
        return toListings(movieNodeRepository.findByActorName(name));
    }

    public List<MovieListing> getMoviesByDirector(String name) {
        log.info("Fetching movies directed by: {}", name);
        return toListings(movieNodeRepository.findByDirectorName(name));
    }

    public GraphStatistics getStatistics() {
        return GraphStatistics.builder()
            .totalMovies(movieNodeRepository.count())
            .totalPeople(movieNodeRepository.countPeople())
            .totalGenres(movieNodeRepository.countGenres())
            .totalRelationships(movieNodeRepository.countRelationships())
            .build();
    }

    private MovieDetails toDetails(MovieNode node) {
        return MovieDetails.builder()
            .title(node.getTitle())
            .year(node.getYear())
            .rating(node.getRating())
            .tagline(node.getTagline())
            .description(node.getDescription())
            .directors(personNames(node.getDirectors()))
            .cast(personNames(node.getActors()))
            .genres(genreNames(node.getGenres()))
            .build();
    }

    private List<MovieListing> toListings(List<MovieNode> nodes) {
        return nodes.stream()
            .map(node -> MovieListing.builder()
                .title(node.getTitle())
                .year(node.getYear())
                .rating(node.getRating())
                .genres(genreNames(node.getGenres()))
                .build())
            .sorted(NEWEST_FIRST)
            .toList();
    }

    private static List<String> personNames(Collection<PersonNode> people) {
        if (people == null) {
            return List.of();
        }
        return people.stream().map(PersonNode::getName).sorted().toList();
    }

    private static List<String> genreNames(Collection<GenreNode> genres) {
        if (genres == null) {
            return List.of();
        }
        return genres.stream().map(GenreNode::getName).sorted().toList();
    }
}
