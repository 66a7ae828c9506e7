package com.moviegraph.controller;

import com.moviegraph.config.GlobalExceptionHandler;
import com.moviegraph.dto.catalog.GraphStatistics;
import com.moviegraph.dto.catalog.MovieDetails;
import com.moviegraph.dto.catalog.MovieListing;
import com.moviegraph.model.recommendation.Movie;
import com.moviegraph.service.CatalogService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.neo4j.driver.exceptions.ClientException;
import org.neo4j.driver.exceptions.ServiceUnavailableException;
import org.springframework.dao.DataAccessException;
import org.springframework.data.neo4j.core.Neo4jPersistenceExceptionTranslator;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.springframework.transaction.TransactionSystemException;

import java.util.List;
import java.util.Optional;

import static org.hamcrest.Matchers.contains;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class MovieControllerTest {

    private static final Neo4jPersistenceExceptionTranslator REPOSITORY_TRANSLATOR =
        new Neo4jPersistenceExceptionTranslator();

    @Mock
    private CatalogService catalogService;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new MovieController(catalogService))
            .setControllerAdvice(new GlobalExceptionHandler())
            .build();
    }

    @Test
    void should_ListMovies() throws Exception {
        when(catalogService.getAllMovies()).thenReturn(List.of(
            Movie.builder().title("Inception").year(2010).rating(8.8).build(),
            Movie.builder().title("Titanic").year(1997).rating(7.9).build()));

        mockMvc.perform(get("/api/movies"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$[*].title", contains("Inception", "Titanic")));
    }

    @Test
    void should_ReturnDetails_OrNotFound() throws Exception {
        when(catalogService.getMovieDetails("Inception")).thenReturn(Optional.of(MovieDetails.builder()
            .title("Inception")
            .directors(List.of("Christopher Nolan"))
            .cast(List.of("Leonardo DiCaprio"))
            .genres(List.of("Action", "Sci-Fi"))
            .build()));
        when(catalogService.getMovieDetails("NoSuchMovie")).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/movies/Inception"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.directors[0]").value("Christopher Nolan"))
            .andExpect(jsonPath("$.genres", contains("Action", "Sci-Fi")));
        mockMvc.perform(get("/api/movies/NoSuchMovie"))
            .andExpect(status().isNotFound());
    }

    @Test
    void should_ListMoviesByActorAndDirector() throws Exception {
        when(catalogService.getMoviesByActor("Leonardo DiCaprio")).thenReturn(List.of(
            MovieListing.builder().title("Inception").year(2010).genres(List.of("Action")).build()));
        when(catalogService.getMoviesByDirector("Christopher Nolan")).thenReturn(List.of(
            MovieListing.builder().title("Interstellar").year(2014).genres(List.of()).build()));

        mockMvc.perform(get("/api/movies/by-actor/{name}", "Leonardo DiCaprio"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$[0].title").value("Inception"));
        mockMvc.perform(get("/api/movies/by-director/{name}", "Christopher Nolan"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$[0].year").value(2014));
    }

    @Test
    void should_ReturnStatistics() throws Exception {
        when(catalogService.getStatistics()).thenReturn(GraphStatistics.builder()
            .totalMovies(3).totalPeople(2).totalGenres(4).totalRelationships(9).build());

        mockMvc.perform(get("/api/movies/statistics"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.totalMovies").value(3))
            .andExpect(jsonPath("$.totalRelationships").value(9));
    }

    @Test
    void should_MapTranslatedConnectivityFailure_ToServiceUnavailable() throws Exception {
        DataAccessException translated = REPOSITORY_TRANSLATOR.translateExceptionIfPossible(
            new ServiceUnavailableException("Connection refused"));
        when(catalogService.getStatistics()).thenThrow(translated);

        mockMvc.perform(get("/api/movies/statistics"))
            .andExpect(status().isServiceUnavailable())
            .andExpect(jsonPath("$.kind").value("STORE_UNAVAILABLE"));
    }

    @Test
    void should_MapTranslatedTransactionTimeout_ToGatewayTimeout() throws Exception {
        DataAccessException translated = REPOSITORY_TRANSLATOR.translateExceptionIfPossible(new ClientException(
            "Neo.ClientError.Transaction.TransactionTimedOutClientConfiguration",
            "The transaction has been terminated"));
        when(catalogService.getAllMovies()).thenThrow(translated);

        mockMvc.perform(get("/api/movies"))
            .andExpect(status().isGatewayTimeout())
            .andExpect(jsonPath("$.kind").value("TIMEOUT"));
    }

    @Test
    void should_MapFailedTransactionBegin_ToServiceUnavailable() throws Exception {
        when(catalogService.getMoviesByActor("Leonardo DiCaprio")).thenThrow(new TransactionSystemException(
            "Could not open a new Neo4j session: Connection refused",
            new ServiceUnavailableException("Connection refused")));

        mockMvc.perform(get("/api/movies/by-actor/{name}", "Leonardo DiCaprio"))
            .andExpect(status().isServiceUnavailable())
            .andExpect(jsonPath("$.kind").value("STORE_UNAVAILABLE"));
    }

    @Test
    void should_MapPoolExhaustionOnTransactionBegin_ToGatewayTimeout() throws Exception {
        when(catalogService.getMoviesByDirector("Christopher Nolan")).thenThrow(new TransactionSystemException(
            "Could not open a new Neo4j session",
            new ClientException("Unable to acquire connection from the pool within configured maximum time of 120000ms")));

        mockMvc.perform(get("/api/movies/by-director/{name}", "Christopher Nolan"))
            .andExpect(status().isGatewayTimeout())
            .andExpect(jsonPath("$.kind").value("TIMEOUT"));
    }
}
