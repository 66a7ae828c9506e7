package com.moviegraph.repository.graph;

import com.moviegraph.config.RecommendationProperties;
import com.moviegraph.exception.StoreTimeoutException;
import com.moviegraph.exception.StoreUnavailableException;
import com.moviegraph.model.recommendation.Movie;
import com.moviegraph.model.recommendation.SignalMatch;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.neo4j.driver.AccessMode;
import org.neo4j.driver.Driver;
import org.neo4j.driver.Record;
import org.neo4j.driver.SessionConfig;
import org.neo4j.driver.TransactionConfig;
import org.neo4j.driver.Value;
import org.neo4j.driver.async.AsyncSession;
import org.neo4j.driver.exceptions.Neo4jException;
import org.springframework.stereotype.Repository;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

// ========== Neo4j Graph Store ==========
@Repository
@RequiredArgsConstructor
@Slf4j
public class Neo4jMovieGraphStore implements MovieGraphStore {

    private final Driver neo4jDriver;
    private final RecommendationProperties properties;

    /**
     * Runs one overlap traversal. The deadline is enforced twice: the server
     * terminates the transaction after {@code timeout}, and the caller stops
     * waiting after the same {@code timeout} even if the server or network
     * never answers (pool acquisition, stalled socket).
     */
    @Override
    public List<SignalMatch> findOverlap(String title, OverlapPath path, Duration timeout) {
        String query = buildOverlapQuery(path);
        String operation = path + " overlap query";
        TransactionConfig txConfig = TransactionConfig.builder()
            .withTimeout(timeout)
            .withMetadata(Map.of("app", "moviegraph", "path", path.name()))
            .build();

        // One session per query, closed on every exit path
        AsyncSession session = neo4jDriver.session(AsyncSession.class, sessionConfig());
        try {
            List<SignalMatch> matches = session.runAsync(query, Map.of("title", title), txConfig)
                .thenCompose(cursor -> cursor.listAsync(this::toSignalMatch))
                .toCompletableFuture()
                .get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            log.debug("{} overlap for '{}' returned {} rows", path, title, matches.size());
            return matches;
        } catch (TimeoutException ex) {
            log.error("{} for '{}' got no answer within {}", operation, title, timeout);
            throw new StoreTimeoutException(operation + " timed out after " + timeout.toMillis() + "ms", ex);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new StoreUnavailableException(operation + " interrupted", ex);
        } catch (ExecutionException ex) {
            throw translateFailure(unwrap(ex.getCause()), operation, title);
        } catch (Neo4jException ex) {
            throw translateFailure(ex, operation, title);
        } finally {
            session.closeAsync();
        }
    }

    /**
     * Builds the two-hop distinct-count pattern for a path. Only enum constants
     * reach the query text; the title is always a parameter.
     */
    static String buildOverlapQuery(OverlapPath path) {
        String rel = "[:" + path.getRelationshipType() + "]";
        String shared = "(shared:" + path.getSharedLabel() + ")";
        String pattern = path.isOutgoing()
            ? "(ref)-" + rel + "->" + shared + "<-" + rel + "-(other:Movie)"
            : "(ref)<-" + rel + "-" + shared + "-" + rel + "->(other:Movie)";

        return """
            MATCH (ref:Movie {title: $title})
            MATCH %s
            WHERE other <> ref
            WITH other, count(DISTINCT shared) AS sharedCount
            RETURN other.title AS title, other.year AS year, other.rating AS rating, sharedCount
            """.formatted(pattern);
    }

    private RuntimeException translateFailure(Throwable failure, String operation, String title) {
        log.error("{} for '{}' failed: {}", operation, title, failure.getMessage());
        if (failure instanceof Neo4jException) {
            return Neo4jExceptionTranslator.translate((Neo4jException) failure, operation);
        }
        return new StoreUnavailableException(operation + " failed: " + failure.getMessage(), failure);
    }

    private static Throwable unwrap(Throwable failure) {
        Throwable current = failure;
        while (current instanceof CompletionException && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private SessionConfig sessionConfig() {
        SessionConfig.Builder builder = SessionConfig.builder()
            .withDefaultAccessMode(AccessMode.READ);
        String database = properties.getDatabase();
        if (database != null && !database.isBlank()) {
            builder.withDatabase(database);
        }
        return builder.build();
    }

    private SignalMatch toSignalMatch(Record record) {
        Value year = record.get("year");
        Value rating = record.get("rating");
        Movie movie = Movie.builder()
            .title(record.get("title").asString())
            .year(year.isNull() ? null : year.asInt())
            .rating(rating.isNull() ? null : rating.asDouble())
            .build();
        return SignalMatch.builder()
            .movie(movie)
            .sharedCount(record.get("sharedCount").asInt())
            .build();
    }
}
