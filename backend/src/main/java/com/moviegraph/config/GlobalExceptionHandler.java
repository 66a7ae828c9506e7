package com.moviegraph.config;

import com.moviegraph.exception.ErrorKind;
import com.moviegraph.exception.InvalidArgumentException;
import com.moviegraph.exception.StoreTimeoutException;
import com.moviegraph.exception.StoreUnavailableException;
import com.moviegraph.repository.graph.Neo4jExceptionTranslator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.transaction.TransactionException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Renders recommendation and store failures as {@code {error, message, kind}} bodies.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(InvalidArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleInvalidArgument(InvalidArgumentException e) {
        log.warn("Invalid request: {}", e.getMessage());
        return build(HttpStatus.BAD_REQUEST, "Invalid argument", e.getMessage(), e.getKind());
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<Map<String, Object>> handleTypeMismatch(MethodArgumentTypeMismatchException e) {
        log.warn("Invalid parameter type: {}", e.getMessage());
        return build(HttpStatus.BAD_REQUEST, "Invalid argument",
            "Parameter " + e.getName() + " has an invalid value", ErrorKind.INVALID_ARGUMENT);
    }

    @ExceptionHandler(StoreUnavailableException.class)
    public ResponseEntity<Map<String, Object>> handleStoreUnavailable(StoreUnavailableException e) {
        log.error("Graph store unavailable: {}", e.getMessage(), e);
        return build(HttpStatus.SERVICE_UNAVAILABLE, "Graph store unavailable", e.getMessage(), e.getKind());
    }

    @ExceptionHandler(StoreTimeoutException.class)
    public ResponseEntity<Map<String, Object>> handleStoreTimeout(StoreTimeoutException e) {
        log.error("Graph store timed out: {}", e.getMessage());
        return build(HttpStatus.GATEWAY_TIMEOUT, "Graph store timeout", e.getMessage(), e.getKind());
    }

    // Catalog repositories: Spring Data Neo4j translates driver errors into DataAccessException
    @ExceptionHandler(DataAccessException.class)
    public ResponseEntity<Map<String, Object>> handleDataAccessFailure(DataAccessException e) {
        return handleCatalogStoreFailure(e);
    }

    // Neo4jTransactionManager fails to begin when no session can be opened
    @ExceptionHandler(TransactionException.class)
    public ResponseEntity<Map<String, Object>> handleTransactionFailure(TransactionException e) {
        return handleCatalogStoreFailure(e);
    }

    private ResponseEntity<Map<String, Object>> handleCatalogStoreFailure(RuntimeException e) {
        if (Neo4jExceptionTranslator.classify(e) == ErrorKind.TIMEOUT) {
            log.error("Catalog query timed out: {}", e.getMessage());
            return build(HttpStatus.GATEWAY_TIMEOUT, "Graph store timeout", e.getMessage(), ErrorKind.TIMEOUT);
        }
        log.error("Catalog query failed, graph store unavailable: {}", e.getMessage(), e);
        return build(HttpStatus.SERVICE_UNAVAILABLE, "Graph store unavailable", e.getMessage(), ErrorKind.STORE_UNAVAILABLE);
    }

    private static ResponseEntity<Map<String, Object>> build(HttpStatus status, String error, String message, ErrorKind kind) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", error);
        body.put("message", message);
        body.put("kind", kind.name());
        return ResponseEntity.status(status).body(body);
    }
}
