package com.catalogmcp.mcpserver.mcp.error;

import com.catalogmcp.shared.mcp.errors.ConflictException;
import com.catalogmcp.shared.mcp.errors.ErrorType;
import com.catalogmcp.shared.mcp.errors.NotFoundException;
import com.catalogmcp.shared.mcp.errors.RateLimitException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

import static org.junit.jupiter.api.Assertions.*;

class ToolErrorClassifierTest {

    private final ToolErrorClassifier classifier = new ToolErrorClassifier();

    @Nested
    @DisplayName("typed errors")
    class Typed {

        @Test
        @DisplayName("use the type pinned by the exception regardless of message")
        void exceptionTypeWins() {
            assertEquals(ErrorType.CONFLICT, classifier.classify(new ConflictException("validation clash", null)));
            assertEquals(ErrorType.RATE_LIMIT, classifier.classify(new RateLimitException("slow down", 30L, null)));
        }

        @Test
        @DisplayName("look through future wrappers")
        void unwrapsFutureWrappers() {
            Throwable wrapped = new CompletionException(new ExecutionException(new NotFoundException("Entity x")));

            assertEquals(ErrorType.NOT_FOUND, classifier.classify(wrapped));
        }

        @Test
        @DisplayName("map HTTP client errors by status")
        void mapsHttpStatus() {
            assertEquals(ErrorType.NOT_FOUND, classifier.classify(new HttpClientErrorException(HttpStatus.NOT_FOUND)));
            assertEquals(ErrorType.AUTHENTICATION,
                classifier.classify(new HttpClientErrorException(HttpStatus.UNAUTHORIZED)));
            assertEquals(ErrorType.VALIDATION, classifier.classify(new HttpClientErrorException(HttpStatus.BAD_REQUEST)));
            assertEquals(ErrorType.BACKSTAGE_API,
                classifier.classify(new HttpServerErrorException(HttpStatus.SERVICE_UNAVAILABLE)));
        }

        @Test
        @DisplayName("treat I/O failures as network errors")
        void resourceAccessIsNetwork() {
            assertEquals(ErrorType.NETWORK, classifier.classify(new ResourceAccessException("I/O error")));
        }
    }

    @Nested
    @DisplayName("message heuristics")
    class Heuristics {

        @Test
        void matchesKeywords() {
            assertEquals(ErrorType.VALIDATION, classifier.classify(new RuntimeException("validation failed: x")));
            assertEquals(ErrorType.NOT_FOUND, classifier.classify(new RuntimeException("Entity not found")));
            assertEquals(ErrorType.AUTHORIZATION, classifier.classify(new RuntimeException("Forbidden")));
            assertEquals(ErrorType.NETWORK, classifier.classify(new RuntimeException("Connection refused")));
            assertEquals(ErrorType.BACKSTAGE_API, classifier.classify(new RuntimeException("Backstage returned 500")));
        }

        @Test
        @DisplayName("first matching group wins")
        void earlierGroupWins() {
            assertEquals(ErrorType.VALIDATION, classifier.classify(new RuntimeException("invalid entity: not found")));
        }

        @Test
        void unmatchedOrEmptyMessageIsInternal() {
            assertEquals(ErrorType.INTERNAL, classifier.classify(new RuntimeException("something odd")));
            assertEquals(ErrorType.INTERNAL, classifier.classify(new NullPointerException()));
        }
    }

    @Test
    void nonThrowableIsUnknown() {
        assertEquals(ErrorType.UNKNOWN, classifier.classify("not found"));
        assertEquals(ErrorType.UNKNOWN, classifier.classify(null));
    }
}
