package com.catalogmcp.mcpserver.mcp.error;

import com.catalogmcp.shared.mcp.errors.ErrorType;
import com.catalogmcp.shared.mcp.errors.McpToolException;
import org.springframework.stereotype.Component;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientResponseException;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.UndeclaredThrowableException;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Maps a failure onto the {@link ErrorType} taxonomy.
 *
 * <p>Errors with a known origin are classified by their declared type: {@link McpToolException}
 * subclasses carry one, Spring HTTP client errors are mapped by status code. Anything else
 * falls back to a best-effort keyword match over the lower-cased message; the keyword groups
 * are checked in order and the first match wins. A failure that is not a {@link Throwable}
 * at all is {@link ErrorType#UNKNOWN}.
 */
@Component
public class ToolErrorClassifier {

    private static final List<Map.Entry<ErrorType, List<String>>> KEYWORD_GROUPS = List.of(
        Map.entry(ErrorType.VALIDATION, List.of("validation", "invalid")),
        Map.entry(ErrorType.AUTHENTICATION, List.of("unauthorized", "authentication")),
        Map.entry(ErrorType.AUTHORIZATION, List.of("forbidden", "permission")),
        Map.entry(ErrorType.NOT_FOUND, List.of("not found", "404")),
        Map.entry(ErrorType.CONFLICT, List.of("conflict", "already exists")),
        Map.entry(ErrorType.RATE_LIMIT, List.of("rate limit", "429")),
        Map.entry(ErrorType.NETWORK, List.of("network", "timeout", "connection")),
        Map.entry(ErrorType.BACKSTAGE_API, List.of("backstage", "api"))
    );

    public ErrorType classify(Object failure) {
        if (!(failure instanceof Throwable)) {
            return ErrorType.UNKNOWN;
        }
        Throwable error = unwrap((Throwable) failure);

        if (error instanceof McpToolException) {
            return ((McpToolException) error).getErrorType();
        }
        if (error instanceof RestClientResponseException) {
            return fromHttpStatus(((RestClientResponseException) error).getStatusCode().value());
        }
        if (error instanceof ResourceAccessException) {
            return ErrorType.NETWORK;
        }
        return classifyMessage(error.getMessage());
    }

    /**
     * Keyword heuristics alone, for messages of foreign or unstructured errors.
     */
    public ErrorType classifyMessage(String message) {
        if (message == null || message.isEmpty()) {
            return ErrorType.INTERNAL;
        }
        String lowered = message.toLowerCase(Locale.ROOT);
        for (Map.Entry<ErrorType, List<String>> group : KEYWORD_GROUPS) {
            for (String keyword : group.getValue()) {
                if (lowered.contains(keyword)) {
                    return group.getKey();
                }
            }
        }
        return ErrorType.INTERNAL;
    }

    /**
     * Strip the wrappers added by futures and reflection so the original failure is classified.
     */
    public static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while (current.getCause() != null
            && (current instanceof CompletionException
                || current instanceof ExecutionException
                || current instanceof InvocationTargetException
                || current instanceof UndeclaredThrowableException)) {
            current = current.getCause();
        }
        return current;
    }

    private static ErrorType fromHttpStatus(int status) {
        switch (status) {
            case 400:
            case 422:
                return ErrorType.VALIDATION;
            case 401:
                return ErrorType.AUTHENTICATION;
            case 403:
                return ErrorType.AUTHORIZATION;
            case 404:
                return ErrorType.NOT_FOUND;
            case 409:
                return ErrorType.CONFLICT;
            case 429:
                return ErrorType.RATE_LIMIT;
            default:
                return ErrorType.BACKSTAGE_API;
        }
    }
}
