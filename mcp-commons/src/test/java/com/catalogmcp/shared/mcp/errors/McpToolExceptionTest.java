package com.catalogmcp.shared.mcp.errors;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class McpToolExceptionTest {

    @Test
    void clientViewMasksSensitiveDetails() {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("entityRef", "component:default/a");
        details.put("Token", "abc");
        details.put("password", "hunter2");
        details.put("apiSecret", "s3");

        ValidationException exception = new ValidationException("bad input", details);

        @SuppressWarnings("unchecked")
        Map<String, Object> clientDetails = (Map<String, Object>) exception.toClientMap().get("details");
        assertEquals(List.of("entityRef", "Token", "password", "apiSecret"), List.copyOf(clientDetails.keySet()));
        assertEquals("component:default/a", clientDetails.get("entityRef"));
        assertEquals(McpToolException.REDACTED, clientDetails.get("Token"));
        assertEquals(McpToolException.REDACTED, clientDetails.get("apiSecret"));
        assertEquals("hunter2", exception.getDetails().get("password"));
    }

    @Test
    void redactionWalksNestedMapsAndLists() {
        Map<String, Object> source = Map.of(
            "accessToken", "a",
            "client_secret", "b",
            "nested", Map.of("password", "c", "name", "checkout"),
            "items", List.of(Map.of("apiKey", "d", "kind", "Component"), "plain"));

        Map<String, Object> redacted = McpToolException.redact(source);

        assertEquals(McpToolException.REDACTED, redacted.get("accessToken"));
        assertEquals(McpToolException.REDACTED, redacted.get("client_secret"));
        assertEquals(Map.of("password", McpToolException.REDACTED, "name", "checkout"), redacted.get("nested"));
        assertEquals(List.of(Map.of("apiKey", McpToolException.REDACTED, "kind", "Component"), "plain"),
            redacted.get("items"));
        assertEquals("c", ((Map<?, ?>) source.get("nested")).get("password"));
    }

    @Test
    void subclassesPinTheirErrorType() {
        assertEquals(ErrorType.NOT_FOUND, new NotFoundException("Entity").getErrorType());
        assertEquals("Entity not found", new NotFoundException("Entity").getMessage());
        assertEquals(ErrorType.AUTHENTICATION, new AuthenticationException().getErrorType());
        assertEquals(403, new AuthorizationException().getStatusCode());
        assertEquals(ErrorType.RATE_LIMIT, new RateLimitException("slow down", 30L, null).getErrorType());
        assertEquals(ErrorType.BACKSTAGE_API, new CatalogApiException("boom").getErrorType());
    }

    @Test
    void configurationErrorsAreNotOperational() {
        assertFalse(new ConfigurationException("missing client", Map.of()).isOperational());
        assertTrue(new ConflictException("exists", Map.of()).isOperational());
    }

    @Test
    void invalidMetadataListsEveryViolation() {
        InvalidToolMetadataException exception = new InvalidToolMetadataException("com.example.BrokenTool",
            List.of("name must not be empty", "description must not be empty"));

        assertEquals("com.example.BrokenTool", exception.getSource());
        assertEquals(2, exception.getViolations().size());
        assertEquals("Tool metadata validation failed for com.example.BrokenTool: "
            + "name must not be empty; description must not be empty", exception.getMessage());
    }
}
