package com.catalogmcp.mcpserver.catalog;

import com.catalogmcp.mcpserver.config.properties.CatalogProperties;
import com.catalogmcp.shared.catalog.CatalogClient;
import com.catalogmcp.shared.mcp.errors.CatalogApiException;
import com.catalogmcp.shared.mcp.errors.ConflictException;
import com.catalogmcp.shared.mcp.errors.NetworkException;
import com.catalogmcp.shared.mcp.errors.NotFoundException;
import com.catalogmcp.shared.mcp.errors.OperationTimeoutException;
import com.catalogmcp.shared.mcp.errors.RateLimitException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.SocketTimeoutException;
import java.net.URI;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * {@link CatalogClient} over the catalog REST API.
 *
 * <p>Calls are blocking {@link RestTemplate} exchanges run on the supplied executor. HTTP and
 * I/O failures are translated into the tagged exception hierarchy so the dispatch boundary can
 * classify them without inspecting messages.
 */
@Slf4j
public class RestCatalogClient implements CatalogClient {

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final CatalogProperties properties;
    private final Executor executor;
    private final String apiBaseUrl;

    public RestCatalogClient(RestTemplate restTemplate, ObjectMapper objectMapper,
                             CatalogProperties properties, Executor executor) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.properties = properties;
        this.executor = executor;
        this.apiBaseUrl = trimTrailingSlash(properties.getBaseUrl()) + properties.getApiPath();
        log.info("Catalog client initialized for {}", apiBaseUrl);
    }

    @Override
    public CompletableFuture<JsonNode> getEntities(List<String> filters, List<String> fields,
                                                   Integer limit, Integer offset) {
        UriComponentsBuilder uri = path("entities");
        addQueryList(uri, "filter", filters);
        if (fields != null && !fields.isEmpty()) {
            uri.queryParam("fields", String.join(",", fields));
        }
        addQueryParam(uri, "limit", limit);
        addQueryParam(uri, "offset", offset);
        return async("getEntities", HttpMethod.GET, uri, null);
    }

    @Override
    public CompletableFuture<JsonNode> getEntityByRef(String entityRef) {
        return async("getEntityByRef", HttpMethod.GET, path("entities", "by-ref", entityRef), null);
    }

    @Override
    public CompletableFuture<JsonNode> getEntitiesByRefs(List<String> entityRefs, List<String> fields) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("entityRefs", entityRefs);
        if (fields != null && !fields.isEmpty()) {
            body.put("fields", fields);
        }
        return async("getEntitiesByRefs", HttpMethod.POST, path("entities", "by-refs"), body);
    }

    @Override
    public CompletableFuture<JsonNode> queryEntities(List<String> filters, String fullTextTerm,
                                                     List<String> orderFields, Integer limit, String cursor) {
        Map<String, Object> body = new LinkedHashMap<>();
        if (filters != null && !filters.isEmpty()) {
            body.put("filter", filters);
        }
        if (fullTextTerm != null && !fullTextTerm.isBlank()) {
            body.put("fullTextFilter", Map.of("term", fullTextTerm));
        }
        if (orderFields != null && !orderFields.isEmpty()) {
            body.put("orderFields", toOrderFields(orderFields));
        }
        if (limit != null) {
            body.put("limit", limit);
        }
        if (cursor != null && !cursor.isBlank()) {
            body.put("cursor", cursor);
        }
        return async("queryEntities", HttpMethod.POST, path("entities", "query"), body);
    }

    @Override
    public CompletableFuture<JsonNode> getEntityAncestors(String entityRef) {
        return async("getEntityAncestors", HttpMethod.GET, path("entities", "by-ref", entityRef, "ancestry"), null);
    }

    @Override
    public CompletableFuture<JsonNode> getEntityFacets(List<String> facets, List<String> filters) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("facets", facets);
        if (filters != null && !filters.isEmpty()) {
            body.put("filter", filters);
        }
        return async("getEntityFacets", HttpMethod.POST, path("entities", "facets"), body);
    }

    @Override
    public CompletableFuture<JsonNode> getLocationByRef(String locationRef) {
        return async("getLocationByRef", HttpMethod.GET, path("locations", "by-ref", locationRef), null);
    }

    @Override
    public CompletableFuture<JsonNode> getLocationByEntity(String entityRef) {
        return async("getLocationByEntity", HttpMethod.GET, path("locations", "by-entity", entityRef), null);
    }

    @Override
    public CompletableFuture<JsonNode> addLocation(String type, String target, boolean dryRun) {
        UriComponentsBuilder uri = path("locations");
        if (dryRun) {
            uri.queryParam("dryRun", true);
        }
        return async("addLocation", HttpMethod.POST, uri, Map.of("type", type, "target", target));
    }

    @Override
    public CompletableFuture<JsonNode> removeLocationById(String id) {
        return async("removeLocationById", HttpMethod.DELETE, path("locations", id), null);
    }

    @Override
    public CompletableFuture<JsonNode> removeEntityByUid(String uid) {
        return async("removeEntityByUid", HttpMethod.DELETE, path("entities", "by-uid", uid), null);
    }

    @Override
    public CompletableFuture<JsonNode> refreshEntity(String entityRef) {
        return async("refreshEntity", HttpMethod.POST, path("refresh"), Map.of("entityRef", entityRef));
    }

    @Override
    public CompletableFuture<JsonNode> validateEntity(JsonNode entity, String locationRef) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("entity", entity);
        body.put("location", locationRef);
        return async("validateEntity", HttpMethod.POST, path("validate-entity"), body);
    }

    private CompletableFuture<JsonNode> async(String operation, HttpMethod method, UriComponentsBuilder uri,
                                              Object body) {
        URI target = uri.build().encode().toUri();
        return CompletableFuture.supplyAsync(() -> exchange(operation, method, target, body), executor);
    }

    JsonNode exchange(String operation, HttpMethod method, URI uri, Object body) {
        log.debug("Catalog {} {} ({})", method, uri, operation);
        try {
            ResponseEntity<String> response = restTemplate.exchange(uri, method,
                new HttpEntity<>(body, headers(body != null)), String.class);
            String payload = response.getBody();
            if (payload == null || payload.isBlank()) {
                return NullNode.getInstance();
            }
            return objectMapper.readTree(payload);
        } catch (HttpStatusCodeException e) {
            throw translate(operation, uri, e);
        } catch (ResourceAccessException e) {
            if (e.getCause() instanceof SocketTimeoutException) {
                throw new OperationTimeoutException(operation, properties.getReadTimeout(), e);
            }
            throw new NetworkException("Catalog unreachable during " + operation,
                Map.of("operation", operation, "uri", uri.toString()), e);
        } catch (JsonProcessingException e) {
            throw new CatalogApiException("Catalog returned malformed JSON for " + operation, 502,
                Map.of("operation", operation), e);
        }
    }

    private RuntimeException translate(String operation, URI uri, HttpStatusCodeException e) {
        int status = e.getStatusCode().value();
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("operation", operation);
        details.put("status", status);
        details.put("uri", uri.toString());
        String upstreamMessage = upstreamMessage(e.getResponseBodyAsString());
        if (upstreamMessage != null) {
            details.put("upstreamMessage", upstreamMessage);
        }
        log.debug("Catalog {} failed with HTTP {}", operation, status);

        switch (status) {
            case 404:
                return new NotFoundException("Catalog resource for " + operation, details);
            case 409:
                return new ConflictException(upstreamMessage != null ? upstreamMessage
                    : "Catalog reported a conflict during " + operation, details);
            case 429:
                return new RateLimitException("Catalog rate limit exceeded during " + operation,
                    retryAfterSeconds(e.getResponseHeaders()), details);
            default:
                return new CatalogApiException(String.format("Catalog API error during %s: HTTP %d", operation, status),
                    status, details, e);
        }
    }

    private String upstreamMessage(String body) {
        if (body == null || body.isBlank()) {
            return null;
        }
        try {
            JsonNode error = objectMapper.readTree(body).path("error").path("message");
            return error.isTextual() ? error.asText() : null;
        } catch (JsonProcessingException e) {
            return null;
        }
    }

    private static Long retryAfterSeconds(HttpHeaders headers) {
        String value = headers == null ? null : headers.getFirst(HttpHeaders.RETRY_AFTER);
        if (value == null) {
            return null;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private HttpHeaders headers(boolean hasBody) {
        HttpHeaders headers = new HttpHeaders();
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        if (hasBody) {
            headers.setContentType(MediaType.APPLICATION_JSON);
        }
        if (properties.getToken() != null && !properties.getToken().isBlank()) {
            headers.setBearerAuth(properties.getToken());
        }
        return headers;
    }

    private UriComponentsBuilder path(String... segments) {
        return UriComponentsBuilder.fromHttpUrl(apiBaseUrl).pathSegment(segments);
    }

    private static void addQueryList(UriComponentsBuilder uri, String name, List<String> values) {
        if (values != null) {
            values.forEach(value -> uri.queryParam(name, value));
        }
    }

    private static void addQueryParam(UriComponentsBuilder uri, String name, Object value) {
        if (value != null) {
            uri.queryParam(name, value);
        }
    }

    /**
     * {@code "metadata.name"} or {@code "metadata.name,desc"} to {@code {field, order}}
     */
    private static List<Map<String, String>> toOrderFields(List<String> orderFields) {
        List<Map<String, String>> result = new ArrayList<>();
        for (String orderField : orderFields) {
            String[] parts = orderField.split(",", 2);
            String order = parts.length > 1 ? parts[1].trim().toLowerCase() : "asc";
            result.add(Map.of("field", parts[0].trim(), "order", order));
        }
        return result;
    }

    private static String trimTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
