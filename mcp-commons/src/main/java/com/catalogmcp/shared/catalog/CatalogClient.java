package com.catalogmcp.shared.catalog;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Asynchronous view of the software catalog REST API.
 *
 * <p>Payloads are returned as raw JSON; the dispatch layer never interprets catalog entities.
 * Failures complete the future exceptionally with a subclass of
 * {@link com.catalogmcp.shared.mcp.errors.McpToolException} whenever the cause is known.
 * Entity references use the {@code kind:namespace/name} form.
 */
public interface CatalogClient {

    /**
     * @param filters filter expressions such as {@code kind=Component,spec.type=service}; alternatives are OR-ed
     * @param fields  field paths to include, all fields when empty
     */
    CompletableFuture<JsonNode> getEntities(List<String> filters, List<String> fields, Integer limit, Integer offset);

    CompletableFuture<JsonNode> getEntityByRef(String entityRef);

    CompletableFuture<JsonNode> getEntitiesByRefs(List<String> entityRefs, List<String> fields);

    /**
     * Cursor-paginated query with optional full-text search.
     */
    CompletableFuture<JsonNode> queryEntities(List<String> filters, String fullTextTerm, List<String> orderFields,
                                              Integer limit, String cursor);

    CompletableFuture<JsonNode> getEntityAncestors(String entityRef);

    CompletableFuture<JsonNode> getEntityFacets(List<String> facets, List<String> filters);

    /**
     * @param locationRef location reference in {@code type:target} form
     */
    CompletableFuture<JsonNode> getLocationByRef(String locationRef);

    CompletableFuture<JsonNode> getLocationByEntity(String entityRef);

    CompletableFuture<JsonNode> addLocation(String type, String target, boolean dryRun);

    CompletableFuture<JsonNode> removeLocationById(String id);

    CompletableFuture<JsonNode> removeEntityByUid(String uid);

    CompletableFuture<JsonNode> refreshEntity(String entityRef);

    CompletableFuture<JsonNode> validateEntity(JsonNode entity, String locationRef);
}
