package com.catalogmcp.mcpserver.mcp.registry;

import com.catalogmcp.shared.mcp.errors.InvalidToolMetadataException;
import com.catalogmcp.shared.mcp.registry.ToolMetadata;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Checks the invariants the metadata builder does not enforce.
 *
 * <ul>
 *   <li>name and description are present and not blank</li>
 *   <li>maxBatchSize, when present, is positive</li>
 *   <li>tags and required scopes contain no blank entries</li>
 * </ul>
 *
 * A parameter schema that cannot list its fields is accepted; the tool then shows up in the
 * manifest without parameter names.
 */
@Slf4j
public class DefaultToolValidator implements ToolValidator {

    @Override
    public void validate(ToolMetadata metadata, String sourceLabel) {
        List<String> violations = new ArrayList<>();

        if (metadata == null) {
            violations.add("metadata is missing");
        } else {
            if (isBlank(metadata.getName())) {
                violations.add("name must not be empty");
            }
            if (isBlank(metadata.getDescription())) {
                violations.add("description must not be empty");
            }
            if (metadata.getMaxBatchSize() != null && metadata.getMaxBatchSize() <= 0) {
                violations.add("maxBatchSize must be greater than 0, was " + metadata.getMaxBatchSize());
            }
            if (containsBlank(metadata.getTags())) {
                violations.add("tags must not contain empty entries");
            }
            if (containsBlank(metadata.getRequiredScopes())) {
                violations.add("requiredScopes must not contain empty entries");
            }
            if (metadata.hasParameterSchema() && !metadata.getParameterSchema().isIntrospectable()) {
                log.debug("Parameter schema of '{}' ({}) is not introspectable; manifest params will be empty",
                    metadata.getName(), sourceLabel);
            }
        }

        if (!violations.isEmpty()) {
            log.error("Invalid tool metadata from {}: {}", sourceLabel, violations);
            throw new InvalidToolMetadataException(sourceLabel, violations);
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }

    private static boolean containsBlank(List<String> values) {
        return values != null && values.stream().anyMatch(DefaultToolValidator::isBlank);
    }
}
