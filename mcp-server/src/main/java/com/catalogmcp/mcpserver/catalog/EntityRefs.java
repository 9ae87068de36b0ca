package com.catalogmcp.mcpserver.catalog;

import com.catalogmcp.shared.mcp.errors.ValidationException;

import java.util.Map;

/**
 * Parsing of entity references given either as {@code kind:[namespace/]name} strings or as
 * compound {@code {kind, namespace, name}} objects.
 */
public final class EntityRefs {

    public static final String DEFAULT_NAMESPACE = "default";

    private EntityRefs() {
    }

    public static EntityRef parse(Object reference) {
        if (reference instanceof String) {
            return parseString((String) reference);
        }
        if (reference instanceof Map) {
            return parseCompound((Map<?, ?>) reference);
        }
        throw new ValidationException("Entity reference must be a string or an object with kind, namespace and name",
            Map.of("entityRef", String.valueOf(reference)));
    }

    /**
     * Canonical string form of {@code reference}
     */
    public static String toRefString(Object reference) {
        return parse(reference).toString();
    }

    private static EntityRef parseString(String reference) {
        String ref = reference.trim();
        int colon = ref.indexOf(':');
        if (colon <= 0) {
            throw invalid(reference, "missing kind");
        }
        String kind = ref.substring(0, colon);
        String rest = ref.substring(colon + 1);

        String namespace = DEFAULT_NAMESPACE;
        String name = rest;
        int slash = rest.indexOf('/');
        if (slash >= 0) {
            namespace = rest.substring(0, slash);
            name = rest.substring(slash + 1);
            if (namespace.isEmpty()) {
                throw invalid(reference, "empty namespace");
            }
        }
        if (name.isEmpty() || name.contains("/") || name.contains(":")) {
            throw invalid(reference, "invalid name");
        }
        return new EntityRef(kind, namespace, name);
    }

    private static EntityRef parseCompound(Map<?, ?> reference) {
        Object kind = reference.get("kind");
        Object name = reference.get("name");
        Object namespace = reference.get("namespace");
        if (!(kind instanceof String) || ((String) kind).isBlank()) {
            throw invalid(String.valueOf(reference), "missing kind");
        }
        if (!(name instanceof String) || ((String) name).isBlank()) {
            throw invalid(String.valueOf(reference), "missing name");
        }
        String ns = namespace instanceof String && !((String) namespace).isBlank()
            ? (String) namespace
            : DEFAULT_NAMESPACE;
        return new EntityRef((String) kind, ns, (String) name);
    }

    private static ValidationException invalid(String reference, String reason) {
        return new ValidationException(String.format("Invalid entity reference '%s': %s", reference, reason),
            Map.of("entityRef", reference, "reason", reason));
    }
}
