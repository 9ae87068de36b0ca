package com.catalogmcp.mcpserver.catalog;

import lombok.Value;

import java.util.Locale;

/**
 * Parsed catalog entity reference. {@link #toString()} yields the canonical
 * {@code kind:namespace/name} form, with kind and namespace lower-cased.
 */
@Value
public class EntityRef {
    String kind;
    String namespace;
    String name;

    @Override
    public String toString() {
        return kind.toLowerCase(Locale.ROOT) + ":" + namespace.toLowerCase(Locale.ROOT) + "/" + name;
    }
}
