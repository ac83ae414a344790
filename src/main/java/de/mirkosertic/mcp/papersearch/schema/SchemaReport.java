package de.mirkosertic.mcp.papersearch.schema;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Field type classification and facet values of a loaded corpus.
 *
 * @param fields one entry per field, sorted by name
 * @param facets facet field to its sorted distinct values
 */
public record SchemaReport(List<FieldDescriptor> fields, Map<String, List<String>> facets) {

    public SchemaReport {
        fields = List.copyOf(fields);
        facets = Collections.unmodifiableMap(new LinkedHashMap<>(facets));
    }

    public record FieldDescriptor(String name, String type) {
    }
}
