package de.mirkosertic.mcp.papersearch.schema;

import de.mirkosertic.mcp.papersearch.model.FieldValue;
import de.mirkosertic.mcp.papersearch.model.PaperDocument;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Derives the field type schema and the facet value lists from a loaded corpus.
 * Runs once per corpus load; the result is cached with the corpus.
 */
public class SchemaReporter {

    /**
     * Facet fields and the maximum number of distinct values collected for each.
     */
    public static final Map<String, Integer> DEFAULT_FACET_LIMITS;

    static {
        final Map<String, Integer> limits = new LinkedHashMap<>();
        limits.put("decision", 50);
        limits.put("event_type", 50);
        limits.put("session", 100);
        limits.put("topic", 100);
        limits.put("keywords", 200);
        limits.put("authors", 200);
        DEFAULT_FACET_LIMITS = Collections.unmodifiableMap(limits);
    }

    private final Map<String, Integer> facetLimits;

    public SchemaReporter() {
        this(DEFAULT_FACET_LIMITS);
    }

    public SchemaReporter(final Map<String, Integer> facetLimits) {
        this.facetLimits = new LinkedHashMap<>(facetLimits);
    }

    public SchemaReport report(final List<PaperDocument> documents) {
        return new SchemaReport(describeFields(documents), buildFacets(documents));
    }

    /**
     * Classifies every non-null field value; a field seen with two different types becomes {@code mixed}.
     */
    List<SchemaReport.FieldDescriptor> describeFields(final List<PaperDocument> documents) {
        final Map<String, FieldType> types = new TreeMap<>();
        for (final PaperDocument document : documents) {
            for (final Map.Entry<String, FieldValue> entry : document.fields().entrySet()) {
                if (entry.getValue().isNull()) {
                    continue;
                }
                final FieldType detected = FieldType.of(entry.getValue());
                final FieldType known = types.get(entry.getKey());
                if (known == null) {
                    types.put(entry.getKey(), detected);
                } else if (known != detected) {
                    types.put(entry.getKey(), FieldType.MIXED);
                }
            }
        }

        final List<SchemaReport.FieldDescriptor> fields = new ArrayList<>(types.size());
        for (final Map.Entry<String, FieldType> entry : types.entrySet()) {
            fields.add(new SchemaReport.FieldDescriptor(entry.getKey(), entry.getValue().tag()));
        }
        return fields;
    }

    /**
     * Collects distinct values in corpus order until a facet's limit is reached, then sorts them.
     * List values contribute each element.
     */
    Map<String, List<String>> buildFacets(final List<PaperDocument> documents) {
        final Map<String, Set<String>> collected = new LinkedHashMap<>();
        for (final String field : facetLimits.keySet()) {
            collected.put(field, new HashSet<>());
        }

        for (final PaperDocument document : documents) {
            for (final Map.Entry<String, Integer> facet : facetLimits.entrySet()) {
                final Set<String> values = collected.get(facet.getKey());
                final int limit = facet.getValue();
                final FieldValue value = document.get(facet.getKey());
                if (value.isNull()) {
                    continue;
                }
                if (value instanceof FieldValue.Array array) {
                    for (final FieldValue item : array.items()) {
                        if (values.size() >= limit) {
                            break;
                        }
                        if (!item.isNull()) {
                            values.add(item.asText());
                        }
                    }
                } else if (values.size() < limit) {
                    values.add(value.asText());
                }
            }
        }

        final Map<String, List<String>> facets = new LinkedHashMap<>();
        for (final Map.Entry<String, Set<String>> entry : collected.entrySet()) {
            final List<String> sorted = new ArrayList<>(entry.getValue());
            sorted.sort(null);
            facets.put(entry.getKey(), sorted);
        }
        return facets;
    }
}
