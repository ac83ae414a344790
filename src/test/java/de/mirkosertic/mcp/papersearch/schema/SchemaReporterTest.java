package de.mirkosertic.mcp.papersearch.schema;

import de.mirkosertic.mcp.papersearch.model.FieldValue;
import de.mirkosertic.mcp.papersearch.model.PaperDocument;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("SchemaReporter Tests")
class SchemaReporterTest {

    private static PaperDocument paper(final long id, final Object... keyValues) {
        final Map<String, FieldValue> fields = new LinkedHashMap<>();
        fields.put("id", FieldValue.of(id));
        for (int i = 0; i < keyValues.length; i += 2) {
            fields.put((String) keyValues[i], (FieldValue) keyValues[i + 1]);
        }
        return new PaperDocument(id, fields);
    }

    @Nested
    @DisplayName("Field types")
    class FieldTypes {

        @Test
        @DisplayName("Should classify each field and sort by name")
        void shouldClassifyFields() {
            final SchemaReport report = new SchemaReporter().report(List.of(
                    paper(1, "name", FieldValue.of("A"), "score", FieldValue.of(1.5), "visible", FieldValue.of(true),
                            "tags", FieldValue.array(FieldValue.of("x")),
                            "media", new FieldValue.Obj(Map.of("p", FieldValue.of("y"))))));

            assertThat(report.fields()).containsExactly(
                    new SchemaReport.FieldDescriptor("id", "integer"),
                    new SchemaReport.FieldDescriptor("media", "object"),
                    new SchemaReport.FieldDescriptor("name", "string"),
                    new SchemaReport.FieldDescriptor("score", "float"),
                    new SchemaReport.FieldDescriptor("tags", "array"),
                    new SchemaReport.FieldDescriptor("visible", "boolean"));
        }

        @Test
        @DisplayName("Should mark fields with differing types as mixed and ignore nulls")
        void shouldDetectMixedTypes() {
            final SchemaReport report = new SchemaReporter().report(List.of(
                    paper(1, "year", FieldValue.of(2020L), "url", FieldValue.NULL),
                    paper(2, "year", FieldValue.of("2021"), "url", FieldValue.of("https://x")),
                    paper(3, "year", FieldValue.NULL)));

            assertThat(report.fields()).contains(
                    new SchemaReport.FieldDescriptor("year", "mixed"),
                    new SchemaReport.FieldDescriptor("url", "string"));
        }

        @Test
        @DisplayName("Should leave out fields that are always null")
        void shouldSkipAllNullFields() {
            final SchemaReport report = new SchemaReporter().report(List.of(paper(1, "url", FieldValue.NULL)));

            assertThat(report.fields()).extracting(SchemaReport.FieldDescriptor::name).containsExactly("id");
        }
    }

    @Nested
    @DisplayName("Facets")
    class Facets {

        @Test
        @DisplayName("Should collect sorted distinct values, expanding lists")
        void shouldCollectDistinctValues() {
            final SchemaReport report = new SchemaReporter().report(List.of(
                    paper(1, "decision", FieldValue.of("Reject"),
                            "keywords", FieldValue.array(FieldValue.of("NLP"), FieldValue.NULL, FieldValue.of("Vision"))),
                    paper(2, "decision", FieldValue.of("Accept"), "keywords", FieldValue.array(FieldValue.of("NLP")))));

            assertThat(report.facets()).containsOnlyKeys(SchemaReporter.DEFAULT_FACET_LIMITS.keySet());
            assertThat(report.facets().get("decision")).containsExactly("Accept", "Reject");
            assertThat(report.facets().get("keywords")).containsExactly("NLP", "Vision");
            assertThat(report.facets().get("session")).isEmpty();
        }

        @Test
        @DisplayName("Should stop collecting at the facet limit in corpus order")
        void shouldRespectLimits() {
            final SchemaReporter reporter = new SchemaReporter(Map.of("topic", 2));

            final SchemaReport report = reporter.report(List.of(
                    paper(1, "topic", FieldValue.of("Zeta")),
                    paper(2, "topic", FieldValue.of("Alpha")),
                    paper(3, "topic", FieldValue.of("Beta"))));

            assertThat(report.facets().get("topic")).containsExactly("Alpha", "Zeta");
        }
    }
}
