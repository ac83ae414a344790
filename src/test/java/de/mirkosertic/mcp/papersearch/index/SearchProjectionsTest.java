package de.mirkosertic.mcp.papersearch.index;

import de.mirkosertic.mcp.papersearch.model.FieldValue;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("SearchProjections Tests")
class SearchProjectionsTest {

    @Test
    @DisplayName("Should only project containers")
    void shouldOnlyProjectContainers() {
        assertThat(SearchProjections.projectionOf(FieldValue.of("text"))).isNull();
        assertThat(SearchProjections.projectionOf(FieldValue.of(3L))).isNull();
        assertThat(SearchProjections.projectionOf(FieldValue.NULL)).isNull();
        assertThat(SearchProjections.projectionOf(FieldValue.array(FieldValue.of("a"), FieldValue.of(2L))))
                .isEqualTo("a | 2");
        assertThat(SearchProjections.projectionOf(FieldValue.array())).isEmpty();
    }

    @Test
    @DisplayName("Should add companions and be idempotent")
    void shouldAugmentIdempotently() {
        final Map<String, FieldValue> fields = new LinkedHashMap<>();
        fields.put("name", FieldValue.of("Paper"));
        fields.put("authors", FieldValue.array(FieldValue.of("Ann"), FieldValue.of("Ben")));
        fields.put("media", new FieldValue.Obj(Map.of("poster", FieldValue.of("p.png"))));

        final Map<String, FieldValue> once = SearchProjections.augment(fields);
        final Map<String, FieldValue> twice = SearchProjections.augment(once);

        assertThat(once)
                .containsEntry("authors_search", FieldValue.of("Ann | Ben"))
                .containsEntry("media_search", FieldValue.of("{\"poster\":\"p.png\"}"))
                .doesNotContainKey("name_search");
        assertThat(twice).isEqualTo(once);
        assertThat(fields).doesNotContainKey("authors_search");
    }
}
