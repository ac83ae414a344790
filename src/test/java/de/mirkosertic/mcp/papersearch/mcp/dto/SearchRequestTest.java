package de.mirkosertic.mcp.papersearch.mcp.dto;

import de.mirkosertic.mcp.papersearch.search.SearchQuery;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("SearchRequest Tests")
class SearchRequestTest {

    @Test
    @DisplayName("Should map all arguments")
    void shouldMapArguments() {
        final Map<String, Object> args = new HashMap<>();
        args.put("query", "graph");
        args.put("filters", Map.of("keywords", List.of("NLP")));
        args.put("page", 2);
        args.put("pageSize", "5");
        args.put("sortBy", "random");
        args.put("sortOrder", "DESC");
        args.put("seed", 42);

        final SearchQuery query = SearchRequest.fromMap(args).toQuery(20, 100);

        assertThat(query.query()).isEqualTo("graph");
        assertThat(query.filters().values()).containsEntry("keywords", List.of("nlp"));
        assertThat(query.page()).isEqualTo(2);
        assertThat(query.pageSize()).isEqualTo(5);
        assertThat(query.sortBy()).isEqualTo("random");
        assertThat(query.sortOrder()).isEqualTo("desc");
        assertThat(query.seed()).isEqualTo("42");
    }

    @Test
    @DisplayName("Should apply defaults and cap the page size")
    void shouldApplyDefaults() {
        final SearchRequest empty = SearchRequest.fromMap(Map.of());
        assertThat(empty.effectivePage()).isEqualTo(1);
        assertThat(empty.effectivePageSize(20, 100)).isEqualTo(20);
        assertThat(empty.effectiveSortOrder()).isEqualTo("asc");

        final SearchRequest large = SearchRequest.fromMap(Map.of("pageSize", 500, "page", 0));
        assertThat(large.effectivePageSize(20, 100)).isEqualTo(100);
        assertThat(large.effectivePage()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should reject invalid arguments")
    void shouldRejectInvalidArguments() {
        assertThatThrownBy(() -> SearchRequest.fromMap(Map.of("sortOrder", "up")).effectiveSortOrder())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("sortOrder");
        assertThatThrownBy(() -> SearchRequest.fromMap(Map.of("page", "two")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("page");
        assertThatThrownBy(() -> SearchRequest.fromMap(Map.of("filters", List.of("decision"))))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("filters");
    }
}
