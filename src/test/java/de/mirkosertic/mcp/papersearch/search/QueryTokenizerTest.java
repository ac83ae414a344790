package de.mirkosertic.mcp.papersearch.search;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("QueryTokenizer Tests")
class QueryTokenizerTest {

    @Test
    @DisplayName("Should extract lowercased word runs")
    void shouldExtractWordRuns() {
        assertThat(QueryTokenizer.tokenize("  Graph-Neural   nets_v2, (ICLR)"))
                .containsExactly("graph", "neural", "nets_v2", "iclr");
    }

    @Test
    @DisplayName("Should keep non-ASCII letters")
    void shouldKeepUnicodeLetters() {
        assertThat(QueryTokenizer.tokenize("Müller über")).containsExactly("müller", "über");
    }

    @Test
    @DisplayName("Should yield nothing for punctuation, blanks and null")
    void shouldYieldNothingWithoutWordCharacters() {
        assertThat(QueryTokenizer.tokenize("?!-- ...")).isEmpty();
        assertThat(QueryTokenizer.tokenize("   ")).isEmpty();
        assertThat(QueryTokenizer.tokenize(null)).isEmpty();
    }
}
