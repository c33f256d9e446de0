package net.lookvault.util;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class SearchQueryUtilsTest {

    @Test
    void tokens_SplitsOnPunctuationAndDropsDuplicates() {
        assertThat(SearchQueryUtils.tokens("Leather-Jacket, leather JACKET!")).containsExactly("leather", "jacket");
    }

    @Test
    void normalizeTitle_CollapsesPunctuationAndCase() {
        assertThat(SearchQueryUtils.normalizeTitle("  The ROW -- Margaux   Bag ")).isEqualTo("the row margaux bag");
    }

    @Test
    void escapeLike_EscapesWildcards() {
        assertThat(SearchQueryUtils.escapeLike("100%_off\\")).isEqualTo("100\\%\\_off\\\\");
    }
}
