package ai.texdocx.converter.scan;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class BraceMatcherTest {

    @Test
    void returnsIndexAfterClosingBraceOfNestedGroup() {
        assertThat(BraceMatcher.matchBrace("{a{b}c} rest", 0)).isEqualTo(7);
        assertThat(BraceMatcher.matchBrace("x{b}", 1)).isEqualTo(4);
    }

    @Test
    void ignoresEscapedBraces() {
        assertThat(BraceMatcher.matchBrace("{a\\}b}", 0)).isEqualTo(6);
        assertThat(BraceMatcher.matchBrace("\\{a}", 1)).isEqualTo(BraceMatcher.NOT_FOUND);
    }

    @Test
    void doubledBackslashDoesNotEscape() {
        assertThat(BraceMatcher.isEscaped("\\\\}", 2)).isFalse();
        assertThat(BraceMatcher.isEscaped("\\}", 1)).isTrue();
        assertThat(BraceMatcher.matchBrace("{a\\\\}", 0)).isEqualTo(5);
    }

    @Test
    void reportsUnterminatedGroup() {
        assertThat(BraceMatcher.matchBrace("{a{b}", 0)).isEqualTo(BraceMatcher.NOT_FOUND);
        assertThat(BraceMatcher.matchBrace("abc", 0)).isEqualTo(BraceMatcher.NOT_FOUND);
    }

    @Test
    void bracketSkipsBracesContainingClosingBracket() {
        assertThat(BraceMatcher.matchBracket("[x{]}y]z", 0)).isEqualTo(7);
        assertThat(BraceMatcher.matchBracket("[open", 0)).isEqualTo(BraceMatcher.NOT_FOUND);
    }

    @Test
    void handlesVeryDeepNesting() {
        int depth = 100_000;
        String text = "{".repeat(depth) + "}".repeat(depth);

        assertThat(BraceMatcher.matchBrace(text, 0)).isEqualTo(2 * depth);
    }
}
