package ai.texdocx.converter.render;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class FormulaCleanerTest {

    @Test
    void removesNullDelimitersAndSizing() {
        assertThat(FormulaCleaner.clean("\\bigl( x \\bigr.+ \\Big| y \\Big|")).isEqualTo("( x + | y |");
    }

    @Test
    void keepsOtherCommands() {
        assertThat(FormulaCleaner.clean("\\bigcup_i A_i")).isEqualTo("\\bigcup_i A_i");
    }
}
