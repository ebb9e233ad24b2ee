package ai.texdocx.converter.pipeline;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class SourcePreprocessorTest {

    private final SourcePreprocessor preprocessor = new SourcePreprocessor();

    @Test
    void stripsCommentsButKeepsEscapedPercent() {
        String result = preprocessor.stripComments("keep \\% this % drop\n% whole line\nnext   \n\n");

        assertThat(result).isEqualTo("keep \\% this\n\nnext");
    }

    @Test
    void extractsDocumentBody() {
        String result = preprocessor.extractBody("\\documentclass{article}\n\\usepackage{amsmath}\n"
                + "\\begin{document}\nHello\n\\end{document}\ntrailer");

        assertThat(result).isEqualTo("Hello");
    }

    @Test
    void startsAtFirstSectioningCommandWithoutDocumentEnvironment() {
        String result = preprocessor.extractBody("\\usepackage{x}\n\\newcommand{\\R}{\\mathbb{R}}\n\\section*{A}\nBody");

        assertThat(result).isEqualTo("\\section*{A}\nBody");
    }

    @Test
    void keepsEverythingWhenNoMarkerIsPresent() {
        assertThat(preprocessor.extractBody("  just text  ")).isEqualTo("just text");
    }

    @Test
    void prepareNormalisesLineEndingsAndRemovesReservedCharacters() {
        String result = preprocessor.prepare("a\r\nb\uE000c % note\r\n");

        assertThat(result).isEqualTo("a\nbc");
    }
}
