package ai.texdocx.converter.render;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class MathMarkupTest {

    private static final String EXPRESSION = "<m:oMath><m:r><m:t>x</m:t></m:r></m:oMath>";

    @Test
    void stripsXmlDeclaration() {
        assertThat(MathMarkup.stripDeclaration("<?xml version=\"1.0\" encoding=\"UTF-8\"?>\n" + EXPRESSION))
                .isEqualTo(EXPRESSION);
        assertThat(MathMarkup.stripDeclaration("  " + EXPRESSION + "\n")).isEqualTo(EXPRESSION);
    }

    @Test
    void declaresMissingNamespacesOnRoot() {
        String result = MathMarkup.withNamespaces("<m:oMath><m:r><w:rPr/><m:t>x</m:t></m:r></m:oMath>");

        assertThat(result).startsWith("<m:oMath xmlns:w=\"" + MathMarkup.WORD_NAMESPACE + "\" xmlns:m=\""
                + MathMarkup.MATH_NAMESPACE + "\">");
    }

    @Test
    void leavesDeclaredNamespacesAlone() {
        String declared = "<m:oMath xmlns:m=\"" + MathMarkup.MATH_NAMESPACE + "\"/>";

        assertThat(MathMarkup.withNamespaces(declared)).isEqualTo(declared);
    }

    @Test
    void inlineExpressionUnwrapsMathParagraph() {
        RenderedFormula paragraph = RenderedFormula.of("<m:oMathPara xmlns:m=\"" + MathMarkup.MATH_NAMESPACE + "\">"
                + "<m:oMathParaPr/>" + EXPRESSION + "</m:oMathPara>");

        String inline = MathMarkup.inlineExpression(paragraph);

        assertThat(paragraph.form()).isEqualTo(MathForm.PARAGRAPH);
        assertThat(inline).startsWith("<m:oMath xmlns:m=").endsWith("</m:oMath>").doesNotContain("oMathPara");
    }

    @Test
    void displayParagraphWrapsExpression() {
        String display = MathMarkup.displayParagraph(RenderedFormula.of(EXPRESSION));

        assertThat(display).startsWith("<m:oMathPara xmlns:m=").endsWith("</m:oMathPara>").contains(">x<");
    }
}
