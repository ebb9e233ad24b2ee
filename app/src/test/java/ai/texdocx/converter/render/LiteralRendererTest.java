package ai.texdocx.converter.render;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;

import org.junit.jupiter.api.Test;

class LiteralRendererTest {

    private final LiteralRenderer renderer = new LiteralRenderer();

    @Test
    void escapesFormulaIntoSingleMathRun() {
        RenderedFormula rendered = renderer.render(" a < b & c ");

        assertThat(rendered.form()).isEqualTo(MathForm.EXPRESSION);
        assertThat(rendered.markup()).contains("a &lt; b &amp; c").contains("xmlns:m=\"" + MathMarkup.MATH_NAMESPACE);
    }

    @Test
    void rejectsBlankFormula() {
        assertThat(catchThrowable(() -> renderer.render("  "))).isInstanceOf(RenderException.class);
    }
}
