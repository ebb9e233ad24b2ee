package ai.texdocx.converter.document;

import ai.texdocx.converter.math.EquationMode;
import ai.texdocx.converter.render.RenderedFormula;
import java.util.Objects;
import java.util.Optional;

/**
 * A formula at its final position, either with its rendered markup or, when rendering failed, as a fallback literal.
 */
public record MathContent(String formula, EquationMode mode, Optional<RenderedFormula> rendered) {

    public MathContent {
        Objects.requireNonNull(formula, "formula");
        Objects.requireNonNull(mode, "mode");
        rendered = rendered == null ? Optional.empty() : rendered;
    }

    public static MathContent rendered(String formula, EquationMode mode, RenderedFormula rendered) {
        return new MathContent(formula, mode, Optional.of(rendered));
    }

    public static MathContent fallback(String formula, EquationMode mode) {
        return new MathContent(formula, mode, Optional.empty());
    }

    public boolean isFallback() {
        return rendered.isEmpty();
    }

    /**
     * Visible stand-in used when no rendered markup is available.
     */
    public String fallbackText() {
        return mode == EquationMode.DISPLAY ? "[Equation: " + formula + "]" : "[eq: " + formula + "]";
    }
}
