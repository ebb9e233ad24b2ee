package ai.texdocx.converter.render;

/**
 * Converts one formula, given without delimiters, into a math markup fragment.
 */
public interface FormulaRenderer {

    /**
     * @throws RenderException when the formula cannot be converted
     */
    RenderedFormula render(String formula);
}
