package ai.texdocx.converter.render;

/**
 * Renderer that converts nothing; every formula ends up as a visible fallback.
 */
public class NoopRenderer implements FormulaRenderer {

    @Override
    public RenderedFormula render(String formula) {
        throw new RenderException("Rendering disabled");
    }
}
