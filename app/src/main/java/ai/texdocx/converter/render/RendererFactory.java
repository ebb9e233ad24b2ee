package ai.texdocx.converter.render;

import java.util.Objects;

/**
 * Provides renderer instances based on the configured mode.
 */
public class RendererFactory {

    private final FormulaRenderer texmathRenderer;
    private final FormulaRenderer literalRenderer;
    private final FormulaRenderer noopRenderer;

    public RendererFactory(FormulaRenderer texmathRenderer,
                           FormulaRenderer literalRenderer,
                           FormulaRenderer noopRenderer) {
        this.texmathRenderer = Objects.requireNonNull(texmathRenderer, "texmathRenderer");
        this.literalRenderer = Objects.requireNonNull(literalRenderer, "literalRenderer");
        this.noopRenderer = Objects.requireNonNull(noopRenderer, "noopRenderer");
    }

    public FormulaRenderer select(RendererMode mode) {
        return switch (mode) {
            case TEXMATH -> texmathRenderer;
            case LITERAL -> literalRenderer;
            case NONE -> noopRenderer;
        };
    }
}
