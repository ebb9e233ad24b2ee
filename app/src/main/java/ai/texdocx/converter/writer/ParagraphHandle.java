package ai.texdocx.converter.writer;

import ai.texdocx.converter.document.RunStyle;
import ai.texdocx.converter.render.RenderedFormula;

public interface ParagraphHandle {

    void addTextRun(String text, RunStyle style);

    /**
     * @throws MathMarkupException when the fragment is not well-formed markup
     */
    void addInlineMath(RenderedFormula formula);

    /**
     * @throws MathMarkupException when the fragment is not well-formed markup
     */
    void addDisplayMath(RenderedFormula formula);
}
