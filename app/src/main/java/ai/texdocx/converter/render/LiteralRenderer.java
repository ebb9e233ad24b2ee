package ai.texdocx.converter.render;

/**
 * Renderer used without an external converter: wraps the formula source in a single math text run.
 */
public class LiteralRenderer implements FormulaRenderer {

    @Override
    public RenderedFormula render(String formula) {
        if (formula == null || formula.isBlank()) {
            throw new RenderException("Empty formula");
        }
        String markup = "<m:oMath xmlns:m=\"" + MathMarkup.MATH_NAMESPACE + "\"><m:r><m:t xml:space=\"preserve\">"
                + escape(formula.trim()) + "</m:t></m:r></m:oMath>";
        return new RenderedFormula(markup, MathForm.EXPRESSION);
    }

    static String escape(String text) {
        StringBuilder escaped = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            char ch = text.charAt(i);
            switch (ch) {
                case '&' -> escaped.append("&amp;");
                case '<' -> escaped.append("&lt;");
                case '>' -> escaped.append("&gt;");
                case '"' -> escaped.append("&quot;");
                default -> escaped.append(ch);
            }
        }
        return escaped.toString();
    }
}
