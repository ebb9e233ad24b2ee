package ai.texdocx.converter.render;

/**
 * String level adjustments of OMML fragments before they are handed to the document backend.
 */
public final class MathMarkup {

    public static final String MATH_NAMESPACE = "http://schemas.openxmlformats.org/officeDocument/2006/math";
    public static final String WORD_NAMESPACE = "http://schemas.openxmlformats.org/wordprocessingml/2006/main";

    private static final String EXPRESSION_OPEN = "<m:oMath";
    private static final String EXPRESSION_CLOSE = "</m:oMath>";

    private MathMarkup() {
    }

    public static String stripDeclaration(String markup) {
        String trimmed = markup.strip();
        if (trimmed.startsWith("<?xml")) {
            int end = trimmed.indexOf("?>");
            if (end >= 0) {
                return trimmed.substring(end + 2).strip();
            }
        }
        return trimmed;
    }

    /**
     * Declares the {@code m} and {@code w} prefixes on the root element when the fragment uses them undeclared.
     */
    public static String withNamespaces(String markup) {
        String result = markup;
        if (result.contains("<m:") && !result.contains("xmlns:m=")) {
            result = declare(result, "xmlns:m=\"" + MATH_NAMESPACE + "\"");
        }
        if ((result.contains("<w:") || result.contains(" w:")) && !result.contains("xmlns:w=")) {
            result = declare(result, "xmlns:w=\"" + WORD_NAMESPACE + "\"");
        }
        return result;
    }

    /**
     * Fragment suitable for placement inside a paragraph: the first {@code m:oMath} of a math paragraph, or the
     * expression itself.
     */
    public static String inlineExpression(RenderedFormula formula) {
        String markup = formula.markup();
        if (formula.form() != MathForm.PARAGRAPH) {
            return withNamespaces(markup);
        }
        int start = indexOfExpression(markup);
        int end = start < 0 ? -1 : markup.indexOf(EXPRESSION_CLOSE, start);
        if (start < 0 || end < 0) {
            return withNamespaces(markup);
        }
        return withNamespaces(markup.substring(start, end + EXPRESSION_CLOSE.length()));
    }

    /**
     * Fragment suitable as the sole content of a display paragraph, always an {@code m:oMathPara}.
     */
    public static String displayParagraph(RenderedFormula formula) {
        if (formula.form() == MathForm.PARAGRAPH) {
            return withNamespaces(formula.markup());
        }
        return "<m:oMathPara xmlns:m=\"" + MATH_NAMESPACE + "\">"
                + withNamespaces(formula.markup()) + "</m:oMathPara>";
    }

    private static int indexOfExpression(String markup) {
        int index = markup.indexOf(EXPRESSION_OPEN);
        while (index >= 0) {
            int next = index + EXPRESSION_OPEN.length();
            if (next < markup.length() && (markup.charAt(next) == '>' || Character.isWhitespace(markup.charAt(next)))) {
                return index;
            }
            index = markup.indexOf(EXPRESSION_OPEN, next);
        }
        return -1;
    }

    private static String declare(String markup, String declaration) {
        int open = markup.indexOf('<');
        if (open < 0) {
            return markup;
        }
        int nameEnd = open + 1;
        while (nameEnd < markup.length() && !Character.isWhitespace(markup.charAt(nameEnd))
                && markup.charAt(nameEnd) != '>' && markup.charAt(nameEnd) != '/') {
            nameEnd++;
        }
        return markup.substring(0, nameEnd) + " " + declaration + markup.substring(nameEnd);
    }
}
