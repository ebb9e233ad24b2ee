package ai.texdocx.converter.render;

/**
 * Shape of a rendered fragment.
 */
public enum MathForm {
    /** A standalone math paragraph ({@code m:oMathPara}). */
    PARAGRAPH,
    /** A bare math expression ({@code m:oMath}). */
    EXPRESSION;

    public static MathForm classify(String markup) {
        return markup != null && markup.contains("oMathPara") ? PARAGRAPH : EXPRESSION;
    }
}
