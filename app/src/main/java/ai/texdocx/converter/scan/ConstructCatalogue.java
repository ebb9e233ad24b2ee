package ai.texdocx.converter.scan;

import java.util.List;
import java.util.Map;

/**
 * The fixed set of constructs the converter understands. Everything else is opaque text.
 *
 * <p>Bump {@link #VERSION} whenever an entry changes meaning, since extraction order depends on it.
 */
public final class ConstructCatalogue {

    public static final int VERSION = 1;

    /**
     * Multi-line alignment environments whose delimiters are kept in the formula, mapped to the inner environment the
     * renderer understands.
     */
    public static final Map<String, String> ALIGNMENT_WRAPPERS = Map.ofEntries(
            Map.entry("align", "aligned"),
            Map.entry("align*", "aligned"),
            Map.entry("flalign", "aligned"),
            Map.entry("flalign*", "aligned"),
            Map.entry("eqnarray", "aligned"),
            Map.entry("eqnarray*", "aligned"),
            Map.entry("alignat", "alignedat"),
            Map.entry("alignat*", "alignedat"),
            Map.entry("gather", "gathered"),
            Map.entry("gather*", "gathered"));

    public static final EnvironmentPattern WRAPPED_EQUATIONS =
            EnvironmentPattern.of(ConstructKind.DISPLAY_MATH, ALIGNMENT_WRAPPERS.keySet().toArray(String[]::new));
    public static final EnvironmentPattern PLAIN_EQUATIONS = EnvironmentPattern.of(ConstructKind.DISPLAY_MATH,
            "equation", "equation*", "displaymath", "multline", "multline*");
    public static final EnvironmentPattern INLINE_MATH_ENVIRONMENT = EnvironmentPattern.of(ConstructKind.INLINE_MATH,
            "math");
    public static final DelimiterPattern DOUBLE_DOLLAR = new DelimiterPattern("$$", "$$", ConstructKind.DISPLAY_MATH, false);
    public static final DelimiterPattern BRACKET_DISPLAY = new DelimiterPattern("\\[", "\\]", ConstructKind.DISPLAY_MATH, false);
    public static final DelimiterPattern PAREN_INLINE = new DelimiterPattern("\\(", "\\)", ConstructKind.INLINE_MATH, true);
    public static final DelimiterPattern SINGLE_DOLLAR = new DelimiterPattern("$", "$", ConstructKind.INLINE_MATH, true);

    public static final EnvironmentPattern FIGURES = EnvironmentPattern.withOptionalArgument(
            "figure", "figure*", "wrapfigure", "SCfigure");
    public static final EnvironmentPattern TABLE_FLOATS = EnvironmentPattern.withOptionalArgument("table", "table*");
    public static final EnvironmentPattern TABULARS = EnvironmentPattern.withArguments(1, "tabular", "longtable");
    public static final EnvironmentPattern WIDE_TABULARS = EnvironmentPattern.withArguments(2, "tabular*", "tabularx");
    public static final EnvironmentPattern LISTS = EnvironmentPattern.withOptionalArgument(
            "itemize", "enumerate", "description");
    public static final EnvironmentPattern ABSTRACT = EnvironmentPattern.of(ConstructKind.ENVIRONMENT, "abstract");

    public static final CommandPattern DUAL_STRING = CommandPattern.of("texorpdfstring", 2);
    public static final CommandPattern RESIZEBOX = CommandPattern.starred("resizebox", 3);
    public static final CommandPattern SCALEBOX = CommandPattern.withOptional("scalebox", 2);
    public static final CommandPattern MULTICOLUMN = CommandPattern.of("multicolumn", 3);
    public static final CommandPattern MULTIROW = CommandPattern.withOptional("multirow", 3);
    public static final CommandPattern CAPTION = CommandPattern.withOptional("caption", 1);
    public static final CommandPattern LABEL = CommandPattern.of("label", 1);

    private ConstructCatalogue() {
    }

    /**
     * Math constructs in extraction priority: environments before loose delimiters, display before inline.
     */
    public static List<ConstructPattern> latexMath() {
        return List.of(WRAPPED_EQUATIONS, PLAIN_EQUATIONS, INLINE_MATH_ENVIRONMENT,
                DOUBLE_DOLLAR, BRACKET_DISPLAY, PAREN_INLINE, SINGLE_DOLLAR);
    }

    /**
     * Markdown only carries dollar-delimited math.
     */
    public static List<ConstructPattern> markdownMath() {
        return List.of(DOUBLE_DOLLAR, SINGLE_DOLLAR);
    }
}
