package ai.texdocx.converter.render;

import java.util.regex.Pattern;

/**
 * Removes delimiter sizing that the external converter does not understand.
 */
public final class FormulaCleaner {

    private static final Pattern NULL_DELIMITER = Pattern.compile("\\\\(?:big|Big|bigg|Bigg)[lrm]?\\s*\\.");
    private static final Pattern SIZING_PREFIX = Pattern.compile("\\\\(?:big|Big|bigg|Bigg)[lrm]?(?![A-Za-z])\\s*");

    private FormulaCleaner() {
    }

    public static String clean(String formula) {
        if (formula == null) {
            return "";
        }
        String cleaned = NULL_DELIMITER.matcher(formula).replaceAll("");
        cleaned = SIZING_PREFIX.matcher(cleaned).replaceAll("");
        return cleaned.trim();
    }
}
