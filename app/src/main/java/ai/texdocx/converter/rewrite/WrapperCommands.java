package ai.texdocx.converter.rewrite;

import ai.texdocx.converter.scan.BraceMatcher;
import ai.texdocx.converter.scan.ConstructCatalogue;
import ai.texdocx.converter.scan.ConstructMatch;
import ai.texdocx.converter.scan.ConstructScanner;
import java.util.function.UnaryOperator;

/**
 * Collapses commands that merely wrap other content.
 */
public final class WrapperCommands {

    private static final int MAX_PASSES = 32;

    private WrapperCommands() {
    }

    /**
     * {@code \texorpdfstring{tex}{plain}} becomes {@code plain}.
     */
    public static String collapseDualStrings(String text) {
        return untilStable(text, current -> ConstructScanner.replaceAll(current, ConstructCatalogue.DUAL_STRING,
                match -> match.argument(1)));
    }

    /**
     * {@code \resizebox{w}{h}{content}} and {@code \scalebox{f}{content}} become {@code content}; a content consisting
     * of exactly one {@code $...$} formula loses its delimiters.
     */
    public static String collapseSizeWrappers(String text) {
        return untilStable(text, current -> {
            String collapsed = ConstructScanner.replaceAll(current, ConstructCatalogue.RESIZEBOX, WrapperCommands::unwrap);
            return ConstructScanner.replaceAll(collapsed, ConstructCatalogue.SCALEBOX, WrapperCommands::unwrap);
        });
    }

    private static String unwrap(ConstructMatch match) {
        String content = match.lastArgument();
        String trimmed = content.trim();
        if (isSingleInlineFormula(trimmed)) {
            return trimmed.substring(1, trimmed.length() - 1);
        }
        return content;
    }

    static boolean isSingleInlineFormula(String candidate) {
        if (candidate.length() < 2 || candidate.charAt(0) != '$' || candidate.charAt(candidate.length() - 1) != '$') {
            return false;
        }
        if (candidate.startsWith("$$") || BraceMatcher.isEscaped(candidate, candidate.length() - 1)) {
            return false;
        }
        for (int i = 1; i < candidate.length() - 1; i++) {
            if (candidate.charAt(i) == '$' && !BraceMatcher.isEscaped(candidate, i)) {
                return false;
            }
        }
        return true;
    }

    static String untilStable(String text, UnaryOperator<String> pass) {
        String current = text;
        for (int i = 0; i < MAX_PASSES; i++) {
            String next = pass.apply(current);
            if (next.equals(current)) {
                return next;
            }
            current = next;
        }
        return current;
    }
}
