package ai.texdocx.converter.scan;

/**
 * Locates the closing partner of a grouping character while honouring backslash escapes.
 *
 * <p>The scan is iterative so arbitrarily deep nesting never grows the call stack.
 */
public final class BraceMatcher {

    public static final int NOT_FOUND = -1;

    private BraceMatcher() {
    }

    /**
     * Returns the index one past the brace closing the group opened at {@code openIndex}, or {@link #NOT_FOUND}.
     */
    public static int matchBrace(CharSequence text, int openIndex) {
        return match(text, openIndex, '{', '}');
    }

    /**
     * Returns the index one past the bracket closing the optional argument opened at {@code openIndex}, or
     * {@link #NOT_FOUND}. Braces nested inside the brackets are skipped as opaque groups.
     */
    public static int matchBracket(CharSequence text, int openIndex) {
        if (!isUnescapedAt(text, openIndex, '[')) {
            return NOT_FOUND;
        }
        int index = openIndex + 1;
        while (index < text.length()) {
            char ch = text.charAt(index);
            if (ch == '{' && !isEscaped(text, index)) {
                int groupEnd = matchBrace(text, index);
                if (groupEnd == NOT_FOUND) {
                    return NOT_FOUND;
                }
                index = groupEnd;
                continue;
            }
            if (ch == ']' && !isEscaped(text, index)) {
                return index + 1;
            }
            index++;
        }
        return NOT_FOUND;
    }

    public static int match(CharSequence text, int openIndex, char open, char close) {
        if (!isUnescapedAt(text, openIndex, open)) {
            return NOT_FOUND;
        }
        int depth = 0;
        for (int index = openIndex; index < text.length(); index++) {
            char ch = text.charAt(index);
            if (ch != open && ch != close) {
                continue;
            }
            if (isEscaped(text, index)) {
                continue;
            }
            if (ch == open) {
                depth++;
            } else {
                depth--;
                if (depth == 0) {
                    return index + 1;
                }
            }
        }
        return NOT_FOUND;
    }

    /**
     * True when the character at {@code index} is preceded by an odd number of backslashes.
     */
    public static boolean isEscaped(CharSequence text, int index) {
        int backslashes = 0;
        for (int cursor = index - 1; cursor >= 0 && text.charAt(cursor) == '\\'; cursor--) {
            backslashes++;
        }
        return (backslashes & 1) == 1;
    }

    public static int skipWhitespace(CharSequence text, int index) {
        int cursor = index;
        while (cursor < text.length() && Character.isWhitespace(text.charAt(cursor))) {
            cursor++;
        }
        return cursor;
    }

    private static boolean isUnescapedAt(CharSequence text, int index, char expected) {
        return index >= 0
                && index < text.length()
                && text.charAt(index) == expected
                && !isEscaped(text, index);
    }
}
