package ai.texdocx.converter.scan;

import java.util.List;
import java.util.Optional;

/**
 * Matches math delimited by a fixed opening and closing token such as {@code $$ ... $$} or {@code \( ... \)}.
 */
public final class DelimiterPattern implements ConstructPattern {

    private final String open;
    private final String close;
    private final ConstructKind kind;
    private final boolean paragraphBound;

    /**
     * @param paragraphBound when true the construct may not cross a blank line
     */
    public DelimiterPattern(String open, String close, ConstructKind kind, boolean paragraphBound) {
        if (open.isEmpty() || close.isEmpty()) {
            throw new IllegalArgumentException("Delimiters must not be empty");
        }
        this.open = open;
        this.close = close;
        this.kind = kind;
        this.paragraphBound = paragraphBound;
    }

    @Override
    public ConstructKind kind() {
        return kind;
    }

    @Override
    public Optional<ConstructMatch> find(CharSequence text, int from) {
        String source = text.toString();
        int cursor = from;
        while (true) {
            int start = source.indexOf(open, cursor);
            if (start < 0) {
                return Optional.empty();
            }
            if (BraceMatcher.isEscaped(source, start)) {
                cursor = start + 1;
                continue;
            }
            if (isSingleDollar() && isDoubledDollar(source, start)) {
                // residue of an unterminated $$ that was already reported
                cursor = start + 2;
                continue;
            }
            int contentStart = start + open.length();
            int closeIndex = findClose(source, contentStart);
            if (closeIndex < 0 || crossesBoundary(source, contentStart, closeIndex)) {
                return Optional.of(ConstructMatch.malformed(kind, open, start, contentStart));
            }
            String content = source.substring(contentStart, closeIndex);
            return Optional.of(new ConstructMatch(kind, open, start, closeIndex + close.length(), List.of(content), true));
        }
    }

    private int findClose(String source, int from) {
        int index = source.indexOf(close, from);
        while (index >= 0) {
            if (!BraceMatcher.isEscaped(source, index)) {
                return index;
            }
            index = source.indexOf(close, index + 1);
        }
        return -1;
    }

    private boolean crossesBoundary(String source, int from, int to) {
        for (int i = from; i < to; i++) {
            char ch = source.charAt(i);
            if (ch == ConstructScanner.MASK) {
                return true;
            }
            if (paragraphBound && ch == '\n' && isBlankLineAhead(source, i + 1, to)) {
                return true;
            }
        }
        return false;
    }

    private static boolean isBlankLineAhead(String source, int from, int to) {
        for (int i = from; i < to; i++) {
            char ch = source.charAt(i);
            if (ch == '\n') {
                return true;
            }
            if (!Character.isWhitespace(ch)) {
                return false;
            }
        }
        return false;
    }

    private boolean isSingleDollar() {
        return open.equals("$");
    }

    private static boolean isDoubledDollar(String source, int index) {
        return index + 1 < source.length() && source.charAt(index + 1) == '$';
    }

    @Override
    public String toString() {
        return "delimiter " + open + "..." + close;
    }
}
