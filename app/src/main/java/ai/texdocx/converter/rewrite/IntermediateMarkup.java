package ai.texdocx.converter.rewrite;

import ai.texdocx.converter.document.ListKind;
import java.util.Optional;

/**
 * Line oriented markers produced by the rewriters and consumed by reinsertion.
 *
 * <p>All markers use code points from the private-use block {@code U+E000..U+E0FF}, which is removed from the input
 * before any processing, so they can never collide with document text. A heading or list item occupies exactly one
 * line; a table region is bracketed by {@link #TABLE_START} and {@link #TABLE_END} lines.
 */
public final class IntermediateMarkup {

    public static final char RESERVED_FIRST = '\uE000';
    public static final char RESERVED_LAST = '\uE0FF';

    public static final char HEADING = '\uE010';
    public static final char LIST_ITEM = '\uE011';
    public static final char TABLE = '\uE012';
    public static final String TABLE_START = TABLE + "TABLE_START";
    public static final String TABLE_END = TABLE + "TABLE_END";

    public static final char SUB_START = '\uE013';
    public static final char SUB_END = '\uE014';
    public static final char SUP_START = '\uE015';
    public static final char SUP_END = '\uE016';

    private IntermediateMarkup() {
    }

    public static String heading(int level, String text) {
        return HEADING + Integer.toString(level) + HEADING + singleLine(text);
    }

    public static String listItem(ListKind kind, int level, String text) {
        char code = kind == ListKind.NUMBERED ? 'N' : 'B';
        return LIST_ITEM + (code + Integer.toString(level)) + LIST_ITEM + singleLine(text);
    }

    public static String subscript(String text) {
        return SUB_START + text + SUB_END;
    }

    public static String superscript(String text) {
        return SUP_START + text + SUP_END;
    }

    public static Optional<HeadingLine> parseHeading(String line) {
        Optional<String[]> parts = split(line, HEADING);
        if (parts.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(new HeadingLine(Integer.parseInt(parts.get()[0]), parts.get()[1]));
        } catch (NumberFormatException ex) {
            return Optional.empty();
        }
    }

    public static Optional<ListLine> parseListItem(String line) {
        Optional<String[]> parts = split(line, LIST_ITEM);
        if (parts.isEmpty() || parts.get()[0].length() < 2) {
            return Optional.empty();
        }
        String header = parts.get()[0];
        ListKind kind = header.charAt(0) == 'N' ? ListKind.NUMBERED : ListKind.BULLET;
        try {
            return Optional.of(new ListLine(kind, Integer.parseInt(header.substring(1)), parts.get()[1]));
        } catch (NumberFormatException ex) {
            return Optional.empty();
        }
    }

    public static boolean isTableStart(String line) {
        return TABLE_START.equals(line.strip());
    }

    public static boolean isTableEnd(String line) {
        return TABLE_END.equals(line.strip());
    }

    /**
     * True for lines that never join a surrounding paragraph.
     */
    public static boolean isStructural(String line) {
        String stripped = line.strip();
        if (stripped.isEmpty()) {
            return false;
        }
        char first = stripped.charAt(0);
        return first == HEADING || first == LIST_ITEM || first == TABLE;
    }

    public static boolean isReserved(char ch) {
        return ch >= RESERVED_FIRST && ch <= RESERVED_LAST;
    }

    /**
     * Removes every reserved code point from source text.
     */
    public static String stripReserved(String text) {
        StringBuilder cleaned = null;
        for (int i = 0; i < text.length(); i++) {
            char ch = text.charAt(i);
            if (isReserved(ch)) {
                if (cleaned == null) {
                    cleaned = new StringBuilder(text.length());
                    cleaned.append(text, 0, i);
                }
            } else if (cleaned != null) {
                cleaned.append(ch);
            }
        }
        return cleaned == null ? text : cleaned.toString();
    }

    private static Optional<String[]> split(String line, char marker) {
        String stripped = line.strip();
        if (stripped.isEmpty() || stripped.charAt(0) != marker) {
            return Optional.empty();
        }
        int second = stripped.indexOf(marker, 1);
        if (second < 0) {
            return Optional.empty();
        }
        return Optional.of(new String[] {stripped.substring(1, second), stripped.substring(second + 1)});
    }

    private static String singleLine(String text) {
        return text.replaceAll("\\s*\\R\\s*", " ").strip();
    }

    public record HeadingLine(int level, String text) {
    }

    public record ListLine(ListKind kind, int level, String text) {
    }
}
