package ai.texdocx.converter.table;

import ai.texdocx.converter.scan.BraceMatcher;
import ai.texdocx.converter.scan.ConstructCatalogue;
import ai.texdocx.converter.scan.ConstructMatch;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Splits the interior of a tabular region into rows and cells.
 *
 * <p>Row separators ({@code \\}, {@code \tabularnewline}) and column separators ({@code &}) only count at brace depth
 * zero and when not escaped. A cell starting with {@code \multicolumn} spans the number of columns given by its first
 * argument; {@code \multirow} contributes its content as a single cell.
 */
public class TableCellTokenizer {

    private static final Logger LOGGER = LoggerFactory.getLogger(TableCellTokenizer.class);

    private static final Pattern RULES = Pattern.compile(
            "\\\\(?:hline|toprule|midrule|bottomrule)(?![A-Za-z])(?:\\[[^\\]]*\\])?"
                    + "|\\\\cline\\s*\\{[^}]*\\}"
                    + "|\\\\cmidrule(?:\\([^)]*\\))?(?:\\[[^\\]]*\\])?\\s*\\{[^}]*\\}");
    private static final String ROW_COMMAND = "\\tabularnewline";
    private static final Pattern ESCAPED_SPECIAL = Pattern.compile("\\\\([%&_#${}])");

    public TableGrid tokenize(String interior) {
        if (interior == null || interior.isBlank()) {
            return new TableGrid(List.of());
        }
        String withoutRules = RULES.matcher(interior).replaceAll("");
        List<List<TableCell>> rows = new ArrayList<>();
        for (String rawRow : splitRows(withoutRules)) {
            if (rawRow.isBlank()) {
                continue;
            }
            List<TableCell> cells = new ArrayList<>();
            for (String rawCell : splitCells(rawRow)) {
                cells.add(toCell(rawCell.trim()));
            }
            rows.add(cells);
        }
        TableGrid grid = new TableGrid(rows);
        LOGGER.debug("Tokenized table with {} rows and {} columns", grid.rowCount(), grid.columnCount());
        return grid;
    }

    List<String> splitRows(String text) {
        List<String> rows = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        int depth = 0;
        int index = 0;
        while (index < text.length()) {
            char ch = text.charAt(index);
            if (ch == '\\' && !BraceMatcher.isEscaped(text, index) && depth == 0) {
                if (index + 1 < text.length() && text.charAt(index + 1) == '\\') {
                    rows.add(current.toString());
                    current.setLength(0);
                    index = skipSpacing(text, index + 2);
                    continue;
                }
                if (text.startsWith(ROW_COMMAND, index) && !isLetterAt(text, index + ROW_COMMAND.length())) {
                    rows.add(current.toString());
                    current.setLength(0);
                    index += ROW_COMMAND.length();
                    continue;
                }
            }
            if ((ch == '{' || ch == '}') && !BraceMatcher.isEscaped(text, index)) {
                depth = ch == '{' ? depth + 1 : Math.max(0, depth - 1);
            }
            current.append(ch);
            index++;
        }
        rows.add(current.toString());
        return rows;
    }

    List<String> splitCells(String row) {
        List<String> cells = new ArrayList<>();
        int depth = 0;
        int cellStart = 0;
        for (int index = 0; index < row.length(); index++) {
            char ch = row.charAt(index);
            if (BraceMatcher.isEscaped(row, index)) {
                continue;
            }
            if (ch == '{') {
                depth++;
            } else if (ch == '}') {
                depth = Math.max(0, depth - 1);
            } else if (ch == '&' && depth == 0) {
                cells.add(row.substring(cellStart, index));
                cellStart = index + 1;
            }
        }
        cells.add(row.substring(cellStart));
        return cells;
    }

    private TableCell toCell(String cell) {
        Optional<ConstructMatch> multicolumn = ConstructCatalogue.MULTICOLUMN.matchAt(cell, 0);
        if (multicolumn.isPresent() && multicolumn.get().closingVerified()) {
            ConstructMatch match = multicolumn.get();
            String content = unwrapMultirow(match.argument(2).trim());
            String remainder = cell.substring(match.end()).trim();
            String text = remainder.isEmpty() ? content : (content + " " + remainder).trim();
            return new TableCell(unescape(text), parseSpan(match.argument(0)));
        }
        return TableCell.single(unescape(unwrapMultirow(cell)));
    }

    private static String unwrapMultirow(String cell) {
        Optional<ConstructMatch> multirow = ConstructCatalogue.MULTIROW.matchAt(cell, 0);
        if (multirow.isEmpty() || !multirow.get().closingVerified()) {
            return cell;
        }
        ConstructMatch match = multirow.get();
        String remainder = cell.substring(match.end()).trim();
        String content = match.lastArgument().trim();
        return remainder.isEmpty() ? content : (content + " " + remainder).trim();
    }

    private static int parseSpan(String raw) {
        try {
            return Math.max(1, Integer.parseInt(raw.trim()));
        } catch (NumberFormatException ex) {
            LOGGER.warn("Invalid column span '{}'; using 1", raw);
            return 1;
        }
    }

    private static String unescape(String text) {
        return ESCAPED_SPECIAL.matcher(text.replace('~', ' ')).replaceAll("$1").trim();
    }

    private static int skipSpacing(String text, int index) {
        int cursor = BraceMatcher.skipWhitespace(text, index);
        if (cursor < text.length() && text.charAt(cursor) == '[') {
            int end = BraceMatcher.matchBracket(text, cursor);
            if (end != BraceMatcher.NOT_FOUND) {
                return end;
            }
        }
        return index;
    }

    private static boolean isLetterAt(String text, int index) {
        return index < text.length() && Character.isLetter(text.charAt(index));
    }
}
