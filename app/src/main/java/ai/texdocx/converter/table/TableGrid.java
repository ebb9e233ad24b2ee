package ai.texdocx.converter.table;

import java.util.List;
import java.util.Objects;

/**
 * Parsed table rows. Rows may be irregular; the grid is as wide as its widest row.
 */
public record TableGrid(List<List<TableCell>> rows) {

    public TableGrid {
        Objects.requireNonNull(rows, "rows");
        rows = rows.stream().map(List::copyOf).toList();
    }

    public int columnCount() {
        return rows.stream().mapToInt(TableGrid::span).max().orElse(0);
    }

    public int rowCount() {
        return rows.size();
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    static int span(List<TableCell> row) {
        return row.stream().mapToInt(TableCell::colspan).sum();
    }
}
