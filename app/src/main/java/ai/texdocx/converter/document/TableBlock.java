package ai.texdocx.converter.document;

import java.util.List;
import java.util.Objects;

/**
 * Rows may be shorter than {@code columnCount}; the missing trailing cells stay empty.
 */
public record TableBlock(List<List<ResolvedCell>> rows, int columnCount) implements Block {

    public TableBlock {
        Objects.requireNonNull(rows, "rows");
        rows = rows.stream().map(List::copyOf).toList();
        if (columnCount < 0) {
            throw new IllegalArgumentException("columnCount must not be negative: " + columnCount);
        }
    }
}
