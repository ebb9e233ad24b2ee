package ai.texdocx.converter.table;

import java.util.Objects;

public record TableCell(String text, int colspan) {

    public TableCell {
        Objects.requireNonNull(text, "text");
        if (colspan < 1) {
            throw new IllegalArgumentException("colspan must be at least 1: " + colspan);
        }
    }

    public static TableCell single(String text) {
        return new TableCell(text, 1);
    }
}
