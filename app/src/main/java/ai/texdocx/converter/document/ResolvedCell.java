package ai.texdocx.converter.document;

import java.util.List;
import java.util.Objects;

public record ResolvedCell(List<Run> runs, int colspan) {

    public ResolvedCell {
        runs = List.copyOf(Objects.requireNonNull(runs, "runs"));
        if (colspan < 1) {
            throw new IllegalArgumentException("colspan must be at least 1: " + colspan);
        }
    }
}
