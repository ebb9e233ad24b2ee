package ai.texdocx.converter.document;

import java.util.List;
import java.util.Objects;

/**
 * @param level zero-based nesting depth
 */
public record ListItemBlock(ListKind kind, int level, List<Run> runs) implements Block {

    public ListItemBlock {
        Objects.requireNonNull(kind, "kind");
        if (level < 0) {
            throw new IllegalArgumentException("List level must not be negative: " + level);
        }
        runs = List.copyOf(Objects.requireNonNull(runs, "runs"));
    }
}
