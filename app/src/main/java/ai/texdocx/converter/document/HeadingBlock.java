package ai.texdocx.converter.document;

import java.util.List;
import java.util.Objects;

public record HeadingBlock(int level, List<Run> runs) implements Block {

    public HeadingBlock {
        if (level < 1) {
            throw new IllegalArgumentException("Heading level must be positive: " + level);
        }
        runs = List.copyOf(Objects.requireNonNull(runs, "runs"));
    }
}
