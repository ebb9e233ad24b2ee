package ai.texdocx.converter.document;

import java.util.List;
import java.util.Objects;

public record ParagraphBlock(List<Run> runs) implements Block {

    public ParagraphBlock {
        runs = List.copyOf(Objects.requireNonNull(runs, "runs"));
    }

    public static ParagraphBlock text(String text) {
        return new ParagraphBlock(List.of(TextRun.plain(text)));
    }
}
