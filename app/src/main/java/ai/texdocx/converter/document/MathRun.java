package ai.texdocx.converter.document;

import java.util.Objects;

public record MathRun(MathContent content) implements Run {

    public MathRun {
        Objects.requireNonNull(content, "content");
    }
}
