package ai.texdocx.converter.document;

import java.util.Objects;
import java.util.Optional;

public record DisplayEquationBlock(MathContent content, Optional<String> label) implements Block {

    public DisplayEquationBlock {
        Objects.requireNonNull(content, "content");
        label = label == null ? Optional.empty() : label;
    }
}
