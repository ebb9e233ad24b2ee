package ai.texdocx.converter.render;

import ai.texdocx.converter.math.EquationRecord;
import java.util.Objects;
import java.util.Optional;

/**
 * Result of rendering one record; a failed outcome still occupies its slot in the pool.
 */
public record RenderOutcome(EquationRecord record, Optional<RenderedFormula> rendered, Optional<String> failure) {

    public RenderOutcome {
        Objects.requireNonNull(record, "record");
        rendered = rendered == null ? Optional.empty() : rendered;
        failure = failure == null ? Optional.empty() : failure;
    }

    public static RenderOutcome success(EquationRecord record, RenderedFormula rendered) {
        return new RenderOutcome(record, Optional.of(rendered), Optional.empty());
    }

    public static RenderOutcome failure(EquationRecord record, String reason) {
        return new RenderOutcome(record, Optional.empty(), Optional.of(reason));
    }

    public boolean succeeded() {
        return rendered.isPresent();
    }
}
