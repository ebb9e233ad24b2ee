package ai.texdocx.converter.math;

import java.util.Objects;
import java.util.Optional;

/**
 * A formula pulled out of the working text. {@code sourceOrder} is its position among all extracted formulas and is
 * the only link back to its placeholder.
 */
public record EquationRecord(String formula, EquationMode mode, Optional<String> label, int sourceOrder) {

    public EquationRecord {
        Objects.requireNonNull(formula, "formula");
        Objects.requireNonNull(mode, "mode");
        label = label == null ? Optional.empty() : label;
        if (sourceOrder < 0) {
            throw new IllegalArgumentException("sourceOrder must not be negative");
        }
    }

    public boolean isDisplay() {
        return mode == EquationMode.DISPLAY;
    }

    public PlaceholderToken placeholder() {
        return new PlaceholderToken(mode, sourceOrder);
    }
}
