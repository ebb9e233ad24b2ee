package ai.texdocx.converter.render;

import ai.texdocx.converter.math.EquationMode;
import java.util.Objects;

/**
 * The independently indexed display and inline pools.
 */
public record RenderedPools(EquationPool display, EquationPool inline) {

    public RenderedPools {
        Objects.requireNonNull(display, "display");
        Objects.requireNonNull(inline, "inline");
        if (display.mode() != EquationMode.DISPLAY || inline.mode() != EquationMode.INLINE) {
            throw new IllegalArgumentException("Pools are assigned to the wrong equation class");
        }
    }

    public static RenderedPools empty() {
        return new RenderedPools(EquationPool.empty(EquationMode.DISPLAY), EquationPool.empty(EquationMode.INLINE));
    }

    public EquationPool pool(EquationMode mode) {
        return mode == EquationMode.DISPLAY ? display : inline;
    }

    public long renderedCount() {
        return display.renderedCount() + inline.renderedCount();
    }

    public long failedCount() {
        return display.failedCount() + inline.failedCount();
    }
}
