package ai.texdocx.converter.render;

import ai.texdocx.converter.math.EquationMode;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Render outcomes of one equation class in extraction order.
 */
public final class EquationPool {

    private final EquationMode mode;
    private final List<RenderOutcome> slots;

    public EquationPool(EquationMode mode, List<RenderOutcome> slots) {
        this.mode = Objects.requireNonNull(mode, "mode");
        this.slots = List.copyOf(Objects.requireNonNull(slots, "slots"));
        for (RenderOutcome slot : this.slots) {
            if (slot.record().mode() != mode) {
                throw new IllegalArgumentException("Record " + slot.record().sourceOrder() + " is not " + mode);
            }
        }
    }

    public static EquationPool empty(EquationMode mode) {
        return new EquationPool(mode, List.of());
    }

    public EquationMode mode() {
        return mode;
    }

    public int size() {
        return slots.size();
    }

    /**
     * The slot at {@code cursor}, empty once the pool is exhausted.
     */
    public Optional<RenderOutcome> at(int cursor) {
        if (cursor < 0 || cursor >= slots.size()) {
            return Optional.empty();
        }
        return Optional.of(slots.get(cursor));
    }

    public Optional<RenderOutcome> bySourceOrder(int sourceOrder) {
        return slots.stream().filter(slot -> slot.record().sourceOrder() == sourceOrder).findFirst();
    }

    public long renderedCount() {
        return slots.stream().filter(RenderOutcome::succeeded).count();
    }

    public long failedCount() {
        return slots.size() - renderedCount();
    }

    public List<RenderOutcome> slots() {
        return slots;
    }
}
