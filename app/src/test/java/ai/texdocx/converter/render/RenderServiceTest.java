package ai.texdocx.converter.render;

import static org.assertj.core.api.Assertions.assertThat;

import ai.texdocx.converter.math.EquationMode;
import ai.texdocx.converter.math.EquationRecord;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;
import java.util.stream.IntStream;
import org.junit.jupiter.api.Test;

class RenderServiceTest {

    private static final FormulaRenderer UNUSED = formula -> {
        throw new AssertionError("renderer should not be selected");
    };

    @Test
    void failedFormulaKeepsItsSlot() {
        FormulaRenderer renderer = formula -> {
            if (formula.equals("bad")) {
                throw new RenderException("unsupported command");
            }
            return RenderedFormula.of("<m:oMath><m:r><m:t>" + formula + "</m:t></m:r></m:oMath>");
        };
        List<EquationRecord> records = List.of(
                record("a", EquationMode.INLINE, 0),
                record("bad", EquationMode.INLINE, 1),
                record("c", EquationMode.INLINE, 2));

        RenderedPools pools = new RenderService(new RendererFactory(renderer, UNUSED, UNUSED))
                .renderAll(records, RendererMode.TEXMATH);

        EquationPool inline = pools.pool(EquationMode.INLINE);
        assertThat(inline.size()).isEqualTo(3);
        assertThat(inline.slots()).extracting(RenderOutcome::succeeded).containsExactly(true, false, true);
        assertThat(inline.at(1)).hasValueSatisfying(outcome ->
                assertThat(outcome.failure()).contains("unsupported command"));
        assertThat(inline.at(2)).hasValueSatisfying(outcome ->
                assertThat(outcome.rendered().get().markup()).contains(">c<"));
        assertThat(pools.renderedCount()).isEqualTo(2);
        assertThat(pools.failedCount()).isEqualTo(1);
    }

    @Test
    void splitsOutcomesIntoPoolsByMode() {
        List<EquationRecord> records = List.of(
                record("x", EquationMode.INLINE, 0),
                record("y", EquationMode.DISPLAY, 1),
                record("z", EquationMode.INLINE, 2));

        RenderedPools pools = new RenderService(new RendererFactory(UNUSED, new LiteralRenderer(), UNUSED))
                .renderAll(records, RendererMode.LITERAL);

        assertThat(pools.pool(EquationMode.DISPLAY).slots()).extracting(outcome -> outcome.record().formula())
                .containsExactly("y");
        assertThat(pools.pool(EquationMode.INLINE).slots()).extracting(outcome -> outcome.record().formula())
                .containsExactly("x", "z");
        assertThat(pools.pool(EquationMode.INLINE).bySourceOrder(2)).isPresent();
    }

    @Test
    void parallelRenderingPreservesExtractionOrder() {
        FormulaRenderer slowRenderer = formula -> {
            try {
                Thread.sleep(ThreadLocalRandom.current().nextInt(5));
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
            }
            return new LiteralRenderer().render(formula);
        };
        List<EquationRecord> records = IntStream.range(0, 40)
                .mapToObj(i -> record("f" + i, i % 3 == 0 ? EquationMode.DISPLAY : EquationMode.INLINE, i))
                .toList();

        RenderedPools pools = new RenderService(new RendererFactory(slowRenderer, UNUSED, UNUSED), 4)
                .renderAll(records, RendererMode.TEXMATH);

        List<Integer> inlineOrder = pools.pool(EquationMode.INLINE).slots().stream()
                .map(outcome -> outcome.record().sourceOrder())
                .toList();
        assertThat(inlineOrder).isSorted().hasSize(26);
        assertThat(pools.pool(EquationMode.DISPLAY).size()).isEqualTo(14);
        assertThat(pools.failedCount()).isZero();
    }

    @Test
    void disabledRendererFailsEveryFormula() {
        RenderedPools pools = new RenderService(new RendererFactory(UNUSED, UNUSED, new NoopRenderer()))
                .renderAll(List.of(record("x", EquationMode.DISPLAY, 0)), RendererMode.NONE);

        assertThat(pools.failedCount()).isEqualTo(1);
        assertThat(pools.pool(EquationMode.DISPLAY).size()).isEqualTo(1);
    }

    @Test
    void noRecordsGiveEmptyPools() {
        RenderedPools pools = new RenderService(new RendererFactory(UNUSED, UNUSED, UNUSED))
                .renderAll(List.of(), RendererMode.TEXMATH);

        assertThat(pools.pool(EquationMode.INLINE).size()).isZero();
        assertThat(pools.pool(EquationMode.DISPLAY).size()).isZero();
    }

    private static EquationRecord record(String formula, EquationMode mode, int sourceOrder) {
        return new EquationRecord(formula, mode, Optional.empty(), sourceOrder);
    }
}
