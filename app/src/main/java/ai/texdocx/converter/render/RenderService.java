package ai.texdocx.converter.render;

import ai.texdocx.converter.math.EquationMode;
import ai.texdocx.converter.math.EquationRecord;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Renders extracted equations and files the outcomes into per-class pools in extraction order.
 *
 * <p>A failed formula keeps its slot, so a failure never shifts the formulas after it. With a parallelism above one,
 * formulas are rendered on a bounded pool and collected in submission order.
 */
public class RenderService {

    private static final Logger LOGGER = LoggerFactory.getLogger(RenderService.class);

    private final RendererFactory rendererFactory;
    private final int parallelism;

    public RenderService(RendererFactory rendererFactory) {
        this(rendererFactory, 1);
    }

    public RenderService(RendererFactory rendererFactory, int parallelism) {
        this.rendererFactory = Objects.requireNonNull(rendererFactory, "rendererFactory");
        if (parallelism < 1) {
            throw new IllegalArgumentException("parallelism must be at least 1");
        }
        this.parallelism = parallelism;
    }

    public RenderedPools renderAll(List<EquationRecord> records, RendererMode mode) {
        if (records == null || records.isEmpty()) {
            return RenderedPools.empty();
        }
        FormulaRenderer renderer = rendererFactory.select(mode);
        List<RenderOutcome> outcomes = parallelism > 1 && records.size() > 1
                ? renderConcurrently(renderer, records)
                : renderSequentially(renderer, records);

        List<RenderOutcome> display = new ArrayList<>();
        List<RenderOutcome> inline = new ArrayList<>();
        for (RenderOutcome outcome : outcomes) {
            (outcome.record().isDisplay() ? display : inline).add(outcome);
        }
        RenderedPools pools = new RenderedPools(new EquationPool(EquationMode.DISPLAY, display),
                new EquationPool(EquationMode.INLINE, inline));
        LOGGER.info("Rendered {} of {} equations ({} failed)", pools.renderedCount(), records.size(), pools.failedCount());
        return pools;
    }

    private List<RenderOutcome> renderSequentially(FormulaRenderer renderer, List<EquationRecord> records) {
        List<RenderOutcome> outcomes = new ArrayList<>(records.size());
        for (EquationRecord record : records) {
            outcomes.add(renderOne(renderer, record));
        }
        return outcomes;
    }

    private List<RenderOutcome> renderConcurrently(FormulaRenderer renderer, List<EquationRecord> records) {
        ExecutorService executor = RenderExecutors.newRenderPool(Math.min(parallelism, records.size()));
        try {
            List<Future<RenderOutcome>> futures = new ArrayList<>(records.size());
            for (EquationRecord record : records) {
                futures.add(executor.submit(() -> renderOne(renderer, record)));
            }
            List<RenderOutcome> outcomes = new ArrayList<>(records.size());
            for (int i = 0; i < futures.size(); i++) {
                outcomes.add(await(futures.get(i), records.get(i)));
            }
            return outcomes;
        } finally {
            executor.shutdownNow();
        }
    }

    private RenderOutcome await(Future<RenderOutcome> future, EquationRecord record) {
        try {
            return future.get();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            return RenderOutcome.failure(record, "Interrupted");
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new IllegalStateException("Rendering failed unexpectedly", cause);
        }
    }

    private RenderOutcome renderOne(FormulaRenderer renderer, EquationRecord record) {
        try {
            RenderedFormula rendered = renderer.render(record.formula());
            LOGGER.debug("Rendered equation {} ({})", record.sourceOrder(), record.mode());
            return RenderOutcome.success(record, rendered);
        } catch (RenderException ex) {
            LOGGER.warn("Failed to render equation {} '{}': {}", record.sourceOrder(), abbreviate(record.formula()),
                    ex.getMessage());
            return RenderOutcome.failure(record, ex.getMessage());
        }
    }

    private static String abbreviate(String formula) {
        return formula.length() <= 60 ? formula : formula.substring(0, 60) + "...";
    }
}
