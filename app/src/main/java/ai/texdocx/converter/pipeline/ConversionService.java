package ai.texdocx.converter.pipeline;

import ai.texdocx.converter.config.Config;
import ai.texdocx.converter.document.Block;
import ai.texdocx.converter.logging.SimpleJsonLayout;
import ai.texdocx.converter.math.EquationMode;
import ai.texdocx.converter.reinsert.PlaceholderReinserter;
import ai.texdocx.converter.render.RenderService;
import ai.texdocx.converter.render.RenderedPools;
import ai.texdocx.converter.scan.Diagnostic;
import ai.texdocx.converter.writer.BlockWriter;
import ai.texdocx.converter.writer.DocumentBuilder;
import ai.texdocx.converter.writer.DocxDocumentBuilder;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Runs one conversion: read, prepare, render, reinsert, build and save.
 *
 * <p>Only input and output problems abort a run; formulas that fail to render end up as visible fallbacks.
 */
public class ConversionService {

    private static final Logger LOGGER = LoggerFactory.getLogger(ConversionService.class);

    private final Map<SourceFormat, SourcePipeline> pipelines;
    private final RenderService renderService;
    private final PlaceholderReinserter reinserter;
    private final BlockWriter blockWriter;
    private final Supplier<DocumentBuilder> builderFactory;
    private final InputResolver inputResolver;

    public ConversionService(RenderService renderService) {
        this(defaultPipelines(), renderService, new PlaceholderReinserter(), new BlockWriter(),
                DocxDocumentBuilder::new, new InputResolver());
    }

    public ConversionService(Map<SourceFormat, SourcePipeline> pipelines,
                             RenderService renderService,
                             PlaceholderReinserter reinserter,
                             BlockWriter blockWriter,
                             Supplier<DocumentBuilder> builderFactory,
                             InputResolver inputResolver) {
        this.pipelines = Map.copyOf(Objects.requireNonNull(pipelines, "pipelines"));
        this.renderService = Objects.requireNonNull(renderService, "renderService");
        this.reinserter = Objects.requireNonNull(reinserter, "reinserter");
        this.blockWriter = Objects.requireNonNull(blockWriter, "blockWriter");
        this.builderFactory = Objects.requireNonNull(builderFactory, "builderFactory");
        this.inputResolver = Objects.requireNonNull(inputResolver, "inputResolver");
    }

    private static Map<SourceFormat, SourcePipeline> defaultPipelines() {
        Map<SourceFormat, SourcePipeline> pipelines = new EnumMap<>(SourceFormat.class);
        pipelines.put(SourceFormat.LATEX, new LatexPipeline());
        pipelines.put(SourceFormat.MARKDOWN, new MarkdownPipeline());
        return pipelines;
    }

    public ConversionReport convert(Config config) {
        Objects.requireNonNull(config, "config");
        Path input = inputResolver.resolve(config.input());
        SourceFormat format = config.sourceFormat()
                .or(() -> SourceFormat.fromFileName(input))
                .orElseThrow(() -> new ConversionException("Unsupported input file extension: " + input.getFileName()
                        + " (expected .tex, .md or .markdown)"));
        SourcePipeline pipeline = pipelines.get(format);
        if (pipeline == null) {
            throw new ConversionException("No pipeline registered for " + format);
        }

        MDC.put(SimpleJsonLayout.SOURCE_KEY, String.valueOf(input.getFileName()));
        try {
            String source = read(input);
            LOGGER.info("Converting {} as {}", input, format);

            PreparedDocument prepared = pipeline.prepare(source);
            long display = prepared.count(EquationMode.DISPLAY);
            long inline = prepared.count(EquationMode.INLINE);
            LOGGER.info("Found {} display and {} inline equations", display, inline);
            for (Diagnostic diagnostic : prepared.diagnostics()) {
                LOGGER.debug("{}", diagnostic.message());
            }
            if (!prepared.diagnostics().isEmpty()) {
                LOGGER.warn("{} malformed constructs were left in the text", prepared.diagnostics().size());
            }

            RenderedPools pools = renderService.renderAll(prepared.records(), config.renderer().mode());
            List<Block> blocks = reinserter.reinsert(prepared.intermediate(), prepared.records(), pools);
            write(blocks, config.output());
            LOGGER.info("Saved {} blocks to {}", blocks.size(), config.output());

            return new ConversionReport(config.output(), display, inline, pools.renderedCount(), pools.failedCount(),
                    prepared.diagnostics().size());
        } finally {
            MDC.remove(SimpleJsonLayout.SOURCE_KEY);
        }
    }

    private static String read(Path input) {
        try {
            return Files.readString(input, StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new ConversionException("Failed to read input file " + input + ": " + ex.getMessage(), ex);
        }
    }

    private void write(List<Block> blocks, Path output) {
        try (DocumentBuilder builder = builderFactory.get()) {
            blockWriter.write(blocks, builder);
            builder.save(output);
        } catch (IOException ex) {
            throw new ConversionException("Failed to write output file " + output + ": " + ex.getMessage(), ex);
        }
    }
}
