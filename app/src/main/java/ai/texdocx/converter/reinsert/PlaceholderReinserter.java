package ai.texdocx.converter.reinsert;

import ai.texdocx.converter.document.Block;
import ai.texdocx.converter.document.DisplayEquationBlock;
import ai.texdocx.converter.document.HeadingBlock;
import ai.texdocx.converter.document.ListItemBlock;
import ai.texdocx.converter.document.MathContent;
import ai.texdocx.converter.document.MathRun;
import ai.texdocx.converter.document.ParagraphBlock;
import ai.texdocx.converter.document.ResolvedCell;
import ai.texdocx.converter.document.Run;
import ai.texdocx.converter.document.RunStyle;
import ai.texdocx.converter.document.TableBlock;
import ai.texdocx.converter.document.TextRun;
import ai.texdocx.converter.math.EquationMode;
import ai.texdocx.converter.math.EquationRecord;
import ai.texdocx.converter.math.PlaceholderToken;
import ai.texdocx.converter.render.EquationPool;
import ai.texdocx.converter.render.RenderOutcome;
import ai.texdocx.converter.render.RenderedPools;
import ai.texdocx.converter.rewrite.IntermediateMarkup;
import ai.texdocx.converter.table.TableCell;
import ai.texdocx.converter.table.TableCellTokenizer;
import ai.texdocx.converter.table.TableGrid;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Walks the intermediate lines once and emits output blocks, replacing each placeholder with the next outcome of its
 * class.
 *
 * <p>Display and inline placeholders are served from independent pools by two cursors. Consecutive text lines form one
 * paragraph; a blank line or a structural line ends it. A placeholder whose pool is exhausted, or whose formula failed
 * to render, becomes a visible fallback holding the formula source.
 */
public class PlaceholderReinserter {

    private static final Logger LOGGER = LoggerFactory.getLogger(PlaceholderReinserter.class);

    private final TableCellTokenizer tableTokenizer;

    public PlaceholderReinserter() {
        this(new TableCellTokenizer());
    }

    public PlaceholderReinserter(TableCellTokenizer tableTokenizer) {
        this.tableTokenizer = Objects.requireNonNull(tableTokenizer, "tableTokenizer");
    }

    public List<Block> reinsert(String intermediate, List<EquationRecord> records, RenderedPools pools) {
        Resolver resolver = new Resolver(records, pools);
        List<Block> blocks = new ArrayList<>();
        List<String> paragraph = new ArrayList<>();
        String[] lines = intermediate.split("\\R", -1);

        for (int index = 0; index < lines.length; index++) {
            String line = lines[index].strip();
            if (line.isEmpty()) {
                flush(paragraph, blocks, resolver);
                continue;
            }
            if (IntermediateMarkup.isTableStart(line)) {
                flush(paragraph, blocks, resolver);
                List<String> interior = new ArrayList<>();
                while (index + 1 < lines.length && !IntermediateMarkup.isTableEnd(lines[index + 1])) {
                    interior.add(lines[++index]);
                }
                index++;
                table(String.join("\n", interior), resolver).ifPresent(blocks::add);
                addEmbeddedLabels(blocks, resolver);
                continue;
            }
            if (IntermediateMarkup.isTableEnd(line)) {
                continue;
            }
            Optional<IntermediateMarkup.HeadingLine> heading = IntermediateMarkup.parseHeading(line);
            if (heading.isPresent()) {
                flush(paragraph, blocks, resolver);
                blocks.add(new HeadingBlock(heading.get().level(), runs(heading.get().text(), resolver)));
                addEmbeddedLabels(blocks, resolver);
                continue;
            }
            Optional<IntermediateMarkup.ListLine> item = IntermediateMarkup.parseListItem(line);
            if (item.isPresent()) {
                flush(paragraph, blocks, resolver);
                blocks.add(new ListItemBlock(item.get().kind(), item.get().level(), runs(item.get().text(), resolver)));
                addEmbeddedLabels(blocks, resolver);
                continue;
            }
            Optional<PlaceholderToken> display = PlaceholderToken.parse(line)
                    .filter(token -> token.mode() == EquationMode.DISPLAY);
            if (display.isPresent()) {
                flush(paragraph, blocks, resolver);
                Resolved resolved = resolver.resolve(display.get());
                blocks.add(new DisplayEquationBlock(resolved.content(), resolved.label()));
                continue;
            }
            paragraph.add(line);
        }
        flush(paragraph, blocks, resolver);
        resolver.reportUnused();
        return blocks;
    }

    private void flush(List<String> paragraph, List<Block> blocks, Resolver resolver) {
        if (paragraph.isEmpty()) {
            return;
        }
        List<Run> runs = runs(String.join(" ", paragraph), resolver);
        paragraph.clear();
        if (!runs.isEmpty()) {
            blocks.add(new ParagraphBlock(runs));
        }
        addEmbeddedLabels(blocks, resolver);
    }

    /**
     * A labelled display equation that ended up inside a text line still gets its label line, right after the block
     * that holds it.
     */
    private static void addEmbeddedLabels(List<Block> blocks, Resolver resolver) {
        for (String label : resolver.drainEmbeddedLabels()) {
            blocks.add(ParagraphBlock.text("[" + label + "]"));
        }
    }

    private Optional<Block> table(String interior, Resolver resolver) {
        TableGrid grid = tableTokenizer.tokenize(interior);
        if (grid.isEmpty()) {
            return Optional.empty();
        }
        List<List<ResolvedCell>> rows = new ArrayList<>(grid.rowCount());
        for (List<TableCell> row : grid.rows()) {
            List<ResolvedCell> cells = new ArrayList<>(row.size());
            for (TableCell cell : row) {
                cells.add(new ResolvedCell(runs(cell.text(), resolver), cell.colspan()));
            }
            rows.add(cells);
        }
        return Optional.of(new TableBlock(rows, grid.columnCount()));
    }

    /**
     * Splits text into styled text runs and math runs. Subscript and superscript markers switch the style of the text
     * between them.
     */
    List<Run> runs(String text, Function<PlaceholderToken, MathContent> math) {
        List<Run> runs = new ArrayList<>();
        StringBuilder pending = new StringBuilder();
        RunStyle style = RunStyle.PLAIN;
        Matcher matcher = PlaceholderToken.PATTERN.matcher(text);
        int index = 0;
        while (index < text.length()) {
            char ch = text.charAt(index);
            if (ch == PlaceholderToken.OPEN && matcher.find(index) && matcher.start() == index) {
                addText(runs, pending, style);
                runs.add(new MathRun(math.apply(PlaceholderToken.fromMatch(matcher))));
                index = matcher.end();
                continue;
            }
            RunStyle next = switch (ch) {
                case IntermediateMarkup.SUB_START -> RunStyle.SUBSCRIPT;
                case IntermediateMarkup.SUP_START -> RunStyle.SUPERSCRIPT;
                case IntermediateMarkup.SUB_END, IntermediateMarkup.SUP_END -> RunStyle.PLAIN;
                default -> null;
            };
            if (next != null) {
                addText(runs, pending, style);
                style = next;
            } else if (!IntermediateMarkup.isReserved(ch)) {
                pending.append(ch);
            }
            index++;
        }
        addText(runs, pending, style);
        return runs;
    }

    private List<Run> runs(String text, Resolver resolver) {
        return runs(text, token -> {
            Resolved resolved = resolver.resolve(token);
            if (token.mode() == EquationMode.DISPLAY) {
                resolved.label().ifPresent(resolver::embedLabel);
            }
            return resolved.content();
        });
    }

    private static void addText(List<Run> runs, StringBuilder pending, RunStyle style) {
        if (pending.length() == 0) {
            return;
        }
        String text = pending.toString();
        pending.setLength(0);
        if (style == RunStyle.PLAIN && text.isBlank() && runs.isEmpty()) {
            return;
        }
        runs.add(new TextRun(text, style));
    }

    private record Resolved(MathContent content, Optional<String> label) {
    }

    /**
     * Holds the two pool cursors for one reinsertion pass.
     */
    private static final class Resolver {

        private final Map<Integer, EquationRecord> recordsBySourceOrder;
        private final RenderedPools pools;
        private final Map<EquationMode, Integer> cursors = new EnumMap<>(EquationMode.class);
        private final List<String> embeddedLabels = new ArrayList<>();

        Resolver(List<EquationRecord> records, RenderedPools pools) {
            this.recordsBySourceOrder = records.stream()
                    .collect(Collectors.toMap(EquationRecord::sourceOrder, Function.identity(), (a, b) -> a));
            this.pools = Objects.requireNonNull(pools, "pools");
            for (EquationMode mode : EquationMode.values()) {
                cursors.put(mode, 0);
            }
        }

        Resolved resolve(PlaceholderToken token) {
            EquationPool pool = pools.pool(token.mode());
            int cursor = cursors.get(token.mode());
            cursors.put(token.mode(), cursor + 1);

            Optional<RenderOutcome> slot = pool.at(cursor);
            if (slot.isPresent() && slot.get().record().sourceOrder() != token.sourceOrder()) {
                LOGGER.warn("Placeholder {} met {} equation {} at position {}; resolving by source order",
                        token, token.mode(), slot.get().record().sourceOrder(), cursor);
                slot = pool.bySourceOrder(token.sourceOrder());
            }
            if (slot.isEmpty()) {
                LOGGER.warn("No rendered {} equation left for placeholder {}; using fallback", token.mode(), token);
                EquationRecord record = recordsBySourceOrder.get(token.sourceOrder());
                String formula = record == null ? "?" : record.formula();
                Optional<String> label = record == null ? Optional.empty() : record.label();
                return new Resolved(MathContent.fallback(formula, token.mode()), label);
            }
            RenderOutcome outcome = slot.get();
            EquationRecord record = outcome.record();
            MathContent content = outcome.rendered()
                    .map(rendered -> MathContent.rendered(record.formula(), record.mode(), rendered))
                    .orElseGet(() -> MathContent.fallback(record.formula(), record.mode()));
            return new Resolved(content, record.label());
        }

        void embedLabel(String label) {
            embeddedLabels.add(label);
        }

        List<String> drainEmbeddedLabels() {
            if (embeddedLabels.isEmpty()) {
                return List.of();
            }
            List<String> drained = List.copyOf(embeddedLabels);
            embeddedLabels.clear();
            return drained;
        }

        void reportUnused() {
            for (EquationMode mode : EquationMode.values()) {
                int consumed = cursors.get(mode);
                int available = pools.pool(mode).size();
                if (consumed != available) {
                    LOGGER.warn("Consumed {} of {} {} equations", consumed, available, mode);
                }
            }
        }
    }
}
