package ai.texdocx.converter.writer;

import static org.assertj.core.api.Assertions.assertThat;

import ai.texdocx.converter.document.Block;
import ai.texdocx.converter.document.DisplayEquationBlock;
import ai.texdocx.converter.document.HeadingBlock;
import ai.texdocx.converter.document.ListItemBlock;
import ai.texdocx.converter.document.ListKind;
import ai.texdocx.converter.document.MathContent;
import ai.texdocx.converter.document.MathRun;
import ai.texdocx.converter.document.ParagraphBlock;
import ai.texdocx.converter.document.ResolvedCell;
import ai.texdocx.converter.document.RunStyle;
import ai.texdocx.converter.document.TableBlock;
import ai.texdocx.converter.document.TextRun;
import ai.texdocx.converter.math.EquationMode;
import ai.texdocx.converter.render.RenderedFormula;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class BlockWriterTest {

    private static final RenderedFormula GOOD = RenderedFormula.of("<m:oMath/>");
    private static final RenderedFormula BROKEN = RenderedFormula.of("<m:oMath><unclosed");

    private final BlockWriter writer = new BlockWriter();

    @Test
    void restartsListNumberingAfterNonListBlock() {
        RecordingBuilder builder = new RecordingBuilder();
        List<Block> blocks = List.of(
                item(ListKind.NUMBERED, 0, "a"),
                item(ListKind.NUMBERED, 1, "b"),
                ParagraphBlock.text("between"),
                item(ListKind.NUMBERED, 0, "c"));

        writer.write(blocks, builder);

        assertThat(builder.events).containsExactly(
                "list NUMBERED 0 new", "text a PLAIN",
                "list NUMBERED 1 continued", "text b PLAIN",
                "paragraph", "text between PLAIN",
                "list NUMBERED 0 new", "text c PLAIN");
    }

    @Test
    void writesDisplayEquationWithLabelLine() {
        RecordingBuilder builder = new RecordingBuilder();
        MathContent content = MathContent.rendered("E", EquationMode.DISPLAY, GOOD);

        writer.write(List.of(new DisplayEquationBlock(content, Optional.of("eq:e"))), builder);

        assertThat(builder.events).containsExactly("paragraph", "display", "paragraph", "text [eq:e] PLAIN");
    }

    @Test
    void unplaceableMathBecomesFallbackText() {
        RecordingBuilder builder = new RecordingBuilder();
        List<Block> blocks = List.of(
                new HeadingBlock(2, List.of(TextRun.plain("T "),
                        new MathRun(MathContent.rendered("x", EquationMode.INLINE, BROKEN)))),
                new DisplayEquationBlock(MathContent.fallback("y", EquationMode.DISPLAY), Optional.empty()));

        writer.write(blocks, builder);

        assertThat(builder.events).containsExactly(
                "heading 2", "text T  PLAIN", "text [eq: x] PLAIN",
                "paragraph", "text [Equation: y] PLAIN");
    }

    @Test
    void mergesCellsAcrossTheirSpan() {
        RecordingBuilder builder = new RecordingBuilder();
        TableBlock table = new TableBlock(List.of(
                List.of(new ResolvedCell(List.of(TextRun.plain("H")), 2)),
                List.of(new ResolvedCell(List.of(TextRun.plain("a")), 1),
                        new ResolvedCell(List.of(new TextRun("b", RunStyle.SUPERSCRIPT)), 1))), 2);

        writer.write(List.of(table), builder);

        assertThat(builder.events).containsExactly(
                "table 2x2",
                "cell 0,0", "text H PLAIN", "merge 0 0..1",
                "cell 1,0", "text a PLAIN",
                "cell 1,1", "text b SUPERSCRIPT");
    }

    private static ListItemBlock item(ListKind kind, int level, String text) {
        return new ListItemBlock(kind, level, List.of(TextRun.plain(text)));
    }

    private static final class RecordingBuilder implements DocumentBuilder {

        private final List<String> events = new ArrayList<>();

        @Override
        public ParagraphHandle addHeading(int level) {
            events.add("heading " + level);
            return paragraph();
        }

        @Override
        public ParagraphHandle addParagraph() {
            events.add("paragraph");
            return paragraph();
        }

        @Override
        public ParagraphHandle addListItem(ListKind kind, int level, boolean startsNewList) {
            events.add("list " + kind + " " + level + (startsNewList ? " new" : " continued"));
            return paragraph();
        }

        @Override
        public TableHandle addTable(int rows, int columns) {
            events.add("table " + rows + "x" + columns);
            return new TableHandle() {
                @Override
                public ParagraphHandle cell(int row, int column) {
                    events.add("cell " + row + "," + column);
                    return paragraph();
                }

                @Override
                public void mergeAcross(int row, int firstColumn, int lastColumn) {
                    events.add("merge " + row + " " + firstColumn + ".." + lastColumn);
                }
            };
        }

        @Override
        public void save(Path target) {
            events.add("save");
        }

        @Override
        public void close() {
        }

        private ParagraphHandle paragraph() {
            return new ParagraphHandle() {
                @Override
                public void addTextRun(String text, RunStyle style) {
                    events.add("text " + text + " " + style);
                }

                @Override
                public void addInlineMath(RenderedFormula formula) {
                    place(formula, "inline");
                }

                @Override
                public void addDisplayMath(RenderedFormula formula) {
                    place(formula, "display");
                }
            };
        }

        private void place(RenderedFormula formula, String kind) {
            if (formula == BROKEN) {
                throw new MathMarkupException("Malformed math fragment", null);
            }
            events.add(kind);
        }
    }
}
