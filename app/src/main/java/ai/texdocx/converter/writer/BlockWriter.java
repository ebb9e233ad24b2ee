package ai.texdocx.converter.writer;

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
import ai.texdocx.converter.render.RenderedFormula;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Feeds blocks to a {@link DocumentBuilder}. Math that cannot be placed is written as its fallback text.
 */
public class BlockWriter {

    private static final Logger LOGGER = LoggerFactory.getLogger(BlockWriter.class);

    public void write(List<Block> blocks, DocumentBuilder builder) {
        Block previous = null;
        for (Block block : blocks) {
            if (block instanceof HeadingBlock heading) {
                writeRuns(builder.addHeading(heading.level()), heading.runs());
            } else if (block instanceof ParagraphBlock paragraph) {
                writeRuns(builder.addParagraph(), paragraph.runs());
            } else if (block instanceof ListItemBlock item) {
                boolean startsNewList = !(previous instanceof ListItemBlock);
                writeRuns(builder.addListItem(item.kind(), item.level(), startsNewList), item.runs());
            } else if (block instanceof TableBlock table) {
                writeTable(builder, table);
            } else if (block instanceof DisplayEquationBlock equation) {
                writeDisplayEquation(builder, equation);
            } else {
                throw new IllegalArgumentException("Unsupported block type: " + block.getClass().getName());
            }
            previous = block;
        }
    }

    private void writeTable(DocumentBuilder builder, TableBlock table) {
        if (table.rows().isEmpty() || table.columnCount() == 0) {
            return;
        }
        TableHandle handle = builder.addTable(table.rows().size(), table.columnCount());
        for (int row = 0; row < table.rows().size(); row++) {
            int column = 0;
            for (ResolvedCell cell : table.rows().get(row)) {
                writeRuns(handle.cell(row, column), cell.runs());
                if (cell.colspan() > 1) {
                    handle.mergeAcross(row, column, column + cell.colspan() - 1);
                }
                column += cell.colspan();
            }
        }
    }

    private void writeDisplayEquation(DocumentBuilder builder, DisplayEquationBlock equation) {
        ParagraphHandle paragraph = builder.addParagraph();
        MathContent content = equation.content();
        if (content.rendered().isPresent()) {
            try {
                paragraph.addDisplayMath(content.rendered().get());
            } catch (MathMarkupException ex) {
                LOGGER.warn("Could not place display equation '{}': {}", content.formula(), ex.getMessage());
                paragraph.addTextRun(content.fallbackText(), RunStyle.PLAIN);
            }
        } else {
            paragraph.addTextRun(content.fallbackText(), RunStyle.PLAIN);
        }
        equation.label().ifPresent(label -> builder.addParagraph().addTextRun("[" + label + "]", RunStyle.PLAIN));
    }

    private void writeRuns(ParagraphHandle paragraph, List<Run> runs) {
        for (Run run : runs) {
            if (run instanceof TextRun text) {
                paragraph.addTextRun(text.text(), text.style());
            } else if (run instanceof MathRun math) {
                writeInlineMath(paragraph, math.content());
            }
        }
    }

    private void writeInlineMath(ParagraphHandle paragraph, MathContent content) {
        if (content.isFallback()) {
            paragraph.addTextRun(content.fallbackText(), RunStyle.PLAIN);
            return;
        }
        RenderedFormula rendered = content.rendered().get();
        try {
            paragraph.addInlineMath(rendered);
        } catch (MathMarkupException ex) {
            LOGGER.warn("Could not place inline equation '{}': {}", content.formula(), ex.getMessage());
            paragraph.addTextRun(content.fallbackText(), RunStyle.PLAIN);
        }
    }
}
