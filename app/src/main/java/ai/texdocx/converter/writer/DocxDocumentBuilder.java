package ai.texdocx.converter.writer;

import ai.texdocx.converter.document.ListKind;
import ai.texdocx.converter.document.RunStyle;
import ai.texdocx.converter.render.MathMarkup;
import ai.texdocx.converter.render.RenderedFormula;
import java.io.IOException;
import java.io.OutputStream;
import java.math.BigInteger;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import org.apache.poi.xwpf.usermodel.ParagraphAlignment;
import org.apache.poi.xwpf.usermodel.VerticalAlign;
import org.apache.poi.xwpf.usermodel.XWPFAbstractNum;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.apache.poi.xwpf.usermodel.XWPFNumbering;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;
import org.apache.poi.xwpf.usermodel.XWPFRun;
import org.apache.poi.xwpf.usermodel.XWPFStyle;
import org.apache.poi.xwpf.usermodel.XWPFStyles;
import org.apache.poi.xwpf.usermodel.XWPFTable;
import org.apache.poi.xwpf.usermodel.XWPFTableCell;
import org.apache.xmlbeans.XmlCursor;
import org.apache.xmlbeans.XmlException;
import org.apache.xmlbeans.XmlObject;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTAbstractNum;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTLvl;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTR;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTRPr;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTStyle;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTTcPr;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.STMerge;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.STNumberFormat;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.STStyleType;

/**
 * {@link DocumentBuilder} writing a Word document through Apache POI.
 *
 * <p>Math fragments are parsed with XMLBeans and copied into the paragraph XML, since POI has no math API.
 */
public class DocxDocumentBuilder implements DocumentBuilder {

    static final int MAX_HEADING_LEVEL = 4;
    static final int MAX_LIST_LEVEL = 8;
    private static final int[] HEADING_SIZES = {16, 14, 13, 12};
    private static final String[] BULLET_SYMBOLS = {"•", "◦", "▪"};
    private static final int INDENT_STEP_TWIPS = 720;
    private static final int HANGING_TWIPS = 360;

    private final XWPFDocument document;
    private final Set<Integer> registeredHeadings = new HashSet<>();
    private final Map<ListKind, BigInteger> currentList = new EnumMap<>(ListKind.class);
    private XWPFNumbering numbering;
    private long nextAbstractNumId;

    public DocxDocumentBuilder() {
        this(new XWPFDocument());
    }

    DocxDocumentBuilder(XWPFDocument document) {
        this.document = document;
    }

    XWPFDocument document() {
        return document;
    }

    @Override
    public ParagraphHandle addHeading(int level) {
        int effective = Math.max(1, Math.min(level, MAX_HEADING_LEVEL));
        String styleId = ensureHeadingStyle(effective);
        XWPFParagraph paragraph = document.createParagraph();
        paragraph.setStyle(styleId);
        return new DocxParagraph(paragraph);
    }

    @Override
    public ParagraphHandle addParagraph() {
        return new DocxParagraph(document.createParagraph());
    }

    @Override
    public ParagraphHandle addListItem(ListKind kind, int level, boolean startsNewList) {
        if (startsNewList) {
            currentList.clear();
        }
        BigInteger numId = currentList.computeIfAbsent(kind, this::createNumbering);
        XWPFParagraph paragraph = document.createParagraph();
        paragraph.setNumID(numId);
        paragraph.setNumILvl(BigInteger.valueOf(Math.max(0, Math.min(level, MAX_LIST_LEVEL))));
        return new DocxParagraph(paragraph);
    }

    @Override
    public TableHandle addTable(int rows, int columns) {
        if (rows < 1 || columns < 1) {
            throw new IllegalArgumentException("Table needs at least one row and one column: " + rows + "x" + columns);
        }
        XWPFTable table = document.createTable(rows, columns);
        table.setTopBorder(XWPFTable.XWPFBorderType.SINGLE, 4, 0, "000000");
        table.setBottomBorder(XWPFTable.XWPFBorderType.SINGLE, 4, 0, "000000");
        table.setLeftBorder(XWPFTable.XWPFBorderType.SINGLE, 4, 0, "000000");
        table.setRightBorder(XWPFTable.XWPFBorderType.SINGLE, 4, 0, "000000");
        table.setInsideHBorder(XWPFTable.XWPFBorderType.SINGLE, 4, 0, "000000");
        table.setInsideVBorder(XWPFTable.XWPFBorderType.SINGLE, 4, 0, "000000");
        return new DocxTable(table);
    }

    @Override
    public void save(Path target) throws IOException {
        Path parent = target.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (OutputStream out = Files.newOutputStream(target)) {
            document.write(out);
        }
    }

    @Override
    public void close() throws IOException {
        document.close();
    }

    private String ensureHeadingStyle(int level) {
        String styleId = "Heading" + level;
        if (registeredHeadings.contains(level)) {
            return styleId;
        }
        XWPFStyles styles = document.createStyles();
        if (!styles.styleExist(styleId)) {
            CTStyle ctStyle = CTStyle.Factory.newInstance();
            ctStyle.setStyleId(styleId);
            ctStyle.addNewName().setVal("heading " + level);
            ctStyle.addNewBasedOn().setVal("Normal");
            ctStyle.addNewNext().setVal("Normal");
            ctStyle.addNewUiPriority().setVal(BigInteger.valueOf(9));
            ctStyle.addNewQFormat();
            ctStyle.addNewPPr().addNewOutlineLvl().setVal(BigInteger.valueOf(level - 1L));
            CTRPr runProperties = ctStyle.addNewRPr();
            runProperties.addNewB();
            runProperties.addNewSz().setVal(BigInteger.valueOf(HEADING_SIZES[level - 1] * 2L));

            XWPFStyle style = new XWPFStyle(ctStyle);
            style.setType(STStyleType.PARAGRAPH);
            styles.addStyle(style);
        }
        registeredHeadings.add(level);
        return styleId;
    }

    private BigInteger createNumbering(ListKind kind) {
        if (numbering == null) {
            numbering = document.createNumbering();
        }
        CTAbstractNum abstractNum = CTAbstractNum.Factory.newInstance();
        abstractNum.setAbstractNumId(BigInteger.valueOf(nextAbstractNumId++));
        for (int level = 0; level <= MAX_LIST_LEVEL; level++) {
            CTLvl lvl = abstractNum.addNewLvl();
            lvl.setIlvl(BigInteger.valueOf(level));
            lvl.addNewStart().setVal(BigInteger.ONE);
            if (kind == ListKind.NUMBERED) {
                lvl.addNewNumFmt().setVal(STNumberFormat.DECIMAL);
                lvl.addNewLvlText().setVal("%" + (level + 1) + ".");
            } else {
                lvl.addNewNumFmt().setVal(STNumberFormat.BULLET);
                lvl.addNewLvlText().setVal(BULLET_SYMBOLS[level % BULLET_SYMBOLS.length]);
            }
            var indent = lvl.addNewPPr().addNewInd();
            indent.setLeft(BigInteger.valueOf((long) INDENT_STEP_TWIPS * (level + 1)));
            indent.setHanging(BigInteger.valueOf(HANGING_TWIPS));
        }
        BigInteger abstractNumId = numbering.addAbstractNum(new XWPFAbstractNum(abstractNum, numbering));
        return numbering.addNum(abstractNumId);
    }

    static XmlObject parseFragment(String markup) {
        try {
            return XmlObject.Factory.parse(markup);
        } catch (XmlException ex) {
            throw new MathMarkupException("Malformed math fragment: " + ex.getMessage(), ex);
        }
    }

    /**
     * Copies the root element of {@code fragment} to the end of {@code paragraph}.
     */
    static void appendFragment(XWPFParagraph paragraph, XmlObject fragment) {
        try (XmlCursor source = fragment.newCursor(); XmlCursor target = paragraph.getCTP().newCursor()) {
            if (!source.toFirstChild()) {
                throw new MathMarkupException("Empty math fragment", null);
            }
            target.toEndToken();
            source.copyXml(target);
        }
    }

    private static final class DocxParagraph implements ParagraphHandle {

        private final XWPFParagraph paragraph;

        DocxParagraph(XWPFParagraph paragraph) {
            this.paragraph = paragraph;
        }

        @Override
        public void addTextRun(String text, RunStyle style) {
            XWPFRun run = paragraph.createRun();
            run.setText(text);
            if (style == RunStyle.SUBSCRIPT) {
                run.setSubscript(VerticalAlign.SUBSCRIPT);
            } else if (style == RunStyle.SUPERSCRIPT) {
                run.setSubscript(VerticalAlign.SUPERSCRIPT);
            }
            moveToEnd(run.getCTR());
        }

        @Override
        public void addInlineMath(RenderedFormula formula) {
            appendFragment(paragraph, parseFragment(MathMarkup.inlineExpression(formula)));
        }

        @Override
        public void addDisplayMath(RenderedFormula formula) {
            XmlObject fragment = parseFragment(MathMarkup.displayParagraph(formula));
            paragraph.setAlignment(ParagraphAlignment.CENTER);
            appendFragment(paragraph, fragment);
        }

        // new runs are placed after the last run, which may precede math copied in earlier
        private void moveToEnd(CTR run) {
            try (XmlCursor cursor = run.newCursor()) {
                if (!cursor.toNextSibling()) {
                    return;
                }
            }
            try (XmlCursor source = run.newCursor(); XmlCursor target = paragraph.getCTP().newCursor()) {
                target.toEndToken();
                source.moveXml(target);
            }
        }
    }

    private static final class DocxTable implements TableHandle {

        private final XWPFTable table;

        DocxTable(XWPFTable table) {
            this.table = table;
        }

        @Override
        public ParagraphHandle cell(int row, int column) {
            XWPFTableCell cell = table.getRow(row).getCell(column);
            if (cell == null) {
                throw new IndexOutOfBoundsException("No cell at " + row + "," + column);
            }
            return new DocxParagraph(cell.getParagraphs().get(0));
        }

        @Override
        public void mergeAcross(int row, int firstColumn, int lastColumn) {
            for (int column = firstColumn; column <= lastColumn; column++) {
                XWPFTableCell cell = table.getRow(row).getCell(column);
                if (cell == null) {
                    return;
                }
                CTTcPr properties = cell.getCTTc().isSetTcPr() ? cell.getCTTc().getTcPr() : cell.getCTTc().addNewTcPr();
                properties.addNewHMerge().setVal(column == firstColumn ? STMerge.RESTART : STMerge.CONTINUE);
            }
        }
    }
}
