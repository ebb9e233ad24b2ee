package ai.texdocx.converter.table;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import org.junit.jupiter.api.Test;

class TableCellTokenizerTest {

    private final TableCellTokenizer tokenizer = new TableCellTokenizer();

    @Test
    void multicolumnHeaderSpansTheGrid() {
        TableGrid grid = tokenizer.tokenize("\\multicolumn{2}{c}{Header} \\\\\n a & b \\\\");

        assertThat(grid.rows()).containsExactly(
                List.of(new TableCell("Header", 2)),
                List.of(TableCell.single("a"), TableCell.single("b")));
        assertThat(grid.columnCount()).isEqualTo(2);
        assertThat(grid.rowCount()).isEqualTo(2);
    }

    @Test
    void dropsRulesAndKeepsEscapedAmpersand() {
        TableGrid grid = tokenizer.tokenize("\\toprule\nA \\& B & C \\\\\n\\midrule\n1 & 2\n\\bottomrule");

        assertThat(grid.rows()).containsExactly(
                List.of(TableCell.single("A & B"), TableCell.single("C")),
                List.of(TableCell.single("1"), TableCell.single("2")));
    }

    @Test
    void unescapesBracesAndSpecialsInCells() {
        TableGrid grid = tokenizer.tokenize("\\{x\\} & 5\\% & a\\_b");

        assertThat(grid.rows()).singleElement()
                .isEqualTo(List.of(TableCell.single("{x}"), TableCell.single("5%"), TableCell.single("a_b")));
    }

    @Test
    void separatorsInsideBracesDoNotSplit() {
        TableGrid grid = tokenizer.tokenize("\\textbf{a & b} & c");

        assertThat(grid.rows()).singleElement()
                .isEqualTo(List.of(TableCell.single("\\textbf{a & b}"), TableCell.single("c")));
    }

    @Test
    void multirowContributesItsContent() {
        TableGrid grid = tokenizer.tokenize("\\multirow{2}{*}{X} & y");

        assertThat(grid.rows().get(0)).containsExactly(TableCell.single("X"), TableCell.single("y"));
    }

    @Test
    void invalidSpanFallsBackToOne() {
        TableGrid grid = tokenizer.tokenize("\\multicolumn{x}{c}{Z} & w");

        assertThat(grid.rows().get(0)).containsExactly(TableCell.single("Z"), TableCell.single("w"));
    }

    @Test
    void recognisesTabularNewlineAndRowSpacing() {
        TableGrid grid = tokenizer.tokenize("a & b \\tabularnewline c & d \\\\[2pt] e & f");

        assertThat(grid.rowCount()).isEqualTo(3);
        assertThat(grid.rows().get(2)).containsExactly(TableCell.single("e"), TableCell.single("f"));
    }

    @Test
    void shortRowsDoNotShrinkColumnCount() {
        TableGrid grid = tokenizer.tokenize("a & b & c \\\\ d");

        assertThat(grid.columnCount()).isEqualTo(3);
        assertThat(grid.rows().get(1)).containsExactly(TableCell.single("d"));
    }

    @Test
    void blankInteriorGivesEmptyGrid() {
        assertThat(tokenizer.tokenize("  \n ").isEmpty()).isTrue();
        assertThat(tokenizer.tokenize("\\hline\n\\hline").isEmpty()).isTrue();
    }
}
