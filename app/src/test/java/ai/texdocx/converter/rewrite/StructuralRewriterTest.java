package ai.texdocx.converter.rewrite;

import static org.assertj.core.api.Assertions.assertThat;

import ai.texdocx.converter.document.ListKind;
import ai.texdocx.converter.scan.Diagnostic;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class StructuralRewriterTest {

    private final StructuralRewriter rewriter = new StructuralRewriter();

    @Test
    void rewritesSectioningCommandsIntoHeadingLines() {
        String result = rewriter.rewrite("\\section{Intro}\nText here.\n\\subsection*{Details}\nMore.");

        assertThat(result).isEqualTo(IntermediateMarkup.heading(1, "Intro") + "\n\nText here.\n\n"
                + IntermediateMarkup.heading(2, "Details") + "\n\nMore.");
    }

    @Test
    void collapsesFormattingInsideHeadings() {
        String result = rewriter.rewrite("\\subsubsection{The \\textbf{Bold} part}");

        assertThat(result).isEqualTo(IntermediateMarkup.heading(3, "The Bold part"));
    }

    @Test
    void flattensNestedListsWithLevels() {
        String result = rewriter.rewrite("\\begin{itemize}\n\\item First\n\\item Second\n"
                + "\\begin{enumerate}\n\\item Inner\n\\end{enumerate}\n\\end{itemize}");

        assertThat(result.split("\n")).containsExactly(
                IntermediateMarkup.listItem(ListKind.BULLET, 0, "First"),
                IntermediateMarkup.listItem(ListKind.BULLET, 0, "Second"),
                IntermediateMarkup.listItem(ListKind.NUMBERED, 1, "Inner"));
    }

    @Test
    void descriptionItemsKeepTheirTerm() {
        String result = rewriter.rewrite("\\begin{description}\n\\item[Term] Meaning\n\\end{description}");

        assertThat(result).isEqualTo(IntermediateMarkup.listItem(ListKind.BULLET, 0, "Term: Meaning"));
    }

    @Test
    void reducesFigureToLabelAndCaption() {
        String result = rewriter.rewrite("Before\n\\begin{figure}[h]\n\\centering\n\\includegraphics{a.png}\n"
                + "\\caption{A plot}\n\\label{fig:plot}\n\\end{figure}\nAfter");

        assertThat(result).isEqualTo("Before\n\n[Figure: fig:plot]\n\n[A plot]\n\nAfter");
    }

    @Test
    void figureWithoutLabelOrCaptionLeavesMarker() {
        assertThat(rewriter.rewrite("\\begin{figure}\\includegraphics{x}\\end{figure}")).isEqualTo("[Figure omitted]");
    }

    @Test
    void tableFloatBecomesCaptionLinesAndRegion() {
        String result = rewriter.rewrite("\\begin{table}\n\\caption{Results}\n\\label{tab:r}\n"
                + "\\begin{tabular}{|c|c|}\n\\hline\na & b \\\\\nc & d \\\\\n\\hline\n\\end{tabular}\n\\end{table}");

        assertThat(result).isEqualTo("[Table: tab:r]\n\n[Results]\n\n" + IntermediateMarkup.TABLE_START
                + "\n\\hline\na & b \\\\\nc & d \\\\\n\\hline\n" + IntermediateMarkup.TABLE_END);
    }

    @Test
    void bareTabularBecomesRegion() {
        String result = rewriter.rewrite("Intro\n\\begin{tabularx}{\\linewidth}{XX}\n1 & 2\n\\end{tabularx}");

        assertThat(result).isEqualTo("Intro\n\n" + IntermediateMarkup.TABLE_START + "\n1 & 2\n"
                + IntermediateMarkup.TABLE_END);
    }

    @Test
    void lineBreaksEndParagraphsOutsideTables() {
        assertThat(rewriter.rewrite("first line\\\\second line")).isEqualTo("first line\n\nsecond line");
        assertThat(rewriter.rewrite("one\\newline two")).isEqualTo("one\n\ntwo");
    }

    @Test
    void rewritesReferencesAndCitations() {
        assertThat(rewriter.rewrite("See \\ref{fig:a} and \\cite{k1, k2}.")).isEqualTo("See [fig:a] and [k1, k2].");
        assertThat(rewriter.rewrite("\\reffig{x} and \\refeqn{y}")).isEqualTo("Fig. and Eq.");
    }

    @Test
    void collapsesNestedFormattingAndMarksSubscripts() {
        String result = rewriter.rewrite("\\textbf{bold \\emph{nested}} H\\textsubscript{2}O");

        assertThat(result).isEqualTo("bold nested H" + IntermediateMarkup.subscript("2") + "O");
    }

    @Test
    void footnotesBecomeParentheticals() {
        assertThat(rewriter.rewrite("Text\\footnote{A note.} end")).isEqualTo("Text (A note.) end");
    }

    @Test
    void unescapesSpecialCharacters() {
        assertThat(rewriter.rewrite("50\\% \\& more~text")).isEqualTo("50% & more text");
    }

    @Test
    void abstractGetsHeading() {
        assertThat(rewriter.rewrite("\\begin{abstract}\nShort.\n\\end{abstract}"))
                .isEqualTo(IntermediateMarkup.heading(2, "Abstract") + "\n\nShort.");
    }

    @Test
    void malformedCommandIsLeftAndReported() {
        List<Diagnostic> diagnostics = new ArrayList<>();

        String result = rewriter.rewrite("\\textbf{open", diagnostics);

        assertThat(result).isEqualTo("\\textbf{open");
        assertThat(diagnostics).isNotEmpty();
    }

    @Test
    void rewritingIsIdempotent() {
        String source = "\\section{Intro}\nSome \\textbf{bold} text \\cite{a,b}.\\\\Next line.\n"
                + "\\begin{itemize}\n\\item One\n\\item Two \\emph{x}\n\\end{itemize}\n"
                + "\\begin{table}\\caption{T}\\begin{tabular}{cc}a & b \\\\ c & d\\end{tabular}\\end{table}\n"
                + "\\begin{figure}\\caption{F}\\label{fig:f}\\end{figure}\n50\\% done";

        String once = rewriter.rewrite(source);

        assertThat(rewriter.rewrite(once)).isEqualTo(once);
    }

    @Test
    void reductionBeforeExtractionDropsFigureContentAndDualStrings() {
        String result = rewriter.reduceBeforeExtraction(
                "\\begin{figure}$x$\\caption{c}\\end{figure} \\texorpdfstring{$a$}{a}");

        assertThat(result).contains("[c]").endsWith(" a").doesNotContain("$");
    }
}
