package ai.texdocx.converter.scan;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class ConstructScannerTest {

    private final ConstructScanner scanner = new ConstructScanner();

    @Test
    void returnsMatchesInDocumentOrder() {
        ScanResult result = scanner.scan("a $x$ and \\begin{equation}y\\end{equation}", ConstructCatalogue.latexMath());

        assertThat(result.matches()).extracting(ConstructMatch::kind)
                .containsExactly(ConstructKind.INLINE_MATH, ConstructKind.DISPLAY_MATH);
        assertThat(result.matches()).extracting(ConstructMatch::lastArgument).containsExactly("x", "y");
        assertThat(result.diagnostics()).isEmpty();
    }

    @Test
    void higherPriorityMatchMasksItsInterior() {
        ScanResult result = scanner.scan("\\begin{align}a $b$ c\\end{align} $d$", ConstructCatalogue.latexMath());

        assertThat(result.matches()).hasSize(2);
        assertThat(result.matches().get(0).name()).isEqualTo("align");
        assertThat(result.matches().get(0).lastArgument()).isEqualTo("a $b$ c");
        assertThat(result.matches().get(1).lastArgument()).isEqualTo("d");
    }

    @Test
    void doubleDollarWinsOverSingleDollar() {
        ScanResult result = scanner.scan("$$a$$ and $b$", ConstructCatalogue.latexMath());

        assertThat(result.matches()).extracting(ConstructMatch::kind)
                .containsExactly(ConstructKind.DISPLAY_MATH, ConstructKind.INLINE_MATH);
    }

    @Test
    void skipsEscapedDollar() {
        ScanResult result = scanner.scan("costs \\$5 and $x$", ConstructCatalogue.latexMath());

        assertThat(result.matches()).singleElement().satisfies(match -> {
            assertThat(match.lastArgument()).isEqualTo("x");
            assertThat(match.start()).isEqualTo(14);
        });
    }

    @Test
    void reportsUnterminatedConstructsWithoutMatchingThem() {
        ScanResult result = scanner.scan("\\begin{equation} x and $open", ConstructCatalogue.latexMath());

        assertThat(result.matches()).isEmpty();
        assertThat(result.diagnostics()).extracting(Diagnostic::construct).contains("equation", "$");
    }

    @Test
    void inlineMathDoesNotCrossBlankLine() {
        ScanResult result = scanner.scan("$a\n\nb$", ConstructCatalogue.latexMath());

        assertThat(result.matches()).isEmpty();
        assertThat(result.diagnostics()).isNotEmpty();
    }

    @Test
    void nestedEnvironmentsOfSameNamePair() {
        String text = "\\begin{itemize}\\item a \\begin{itemize}\\item b\\end{itemize}\\end{itemize} tail";

        ScanResult result = scanner.scan(text, List.of(ConstructCatalogue.LISTS));

        assertThat(result.matches()).singleElement().satisfies(match -> {
            assertThat(match.end()).isEqualTo(text.indexOf(" tail"));
            assertThat(match.lastArgument()).contains("\\end{itemize}");
        });
    }

    @Test
    void replaceAllKeepsMalformedOccurrenceVerbatim() {
        List<Diagnostic> diagnostics = new ArrayList<>();

        String result = ConstructScanner.replaceAll("\\textbf{a} \\textbf{b", CommandPattern.of("textbf", 1),
                ConstructMatch::lastArgument, diagnostics);

        assertThat(result).isEqualTo("a \\textbf{b");
        assertThat(diagnostics).hasSize(1);
    }

    @Test
    void commandPatternRequiresFullControlWord() {
        CommandPattern label = CommandPattern.of("label", 1);

        assertThat(label.find("\\labelsep{x} \\label{y}", 0))
                .hasValueSatisfying(match -> assertThat(match.lastArgument()).isEqualTo("y"));
    }

    @Test
    void starredCommandReportsStarInName() {
        assertThat(ConstructCatalogue.RESIZEBOX.matchAt("\\resizebox*{1}{2}{c}", 0))
                .hasValueSatisfying(match -> {
                    assertThat(match.name()).isEqualTo("resizebox*");
                    assertThat(match.arguments()).containsExactly("", "1", "2", "c");
                });
    }
}
