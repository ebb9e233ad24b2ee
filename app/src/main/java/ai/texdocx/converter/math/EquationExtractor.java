package ai.texdocx.converter.math;

import ai.texdocx.converter.rewrite.WrapperCommands;
import ai.texdocx.converter.scan.ConstructCatalogue;
import ai.texdocx.converter.scan.ConstructKind;
import ai.texdocx.converter.scan.ConstructMatch;
import ai.texdocx.converter.scan.ConstructPattern;
import ai.texdocx.converter.scan.ConstructScanner;
import ai.texdocx.converter.scan.ScanResult;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Pulls equations out of a document and leaves numbered placeholders in their place.
 *
 * <p>Records are numbered in the order their placeholders appear in the returned text, which is what allows the
 * reinsertion pass to consume rendered formulas sequentially. Display placeholders always sit on a line of their own.
 */
public class EquationExtractor {

    private static final Logger LOGGER = LoggerFactory.getLogger(EquationExtractor.class);
    private static final Pattern NUMBERING_SUPPRESSION = Pattern.compile("\\\\(?:nonumber|notag)(?![A-Za-z])");
    private static final String LABEL_SEPARATOR = ", ";

    private final List<ConstructPattern> catalogue;
    private final ConstructScanner scanner;

    public EquationExtractor(List<ConstructPattern> catalogue) {
        this.catalogue = List.copyOf(Objects.requireNonNull(catalogue, "catalogue"));
        this.scanner = new ConstructScanner();
    }

    public static EquationExtractor forLatex() {
        return new EquationExtractor(ConstructCatalogue.latexMath());
    }

    public static EquationExtractor forMarkdown() {
        return new EquationExtractor(ConstructCatalogue.markdownMath());
    }

    public ExtractionResult extract(String text) {
        ScanResult scan = scanner.scan(text, catalogue);
        StringBuilder output = new StringBuilder(text.length());
        List<EquationRecord> records = new ArrayList<>();
        int cursor = 0;
        for (ConstructMatch match : scan.matches()) {
            output.append(text, cursor, match.start());
            cursor = match.end();

            List<String> labels = new ArrayList<>();
            String formula = toFormula(match, labels);
            if (formula.isBlank()) {
                LOGGER.debug("Dropping empty {} at offset {}", match.name(), match.start());
                continue;
            }
            EquationMode mode = match.kind() == ConstructKind.INLINE_MATH ? EquationMode.INLINE : EquationMode.DISPLAY;
            Optional<String> label = labels.isEmpty() ? Optional.empty() : Optional.of(String.join(LABEL_SEPARATOR, labels));
            EquationRecord record = new EquationRecord(formula, mode, label, records.size());
            records.add(record);

            if (mode == EquationMode.DISPLAY) {
                output.append('\n').append(record.placeholder().text()).append('\n');
            } else {
                output.append(record.placeholder().text());
            }
        }
        output.append(text, cursor, text.length());

        LOGGER.debug("Extracted {} equations ({} malformed constructs left in place)",
                records.size(), scan.diagnostics().size());
        return new ExtractionResult(output.toString(), records, scan.diagnostics());
    }

    private String toFormula(ConstructMatch match, List<String> labels) {
        String body = ConstructScanner.replaceAll(match.lastArgument(), ConstructCatalogue.LABEL, label -> {
            String key = label.argument(0).trim();
            if (!key.isEmpty()) {
                labels.add(key);
            }
            return "";
        });
        body = NUMBERING_SUPPRESSION.matcher(body).replaceAll("");
        body = WrapperCommands.collapseSizeWrappers(body).trim();
        String wrapper = ConstructCatalogue.ALIGNMENT_WRAPPERS.get(match.name());
        if (wrapper == null || body.isEmpty()) {
            return body;
        }
        return "\\begin{" + wrapper + "}" + body + "\\end{" + wrapper + "}";
    }
}
