package ai.texdocx.converter.math;

import ai.texdocx.converter.scan.Diagnostic;
import java.util.List;
import java.util.Objects;

/**
 * Working text with placeholders plus the records they stand for, in source order.
 */
public record ExtractionResult(String text, List<EquationRecord> records, List<Diagnostic> diagnostics) {

    public ExtractionResult {
        Objects.requireNonNull(text, "text");
        records = List.copyOf(Objects.requireNonNull(records, "records"));
        diagnostics = List.copyOf(Objects.requireNonNull(diagnostics, "diagnostics"));
    }

    public List<EquationRecord> recordsOf(EquationMode mode) {
        return records.stream().filter(record -> record.mode() == mode).toList();
    }

    public long count(EquationMode mode) {
        return records.stream().filter(record -> record.mode() == mode).count();
    }
}
