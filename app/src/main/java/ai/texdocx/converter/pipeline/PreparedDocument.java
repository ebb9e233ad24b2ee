package ai.texdocx.converter.pipeline;

import ai.texdocx.converter.math.EquationMode;
import ai.texdocx.converter.math.EquationRecord;
import ai.texdocx.converter.scan.Diagnostic;
import java.util.List;
import java.util.Objects;

/**
 * Intermediate lines with placeholders, ready for rendering and reinsertion.
 */
public record PreparedDocument(String intermediate, List<EquationRecord> records, List<Diagnostic> diagnostics) {

    public PreparedDocument {
        Objects.requireNonNull(intermediate, "intermediate");
        records = List.copyOf(Objects.requireNonNull(records, "records"));
        diagnostics = List.copyOf(Objects.requireNonNull(diagnostics, "diagnostics"));
    }

    public long count(EquationMode mode) {
        return records.stream().filter(record -> record.mode() == mode).count();
    }
}
