package ai.texdocx.converter.scan;

import java.util.List;
import java.util.Objects;

/**
 * Verified matches in document order plus the malformed constructs that were left in place.
 */
public record ScanResult(List<ConstructMatch> matches, List<Diagnostic> diagnostics) {

    public ScanResult {
        matches = List.copyOf(Objects.requireNonNull(matches, "matches"));
        diagnostics = List.copyOf(Objects.requireNonNull(diagnostics, "diagnostics"));
    }
}
