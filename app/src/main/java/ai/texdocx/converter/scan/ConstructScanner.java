package ai.texdocx.converter.scan;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs catalogue patterns over a text in priority order.
 *
 * <p>Each verified match is masked out of the working copy before the next pattern runs, so a lower priority pattern
 * can neither match inside nor across a span claimed earlier. Masking keeps offsets stable, which lets the final
 * result be ordered purely by start offset.
 */
public final class ConstructScanner {

    private static final Logger LOGGER = LoggerFactory.getLogger(ConstructScanner.class);

    /**
     * Fills claimed spans; part of the reserved private-use range stripped from all input.
     */
    public static final char MASK = '\uE0FF';

    public ScanResult scan(String text, List<? extends ConstructPattern> patternsByPriority) {
        StringBuilder working = new StringBuilder(text);
        List<ConstructMatch> matches = new ArrayList<>();
        List<Diagnostic> diagnostics = new ArrayList<>();

        for (ConstructPattern pattern : patternsByPriority) {
            int cursor = 0;
            while (cursor < working.length()) {
                Optional<ConstructMatch> found = pattern.find(working, cursor);
                if (found.isEmpty()) {
                    break;
                }
                ConstructMatch match = found.get();
                if (match.closingVerified()) {
                    matches.add(match);
                    mask(working, match.start(), match.end());
                } else {
                    diagnostics.add(Diagnostic.unterminated(match));
                    LOGGER.warn("Unterminated {} at offset {}; leaving it in place", match.name(), match.start());
                }
                cursor = Math.max(match.end(), match.start() + 1);
            }
        }

        matches.sort(Comparator.comparingInt(ConstructMatch::start));
        return new ScanResult(matches, diagnostics);
    }

    /**
     * Replaces every verified match of {@code pattern}, scanning left to right. Malformed occurrences stay verbatim.
     */
    public static String replaceAll(String text, ConstructPattern pattern, Function<ConstructMatch, String> replacement) {
        return replaceAll(text, pattern, replacement, null);
    }

    public static String replaceAll(String text,
                                    ConstructPattern pattern,
                                    Function<ConstructMatch, String> replacement,
                                    List<Diagnostic> diagnostics) {
        StringBuilder output = new StringBuilder(text.length());
        int cursor = 0;
        while (cursor < text.length()) {
            Optional<ConstructMatch> found = pattern.find(text, cursor);
            if (found.isEmpty()) {
                break;
            }
            ConstructMatch match = found.get();
            output.append(text, cursor, match.start());
            if (match.closingVerified()) {
                output.append(replacement.apply(match));
            } else {
                output.append(text, match.start(), match.end());
                if (diagnostics != null) {
                    diagnostics.add(Diagnostic.unterminated(match));
                }
                LOGGER.debug("Skipping malformed {} at offset {}", match.name(), match.start());
            }
            cursor = Math.max(match.end(), match.start() + 1);
        }
        if (cursor < text.length()) {
            output.append(text, cursor, text.length());
        }
        return output.toString();
    }

    private static void mask(StringBuilder working, int start, int end) {
        for (int i = start; i < end; i++) {
            working.setCharAt(i, MASK);
        }
    }
}
