package ai.texdocx.converter.scan;

import java.util.List;
import java.util.Objects;

/**
 * A construct located by a {@link ConstructPattern}.
 *
 * <p>{@code start}/{@code end} are offsets into the text that was scanned. For environments the arguments are the
 * leading {@code \begin} arguments followed by the body; for delimiter math the single argument is the formula; for
 * commands they are the optional argument (empty when absent, only for patterns declaring one) followed by the
 * required groups. An unverified match only covers its opening token.
 */
public record ConstructMatch(ConstructKind kind,
                             String name,
                             int start,
                             int end,
                             List<String> arguments,
                             boolean closingVerified) {

    public ConstructMatch {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(name, "name");
        arguments = List.copyOf(Objects.requireNonNull(arguments, "arguments"));
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Invalid construct boundaries " + start + ".." + end);
        }
    }

    static ConstructMatch malformed(ConstructKind kind, String name, int start, int openingEnd) {
        return new ConstructMatch(kind, name, start, openingEnd, List.of(), false);
    }

    public String argument(int index) {
        return arguments.get(index);
    }

    /**
     * The last argument: an environment body, a delimited formula or a command's final group.
     */
    public String lastArgument() {
        return arguments.isEmpty() ? "" : arguments.get(arguments.size() - 1);
    }

    public int length() {
        return end - start;
    }
}
