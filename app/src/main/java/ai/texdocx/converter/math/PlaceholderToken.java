package ai.texdocx.converter.math;

import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * In-text stand-in for an extracted equation.
 *
 * <p>Tokens are built from private-use code points that are stripped from every input, so they cannot collide with
 * source text.
 */
public record PlaceholderToken(EquationMode mode, int sourceOrder) {

    public static final char OPEN = '\uE000';
    public static final char CLOSE = '\uE001';
    public static final Pattern PATTERN = Pattern.compile("\uE000([DI])(\\d+)\uE001");

    public PlaceholderToken {
        Objects.requireNonNull(mode, "mode");
    }

    public String text() {
        return String.valueOf(OPEN) + mode.code() + sourceOrder + CLOSE;
    }

    public static Optional<PlaceholderToken> parse(String candidate) {
        Matcher matcher = PATTERN.matcher(candidate.trim());
        if (!matcher.matches()) {
            return Optional.empty();
        }
        return Optional.of(fromMatch(matcher));
    }

    /**
     * Builds the token from a {@link #PATTERN} match.
     */
    public static PlaceholderToken fromMatch(Matcher matcher) {
        return new PlaceholderToken(EquationMode.fromCode(matcher.group(1).charAt(0)), Integer.parseInt(matcher.group(2)));
    }

    @Override
    public String toString() {
        return "{" + mode + "#" + sourceOrder + "}";
    }
}
