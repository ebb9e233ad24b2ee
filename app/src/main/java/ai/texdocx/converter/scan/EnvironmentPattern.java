package ai.texdocx.converter.scan;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Matches {@code \begin{name} ... \end{name}} for a set of environment names, pairing nested environments of the
 * same name.
 */
public final class EnvironmentPattern implements ConstructPattern {

    private static final String BEGIN = "\\begin";

    private final Set<String> names;
    private final ConstructKind kind;
    private final int leadingArguments;
    private final boolean optionalArguments;

    private EnvironmentPattern(Set<String> names, ConstructKind kind, int leadingArguments, boolean optionalArguments) {
        if (names.isEmpty()) {
            throw new IllegalArgumentException("At least one environment name is required");
        }
        this.names = Set.copyOf(names);
        this.kind = kind;
        this.leadingArguments = leadingArguments;
        this.optionalArguments = optionalArguments;
    }

    public static EnvironmentPattern of(ConstructKind kind, String... names) {
        return new EnvironmentPattern(Set.of(names), kind, 0, false);
    }

    /**
     * Environment whose {@code \begin} carries {@code leadingArguments} required groups, each optionally preceded by a
     * bracketed argument which is skipped.
     */
    public static EnvironmentPattern withArguments(int leadingArguments, String... names) {
        return new EnvironmentPattern(Set.of(names), ConstructKind.ENVIRONMENT, leadingArguments, true);
    }

    /**
     * Environment accepting one skipped bracketed argument right after {@code \begin{name}}.
     */
    public static EnvironmentPattern withOptionalArgument(String... names) {
        return new EnvironmentPattern(Set.of(names), ConstructKind.ENVIRONMENT, 0, true);
    }

    public Set<String> names() {
        return names;
    }

    @Override
    public ConstructKind kind() {
        return kind;
    }

    @Override
    public Optional<ConstructMatch> find(CharSequence text, int from) {
        String source = text.toString();
        int cursor = from;
        while (true) {
            int start = source.indexOf(BEGIN, cursor);
            if (start < 0) {
                return Optional.empty();
            }
            cursor = start + BEGIN.length();
            if (BraceMatcher.isEscaped(source, start)) {
                continue;
            }
            int nameOpen = BraceMatcher.skipWhitespace(source, cursor);
            int nameEnd = BraceMatcher.matchBrace(source, nameOpen);
            if (nameEnd == BraceMatcher.NOT_FOUND) {
                continue;
            }
            String name = source.substring(nameOpen + 1, nameEnd - 1).trim();
            if (!names.contains(name)) {
                continue;
            }
            return Optional.of(complete(source, start, nameEnd, name));
        }
    }

    private ConstructMatch complete(String source, int start, int openingEnd, String name) {
        List<String> arguments = new ArrayList<>(leadingArguments + 1);
        int bodyStart = openingEnd;
        if (optionalArguments && leadingArguments == 0) {
            bodyStart = skipOptional(source, bodyStart);
        }
        for (int i = 0; i < leadingArguments; i++) {
            int groupOpen = BraceMatcher.skipWhitespace(source, skipOptional(source, bodyStart));
            int groupEnd = BraceMatcher.matchBrace(source, groupOpen);
            if (groupEnd == BraceMatcher.NOT_FOUND) {
                return ConstructMatch.malformed(kind, name, start, openingEnd);
            }
            arguments.add(source.substring(groupOpen + 1, groupEnd - 1));
            bodyStart = groupEnd;
        }

        String beginToken = BEGIN + "{" + name + "}";
        String endToken = "\\end{" + name + "}";
        int depth = 1;
        int cursor = bodyStart;
        while (depth > 0) {
            int nextBegin = indexOfUnescaped(source, beginToken, cursor);
            int nextEnd = indexOfUnescaped(source, endToken, cursor);
            if (nextEnd < 0) {
                return ConstructMatch.malformed(kind, name, start, openingEnd);
            }
            if (nextBegin >= 0 && nextBegin < nextEnd) {
                depth++;
                cursor = nextBegin + beginToken.length();
            } else {
                depth--;
                if (depth == 0) {
                    arguments.add(source.substring(bodyStart, nextEnd));
                    return new ConstructMatch(kind, name, start, nextEnd + endToken.length(), arguments, true);
                }
                cursor = nextEnd + endToken.length();
            }
        }
        return ConstructMatch.malformed(kind, name, start, openingEnd);
    }

    private int skipOptional(String source, int index) {
        if (!optionalArguments) {
            return index;
        }
        int candidate = BraceMatcher.skipWhitespace(source, index);
        if (candidate < source.length() && source.charAt(candidate) == '[') {
            int end = BraceMatcher.matchBracket(source, candidate);
            if (end != BraceMatcher.NOT_FOUND) {
                return end;
            }
        }
        return index;
    }

    private static int indexOfUnescaped(String source, String token, int from) {
        int index = source.indexOf(token, from);
        while (index >= 0 && BraceMatcher.isEscaped(source, index)) {
            index = source.indexOf(token, index + 1);
        }
        return index;
    }

    @Override
    public String toString() {
        return "environment" + names;
    }
}
