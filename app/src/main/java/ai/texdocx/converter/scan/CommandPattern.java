package ai.texdocx.converter.scan;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Matches a control sequence followed by its brace-grouped arguments, e.g. {@code \multicolumn{2}{c}{text}}.
 */
public final class CommandPattern implements ConstructPattern {

    private final String name;
    private final int requiredArguments;
    private final boolean optionalArgument;
    private final boolean starred;

    private CommandPattern(String name, int requiredArguments, boolean optionalArgument, boolean starred) {
        if (name.isEmpty() || name.startsWith("\\")) {
            throw new IllegalArgumentException("Command name must be given without backslash: " + name);
        }
        if (requiredArguments < 0) {
            throw new IllegalArgumentException("requiredArguments must not be negative");
        }
        this.name = name;
        this.requiredArguments = requiredArguments;
        this.optionalArgument = optionalArgument;
        this.starred = starred;
    }

    public static CommandPattern of(String name, int requiredArguments) {
        return new CommandPattern(name, requiredArguments, false, false);
    }

    /**
     * Command whose first argument list entry is an optional bracketed argument ({@code ""} when absent).
     */
    public static CommandPattern withOptional(String name, int requiredArguments) {
        return new CommandPattern(name, requiredArguments, true, false);
    }

    /**
     * Command accepting a trailing {@code *} variant; the star is reported in {@link ConstructMatch#name()}.
     */
    public static CommandPattern starred(String name, int requiredArguments) {
        return new CommandPattern(name, requiredArguments, true, true);
    }

    public String name() {
        return name;
    }

    @Override
    public ConstructKind kind() {
        return ConstructKind.COMMAND;
    }

    @Override
    public Optional<ConstructMatch> find(CharSequence text, int from) {
        String source = text.toString();
        String token = "\\" + name;
        int cursor = from;
        while (true) {
            int start = source.indexOf(token, cursor);
            if (start < 0) {
                return Optional.empty();
            }
            Optional<ConstructMatch> match = matchAt(source, start);
            if (match.isPresent()) {
                return match;
            }
            cursor = start + token.length();
        }
    }

    /**
     * Matches the command only if it starts exactly at {@code index}.
     */
    public Optional<ConstructMatch> matchAt(CharSequence text, int index) {
        String source = text.toString();
        String token = "\\" + name;
        if (!source.startsWith(token, index) || BraceMatcher.isEscaped(source, index)) {
            return Optional.empty();
        }
        int cursor = index + token.length();
        if (cursor < source.length() && Character.isLetter(source.charAt(cursor))) {
            return Optional.empty();
        }
        String matchedName = name;
        if (starred && cursor < source.length() && source.charAt(cursor) == '*') {
            matchedName = name + "*";
            cursor++;
        }
        int openingEnd = cursor;

        List<String> arguments = new ArrayList<>(requiredArguments + 1);
        if (optionalArgument) {
            int candidate = BraceMatcher.skipWhitespace(source, cursor);
            int bracketEnd = BraceMatcher.matchBracket(source, candidate);
            if (bracketEnd != BraceMatcher.NOT_FOUND) {
                arguments.add(source.substring(candidate + 1, bracketEnd - 1));
                cursor = bracketEnd;
            } else {
                arguments.add("");
            }
        }
        for (int i = 0; i < requiredArguments; i++) {
            int groupOpen = BraceMatcher.skipWhitespace(source, cursor);
            int groupEnd = BraceMatcher.matchBrace(source, groupOpen);
            if (groupEnd == BraceMatcher.NOT_FOUND) {
                return Optional.of(ConstructMatch.malformed(ConstructKind.COMMAND, matchedName, index, openingEnd));
            }
            arguments.add(source.substring(groupOpen + 1, groupEnd - 1));
            cursor = groupEnd;
        }
        return Optional.of(new ConstructMatch(ConstructKind.COMMAND, matchedName, index, cursor, arguments, true));
    }

    @Override
    public String toString() {
        return "command \\" + name;
    }
}
