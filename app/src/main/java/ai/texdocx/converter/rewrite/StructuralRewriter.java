package ai.texdocx.converter.rewrite;

import ai.texdocx.converter.document.ListKind;
import ai.texdocx.converter.math.EquationMode;
import ai.texdocx.converter.math.PlaceholderToken;
import ai.texdocx.converter.scan.BraceMatcher;
import ai.texdocx.converter.scan.CommandPattern;
import ai.texdocx.converter.scan.ConstructCatalogue;
import ai.texdocx.converter.scan.ConstructMatch;
import ai.texdocx.converter.scan.ConstructPattern;
import ai.texdocx.converter.scan.ConstructScanner;
import ai.texdocx.converter.scan.Diagnostic;
import ai.texdocx.converter.scan.EnvironmentPattern;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns the document markup that remains after equation extraction into the line oriented form described by
 * {@link IntermediateMarkup}.
 *
 * <p>The steps run in a fixed order and each one is total: input without the construct a step handles passes through
 * unchanged. Running the rewriter on its own output changes nothing.
 */
public class StructuralRewriter {

    private static final Logger LOGGER = LoggerFactory.getLogger(StructuralRewriter.class);

    private static final Map<CommandPattern, Integer> HEADINGS = headings();
    private static final EnvironmentPattern ENUMERATE = EnvironmentPattern.withOptionalArgument("enumerate");
    private static final EnvironmentPattern DESCRIPTION = EnvironmentPattern.withOptionalArgument("description");
    private static final String ITEM = "\\item";

    private static final List<CommandPattern> REFERENCES = List.of(
            CommandPattern.of("ref", 1), CommandPattern.of("eqref", 1), CommandPattern.of("autoref", 1),
            CommandPattern.of("cref", 1), CommandPattern.of("Cref", 1), CommandPattern.of("pageref", 1));
    private static final CommandPattern FIGURE_REFERENCE = CommandPattern.of("reffig", 1);
    private static final CommandPattern EQUATION_REFERENCE = CommandPattern.of("refeqn", 1);
    private static final List<CommandPattern> CITATIONS = List.of(
            CommandPattern.withOptional("cite", 1), CommandPattern.withOptional("citep", 1),
            CommandPattern.withOptional("citet", 1));

    private static final List<CommandPattern> FORMATTING = Arrays.stream(new String[] {
            "textbf", "textit", "texttt", "textrm", "textsf", "textsc", "emph", "underline", "text",
            "mathrm", "mathbf", "mathcal", "mathbb", "url"})
            .map(name -> CommandPattern.of(name, 1))
            .toList();
    private static final CommandPattern HREF = CommandPattern.of("href", 2);
    private static final CommandPattern FOOTNOTE = CommandPattern.withOptional("footnote", 1);
    private static final CommandPattern TEXT_SUBSCRIPT = CommandPattern.of("textsubscript", 1);
    private static final CommandPattern TEXT_SUPERSCRIPT = CommandPattern.of("textsuperscript", 1);

    private static final Pattern LAYOUT_COMMANDS = Pattern.compile(
            "\\\\(?:maketitle|centering|noindent|newpage|clearpage|tableofcontents|hfill|medskip|smallskip|bigskip"
                    + "|tiny|scriptsize|footnotesize|small|normalsize|large|Large|LARGE|huge|Huge)"
                    + "(?![A-Za-z])");
    private static final List<CommandPattern> LAYOUT_WITH_ARGUMENTS = List.of(
            CommandPattern.starred("vspace", 1), CommandPattern.starred("hspace", 1),
            CommandPattern.of("bibliographystyle", 1), CommandPattern.of("bibliography", 1),
            CommandPattern.withOptional("includegraphics", 1));

    private static final Pattern LINE_BREAK = Pattern.compile(
            "(?<!\\\\)\\\\\\\\\\*?(?:[ \\t]*\\[[^\\]\\n]*\\])?|\\\\newline(?![A-Za-z])|\\\\linebreak(?![A-Za-z])(?:\\[\\d\\])?");
    private static final Pattern ENVIRONMENT_DELIMITER = Pattern.compile(
            "\\\\begin\\s*\\{[^}]*\\}(?:\\[[^\\]\\n]*\\])?|\\\\end\\s*\\{[^}]*\\}");
    private static final Pattern ESCAPED_SPECIAL = Pattern.compile("\\\\([%&_#${}])");
    private static final Pattern EXCESS_BLANK_LINES = Pattern.compile("\\n{3,}");

    private static Map<CommandPattern, Integer> headings() {
        Map<CommandPattern, Integer> levels = new LinkedHashMap<>();
        levels.put(CommandPattern.starred("part", 1), 1);
        levels.put(CommandPattern.starred("chapter", 1), 1);
        levels.put(CommandPattern.starred("section", 1), 1);
        levels.put(CommandPattern.starred("subsection", 1), 2);
        levels.put(CommandPattern.starred("subsubsection", 1), 3);
        levels.put(CommandPattern.starred("paragraph", 1), 4);
        return levels;
    }

    /**
     * The steps that discard content. They run before equation extraction as well, so no placeholder is ever dropped
     * together with the construct around it.
     */
    public String reduceBeforeExtraction(String text) {
        return reduceBeforeExtraction(text, new ArrayList<>());
    }

    public String reduceBeforeExtraction(String text, List<Diagnostic> diagnostics) {
        String result = WrapperCommands.collapseDualStrings(text);
        return reduceFigures(result, diagnostics);
    }

    public String rewrite(String text) {
        return rewrite(text, new ArrayList<>());
    }

    public String rewrite(String text, List<Diagnostic> diagnostics) {
        String result = WrapperCommands.collapseDualStrings(text);
        result = WrapperCommands.collapseSizeWrappers(result);
        result = reduceFigures(result, diagnostics);
        result = reduceTables(result, diagnostics);
        result = rewriteAbstract(result, diagnostics);
        result = rewriteLists(result, 0, diagnostics);
        result = rewriteHeadings(result, diagnostics);
        result = rewriteReferences(result, diagnostics);
        result = collapseFormatting(result, diagnostics);
        result = convertLineBreaks(result);
        result = cleanUp(result);
        LOGGER.debug("Rewrote document into {} intermediate lines", result.lines().count());
        return result;
    }

    String reduceFigures(String text, List<Diagnostic> diagnostics) {
        return ConstructScanner.replaceAll(text, ConstructCatalogue.FIGURES, figure -> {
            String body = figure.lastArgument();
            List<String> lines = new ArrayList<>();
            firstLabel(body).ifPresent(label -> lines.add("[Figure: " + label + "]"));
            caption(body).ifPresent(caption -> lines.add("[" + caption + "]"));
            if (lines.isEmpty()) {
                return block("[Figure omitted]");
            }
            return block(String.join("\n\n", lines));
        }, diagnostics);
    }

    String reduceTables(String text, List<Diagnostic> diagnostics) {
        String result = ConstructScanner.replaceAll(text, ConstructCatalogue.TABLE_FLOATS, table -> {
            String body = table.lastArgument();
            List<String> lines = new ArrayList<>();
            firstLabel(body).ifPresent(label -> lines.add("[Table: " + label + "]"));
            caption(body).ifPresent(caption -> lines.add("[" + caption + "]"));
            String header = lines.isEmpty() ? "\n" : block(String.join("\n\n", lines));
            return header + floatRemainder(body, diagnostics) + "\n\n";
        }, diagnostics);
        result = ConstructScanner.replaceAll(result, ConstructCatalogue.TABULARS, this::region, diagnostics);
        return ConstructScanner.replaceAll(result, ConstructCatalogue.WIDE_TABULARS, this::region, diagnostics);
    }

    /**
     * Everything in a table float besides its first caption stays in place, so notes and equations around the tabular
     * keep their placeholders. Later captions become caption lines of their own.
     */
    private String floatRemainder(String body, List<Diagnostic> diagnostics) {
        boolean[] first = {true};
        return ConstructScanner.replaceAll(body, ConstructCatalogue.CAPTION, caption -> {
            if (first[0]) {
                first[0] = false;
                return "\n";
            }
            String text = caption.lastArgument().replaceAll("\\s*\\n\\s*", " ").strip();
            return text.isEmpty() ? "\n" : block("[" + text + "]");
        }, diagnostics);
    }

    private String region(ConstructMatch tabular) {
        return block(IntermediateMarkup.TABLE_START + "\n" + tabular.lastArgument().strip() + "\n"
                + IntermediateMarkup.TABLE_END);
    }

    String rewriteAbstract(String text, List<Diagnostic> diagnostics) {
        return ConstructScanner.replaceAll(text, ConstructCatalogue.ABSTRACT,
                match -> block(IntermediateMarkup.heading(2, "Abstract")) + match.lastArgument().strip() + "\n\n",
                diagnostics);
    }

    String rewriteLists(String text, int level, List<Diagnostic> diagnostics) {
        return ConstructScanner.replaceAll(text, ConstructCatalogue.LISTS, list -> {
            ListKind kind = ENUMERATE.names().contains(list.name()) ? ListKind.NUMBERED : ListKind.BULLET;
            boolean description = DESCRIPTION.names().contains(list.name());
            String body = rewriteLists(list.lastArgument(), level + 1, diagnostics);
            List<String> lines = new ArrayList<>();
            for (String item : splitItems(body)) {
                appendItem(lines, kind, level, description, item);
            }
            return lines.isEmpty() ? "\n" : block(String.join("\n", lines));
        }, diagnostics);
    }

    private void appendItem(List<String> lines, ListKind kind, int level, boolean description, String item) {
        String content = item;
        String term = "";
        int bracket = BraceMatcher.skipWhitespace(content, 0);
        if (bracket < content.length() && content.charAt(bracket) == '[') {
            int bracketEnd = BraceMatcher.matchBracket(content, bracket);
            if (bracketEnd != BraceMatcher.NOT_FOUND) {
                term = content.substring(bracket + 1, bracketEnd - 1).strip();
                content = content.substring(bracketEnd);
            }
        }

        List<String> itemText = new ArrayList<>();
        List<String> trailing = new ArrayList<>();
        boolean itemClosed = false;
        boolean inTable = false;
        for (String line : content.split("\n", -1)) {
            String stripped = line.strip();
            if (inTable || IntermediateMarkup.isStructural(stripped) || isDisplayPlaceholder(stripped)) {
                itemClosed = true;
                inTable = IntermediateMarkup.isTableStart(stripped) || (inTable && !IntermediateMarkup.isTableEnd(stripped));
                trailing.add(stripped);
            } else if (!itemClosed) {
                if (!stripped.isEmpty()) {
                    itemText.add(stripped);
                }
            } else {
                trailing.add(stripped);
            }
        }

        String prefix = term.isEmpty() ? "" : (description ? term + ": " : term + " ");
        String text = prefix + String.join(" ", itemText);
        if (!text.isBlank()) {
            lines.add(IntermediateMarkup.listItem(kind, level, text));
        }
        lines.addAll(trailing);
    }

    private static boolean isDisplayPlaceholder(String line) {
        return PlaceholderToken.parse(line).filter(token -> token.mode() == EquationMode.DISPLAY).isPresent();
    }

    /**
     * Splits a list body on {@code \item} at brace depth zero. Text before the first item is dropped.
     */
    List<String> splitItems(String body) {
        List<String> items = new ArrayList<>();
        int depth = 0;
        int itemStart = -1;
        for (int index = 0; index < body.length(); index++) {
            char ch = body.charAt(index);
            if ((ch == '{' || ch == '}') && !BraceMatcher.isEscaped(body, index)) {
                depth = ch == '{' ? depth + 1 : Math.max(0, depth - 1);
                continue;
            }
            if (depth == 0 && ch == '\\' && isItemAt(body, index)) {
                if (itemStart >= 0) {
                    items.add(body.substring(itemStart, index));
                }
                itemStart = index + ITEM.length();
                index = itemStart - 1;
            }
        }
        if (itemStart >= 0) {
            items.add(body.substring(itemStart));
        }
        return items;
    }

    private static boolean isItemAt(String body, int index) {
        if (!body.startsWith(ITEM, index) || BraceMatcher.isEscaped(body, index)) {
            return false;
        }
        int after = index + ITEM.length();
        return after >= body.length() || !Character.isLetter(body.charAt(after));
    }

    String rewriteHeadings(String text, List<Diagnostic> diagnostics) {
        String result = text;
        for (Map.Entry<CommandPattern, Integer> heading : HEADINGS.entrySet()) {
            int level = heading.getValue();
            result = ConstructScanner.replaceAll(result, heading.getKey(),
                    match -> block(IntermediateMarkup.heading(level, match.lastArgument())), diagnostics);
        }
        return result;
    }

    String rewriteReferences(String text, List<Diagnostic> diagnostics) {
        String result = ConstructScanner.replaceAll(text, ConstructCatalogue.LABEL, match -> "", diagnostics);
        for (CommandPattern reference : REFERENCES) {
            result = ConstructScanner.replaceAll(result, reference, match -> "[" + match.lastArgument().strip() + "]",
                    diagnostics);
        }
        result = ConstructScanner.replaceAll(result, FIGURE_REFERENCE, match -> "Fig.", diagnostics);
        result = ConstructScanner.replaceAll(result, EQUATION_REFERENCE, match -> "Eq.", diagnostics);
        for (CommandPattern citation : CITATIONS) {
            result = ConstructScanner.replaceAll(result, citation, StructuralRewriter::citationKeys, diagnostics);
        }
        return result;
    }

    private static String citationKeys(ConstructMatch citation) {
        String keys = Arrays.stream(citation.lastArgument().split(","))
                .map(String::strip)
                .filter(key -> !key.isEmpty())
                .collect(Collectors.joining(", "));
        return "[" + keys + "]";
    }

    String collapseFormatting(String text, List<Diagnostic> diagnostics) {
        return WrapperCommands.untilStable(text, current -> {
            String result = current;
            for (CommandPattern formatting : FORMATTING) {
                result = ConstructScanner.replaceAll(result, formatting, ConstructMatch::lastArgument, diagnostics);
            }
            result = ConstructScanner.replaceAll(result, HREF, ConstructMatch::lastArgument, diagnostics);
            result = ConstructScanner.replaceAll(result, TEXT_SUBSCRIPT,
                    match -> IntermediateMarkup.subscript(match.lastArgument()), diagnostics);
            result = ConstructScanner.replaceAll(result, TEXT_SUPERSCRIPT,
                    match -> IntermediateMarkup.superscript(match.lastArgument()), diagnostics);
            result = ConstructScanner.replaceAll(result, FOOTNOTE,
                    match -> " (" + match.lastArgument().replaceAll("\\s+", " ").strip() + ")", diagnostics);
            result = LAYOUT_COMMANDS.matcher(result).replaceAll("");
            for (CommandPattern layout : LAYOUT_WITH_ARGUMENTS) {
                result = ConstructScanner.replaceAll(result, layout, match -> "", diagnostics);
            }
            return result;
        });
    }

    /**
     * Explicit line breaks end the current paragraph, except inside table regions where they separate rows and inside
     * heading or list lines which must stay on one line.
     */
    String convertLineBreaks(String text) {
        return mapOutsideTables(text, line -> {
            if (IntermediateMarkup.isStructural(line)) {
                return LINE_BREAK.matcher(line).replaceAll(" ");
            }
            return LINE_BREAK.matcher(line).replaceAll("\n\n");
        });
    }

    String cleanUp(String text) {
        String result = mapOutsideTables(text, line -> {
            String cleaned = ENVIRONMENT_DELIMITER.matcher(line.replace('~', ' ')).replaceAll("");
            return ESCAPED_SPECIAL.matcher(cleaned).replaceAll("$1");
        });
        String trimmed = result.lines().map(String::strip).collect(Collectors.joining("\n"));
        return EXCESS_BLANK_LINES.matcher(trimmed).replaceAll("\n\n").strip();
    }

    private static String mapOutsideTables(String text, Function<String, String> mapper) {
        StringBuilder output = new StringBuilder(text.length());
        boolean inTable = false;
        String[] lines = text.split("\n", -1);
        for (int i = 0; i < lines.length; i++) {
            String line = lines[i];
            if (IntermediateMarkup.isTableStart(line)) {
                inTable = true;
                output.append(line);
            } else if (IntermediateMarkup.isTableEnd(line)) {
                inTable = false;
                output.append(line);
            } else {
                output.append(inTable ? line : mapper.apply(line));
            }
            if (i < lines.length - 1) {
                output.append('\n');
            }
        }
        return output.toString();
    }

    private static Optional<String> firstLabel(String body) {
        return firstMatch(body, ConstructCatalogue.LABEL).map(match -> match.lastArgument().strip())
                .filter(label -> !label.isEmpty());
    }

    private static Optional<String> caption(String body) {
        return firstMatch(body, ConstructCatalogue.CAPTION)
                .map(match -> match.lastArgument().replaceAll("\\s*\\n\\s*", " ").strip())
                .filter(caption -> !caption.isEmpty());
    }

    private static Optional<ConstructMatch> firstMatch(String body, ConstructPattern pattern) {
        int cursor = 0;
        while (cursor < body.length()) {
            Optional<ConstructMatch> found = pattern.find(body, cursor);
            if (found.isEmpty() || found.get().closingVerified()) {
                return found;
            }
            cursor = found.get().end();
        }
        return Optional.empty();
    }

    private static String block(String content) {
        return "\n\n" + content + "\n\n";
    }
}
