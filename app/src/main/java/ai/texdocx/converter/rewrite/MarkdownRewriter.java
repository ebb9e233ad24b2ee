package ai.texdocx.converter.rewrite;

import ai.texdocx.converter.document.ListKind;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Maps the small Markdown subset the converter supports onto {@link IntermediateMarkup} lines.
 */
public class MarkdownRewriter {

    private static final Pattern HEADING = Pattern.compile("^(#{1,6})\\s+(.*?)\\s*#*\\s*$");
    private static final Pattern BULLET = Pattern.compile("^(\\s*)[-*+]\\s+(.*)$");
    private static final Pattern NUMBERED = Pattern.compile("^(\\s*)\\d+[.)]\\s+(.*)$");
    private static final int MAX_HEADING_LEVEL = 4;
    private static final int INDENT_WIDTH = 2;

    public String rewrite(String text) {
        List<String> output = new ArrayList<>();
        for (String line : text.split("\\R", -1)) {
            output.add(rewriteLine(line));
        }
        return String.join("\n", output).strip();
    }

    private String rewriteLine(String line) {
        if (IntermediateMarkup.isStructural(line)) {
            return line.strip();
        }
        Matcher heading = HEADING.matcher(line);
        if (heading.matches()) {
            int level = Math.min(heading.group(1).length(), MAX_HEADING_LEVEL);
            return IntermediateMarkup.heading(level, heading.group(2));
        }
        Matcher bullet = BULLET.matcher(line);
        if (bullet.matches()) {
            return IntermediateMarkup.listItem(ListKind.BULLET, level(bullet.group(1)), bullet.group(2));
        }
        Matcher numbered = NUMBERED.matcher(line);
        if (numbered.matches()) {
            return IntermediateMarkup.listItem(ListKind.NUMBERED, level(numbered.group(1)), numbered.group(2));
        }
        return line.strip();
    }

    private static int level(String indent) {
        int width = 0;
        for (char ch : indent.toCharArray()) {
            width += ch == '\t' ? INDENT_WIDTH * 2 : 1;
        }
        return width / INDENT_WIDTH;
    }
}
