package ai.texdocx.converter.pipeline;

import ai.texdocx.converter.rewrite.IntermediateMarkup;
import ai.texdocx.converter.scan.BraceMatcher;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Prepares raw LaTeX source: strips comments, skips the preamble and drops anything after the end of the document.
 */
public class SourcePreprocessor {

    private static final String BODY_START = "\\begin{document}";
    private static final String BODY_END = "\\end{document}";
    private static final Pattern FIRST_SECTIONING = Pattern.compile("\\\\(?:part|chapter|section|subsection)\\*?\\s*[\\[{]");

    public String prepare(String source) {
        String text = IntermediateMarkup.stripReserved(source.replace("\r\n", "\n").replace('\r', '\n'));
        text = stripComments(text);
        return extractBody(text);
    }

    /**
     * Removes everything from an unescaped {@code %} to the end of its line, trims trailing whitespace and drops
     * trailing empty lines.
     */
    public String stripComments(String text) {
        List<String> lines = new ArrayList<>();
        for (String line : text.split("\n", -1)) {
            lines.add(stripLineComment(line).stripTrailing());
        }
        int last = lines.size();
        while (last > 0 && lines.get(last - 1).isEmpty()) {
            last--;
        }
        return String.join("\n", lines.subList(0, last));
    }

    private static String stripLineComment(String line) {
        int index = line.indexOf('%');
        while (index >= 0) {
            if (!BraceMatcher.isEscaped(line, index)) {
                return line.substring(0, index);
            }
            index = line.indexOf('%', index + 1);
        }
        return line;
    }

    /**
     * Text after {@code \begin{document}}, otherwise from the first sectioning command, otherwise everything. Content
     * after {@code \end{document}} is discarded.
     */
    public String extractBody(String text) {
        String body = text;
        int start = body.indexOf(BODY_START);
        if (start >= 0) {
            body = body.substring(start + BODY_START.length());
        } else {
            Matcher sectioning = FIRST_SECTIONING.matcher(body);
            if (sectioning.find()) {
                body = body.substring(sectioning.start());
            }
        }
        int end = body.indexOf(BODY_END);
        if (end >= 0) {
            body = body.substring(0, end);
        }
        return body.strip();
    }
}
