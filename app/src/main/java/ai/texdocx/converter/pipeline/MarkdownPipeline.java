package ai.texdocx.converter.pipeline;

import ai.texdocx.converter.math.EquationExtractor;
import ai.texdocx.converter.math.ExtractionResult;
import ai.texdocx.converter.rewrite.IntermediateMarkup;
import ai.texdocx.converter.rewrite.MarkdownRewriter;
import java.util.Objects;

public class MarkdownPipeline implements SourcePipeline {

    private final EquationExtractor extractor;
    private final MarkdownRewriter rewriter;

    public MarkdownPipeline() {
        this(EquationExtractor.forMarkdown(), new MarkdownRewriter());
    }

    public MarkdownPipeline(EquationExtractor extractor, MarkdownRewriter rewriter) {
        this.extractor = Objects.requireNonNull(extractor, "extractor");
        this.rewriter = Objects.requireNonNull(rewriter, "rewriter");
    }

    @Override
    public PreparedDocument prepare(String source) {
        String text = IntermediateMarkup.stripReserved(source.replace("\r\n", "\n").replace('\r', '\n'));
        ExtractionResult extraction = extractor.extract(text);
        return new PreparedDocument(rewriter.rewrite(extraction.text()), extraction.records(), extraction.diagnostics());
    }
}
