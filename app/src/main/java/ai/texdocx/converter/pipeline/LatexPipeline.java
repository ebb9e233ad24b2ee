package ai.texdocx.converter.pipeline;

import ai.texdocx.converter.math.EquationExtractor;
import ai.texdocx.converter.math.ExtractionResult;
import ai.texdocx.converter.rewrite.StructuralRewriter;
import ai.texdocx.converter.scan.Diagnostic;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

public class LatexPipeline implements SourcePipeline {

    private final SourcePreprocessor preprocessor;
    private final EquationExtractor extractor;
    private final StructuralRewriter rewriter;

    public LatexPipeline() {
        this(new SourcePreprocessor(), EquationExtractor.forLatex(), new StructuralRewriter());
    }

    public LatexPipeline(SourcePreprocessor preprocessor, EquationExtractor extractor, StructuralRewriter rewriter) {
        this.preprocessor = Objects.requireNonNull(preprocessor, "preprocessor");
        this.extractor = Objects.requireNonNull(extractor, "extractor");
        this.rewriter = Objects.requireNonNull(rewriter, "rewriter");
    }

    @Override
    public PreparedDocument prepare(String source) {
        List<Diagnostic> diagnostics = new ArrayList<>();
        String body = preprocessor.prepare(source);
        String reduced = rewriter.reduceBeforeExtraction(body, diagnostics);
        ExtractionResult extraction = extractor.extract(reduced);
        diagnostics.addAll(extraction.diagnostics());
        String intermediate = rewriter.rewrite(extraction.text(), diagnostics);
        return new PreparedDocument(intermediate, extraction.records(), diagnostics);
    }
}
