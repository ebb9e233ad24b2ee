package ai.texdocx.converter.pipeline;

/**
 * Turns source text of one dialect into a {@link PreparedDocument}.
 */
public interface SourcePipeline {

    PreparedDocument prepare(String source);
}
