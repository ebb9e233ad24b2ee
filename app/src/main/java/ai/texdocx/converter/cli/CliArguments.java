package ai.texdocx.converter.cli;

import ai.texdocx.converter.config.LogFormat;
import ai.texdocx.converter.pipeline.SourceFormat;
import ai.texdocx.converter.render.RendererMode;
import java.nio.file.Path;
import picocli.CommandLine;

@CommandLine.Command(name = "tex-docx-converter", mixinStandardHelpOptions = true,
        description = "Converts LaTeX or Markdown documents with math into Word documents")
public class CliArguments {

    @CommandLine.Parameters(index = "0", paramLabel = "INPUT", description = "Source file (.tex, .md or .markdown)")
    private Path input;

    @CommandLine.Option(names = {"-o", "--output"}, description = "Output .docx file (default: <input name>.docx)", paramLabel = "FILE")
    private Path output;

    @CommandLine.Option(names = "--format", description = "Source format: latex or markdown", converter = SourceFormatConverter.class)
    private SourceFormat sourceFormat;

    @CommandLine.Option(names = "--renderer", description = "Formula renderer: texmath, literal or none", converter = RendererModeConverter.class)
    private RendererMode rendererMode;

    @CommandLine.Option(names = "--texmath", description = "Path of the texmath executable", paramLabel = "PATH")
    private String texmathExecutable;

    @CommandLine.Option(names = "--timeout", description = "Per-formula render timeout", paramLabel = "SECONDS")
    private Integer timeoutSeconds;

    @CommandLine.Option(names = "--parallelism", description = "Number of formulas rendered concurrently", paramLabel = "N")
    private Integer parallelism;

    @CommandLine.Option(names = "--log-format", description = "Log format: text or json", converter = LogFormatConverter.class)
    private LogFormat logFormat;

    @CommandLine.Option(names = {"-v", "--verbose"}, description = "Log per-formula details")
    private boolean verbose;

    public Path input() {
        return input;
    }

    public Path output() {
        return output;
    }

    public SourceFormat sourceFormat() {
        return sourceFormat;
    }

    public RendererMode rendererMode() {
        return rendererMode;
    }

    public String texmathExecutable() {
        return texmathExecutable;
    }

    public Integer timeoutSeconds() {
        return timeoutSeconds;
    }

    public Integer parallelism() {
        return parallelism;
    }

    public LogFormat logFormat() {
        return logFormat;
    }

    public boolean verbose() {
        return verbose;
    }
}
