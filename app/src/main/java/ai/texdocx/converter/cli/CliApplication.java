package ai.texdocx.converter.cli;

import ai.texdocx.converter.config.Config;
import ai.texdocx.converter.config.ConfigLoader;
import ai.texdocx.converter.config.RendererConfig;
import ai.texdocx.converter.config.SystemEnvironmentReader;
import ai.texdocx.converter.logging.LoggingConfigurator;
import ai.texdocx.converter.pipeline.ConversionException;
import ai.texdocx.converter.pipeline.ConversionReport;
import ai.texdocx.converter.pipeline.ConversionService;
import ai.texdocx.converter.render.FormulaRenderer;
import ai.texdocx.converter.render.LiteralRenderer;
import ai.texdocx.converter.render.NoopRenderer;
import ai.texdocx.converter.render.RenderService;
import ai.texdocx.converter.render.RendererFactory;
import ai.texdocx.converter.render.TexmathRenderer;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

/**
 * Entry point wiring the command-line parser, configuration loader and conversion service.
 */
public final class CliApplication {

    private static final Logger LOGGER = LoggerFactory.getLogger(CliApplication.class);

    static final int EXIT_CONVERSION_FAILED = 1;

    private final ConfigLoader configLoader;
    private final Function<Config, ConversionService> serviceFactory;

    public CliApplication() {
        this(new ConfigLoader(new SystemEnvironmentReader()), CliApplication::createConversionService);
    }

    CliApplication(ConfigLoader configLoader, Function<Config, ConversionService> serviceFactory) {
        this.configLoader = configLoader;
        this.serviceFactory = serviceFactory;
    }

    public static void main(String[] args) {
        System.exit(new CliApplication().run(args));
    }

    public int run(String[] args) {
        CliArguments cliArguments = new CliArguments();
        CommandLine commandLine = new CommandLine(cliArguments);

        try {
            commandLine.parseArgs(args);
        } catch (CommandLine.ParameterException ex) {
            commandLine.getErr().println(ex.getMessage());
            commandLine.usage(commandLine.getErr());
            return commandLine.getCommandSpec().exitCodeOnInvalidInput();
        }

        if (commandLine.isUsageHelpRequested()) {
            commandLine.usage(commandLine.getOut());
            return commandLine.getCommandSpec().exitCodeOnUsageHelp();
        }
        if (commandLine.isVersionHelpRequested()) {
            commandLine.printVersionHelp(commandLine.getOut());
            return commandLine.getCommandSpec().exitCodeOnVersionHelp();
        }

        Config config;
        try {
            config = configLoader.load(cliArguments);
        } catch (IllegalArgumentException ex) {
            commandLine.getErr().println(ex.getMessage());
            return commandLine.getCommandSpec().exitCodeOnInvalidInput();
        }
        LoggingConfigurator.configure(config.logFormat(), config.verbose());
        LOGGER.info("Rendering formulas with {} (timeout={}s, parallelism={})", config.renderer().mode(),
                config.renderer().timeout().toSeconds(), config.renderer().parallelism());

        try {
            ConversionReport report = serviceFactory.apply(config).convert(config);
            LOGGER.info("Converted {} equations ({} display, {} inline): {} rendered, {} failed; output {}",
                    report.totalEquations(), report.displayEquations(), report.inlineEquations(),
                    report.rendered(), report.failed(), report.output());
            if (report.diagnostics() > 0) {
                LOGGER.warn("{} malformed constructs were left unconverted", report.diagnostics());
            }
            return 0;
        } catch (ConversionException ex) {
            LOGGER.error("Conversion failed: {}", ex.getMessage(), ex);
            commandLine.getErr().println(ex.getMessage());
            return EXIT_CONVERSION_FAILED;
        }
    }

    static ConversionService createConversionService(Config config) {
        RendererConfig renderer = config.renderer();
        FormulaRenderer texmath = new TexmathRenderer(renderer.texmathExecutable(), renderer.timeout());
        RendererFactory factory = new RendererFactory(texmath, new LiteralRenderer(), new NoopRenderer());
        return new ConversionService(new RenderService(factory, renderer.parallelism()));
    }
}
