package ai.texdocx.converter.config;

import ai.texdocx.converter.cli.CliArguments;
import ai.texdocx.converter.pipeline.SourceFormat;
import ai.texdocx.converter.render.RendererMode;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Builds a {@link Config} instance by combining CLI arguments with environment variables and defaults.
 */
public class ConfigLoader {

    static final String ENV_SOURCE_FORMAT = "SOURCE_FORMAT";
    static final String ENV_RENDERER_MODE = "RENDERER_MODE";
    static final String ENV_TEXMATH_PATH = "TEXMATH_PATH";
    static final String ENV_RENDER_TIMEOUT_SECONDS = "RENDER_TIMEOUT_SECONDS";
    static final String ENV_RENDER_PARALLELISM = "RENDER_PARALLELISM";
    static final String ENV_LOG_FORMAT = "LOG_FORMAT";
    static final String ENV_VERBOSE = "VERBOSE";

    private static final String DEFAULT_TEXMATH = "texmath";
    private static final int DEFAULT_RENDER_TIMEOUT_SECONDS = 5;
    private static final int DEFAULT_RENDER_PARALLELISM = 1;
    private static final String OUTPUT_EXTENSION = ".docx";

    private final EnvironmentReader environmentReader;
    private final Path workingDirectory;
    private final Path userHome;

    public ConfigLoader(EnvironmentReader environmentReader) {
        this(environmentReader, Path.of("").toAbsolutePath(), Path.of(System.getProperty("user.home")));
    }

    public ConfigLoader(EnvironmentReader environmentReader, Path workingDirectory, Path userHome) {
        this.environmentReader = Objects.requireNonNull(environmentReader, "environmentReader");
        this.workingDirectory = Objects.requireNonNull(workingDirectory, "workingDirectory");
        this.userHome = Objects.requireNonNull(userHome, "userHome");
    }

    public Config load(CliArguments arguments) {
        Objects.requireNonNull(arguments, "arguments");
        Path input = Optional.ofNullable(arguments.input())
                .orElseThrow(() -> new IllegalArgumentException("input file must be provided"));

        Path output = arguments.output() != null ? arguments.output() : defaultOutput(input);
        Optional<SourceFormat> sourceFormat = resolveSourceFormat(arguments, input);
        RendererMode rendererMode = resolveRendererMode(arguments);
        String texmath = firstNonBlank(arguments.texmathExecutable(), ENV_TEXMATH_PATH, defaultTexmath());
        int timeoutSeconds = resolvePositive(arguments.timeoutSeconds(), ENV_RENDER_TIMEOUT_SECONDS,
                DEFAULT_RENDER_TIMEOUT_SECONDS, "render timeout");
        int parallelism = resolvePositive(arguments.parallelism(), ENV_RENDER_PARALLELISM,
                DEFAULT_RENDER_PARALLELISM, "render parallelism");
        LogFormat logFormat = resolveLogFormat(arguments);
        boolean verbose = resolveVerbose(arguments);

        RendererConfig renderer = new RendererConfig(rendererMode, texmath, Duration.ofSeconds(timeoutSeconds), parallelism);
        return new Config(input, output, sourceFormat, renderer, logFormat, verbose);
    }

    private Path defaultOutput(Path input) {
        String fileName = input.getFileName() == null ? "output" : input.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        String stem = dot > 0 ? fileName.substring(0, dot) : fileName;
        return workingDirectory.resolve(stem + OUTPUT_EXTENSION);
    }

    private Optional<SourceFormat> resolveSourceFormat(CliArguments arguments, Path input) {
        if (arguments.sourceFormat() != null) {
            return Optional.of(arguments.sourceFormat());
        }
        return environmentReader.get(ENV_SOURCE_FORMAT)
                .filter(ConfigLoader::isNotBlank)
                .map(SourceFormat::from)
                .or(() -> SourceFormat.fromFileName(input));
    }

    private RendererMode resolveRendererMode(CliArguments arguments) {
        RendererMode cliMode = arguments.rendererMode();
        if (cliMode != null) {
            return cliMode;
        }
        return environmentReader.get(ENV_RENDERER_MODE)
                .filter(ConfigLoader::isNotBlank)
                .map(RendererMode::from)
                .orElse(RendererMode.TEXMATH);
    }

    private LogFormat resolveLogFormat(CliArguments arguments) {
        LogFormat cliFormat = arguments.logFormat();
        if (cliFormat != null) {
            return cliFormat;
        }
        return environmentReader.get(ENV_LOG_FORMAT)
                .filter(ConfigLoader::isNotBlank)
                .map(LogFormat::from)
                .orElse(LogFormat.TEXT);
    }

    private boolean resolveVerbose(CliArguments arguments) {
        if (arguments.verbose()) {
            return true;
        }
        return environmentReader.get(ENV_VERBOSE)
                .map(String::trim)
                .map(value -> value.equalsIgnoreCase("true") || value.equals("1"))
                .orElse(false);
    }

    private String defaultTexmath() {
        Path local = userHome.resolve(".local").resolve("bin").resolve(DEFAULT_TEXMATH);
        return Files.isRegularFile(local) ? local.toString() : DEFAULT_TEXMATH;
    }

    private int resolvePositive(Integer cliValue, String envKey, int defaultValue, String description) {
        if (cliValue != null) {
            return requirePositive(cliValue, description);
        }
        return environmentReader.get(envKey)
                .filter(ConfigLoader::isNotBlank)
                .map(String::trim)
                .map(raw -> parsePositiveInteger(raw, envKey))
                .orElse(defaultValue);
    }

    private String firstNonBlank(String cliValue, String envKey, String defaultValue) {
        if (isNotBlank(cliValue)) {
            return cliValue;
        }
        return environmentReader.get(envKey)
                .filter(ConfigLoader::isNotBlank)
                .orElse(defaultValue);
    }

    private static int requirePositive(int value, String description) {
        if (value < 1) {
            throw new IllegalArgumentException(description + " must be at least 1");
        }
        return value;
    }

    private static int parsePositiveInteger(String raw, String envKey) {
        try {
            return requirePositive(Integer.parseInt(raw), envKey);
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException(envKey + " must be an integer", ex);
        }
    }

    private static boolean isNotBlank(String value) {
        return value != null && !value.isBlank();
    }
}
