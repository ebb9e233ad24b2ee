package ai.texdocx.converter.render;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Renders formulas by piping them through the {@code texmath} executable, which emits OMML.
 */
public class TexmathRenderer implements FormulaRenderer {

    private static final Logger LOGGER = LoggerFactory.getLogger(TexmathRenderer.class);
    private static final int MAX_ERROR_LENGTH = 200;

    private final String executable;
    private final Duration timeout;

    public TexmathRenderer(String executable, Duration timeout) {
        this.executable = Objects.requireNonNull(executable, "executable");
        this.timeout = Objects.requireNonNull(timeout, "timeout");
        if (executable.isBlank()) {
            throw new IllegalArgumentException("executable must not be blank");
        }
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive");
        }
    }

    List<String> command() {
        return List.of(executable, "--from", "tex", "--to", "omml");
    }

    @Override
    public RenderedFormula render(String formula) {
        String cleaned = FormulaCleaner.clean(formula);
        if (cleaned.isEmpty()) {
            throw new RenderException("Empty formula");
        }

        Process process;
        try {
            process = new ProcessBuilder(command()).start();
        } catch (IOException ex) {
            throw new RenderException("Failed to start " + executable + ": " + ex.getMessage(), ex);
        }

        Future<String> stdout = RenderExecutors.streamReaders().submit(() -> read(process.getInputStream()));
        Future<String> stderr = RenderExecutors.streamReaders().submit(() -> read(process.getErrorStream()));
        try (OutputStream stdin = process.getOutputStream()) {
            stdin.write(cleaned.getBytes(StandardCharsets.UTF_8));
        } catch (IOException ex) {
            process.destroyForcibly();
            throw new RenderException("Failed to pass formula to " + executable, ex);
        }

        try {
            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                throw new RenderException("Timed out after " + timeout.toSeconds() + "s");
            }
            String output = stdout.get(timeout.toMillis(), TimeUnit.MILLISECONDS).trim();
            int exitCode = process.exitValue();
            if (exitCode != 0) {
                throw new RenderException("Exit code " + exitCode + ": "
                        + abbreviate(stderr.get(timeout.toMillis(), TimeUnit.MILLISECONDS)));
            }
            if (output.isEmpty()) {
                throw new RenderException("No output produced");
            }
            LOGGER.debug("Rendered formula of {} chars into {} chars of markup", cleaned.length(), output.length());
            return RenderedFormula.of(MathMarkup.withNamespaces(MathMarkup.stripDeclaration(output)));
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            throw new RenderException("Interrupted while rendering", ex);
        } catch (ExecutionException | TimeoutException ex) {
            process.destroyForcibly();
            throw new RenderException("Failed to read output of " + executable, ex);
        }
    }

    private static String read(InputStream stream) throws IOException {
        try (InputStream in = stream) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    private static String abbreviate(String message) {
        String trimmed = message == null ? "" : message.strip();
        return trimmed.length() <= MAX_ERROR_LENGTH ? trimmed : trimmed.substring(0, MAX_ERROR_LENGTH) + "...";
    }
}
