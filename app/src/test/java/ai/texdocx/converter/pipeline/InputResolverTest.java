package ai.texdocx.converter.pipeline;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class InputResolverTest {

    @TempDir
    Path tempDir;

    @Test
    void resolvesRelativeToWorkingDirectoryThenHome() throws IOException {
        Path work = Files.createDirectories(tempDir.resolve("work/sub"));
        Path home = Files.createDirectories(tempDir.resolve("home"));
        Path inParent = Files.writeString(tempDir.resolve("work/parent.tex"), "x");
        Path inHome = Files.writeString(home.resolve("home.md"), "y");
        InputResolver resolver = new InputResolver(work, home);

        assertThat(resolver.resolve(Path.of("parent.tex"))).isEqualTo(inParent);
        assertThat(resolver.resolve(Path.of("home.md"))).isEqualTo(inHome);
    }

    @Test
    void missingFileRaisesConversionException() {
        InputResolver resolver = new InputResolver(tempDir, tempDir);

        Throwable thrown = catchThrowable(() -> resolver.resolve(Path.of("nowhere.tex")));

        assertThat(thrown).isInstanceOf(ConversionException.class).hasMessageContaining("nowhere.tex");
    }
}
