package ai.texdocx.converter.render;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;

import java.time.Duration;
import org.junit.jupiter.api.Test;

class TexmathRendererTest {

    @Test
    void buildsTexToOmmlCommand() {
        TexmathRenderer renderer = new TexmathRenderer("/opt/texmath", Duration.ofSeconds(2));

        assertThat(renderer.command()).containsExactly("/opt/texmath", "--from", "tex", "--to", "omml");
    }

    @Test
    void missingExecutableSurfacesAsRenderException() {
        TexmathRenderer renderer = new TexmathRenderer("/nonexistent/texmath-binary", Duration.ofSeconds(2));

        Throwable thrown = catchThrowable(() -> renderer.render("x^2"));

        assertThat(thrown).isInstanceOf(RenderException.class).hasMessageContaining("Failed to start");
    }

    @Test
    void rejectsNonPositiveTimeout() {
        assertThat(catchThrowable(() -> new TexmathRenderer("texmath", Duration.ZERO)))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
