package ai.texdocx.converter.pipeline;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Locates the input file: as given, then relative to the working directory, its parent and the user home.
 */
public class InputResolver {

    private final Path workingDirectory;
    private final Path userHome;

    public InputResolver() {
        this(Path.of("").toAbsolutePath(), Path.of(System.getProperty("user.home")));
    }

    public InputResolver(Path workingDirectory, Path userHome) {
        this.workingDirectory = Objects.requireNonNull(workingDirectory, "workingDirectory");
        this.userHome = Objects.requireNonNull(userHome, "userHome");
    }

    public Path resolve(Path input) {
        return find(input).orElseThrow(() -> new ConversionException("Input file not found: " + input));
    }

    Optional<Path> find(Path input) {
        if (Files.isRegularFile(input)) {
            return Optional.of(input);
        }
        if (input.isAbsolute()) {
            return Optional.empty();
        }
        List<Path> candidates = new ArrayList<>();
        candidates.add(workingDirectory.resolve(input));
        if (workingDirectory.getParent() != null) {
            candidates.add(workingDirectory.getParent().resolve(input));
        }
        candidates.add(userHome.resolve(input));
        return candidates.stream().filter(Files::isRegularFile).findFirst();
    }
}
