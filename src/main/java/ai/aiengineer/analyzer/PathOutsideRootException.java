package ai.aiengineer.analyzer;

import java.nio.file.Path;

/** Thrown when a path that should identify a repository file does not lie under the repository root. */
public class PathOutsideRootException extends IllegalArgumentException {
    private final Path path;
    private final Path root;

    public PathOutsideRootException(Path path, Path root) {
        super("%s is not under repository root %s".formatted(path, root));
        this.path = path;
        this.root = root;
    }

    public Path getPath() {
        return path;
    }

    public Path getRoot() {
        return root;
    }
}
