package ai.aiengineer.analyzer;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Abstraction for a filename relative to the repo. This exists to make it less difficult to ensure that different
 * filename objects can be meaningfully compared, unlike bare Paths which may or may not be absolute, or may be
 * relative to the jvm root rather than the repo root.
 */
public final class ProjectFile implements Comparable<ProjectFile> {
    private final Path root;
    private final Path relPath;

    /** root must be pre-normalized; we will normalize relPath if it is not already */
    public ProjectFile(Path root, Path relPath) {
        if (!root.isAbsolute()) {
            throw new IllegalArgumentException("Root must be absolute, got " + root);
        }
        if (!root.equals(root.normalize())) {
            throw new IllegalArgumentException("Root must be normalized, got " + root);
        }
        if (relPath.isAbsolute()) {
            throw new IllegalArgumentException("RelPath must be relative, got " + relPath);
        }

        this.root = root;
        this.relPath = relPath.normalize();
    }

    public ProjectFile(Path root, String relName) {
        this(root, Path.of(relName));
    }

    /**
     * Reduces an absolute path to its repo-relative identity.
     *
     * @throws PathOutsideRootException if {@code absolutePath} does not lie under {@code repoRoot}
     */
    public static ProjectFile normalize(Path absolutePath, Path repoRoot) {
        var root = repoRoot.toAbsolutePath().normalize();
        var abs = absolutePath.toAbsolutePath().normalize();
        if (!abs.startsWith(root) || abs.equals(root)) {
            throw new PathOutsideRootException(absolutePath, repoRoot);
        }
        return new ProjectFile(root, root.relativize(abs));
    }

    public Path getRoot() {
        return root;
    }

    public Path getRelPath() {
        return relPath;
    }

    /**
     * Plain concatenation of root and relative path. A relPath that starts with ".." survives normalization and
     * resolves outside the root; nothing here guards against that.
     */
    public Path absPath() {
        return root.resolve(relPath);
    }

    /** The repo-relative identity, '/'-separated regardless of platform. This is the interchange name. */
    public String name() {
        return relPath.toString().replace('\\', '/');
    }

    public String getFileName() {
        return relPath.getFileName().toString();
    }

    public String extension() {
        var fileName = getFileName();
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(dot + 1) : "";
    }

    /** Dotted module identity: extension stripped, path separators replaced by '.' */
    public String moduleName() {
        var n = name();
        var ext = extension();
        if (!ext.isEmpty()) {
            n = n.substring(0, n.length() - ext.length() - 1);
        }
        return n.replace('/', '.');
    }

    @Override
    public int compareTo(ProjectFile o) {
        return name().compareTo(o.name());
    }

    @Override
    public String toString() {
        return name();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ProjectFile projectFile)) return false;
        return Objects.equals(root, projectFile.root) && Objects.equals(relPath, projectFile.relPath);
    }

    @Override
    public int hashCode() {
        return relPath.hashCode();
    }
}
