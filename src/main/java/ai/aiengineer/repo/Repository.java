package ai.aiengineer.repo;

import ai.aiengineer.analyzer.ProjectFile;
import ai.aiengineer.analyzer.PythonSummarizer;
import ai.aiengineer.analyzer.StructuralSummarizer;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.NotDirectoryException;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * In-memory model of every tracked file under a root directory, keyed by repo-relative name and kept in the order
 * the files were discovered (or supplied). A Repository is immutable: merging changes produces a new one.
 */
public final class Repository {
    private static final Logger logger = LogManager.getLogger(Repository.class);

    /** Matched against each file name, at any depth. */
    public static final String DEFAULT_PATTERN = "*.py";

    private final Path root;
    private final Map<String, FileRecord> records;

    private Repository(Path root, Collection<FileRecord> records) {
        this.root = root;
        var byName = new LinkedHashMap<String, FileRecord>();
        for (var record : records) {
            if (!record.file().getRoot().equals(root)) {
                throw new IllegalArgumentException("%s belongs to %s, not %s"
                        .formatted(record.name(), record.file().getRoot(), root));
            }
            if (byName.putIfAbsent(record.name(), record) != null) {
                throw new DuplicatePathException(record.name());
            }
        }
        this.records = Collections.unmodifiableMap(byName);
    }

    public static Repository load(Path root) throws IOException {
        return load(root, DEFAULT_PATTERN);
    }

    /**
     * Walks {@code root} recursively and reads every file whose name matches the glob {@code pattern}.
     *
     * @throws NoSuchFileException if the root does not exist, or a discovered file disappears before it is read
     */
    public static Repository load(Path root, String pattern) throws IOException {
        var normalizedRoot = root.toAbsolutePath().normalize();
        if (!Files.exists(normalizedRoot)) {
            throw new NoSuchFileException(normalizedRoot.toString());
        }
        if (!Files.isDirectory(normalizedRoot)) {
            throw new NotDirectoryException(normalizedRoot.toString());
        }

        PathMatcher matcher = FileSystems.getDefault().getPathMatcher("glob:" + pattern);
        List<Path> discovered;
        try (Stream<Path> walk = Files.walk(normalizedRoot)) {
            discovered = walk.filter(p -> p.getFileName() != null && matcher.matches(p.getFileName()))
                    .filter(p -> !Files.isDirectory(p))
                    .toList();
        } catch (UncheckedIOException e) {
            throw e.getCause();
        }

        List<FileRecord> records = new ArrayList<>(discovered.size());
        for (var path : discovered) {
            // no retry: a file that vanished since the walk surfaces as NoSuchFileException
            String text = Files.readString(path, StandardCharsets.UTF_8);
            records.add(new FileRecord(ProjectFile.normalize(path, normalizedRoot), new FileContent.Keep(text)));
        }
        logger.debug("Loaded {} files matching {} under {}", records.size(), pattern, normalizedRoot);
        return new Repository(normalizedRoot, records);
    }

    /**
     * Builds an in-memory repository from a payload. Nothing is read from or written to disk.
     *
     * @throws DuplicatePathException if two entries share a name
     */
    public static Repository fromInterchange(InterchangePayload payload, Path root) {
        var normalizedRoot = root.toAbsolutePath().normalize();
        var records = payload.toMap().values().stream()
                .map(entry -> toRecord(entry, normalizedRoot))
                .toList();
        return new Repository(normalizedRoot, records);
    }

    private static FileRecord toRecord(InterchangeEntry entry, Path root) {
        return new FileRecord(new ProjectFile(root, entry.name()), FileContent.of(entry.content()));
    }

    /**
     * Merges an answer from the code-modification component: each entry replaces (or adds) the record of the same
     * name, null contents mark the record for deletion, untouched records carry over.
     */
    public Repository apply(InterchangePayload changes) {
        var merged = new LinkedHashMap<>(records);
        for (var entry : changes.toMap().values()) {
            var record = toRecord(entry, root);
            merged.put(record.name(), record);
        }
        logger.debug("Applied {} changed files to {}", changes.size(), root);
        return new Repository(root, merged.values());
    }

    /**
     * Writes kept records to disk, creating parent directories, and removes files whose record is a deletion.
     * Overwrites in place: no temp file, no backup, no diffing.
     */
    public void persist() throws IOException {
        for (var record : records.values()) {
            Path target = record.file().absPath();
            if (record.content() instanceof FileContent.Keep keep) {
                var parent = target.getParent();
                if (parent != null) {
                    Files.createDirectories(parent);
                }
                Files.writeString(target, keep.text(), StandardCharsets.UTF_8);
            } else if (Files.deleteIfExists(target)) {
                logger.debug("Deleted {}", record.name());
            }
        }
        logger.debug("Persisted {} files to {}", records.size(), root);
    }

    public InterchangePayload toInterchange(boolean summary) {
        return toInterchange(summary ? new PythonSummarizer() : null);
    }

    /**
     * One entry per record, in record order. With a summarizer each kept file is replaced by its outline; a file
     * that cannot be parsed aborts the whole conversion.
     */
    public InterchangePayload toInterchange(@Nullable StructuralSummarizer summarizer) {
        return new InterchangePayload(
                records.values().stream().map(r -> r.toEntry(summarizer)).toList());
    }

    public Optional<FileRecord> get(String name) {
        return Optional.ofNullable(records.get(name));
    }

    /**
     * @throws NoSuchFileException if no kept record has this name
     */
    public String content(String name) throws NoSuchFileException {
        var record = records.get(name);
        if (record != null && record.content() instanceof FileContent.Keep keep) {
            return keep.text();
        }
        throw new NoSuchFileException(name, null, "not a file of the repository at " + root);
    }

    public String toMarkdown() {
        return records.values().stream()
                .filter(r -> !r.isDeleted())
                .map(r -> "\n**%s**:\n```python\n%s\n```\n".formatted(r.name(), r.content().textOrNull()))
                .collect(Collectors.joining("\n"));
    }

    public List<FileRecord> files() {
        return List.copyOf(records.values());
    }

    public List<String> names() {
        return List.copyOf(records.keySet());
    }

    public int size() {
        return records.size();
    }

    public Path root() {
        return root;
    }

    @Override
    public String toString() {
        return "Repository{root=%s, files=%d}".formatted(root, records.size());
    }
}
