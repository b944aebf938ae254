package ai.aiengineer.tools;

import ai.aiengineer.executor.DiagnosticReport;
import ai.aiengineer.executor.ExecutionHarness;
import ai.aiengineer.executor.PythonScriptRunner;
import ai.aiengineer.repo.InterchangePayload;
import ai.aiengineer.repo.Repository;
import ai.aiengineer.util.EngineConfig;
import java.io.IOException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * The operations the orchestration layer calls. Each one reloads the repository from disk, so it always sees the
 * latest persisted state.
 */
public final class RepositoryTools {
    private static final Logger logger = LogManager.getLogger(RepositoryTools.class);

    private final Path root;
    private final EngineConfig config;
    private final ExecutionHarness harness;
    private final CodeModifier modifier;
    private final DocumentRenderer renderer;

    public RepositoryTools(
            Path root,
            EngineConfig config,
            ExecutionHarness harness,
            CodeModifier modifier,
            DocumentRenderer renderer) {
        this.root = root.toAbsolutePath().normalize();
        this.config = config;
        this.harness = harness;
        this.modifier = modifier;
        this.renderer = renderer;
    }

    /** Tools for {@code root} configured from its properties, executing files with a Python subprocess runner. */
    public static RepositoryTools create(Path root, CodeModifier modifier, DocumentRenderer renderer) {
        var config = EngineConfig.load(root);
        var runner = new PythonScriptRunner(config.pythonExecutable(), config.executionTimeout());
        return new RepositoryTools(root, config, new ExecutionHarness(runner), modifier, renderer);
    }

    public Repository loadRepository() throws IOException {
        return Repository.load(root, config.filePattern());
    }

    /** Every file as flat text, either in full or as structural outlines. */
    public String getRepositoryMap(boolean summary) throws IOException {
        return loadRepository().toInterchange(summary).toFlatText();
    }

    public String getFileContent(String name) throws IOException {
        return loadRepository().content(name);
    }

    public String getErrorsAndOutputs() throws IOException, InterruptedException {
        return flatText(harness.run(loadRepository(), true, true));
    }

    public String getPrintOutputs() throws IOException, InterruptedException {
        return flatText(harness.run(loadRepository(), true, false));
    }

    public String getErrors() throws IOException, InterruptedException {
        return flatText(harness.run(loadRepository(), false, true));
    }

    /**
     * Runs the repository once and, if any file fails, asks the code modifier to fix it, sending the failures along
     * with the output of the files that ran cleanly, then persists the answer.
     *
     * @return the failures that triggered the fix, or null if every file ran cleanly and nothing was sent
     */
    public @Nullable List<DiagnosticReport> requestFix(String additionalInstructions)
            throws IOException, InterruptedException {
        var repository = loadRepository();
        var diagnostics = harness.run(repository, true, true);
        var problems = diagnostics == null
                ? List.<DiagnosticReport>of()
                : diagnostics.stream().filter(DiagnosticReport::failed).toList();
        if (problems.isEmpty()) {
            logger.info("No problems found in {}", root);
            return null;
        }

        var instruction = additionalInstructions.isBlank()
                ? flatText(diagnostics)
                : additionalInstructions + "\n" + flatText(diagnostics);
        logger.warn("{} files failed in {}, requesting a fix", problems.size(), root);
        applyAndPersist(repository, modifier.modify(instruction, repository.toInterchange(false)));
        return problems;
    }

    /** Sends a free-form instruction with the full or summarized repository, then persists the modifier's answer. */
    public InterchangePayload requestEdit(String instruction, boolean summary) throws IOException {
        var repository = loadRepository();
        var answer = modifier.modify(instruction, repository.toInterchange(summary));
        applyAndPersist(repository, answer);
        return answer;
    }

    /**
     * @throws NoSuchFileException if {@code name} is not a file of the repository; the message lists the known files
     */
    public String renderDocument(String name) throws IOException {
        var repository = loadRepository();
        var record = repository.get(name).filter(r -> !r.isDeleted()).orElseThrow(() -> new NoSuchFileException(
                name,
                null,
                "not found in the repository %s. Files in the repository:\n%s"
                        .formatted(root, String.join("\n", repository.names()))));
        return renderer.render(record.file().absPath());
    }

    private void applyAndPersist(Repository repository, InterchangePayload answer) throws IOException {
        if (answer.isEmpty()) {
            logger.info("Code modifier returned no changes");
            return;
        }
        repository.apply(answer).persist();
        logger.info("Persisted {} changed files under {}", answer.size(), root);
    }

    private static String flatText(@Nullable List<DiagnosticReport> reports) {
        return reports == null ? "" : DiagnosticReport.toPayload(reports).toFlatText();
    }

    public Path getRoot() {
        return root;
    }

    public EngineConfig getConfig() {
        return config;
    }
}
