package ai.aiengineer.executor;

import ai.aiengineer.repo.FileRecord;
import ai.aiengineer.repo.Repository;
import java.util.ArrayList;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Executes every file of a repository, one after the other in the repository's stored order, and collects what
 * they print and how they fail.
 *
 * <p>A failing file never aborts the batch: its error is turned into a report and the next file runs. That is the
 * opposite of the rest of the engine, which fails fast, and it is what lets a caller get feedback from a repository
 * that is partly broken.
 */
public final class ExecutionHarness {
    private static final Logger logger = LogManager.getLogger(ExecutionHarness.class);

    private final ScriptRunner runner;

    public ExecutionHarness(ScriptRunner runner) {
        this.runner = runner;
    }

    /**
     * @param withOutputs report the printed output of files that ran successfully
     * @param withErrors report failures, prefixed by whatever the file printed before failing
     * @return the reports in execution order, or null if nothing qualified
     * @throws InterruptedException if the calling thread is interrupted; the batch stops there
     */
    public @Nullable List<DiagnosticReport> run(Repository repository, boolean withOutputs, boolean withErrors)
            throws InterruptedException {
        List<DiagnosticReport> reports = new ArrayList<>();
        for (FileRecord record : repository.files()) {
            if (record.isDeleted()) {
                continue;
            }
            var unit = ExecutionUnit.of(record);
            try (var stdout = OutputCapture.open()) {
                try {
                    runner.run(unit, repository.root(), stdout);
                    if (withOutputs && !stdout.isEmpty()) {
                        reports.add(DiagnosticReport.output(unit.name(), stdout.contents()));
                    }
                } catch (ScriptExecutionException e) {
                    logger.warn("{} failed: {}", unit.name(), e.getMessage());
                    if (withErrors) {
                        var text = failureText(stdout.contents(), e.getTrace());
                        reports.add(DiagnosticReport.failure(unit.name(), text));
                    }
                }
            }
        }
        logger.debug("Executed {} files, {} reports", repository.size(), reports.size());
        return reports.isEmpty() ? null : List.copyOf(reports);
    }

    static String failureText(String outputSoFar, String trace) {
        var separator = outputSoFar.isEmpty() || outputSoFar.endsWith("\n") ? "" : "\n";
        return "STDOUT:\n" + outputSoFar + separator + "Error: " + trace;
    }
}
