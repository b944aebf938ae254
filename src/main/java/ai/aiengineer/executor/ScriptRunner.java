package ai.aiengineer.executor;

import java.nio.file.Path;

/** Executes the full content of one file as a fresh unit, writing its standard output into {@code stdout}. */
@FunctionalInterface
public interface ScriptRunner {
    /**
     * @param root repository root the unit belongs to; sibling modules resolve against it
     * @throws ScriptExecutionException if the script raised, exited abnormally, timed out or could not start
     */
    void run(ExecutionUnit unit, Path root, OutputCapture stdout) throws ScriptExecutionException, InterruptedException;
}
