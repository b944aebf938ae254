package ai.aiengineer.executor;

import ai.aiengineer.util.Environment;
import java.io.File;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Runs each file in its own Python interpreter process. The unit's source, not whatever is on disk, is piped to the
 * interpreter and executed under the file's module name (so top-level statements run but
 * {@code if __name__ == "__main__"} blocks do not). The file's absolute path only names the code in tracebacks. The
 * repository root and its parent are on the import path so that both {@code import values} and
 * {@code import <repo>.values} resolve.
 *
 * <p>A process that outlives the timeout is killed and reported as a failure.
 */
public final class PythonScriptRunner implements ScriptRunner {
    private static final Logger logger = LogManager.getLogger(PythonScriptRunner.class);

    static final String BOOTSTRAP = "import os, sys; path, name = sys.argv[1], sys.argv[2]; "
            + "code = compile(sys.stdin.buffer.read(), path, 'exec'); "
            + "sys.stdin = open(os.devnull); sys.argv = [path]; "
            + "exec(code, {'__name__': name, '__file__': path, '__builtins__': __builtins__})";

    private final Environment environment;
    private final String pythonExecutable;
    private final Duration timeout;

    public PythonScriptRunner(String pythonExecutable, Duration timeout) {
        this(Environment.instance, pythonExecutable, timeout);
    }

    PythonScriptRunner(Environment environment, String pythonExecutable, Duration timeout) {
        this.environment = environment;
        this.pythonExecutable = pythonExecutable;
        this.timeout = timeout;
    }

    @Override
    public void run(ExecutionUnit unit, Path root, OutputCapture stdout)
            throws ScriptExecutionException, InterruptedException {
        var command = List.of(
                pythonExecutable,
                "-c",
                BOOTSTRAP,
                unit.file().absPath().toString(),
                unit.moduleName());
        logger.debug("Executing {} as module {}", unit.name(), unit.moduleName());
        try {
            environment.runCommand(command, root, childEnvironment(root), unit.source(), stdout::append, timeout);
        } catch (Environment.TimeoutException e) {
            throw new ScriptExecutionException(
                    e.getMessage(),
                    "TimeoutError: execution exceeded %s and was killed\n%s".formatted(timeout, e.getStderr()),
                    e);
        } catch (Environment.SubprocessException e) {
            // non-zero exit or failure to start; stderr holds the traceback when there is one
            throw new ScriptExecutionException(e.getMessage(), e.getStderr(), e);
        }
    }

    private static Map<String, String> childEnvironment(Path root) {
        List<String> pythonPath = new ArrayList<>();
        var parent = root.getParent();
        if (parent != null) {
            pythonPath.add(parent.toString());
        }
        pythonPath.add(root.toString());
        var inherited = System.getenv("PYTHONPATH");
        if (inherited != null && !inherited.isBlank()) {
            pythonPath.add(inherited);
        }
        return Map.of(
                "PYTHONPATH", String.join(File.pathSeparator, pythonPath),
                "PYTHONUNBUFFERED", "1",
                "PYTHONIOENCODING", "utf-8",
                "PYTHONDONTWRITEBYTECODE", "1");
    }

    public String getPythonExecutable() {
        return pythonExecutable;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
