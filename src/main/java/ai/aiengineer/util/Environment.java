package ai.aiengineer.util;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

public class Environment {
    private static final Logger logger = LogManager.getLogger(Environment.class);
    public static final Environment instance = new Environment();

    /** Default timeout for a single subprocess. */
    public static final Duration DEFAULT_TIMEOUT = Duration.ofMinutes(2);

    /** How long to wait for the stream readers once the process has exited. */
    private static final Duration STREAM_DRAIN_TIMEOUT = Duration.ofSeconds(5);

    private Environment() {}

    /** stdout and stderr of a finished process, exactly as the process wrote them. */
    public record ProcessOutput(String stdout, String stderr) {}

    public ProcessOutput runCommand(
            List<String> command,
            Path root,
            Map<String, String> environment,
            Consumer<String> stdoutConsumer,
            Duration timeout)
            throws SubprocessException, InterruptedException {
        return runCommand(command, root, environment, null, stdoutConsumer, timeout);
    }

    /**
     * Runs {@code command} (no shell) in {@code root}. stdout is handed to {@code stdoutConsumer} verbatim, in
     * chunks, as it is produced; stderr is only collected.
     *
     * @param environment extra variables, layered over the inherited environment
     * @param stdin text written to the process's standard input, which is then closed; null reads from the null
     *     device instead
     * @param timeout {@code Duration.ZERO} disables the guard; on expiry the process is killed forcibly
     * @throws StartupException if the process cannot be started
     * @throws TimeoutException if the process did not finish in time
     * @throws FailureException if the process exited with a non-zero code
     */
    public ProcessOutput runCommand(
            List<String> command,
            Path root,
            Map<String, String> environment,
            @Nullable String stdin,
            Consumer<String> stdoutConsumer,
            Duration timeout)
            throws SubprocessException, InterruptedException {
        if (timeout.isNegative()) {
            throw new IllegalArgumentException("Timeout duration cannot be negative: " + timeout);
        }
        var display = String.join(" ", command);
        logger.debug("Running `{}` in `{}`", display, root);

        ProcessBuilder pb = createProcessBuilder(root, command, stdin != null);
        pb.environment().putAll(environment);

        Process process;
        try {
            process = pb.start();
        } catch (IOException e) {
            throw new StartupException(
                    "unable to start `%s` in %s (%s)".formatted(display, root, e.getMessage()), "", "");
        }

        // start draining stdout/stderr immediately to avoid pipe-buffer deadlock
        CompletableFuture<String> stdoutFuture =
                CompletableFuture.supplyAsync(() -> readStream(process.getInputStream(), stdoutConsumer));
        CompletableFuture<String> stderrFuture =
                CompletableFuture.supplyAsync(() -> readStream(process.getErrorStream(), chunk -> {}));
        if (stdin != null) {
            CompletableFuture.runAsync(() -> writeStream(process.getOutputStream(), stdin));
        }

        try {
            boolean finished;
            if (timeout.isZero()) {
                process.waitFor();
                finished = true;
            } else {
                finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            }
            if (!finished) {
                process.destroyForcibly();
                var partial = collect(stdoutFuture, stderrFuture, display);
                throw new TimeoutException(
                        "process `%s` did not complete within %s".formatted(display, timeout),
                        partial.stdout(),
                        partial.stderr());
            }
        } catch (InterruptedException ie) {
            process.destroyForcibly();
            stdoutFuture.cancel(true);
            stderrFuture.cancel(true);
            logger.warn("Process `{}` interrupted.", display);
            throw ie;
        }

        var output = collect(stdoutFuture, stderrFuture, display);
        int exitCode = process.exitValue();
        if (exitCode != 0) {
            throw new FailureException(
                    "process `%s` signalled error code %d".formatted(display, exitCode),
                    output.stdout(),
                    output.stderr(),
                    exitCode);
        }
        return output;
    }

    private static String readStream(InputStream in, Consumer<String> chunkConsumer) {
        var collected = new StringBuilder();
        try (var reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
            char[] buffer = new char[8192];
            int read;
            while ((read = reader.read(buffer)) != -1) {
                var chunk = new String(buffer, 0, read);
                chunkConsumer.accept(chunk);
                collected.append(chunk);
            }
        } catch (IOException e) {
            // the process was killed or closed its end; keep what was read
            logger.debug("Stream closed early: {}", e.getMessage());
        }
        return collected.toString();
    }

    private static void writeStream(OutputStream out, String text) {
        try (var writer = new OutputStreamWriter(out, StandardCharsets.UTF_8)) {
            writer.write(text);
        } catch (IOException e) {
            // the process exited without consuming its input; its own exit status reports the problem
            logger.debug("Unable to write process input: {}", e.getMessage());
        }
    }

    /** Collect stdout and stderr with a timeout so a wedged reader cannot block the caller forever. */
    private static ProcessOutput collect(
            CompletableFuture<String> stdoutFuture, CompletableFuture<String> stderrFuture, String command)
            throws InterruptedException {
        try {
            String stdout = stdoutFuture.get(STREAM_DRAIN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
            String stderr = stderrFuture.get(STREAM_DRAIN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
            return new ProcessOutput(stdout, stderr);
        } catch (ExecutionException | java.util.concurrent.TimeoutException e) {
            logger.warn("Timeout or error collecting output streams for `{}`: {}", command, e.getMessage());
            // read whatever completed before cancelling; getNow throws on a cancelled future
            String stdout = stdoutFuture.isDone() && !stdoutFuture.isCompletedExceptionally() ? stdoutFuture.join() : "";
            stdoutFuture.cancel(true);
            stderrFuture.cancel(true);
            return new ProcessOutput(stdout, "Stream collection timeout or error: " + e.getMessage());
        }
    }

    private static ProcessBuilder createProcessBuilder(Path root, List<String> command, boolean pipeInput) {
        var pb = new ProcessBuilder(command);
        pb.directory(root.toFile());
        if (!pipeInput) {
            // Redirect input from /dev/null (or NUL on Windows) so interactive prompts fail fast
            pb.redirectInput(ProcessBuilder.Redirect.from(new File(isWindows() ? "NUL" : "/dev/null")));
        }
        pb.environment().remove("EDITOR");
        pb.environment().remove("VISUAL");
        pb.environment().put("TERM", "dumb");
        return pb;
    }

    /** Base exception for subprocess errors. */
    public abstract static class SubprocessException extends IOException {
        private final String stdout;
        private final String stderr;

        protected SubprocessException(String message, String stdout, String stderr) {
            super(message);
            this.stdout = stdout;
            this.stderr = stderr;
        }

        public String getStdout() {
            return stdout;
        }

        public String getStderr() {
            return stderr;
        }
    }

    /** Exception thrown when a subprocess fails to start. */
    public static class StartupException extends SubprocessException {
        public StartupException(String message, String stdout, String stderr) {
            super(message, stdout, stderr);
        }
    }

    /** Exception thrown when a subprocess times out. */
    public static class TimeoutException extends SubprocessException {
        public TimeoutException(String message, String stdout, String stderr) {
            super(message, stdout, stderr);
        }
    }

    /** Exception thrown when a subprocess returns a non-zero exit code. */
    public static class FailureException extends SubprocessException {
        private final int exitCode;

        public FailureException(String message, String stdout, String stderr, int exitCode) {
            super(message, stdout, stderr);
            this.exitCode = exitCode;
        }

        public int getExitCode() {
            return exitCode;
        }
    }

    public static boolean isWindows() {
        return System.getProperty("os.name").toLowerCase(Locale.ENGLISH).contains("win");
    }

    /** Whether {@code executable} can be started; used to pick or validate an interpreter. */
    public boolean isAvailable(String executable, Path workingDir) {
        try {
            runCommand(List.of(executable, "--version"), workingDir, Map.of(), line -> {}, Duration.ofSeconds(10));
            return true;
        } catch (SubprocessException e) {
            logger.debug("{} is not usable: {}", executable, e.getMessage());
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
