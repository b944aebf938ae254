package ai.aiengineer.executor;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

import ai.aiengineer.repo.InterchangeEntry;
import ai.aiengineer.repo.InterchangePayload;
import ai.aiengineer.repo.Repository;
import ai.aiengineer.util.Environment;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/** Runs real files through a python3 subprocess; skipped where no interpreter is installed. */
class PythonScriptRunnerTest {

    private static final String PYTHON = "python3";

    @TempDir
    Path tempDir;

    Path root;

    @BeforeEach
    void setUp() throws IOException {
        assumeTrue(Environment.instance.isAvailable(PYTHON, tempDir), "python3 is not available");
        root = tempDir.resolve("repo");
        Files.createDirectories(root);
    }

    private ExecutionHarness harness(Duration timeout) {
        return new ExecutionHarness(new PythonScriptRunner(PYTHON, timeout));
    }

    @Test
    void testSiblingImportAndOutput() throws Exception {
        Files.writeString(root.resolve("a.py"), "x = 1\n");
        Files.writeString(root.resolve("b.py"), "from a import x\nprint(x * 2)\n");

        var reports = harness(Duration.ofSeconds(30)).run(Repository.load(root), true, false);

        assertNotNull(reports);
        assertEquals(1, reports.size());
        assertEquals("b.py", reports.get(0).path());
        assertTrue(reports.get(0).text().contains("2"), reports.get(0).text());
    }

    @Test
    void testFailureCarriesOutputAndTraceback() throws Exception {
        Files.writeString(root.resolve("a.py"), "print('X')\nraise ValueError('boom')\n");
        Files.writeString(root.resolve("b.py"), "print('Y')\n");

        var reports = harness(Duration.ofSeconds(30)).run(Repository.load(root), true, true);

        assertNotNull(reports);
        var byPath = reports.stream()
                .collect(Collectors.toMap(DiagnosticReport::path, DiagnosticReport::text));
        var a = byPath.get("a.py");
        assertTrue(reports.stream().filter(DiagnosticReport::failed).allMatch(r -> r.path().equals("a.py")));
        assertTrue(a.startsWith("STDOUT:\nX\nError: "), a);
        assertTrue(a.contains("ValueError: boom"), a);
        assertEquals("Y\n", byPath.get("b.py"));
    }

    @Test
    void testRunsRecordContentRatherThanDisk() throws Exception {
        Files.writeString(root.resolve("a.py"), "print('disk')\n");
        var repository = Repository.fromInterchange(
                InterchangePayload.of(
                        new InterchangeEntry("a.py", "print('memory')\n"),
                        new InterchangeEntry("b.py", "print('unsaved', __file__.endswith('b.py'))\n")),
                root);

        var reports = harness(Duration.ofSeconds(30)).run(repository, true, true);

        assertEquals(
                List.of(
                        DiagnosticReport.output("a.py", "memory\n"),
                        DiagnosticReport.output("b.py", "unsaved True\n")),
                reports);
        assertFalse(Files.exists(root.resolve("b.py")));
    }

    @Test
    void testOutputCapturedVerbatim() throws Exception {
        Files.writeString(root.resolve("a.py"), "print('X', end='')\nprint('', end='\\n\\n')\nprint('Y', end='')\n");

        var reports = harness(Duration.ofSeconds(30)).run(Repository.load(root), true, true);

        assertEquals(List.of(DiagnosticReport.output("a.py", "X\n\nY")), reports);
    }

    @Test
    void testStandardInputIsEmpty() throws Exception {
        Files.writeString(root.resolve("a.py"), "import sys\nprint(repr(sys.stdin.read()))\n");

        var reports = harness(Duration.ofSeconds(30)).run(Repository.load(root), true, true);

        assertEquals(List.of(DiagnosticReport.output("a.py", "''\n")), reports);
    }

    @Test
    void testSyntaxErrorReportedAsFailure() throws Exception {
        Files.writeString(root.resolve("old.py"), "print 'hi'\n");

        var reports = harness(Duration.ofSeconds(30)).run(Repository.load(root), false, true);

        assertNotNull(reports);
        assertTrue(reports.get(0).failed());
        assertTrue(reports.get(0).text().contains("SyntaxError"), reports.get(0).text());
    }

    @Test
    void testMainGuardDoesNotRun() throws Exception {
        Files.writeString(root.resolve("tool.py"), "print(__name__)\nif __name__ == '__main__':\n    print('main')\n");

        var reports = harness(Duration.ofSeconds(30)).run(Repository.load(root), true, true);

        assertEquals(List.of(DiagnosticReport.output("tool.py", "tool\n")), reports);
    }

    @Test
    void testNestedModuleName() throws Exception {
        Files.createDirectories(root.resolve("pkg"));
        Files.writeString(root.resolve("pkg/mod.py"), "print(__name__)\n");

        var reports = harness(Duration.ofSeconds(30)).run(Repository.load(root), true, false);

        assertEquals(List.of(DiagnosticReport.output("pkg/mod.py", "pkg.mod\n")), reports);
    }

    @Test
    void testRunawayScriptIsKilled() throws Exception {
        Files.writeString(root.resolve("slow.py"), "import time\nprint('started', flush=True)\ntime.sleep(60)\n");
        var runner = new PythonScriptRunner(PYTHON, Duration.ofSeconds(2));
        var repository = Repository.load(root);
        var unit = ExecutionUnit.of(repository.get("slow.py").orElseThrow());

        long start = System.nanoTime();
        try (var stdout = OutputCapture.open()) {
            var ex = assertThrows(ScriptExecutionException.class, () -> runner.run(unit, root, stdout));
            assertTrue(ex.getTrace().startsWith("TimeoutError"), ex.getTrace());
        }
        assertTrue(Duration.ofNanos(System.nanoTime() - start).compareTo(Duration.ofSeconds(30)) < 0);
    }
}
