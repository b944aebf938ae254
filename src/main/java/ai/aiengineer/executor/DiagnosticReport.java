package ai.aiengineer.executor;

import ai.aiengineer.repo.InterchangeEntry;
import ai.aiengineer.repo.InterchangePayload;
import java.util.List;

/**
 * Captured output or failure trace of one file, produced fresh by each harness run. {@code failed} tells a failure
 * report (output so far plus trace) from the plain output of a file that ran cleanly.
 */
public record DiagnosticReport(String path, String text, boolean failed) {

    public static DiagnosticReport output(String path, String text) {
        return new DiagnosticReport(path, text, false);
    }

    public static DiagnosticReport failure(String path, String text) {
        return new DiagnosticReport(path, text, true);
    }

    /** Reports in the interchange shape, for rendering with {@link InterchangePayload#toFlatText()}. */
    public static InterchangePayload toPayload(List<DiagnosticReport> reports) {
        return new InterchangePayload(reports.stream()
                .map(r -> new InterchangeEntry(r.path(), r.text()))
                .toList());
    }
}
