package ai.aiengineer.executor;

/** A script that failed to run to completion. Carries the trace the runtime reported. */
public class ScriptExecutionException extends Exception {
    private final String trace;

    public ScriptExecutionException(String message, String trace) {
        super(message);
        this.trace = trace;
    }

    public ScriptExecutionException(String message, String trace, Throwable cause) {
        super(message, cause);
        this.trace = trace;
    }

    /** The runtime's error output; falls back to the message when the runtime said nothing. */
    public String getTrace() {
        return trace.isBlank() ? getMessage() : trace;
    }
}
