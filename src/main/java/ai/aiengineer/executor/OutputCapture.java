package ai.aiengineer.executor;

/**
 * Scoped standard-output handle for exactly one script execution. The harness opens one per file with
 * try-with-resources and hands it to the {@link ScriptRunner}; closing it discards the buffer, and a closed capture
 * rejects further writes.
 */
public final class OutputCapture implements AutoCloseable {
    private final StringBuilder buffer = new StringBuilder();
    private boolean closed;

    private OutputCapture() {}

    public static OutputCapture open() {
        return new OutputCapture();
    }

    public synchronized void append(String text) {
        ensureOpen();
        buffer.append(text);
    }

    public void appendLine(String line) {
        append(line + "\n");
    }

    public synchronized String contents() {
        ensureOpen();
        return buffer.toString();
    }

    public synchronized boolean isEmpty() {
        ensureOpen();
        return buffer.length() == 0;
    }

    public synchronized boolean isClosed() {
        return closed;
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("Output capture already closed");
        }
    }

    @Override
    public synchronized void close() {
        buffer.setLength(0);
        closed = true;
    }
}
