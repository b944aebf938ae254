package ai.aiengineer.analyzer;

/** Source text that could not be parsed into a structural tree. No partial result accompanies it. */
public class SourceParseException extends RuntimeException {
    private final int line;

    public SourceParseException(String message, int line) {
        super(message);
        this.line = line;
    }

    /** 1-based line of the first syntax error. */
    public int getLine() {
        return line;
    }
}
