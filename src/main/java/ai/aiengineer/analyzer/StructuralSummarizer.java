package ai.aiengineer.analyzer;

/** Produces a condensed outline of one file's top-level declarations without executing it. */
@FunctionalInterface
public interface StructuralSummarizer {
    /**
     * @throws SourceParseException if {@code source} is not syntactically valid
     */
    String summarize(String source);
}
