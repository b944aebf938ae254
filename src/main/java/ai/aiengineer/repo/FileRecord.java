package ai.aiengineer.repo;

import ai.aiengineer.analyzer.ProjectFile;
import ai.aiengineer.analyzer.StructuralSummarizer;
import org.jetbrains.annotations.Nullable;

/**
 * One tracked file. Records are never edited in place; a change is a new record replacing the old one in its
 * {@link Repository}.
 */
public record FileRecord(ProjectFile file, FileContent content) {

    public String name() {
        return file.name();
    }

    public boolean isDeleted() {
        return content instanceof FileContent.Delete;
    }

    /** Summary derived from the current content; null for a deletion. */
    public @Nullable String summary(StructuralSummarizer summarizer) {
        if (content instanceof FileContent.Keep keep) {
            return summarizer.summarize(keep.text());
        }
        return null;
    }

    InterchangeEntry toEntry(@Nullable StructuralSummarizer summarizer) {
        var text = summarizer == null ? content.textOrNull() : summary(summarizer);
        return new InterchangeEntry(name(), text);
    }
}
