package ai.aiengineer.executor;

import ai.aiengineer.analyzer.ProjectFile;
import ai.aiengineer.repo.FileContent;
import ai.aiengineer.repo.FileRecord;

/** A file to execute, with the dotted module identity it runs under. */
public record ExecutionUnit(ProjectFile file, String moduleName, String source) {

    public static ExecutionUnit of(FileRecord record) {
        if (!(record.content() instanceof FileContent.Keep keep)) {
            throw new IllegalArgumentException(record.name() + " is marked for deletion and cannot be executed");
        }
        return new ExecutionUnit(record.file(), record.file().moduleName(), keep.text());
    }

    public String name() {
        return file.name();
    }
}
