package ai.aiengineer.repo;

/** Two interchange entries, or two file records, claim the same repo-relative path. */
public class DuplicatePathException extends IllegalStateException {
    private final String name;

    public DuplicatePathException(String name) {
        super("Can't have two files with the same name " + name);
        this.name = name;
    }

    public String getName() {
        return name;
    }
}
