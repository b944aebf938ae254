package ai.aiengineer.tools;

import java.io.IOException;
import java.nio.file.Path;

/** The external component that renders one source file into a human-readable document. */
@FunctionalInterface
public interface DocumentRenderer {
    String render(Path absolutePath) throws IOException;
}
