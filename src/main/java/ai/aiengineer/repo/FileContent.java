package ai.aiengineer.repo;

import org.jetbrains.annotations.Nullable;

/**
 * What a {@link FileRecord} says about its file: keep it with the given text, or remove it. The wire format encodes
 * {@link Delete} as a null content; in memory it is always explicit.
 */
public sealed interface FileContent permits FileContent.Keep, FileContent.Delete {

    static FileContent of(@Nullable String text) {
        return text == null ? Delete.INSTANCE : new Keep(text);
    }

    /** The wire form: the text, or null for a deletion. */
    @Nullable
    String textOrNull();

    record Keep(String text) implements FileContent {
        public Keep {
            if (text == null) {
                throw new IllegalArgumentException("Keep requires text; use Delete for removals");
            }
        }

        @Override
        public String textOrNull() {
            return text;
        }
    }

    final class Delete implements FileContent {
        public static final Delete INSTANCE = new Delete();

        private Delete() {}

        @Override
        public @Nullable String textOrNull() {
            return null;
        }

        @Override
        public String toString() {
            return "Delete";
        }
    }
}
