package ai.aiengineer.repo;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.jetbrains.annotations.Nullable;

/** One file on the wire. A null content means "delete this file". */
@JsonInclude(JsonInclude.Include.ALWAYS)
public record InterchangeEntry(
        @JsonProperty("name") String name, @JsonProperty("content") @Nullable String content) {

    public InterchangeEntry {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Interchange entry requires a name");
        }
    }

    public boolean isDeletion() {
        return content == null;
    }
}
