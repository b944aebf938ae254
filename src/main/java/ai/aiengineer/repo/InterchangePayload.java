package ai.aiengineer.repo;

import ai.aiengineer.util.Json;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * The flat wire form of a repository: an ordered list of {@code {"name", "content"}} objects, exchanged verbatim with
 * the external code-modification component.
 */
public record InterchangePayload(List<InterchangeEntry> files) {

    private static final String DELETED_PLACEHOLDER = "<deleted>";

    public InterchangePayload {
        files = List.copyOf(Objects.requireNonNull(files, "files"));
    }

    public static InterchangePayload of(InterchangeEntry... entries) {
        return new InterchangePayload(List.of(entries));
    }

    public boolean isEmpty() {
        return files.isEmpty();
    }

    public int size() {
        return files.size();
    }

    /**
     * Index by name, preserving order.
     *
     * @throws DuplicatePathException on the first name that appears twice
     */
    public Map<String, InterchangeEntry> toMap() {
        var output = new LinkedHashMap<String, InterchangeEntry>();
        for (var entry : files) {
            if (output.putIfAbsent(entry.name(), entry) != null) {
                throw new DuplicatePathException(entry.name());
            }
        }
        return output;
    }

    /**
     * Concatenated {@code **name**:} blocks for humans and LLM prompts. Display only: nothing parses this back into a
     * payload.
     */
    public String toFlatText() {
        var sb = new StringBuilder();
        for (var entry : files) {
            sb.append("\n\n**").append(entry.name()).append("**:\n");
            sb.append(entry.content() == null ? DELETED_PLACEHOLDER : entry.content());
        }
        return sb.toString();
    }

    /** The bare JSON array, {@code null} contents included. */
    public String toJson() {
        return Json.toJson(files);
    }

    /**
     * Parses either the bare array or the {@code {"files": [...]}} wrapper.
     *
     * @throws IllegalArgumentException if the text is not JSON of either shape
     */
    public static InterchangePayload fromJson(String json) {
        JsonNode root = Json.readTree(json);
        if (root.isObject() && root.has("files")) {
            root = root.get("files");
        }
        if (!root.isArray()) {
            throw new IllegalArgumentException("Expected a JSON array of {name, content} objects, got " + root.getNodeType());
        }
        var entries = Json.fromTree(root, InterchangeEntry[].class);
        for (var entry : entries) {
            if (entry == null) {
                throw new IllegalArgumentException("Interchange payload contains a null entry");
            }
        }
        return new InterchangePayload(List.of(entries));
    }
}
