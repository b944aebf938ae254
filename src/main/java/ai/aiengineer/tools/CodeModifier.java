package ai.aiengineer.tools;

import ai.aiengineer.repo.InterchangePayload;

/**
 * The external component that rewrites code. It receives an instruction and the repository (full or summarized) and
 * answers with the files it changed; a null content in the answer deletes that file.
 */
@FunctionalInterface
public interface CodeModifier {
    InterchangePayload modify(String instruction, InterchangePayload repository);
}
