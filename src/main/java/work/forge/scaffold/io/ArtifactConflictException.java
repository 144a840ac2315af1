package work.forge.scaffold.io;

import work.forge.scaffold.shared.GenerationException;

/**
 * The target artifact already exists and overwriting was not requested. Recoverable: the engine
 * records the step as failed and carries on with independent steps.
 */
public final class ArtifactConflictException extends GenerationException {
    private final String relativePath;

    public ArtifactConflictException(String relativePath) {
        super("artifact_conflict", "File already exists: " + relativePath);
        this.relativePath = relativePath;
    }

    public String relativePath() {
        return relativePath;
    }
}
