package work.forge.scaffold.io;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Single mutation point for generated artifacts. Steps never touch storage directly, which keeps
 * the engine testable with an in-memory or recording writer.
 */
public interface ArtifactWriter {
    /**
     * Writes {@code content} to {@code relativePath}, creating parent directories as needed.
     *
     * @throws ArtifactConflictException when the path exists and {@code overwrite} is false
     * @throws IOException on any other storage failure
     */
    Path write(String relativePath, String content, boolean overwrite) throws IOException;

    /** Overwrite policy applied by {@link #write(String, String)}. */
    boolean overwriteByDefault();

    void createDirectories(String relativePath) throws IOException;

    boolean exists(String relativePath);

    default Path write(String relativePath, String content) throws IOException {
        return write(relativePath, content, overwriteByDefault());
    }

    /**
     * Writes only when nothing exists yet at the path; returns whether a write happened.
     */
    default boolean writeIfAbsent(String relativePath, String content) throws IOException {
        if (exists(relativePath)) {
            return false;
        }
        write(relativePath, content, false);
        return true;
    }
}
