package work.forge.scaffold.io;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Objects;

/**
 * Writes artifacts below a destination root. Paths escaping the root are rejected.
 */
public final class FileSystemArtifactWriter implements ArtifactWriter {
    private final Path root;
    private final boolean overwriteByDefault;

    public FileSystemArtifactWriter(Path root, boolean overwriteByDefault) {
        this.root = Objects.requireNonNull(root, "root").toAbsolutePath().normalize();
        this.overwriteByDefault = overwriteByDefault;
    }

    public Path root() {
        return root;
    }

    @Override
    public Path write(String relativePath, String content, boolean overwrite) throws IOException {
        Path target = resolve(relativePath);
        if (Files.exists(target) && !overwrite) {
            throw new ArtifactConflictException(relativePath);
        }
        Path parent = target.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        byte[] data = (content == null ? "" : content).getBytes(StandardCharsets.UTF_8);
        Files.write(target, data, StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE);
        return target;
    }

    @Override
    public boolean overwriteByDefault() {
        return overwriteByDefault;
    }

    @Override
    public void createDirectories(String relativePath) throws IOException {
        Files.createDirectories(resolve(relativePath));
    }

    @Override
    public boolean exists(String relativePath) {
        return Files.exists(resolve(relativePath));
    }

    private Path resolve(String relativePath) {
        if (relativePath == null || relativePath.isBlank()) {
            throw new IllegalArgumentException("path is required");
        }
        Path target = root.resolve(relativePath).normalize();
        if (!target.startsWith(root)) {
            throw new IllegalArgumentException("Path escapes destination root: " + relativePath);
        }
        return target;
    }
}
