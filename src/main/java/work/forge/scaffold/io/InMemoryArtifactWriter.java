package work.forge.scaffold.io;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Keeps artifacts in memory. Backs dry runs and doubles as a fake in tests.
 */
public final class InMemoryArtifactWriter implements ArtifactWriter {
    private final Map<String, String> files = new LinkedHashMap<>();
    private final Set<String> directories = new LinkedHashSet<>();
    private final boolean overwriteByDefault;

    public InMemoryArtifactWriter() {
        this(true);
    }

    public InMemoryArtifactWriter(boolean overwriteByDefault) {
        this.overwriteByDefault = overwriteByDefault;
    }

    @Override
    public Path write(String relativePath, String content, boolean overwrite) {
        String key = normalize(relativePath);
        if (files.containsKey(key) && !overwrite) {
            throw new ArtifactConflictException(relativePath);
        }
        Path path = Path.of(key);
        for (Path parent = path.getParent(); parent != null; parent = parent.getParent()) {
            directories.add(parent.toString().replace('\\', '/'));
        }
        files.put(key, content == null ? "" : content);
        return path;
    }

    @Override
    public Path write(String relativePath, String content) {
        return write(relativePath, content, overwriteByDefault);
    }

    @Override
    public boolean writeIfAbsent(String relativePath, String content) {
        if (exists(relativePath)) {
            return false;
        }
        write(relativePath, content, false);
        return true;
    }

    @Override
    public boolean overwriteByDefault() {
        return overwriteByDefault;
    }

    @Override
    public void createDirectories(String relativePath) {
        Path path = Path.of(normalize(relativePath));
        for (Path current = path; current != null; current = current.getParent()) {
            directories.add(current.toString().replace('\\', '/'));
        }
    }

    @Override
    public boolean exists(String relativePath) {
        String key = normalize(relativePath);
        return files.containsKey(key) || directories.contains(key);
    }

    public Optional<String> content(String relativePath) {
        return Optional.ofNullable(files.get(normalize(relativePath)));
    }

    public Map<String, String> files() {
        return Collections.unmodifiableMap(files);
    }

    public Set<String> directories() {
        return Collections.unmodifiableSet(directories);
    }

    private static String normalize(String relativePath) {
        if (relativePath == null || relativePath.isBlank()) {
            throw new IllegalArgumentException("path is required");
        }
        Path normalized = Path.of(relativePath).normalize();
        if (normalized.isAbsolute() || normalized.startsWith("..")) {
            throw new IllegalArgumentException("Path escapes destination root: " + relativePath);
        }
        return normalized.toString().replace('\\', '/');
    }
}
