package work.forge.scaffold.support;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import work.forge.scaffold.io.ArtifactWriter;
import work.forge.scaffold.io.InMemoryArtifactWriter;

/**
 * In-memory writer that records every call in order and can be told to fail on given paths.
 */
public final class RecordingArtifactWriter implements ArtifactWriter {
    private final InMemoryArtifactWriter delegate;
    private final List<String> calls = new ArrayList<>();
    private final Set<String> failing = new HashSet<>();

    public RecordingArtifactWriter() {
        this(new InMemoryArtifactWriter(false));
    }

    public RecordingArtifactWriter(InMemoryArtifactWriter delegate) {
        this.delegate = delegate;
    }

    public RecordingArtifactWriter failOn(String relativePath) {
        failing.add(relativePath);
        return this;
    }

    @Override
    public Path write(String relativePath, String content, boolean overwrite) throws IOException {
        calls.add("write " + relativePath);
        if (failing.contains(relativePath)) {
            throw new IOException("disk full: " + relativePath);
        }
        return delegate.write(relativePath, content, overwrite);
    }

    @Override
    public boolean overwriteByDefault() {
        return delegate.overwriteByDefault();
    }

    @Override
    public void createDirectories(String relativePath) {
        calls.add("mkdir " + relativePath);
        delegate.createDirectories(relativePath);
    }

    @Override
    public boolean exists(String relativePath) {
        return delegate.exists(relativePath);
    }

    public List<String> calls() {
        return List.copyOf(calls);
    }

    public InMemoryArtifactWriter delegate() {
        return delegate;
    }
}
