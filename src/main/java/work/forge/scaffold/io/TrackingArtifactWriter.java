package work.forge.scaffold.io;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Writer decorator that records which artifacts one step wrote before delegating.
 */
public final class TrackingArtifactWriter implements ArtifactWriter {
    private final ArtifactWriter delegate;
    private final List<String> written = new ArrayList<>();

    public TrackingArtifactWriter(ArtifactWriter delegate) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
    }

    @Override
    public Path write(String relativePath, String content, boolean overwrite) throws IOException {
        Path path = delegate.write(relativePath, content, overwrite);
        written.add(relativePath);
        return path;
    }

    @Override
    public boolean overwriteByDefault() {
        return delegate.overwriteByDefault();
    }

    @Override
    public void createDirectories(String relativePath) throws IOException {
        delegate.createDirectories(relativePath);
    }

    @Override
    public boolean exists(String relativePath) {
        return delegate.exists(relativePath);
    }

    public List<String> written() {
        return List.copyOf(written);
    }
}
