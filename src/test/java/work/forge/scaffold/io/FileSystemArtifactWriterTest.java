package work.forge.scaffold.io;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FileSystemArtifactWriterTest {
    @TempDir
    Path root;

    @Test
    void createsParentsAndWritesUtf8() throws Exception {
        var writer = new FileSystemArtifactWriter(root, false);

        Path written = writer.write("app/core/config/base.py", "# déjà vu\n");

        assertEquals(root.resolve("app/core/config/base.py"), written);
        assertEquals("# déjà vu\n", Files.readString(written));
        assertTrue(writer.exists("app/core"));
    }

    @Test
    void refusesToOverwriteByDefault() throws Exception {
        var writer = new FileSystemArtifactWriter(root, false);
        writer.write("README.md", "first");

        var ex = assertThrows(ArtifactConflictException.class, () -> writer.write("README.md", "second"));
        assertEquals("README.md", ex.relativePath());
        assertEquals("artifact_conflict", ex.code());
        assertEquals("first", Files.readString(root.resolve("README.md")));
    }

    @Test
    void overwriteReplacesWholeContent() throws Exception {
        var writer = new FileSystemArtifactWriter(root, true);
        writer.write("a.txt", "a much longer first version");
        writer.write("a.txt", "short");

        assertEquals("short", Files.readString(root.resolve("a.txt")));
    }

    @Test
    void writeIfAbsentKeepsExistingFiles() throws Exception {
        var writer = new FileSystemArtifactWriter(root, true);
        writer.write("app/__init__.py", "# mine");

        assertFalse(writer.writeIfAbsent("app/__init__.py", ""));
        assertTrue(writer.writeIfAbsent("app/utils/__init__.py", ""));
        assertEquals("# mine", Files.readString(root.resolve("app/__init__.py")));
    }

    @Test
    void rejectsPathsOutsideRoot() {
        var writer = new FileSystemArtifactWriter(root, true);

        assertThrows(IllegalArgumentException.class, () -> writer.write("../escape.txt", "x"));
        assertThrows(IllegalArgumentException.class, () -> writer.write("app/../../escape.txt", "x"));
        assertFalse(Files.exists(root.getParent().resolve("escape.txt")));
    }
}
