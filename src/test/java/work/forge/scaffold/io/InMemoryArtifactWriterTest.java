package work.forge.scaffold.io;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;

class InMemoryArtifactWriterTest {
    @Test
    void tracksFilesAndParentDirectories() {
        var writer = new InMemoryArtifactWriter();
        writer.write("app/core/logger.py", "log");

        assertEquals("log", writer.content("app/core/logger.py").orElseThrow());
        assertTrue(writer.exists("app/core"));
        assertTrue(writer.directories().contains("app"));
    }

    @Test
    void honoursOverwritePolicy() {
        var writer = new InMemoryArtifactWriter(false);
        writer.write("x", "1", false);

        assertThrows(ArtifactConflictException.class, () -> writer.write("x", "2", false));
        writer.write("x", "3", true);
        assertEquals("3", writer.content("x").orElseThrow());
    }

    @Test
    void trackingWriterRecordsOnlySuccessfulWrites() throws Exception {
        var memory = new InMemoryArtifactWriter(false);
        memory.write("taken", "x", false);
        var tracking = new TrackingArtifactWriter(memory);

        tracking.write("fresh", "y");
        assertThrows(ArtifactConflictException.class, () -> tracking.write("taken", "z"));

        assertEquals(List.of("fresh"), tracking.written());
    }
}
