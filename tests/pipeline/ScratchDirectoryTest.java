package pipeline;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class ScratchDirectoryTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("A fresh directory is created below a missing parent and removed with its content")
    void createAndClose() throws IOException {
        Path parent = tempDir.resolve("a/b");
        Path created;
        try (ScratchDirectory scratch = ScratchDirectory.create(parent)) {
            created = scratch.path();
            assertTrue(Files.isDirectory(created));
            assertEquals(parent.toAbsolutePath().normalize(), created.getParent());
            Files.createDirectories(created.resolve("x/y"));
            Files.writeString(created.resolve("x/y/file.csv"), "a\n");
        }
        assertFalse(Files.exists(created));
        assertTrue(Files.isDirectory(parent));
    }

    @Test
    @DisplayName("Two scratch directories never share a path and closing twice is harmless")
    void uniqueAndIdempotentClose() throws IOException {
        ScratchDirectory first = ScratchDirectory.create(tempDir);
        ScratchDirectory second = ScratchDirectory.create(tempDir);

        assertNotEquals(first.path(), second.path());
        first.close();
        first.close();
        second.close();
        assertFalse(Files.exists(second.path()));
    }
}
