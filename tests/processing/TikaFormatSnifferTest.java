package processing;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class TikaFormatSnifferTest {

    @TempDir
    Path tempDir;

    private final TikaFormatSniffer sniffer = new TikaFormatSniffer();

    @Test
    @DisplayName("A zip without an extension is recognised by its content")
    void isZipArchive_ZipContent_True() throws IOException {
        Path file = ArchiveResolverTest.zip(tempDir.resolve("download"), Map.of("data.csv", "a\n1\n"));
        assertTrue(sniffer.isZipArchive(file));
    }

    @Test
    @DisplayName("Plain text is not an archive")
    void isZipArchive_Text_False() throws IOException {
        Path file = Files.writeString(tempDir.resolve("download"), "a,b\n1,2\n");
        assertFalse(sniffer.isZipArchive(file));
    }

    @Test
    @DisplayName("Constructor rejects a null Tika facade")
    void constructor_Null_Throws() {
        assertThrows(NullPointerException.class, () -> new TikaFormatSniffer(null));
    }
}
