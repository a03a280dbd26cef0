package processing;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import processing.LocationExceptions.ReadException;
import tabular.Table;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ShapefileLoaderTest {

    @TempDir
    Path tempDir;

    private final ShapefileLoader loader = new ShapefileLoader();

    @Test
    @DisplayName("The attribute table is read from an upper-case .DBF, decoded per the .cpg")
    void read_SiblingDbfAndCodePage() throws IOException {
        Path shp = Files.write(tempDir.resolve("districts.shp"), new byte[100]);
        new DbfFixture(StandardCharsets.UTF_8)
                .field("ADM2_PCODE", 'C', 8, 0)
                .field("ADM2_EN", 'C', 12, 0)
                .record("TR060001", "Çankaya")
                .writeTo(tempDir.resolve("districts.DBF"));
        Files.writeString(tempDir.resolve("districts.cpg"), "UTF-8\n");

        List<Table> tables = loader.read(Candidate.of(shp), FileType.SHP, 100);

        assertEquals(1, tables.size());
        assertEquals(List.of("ADM2_PCODE", "ADM2_EN"), tables.get(0).getColumns());
        assertEquals("Çankaya", tables.get(0).cell(0, 1));
    }

    @Test
    @DisplayName("Without a .cpg the attribute table is read as ISO-8859-1")
    void read_DefaultCharset() throws IOException {
        Path shp = Files.write(tempDir.resolve("towns.shp"), new byte[100]);
        new DbfFixture(StandardCharsets.ISO_8859_1)
                .field("NAME", 'C', 8, 0)
                .record("Malmö")
                .writeTo(tempDir.resolve("towns.dbf"));

        assertEquals("Malmö", loader.read(Candidate.of(shp), FileType.SHP, 100).get(0).cell(0, 0));
    }

    @Test
    @DisplayName("A shapefile without its .dbf cannot be read")
    void read_MissingDbf_Throws() throws IOException {
        Path shp = Files.write(tempDir.resolve("roads.shp"), new byte[100]);

        ReadException e = assertThrows(ReadException.class,
                () -> loader.read(Candidate.of(shp), FileType.SHP, 100));
        assertEquals("Unable to read resource roads.shp", e.getMessage());
    }

    @ParameterizedTest(name = "''{0}'' -> {1}")
    @CsvSource({
            "UTF-8, UTF-8",
            "1252, windows-1252",
            "88591, ISO-8859-1",
            "ISO-8859-9, ISO-8859-9",
            "not-a-charset, ISO-8859-1",
            "'', ISO-8859-1"
    })
    @DisplayName("charsetOf: code page names and bare numbers")
    void charsetOf(String declared, String expected) {
        assertEquals(Charset.forName(expected), ShapefileLoader.charsetOf(declared));
    }
}
