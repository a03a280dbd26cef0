package processing;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import processing.LocationExceptions.ReadException;
import tabular.ColumnType;
import tabular.Table;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class GeoJsonLoaderTest {

    @TempDir
    Path tempDir;

    private final GeoJsonLoader loader = new GeoJsonLoader();

    private Table readSingle(String name, String json, FileType type, int maxRows) throws IOException {
        Path file = Files.writeString(tempDir.resolve(name), json);
        List<Table> tables = loader.read(Candidate.of(file), type, maxRows);
        assertEquals(1, tables.size());
        return tables.get(0);
    }

    @Test
    @DisplayName("Feature properties become columns, the geometry a trailing opaque column")
    void read_FeatureCollection() throws IOException {
        String json = "{\"type\":\"FeatureCollection\",\"features\":["
                + "{\"type\":\"Feature\",\"geometry\":{\"type\":\"Point\",\"coordinates\":[36.8,-1.3]},"
                + "\"properties\":{\"name\":\"Nairobi\",\"pcode\":\"KE047\",\"pop\":4397073}},"
                + "{\"type\":\"Feature\",\"geometry\":null,"
                + "\"properties\":{\"name\":\"Mombasa\",\"area\":219.9,\"capital\":false,\"geometry\":\"shadowed\"}}]}";

        Table table = readSingle("towns.geojson", json, FileType.GEOJSON, 100);

        assertEquals(List.of("name", "pcode", "pop", "area", "capital", "geometry"), table.getColumns());
        assertEquals(List.of(ColumnType.TEXT, ColumnType.TEXT, ColumnType.NUMBER, ColumnType.NUMBER,
                ColumnType.BOOLEAN, ColumnType.GEOMETRY), table.getTypes());
        assertEquals(4397073L, table.cell(0, 2));
        assertEquals(219.9, table.cell(1, 3));
        assertEquals(Boolean.FALSE, table.cell(1, 4));
        assertNull(table.cell(0, 3));
        assertTrue(((String) table.cell(0, 5)).contains("Point"));
        assertNull(table.cell(1, 5));
    }

    @Test
    @DisplayName("A bare Feature is a one-row table")
    void read_SingleFeature() throws IOException {
        String json = "{\"type\":\"Feature\",\"geometry\":null,\"properties\":{\"code\":\"UG101\"}}";

        Table table = readSingle("one.json", json, FileType.JSON, 100);

        assertEquals(1, table.rowCount());
        assertEquals("UG101", table.cell(0, 0));
    }

    @Test
    @DisplayName("TopoJSON reads the geometries of the first object")
    void read_Topology() throws IOException {
        String json = "{\"type\":\"Topology\",\"arcs\":[[[0,0],[1,1]]],\"objects\":{"
                + "\"districts\":{\"type\":\"GeometryCollection\",\"geometries\":["
                + "{\"type\":\"Polygon\",\"arcs\":[[0]],\"properties\":{\"ADM2_PCODE\":\"KE001001\"}},"
                + "{\"type\":\"Polygon\",\"arcs\":[[0]],\"properties\":{\"ADM2_PCODE\":\"KE001002\"}}]},"
                + "\"other\":{\"type\":\"GeometryCollection\",\"geometries\":[]}}}";

        Table table = readSingle("districts.topojson", json, FileType.TOPOJSON, 100);

        assertEquals(List.of("ADM2_PCODE", "geometry"), table.getColumns());
        assertEquals(2, table.rowCount());
        assertEquals("KE001002", table.cell(1, 0));
        assertTrue(((String) table.cell(0, 1)).contains("Polygon"));
    }

    @Test
    @DisplayName("Features beyond the cap are not read")
    void read_RespectsMaxRows() throws IOException {
        StringBuilder json = new StringBuilder("{\"type\":\"FeatureCollection\",\"features\":[");
        for (int i = 0; i < 10; i++) {
            if (i > 0) {
                json.append(',');
            }
            json.append("{\"type\":\"Feature\",\"geometry\":null,\"properties\":{\"id\":").append(i).append("}}");
        }
        json.append("]}");

        assertEquals(3, readSingle("many.geojson", json.toString(), FileType.GEOJSON, 3).rowCount());
    }

    @Test
    @DisplayName("JSON that is not a feature document is a read failure")
    void read_NotGeoJson_Throws() throws IOException {
        Path file = Files.writeString(tempDir.resolve("plain.json"), "{\"records\":[1,2,3]}");

        ReadException e = assertThrows(ReadException.class,
                () -> loader.read(Candidate.of(file), FileType.JSON, 100));
        assertEquals("Unable to read resource plain.json", e.getMessage());
    }

    @Test
    @DisplayName("Malformed JSON is a read failure")
    void read_Malformed_Throws() throws IOException {
        Path file = Files.writeString(tempDir.resolve("broken.geojson"), "{\"type\": ");
        assertThrows(ReadException.class, () -> loader.read(Candidate.of(file), FileType.GEOJSON, 100));
    }
}
