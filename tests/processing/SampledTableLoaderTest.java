package processing;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import processing.LocationExceptions.ReadException;
import processing.SampledTableLoader.LoadResult;
import tabular.Table;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SampledTableLoaderTest {

    /**
     * Fails for file names starting with "bad", crashes for names starting with "boom",
     * otherwise returns one table named after the file.
     */
    private static final ITableLoader FAKE = (candidate, type, maxRows) -> {
        String name = candidate.displayName();
        if (name.startsWith("bad")) {
            throw new ReadException("Unable to read resource " + name);
        }
        if (name.startsWith("boom")) {
            throw new IllegalStateException("corrupt record in " + name);
        }
        return List.of(Table.fromRows(List.of(name), List.of(List.of("v"))));
    };

    private static SampledTableLoader loader(FormatFamily family, boolean accumulate) {
        Map<FormatFamily, ITableLoader> loaders = new EnumMap<>(FormatFamily.class);
        loaders.put(family, FAKE);
        return new SampledTableLoader(loaders, accumulate);
    }

    private static List<Candidate> candidates(String... names) {
        List<Candidate> list = new ArrayList<>();
        for (String name : names) {
            list.add(Candidate.of(Path.of(name)));
        }
        return list;
    }

    private static List<String> firstColumns(LoadResult result) {
        List<String> columns = new ArrayList<>();
        result.samples().tables().forEach(t -> columns.add(t.columnName(0)));
        return columns;
    }

    @Test
    @DisplayName("Tabular candidates accumulate and a failure is recorded")
    void load_TabularAccumulatesAndRecordsError() {
        LoadResult result = loader(FormatFamily.DELIMITED_TEXT, false)
                .load(candidates("one.csv", "bad.csv", "two.csv"), FileType.CSV);

        assertEquals(List.of("one.csv", "two.csv"), firstColumns(result));
        assertTrue(result.hasError());
        assertEquals("Unable to read resource bad.csv", result.error());
    }

    @Test
    @DisplayName("The last failure's message wins")
    void load_LastErrorWins() {
        LoadResult result = loader(FormatFamily.SPREADSHEET, false)
                .load(candidates("bad1.xlsx", "bad2.xlsx"), FileType.XLSX);

        assertTrue(result.samples().isEmpty());
        assertEquals("Unable to read resource bad2.xlsx", result.error());
    }

    @Test
    @DisplayName("Geo candidates replace earlier samples by default")
    void load_GeoReplaces() {
        LoadResult result = loader(FormatFamily.SINGLE_LAYER_GEO, false)
                .load(candidates("a.shp", "b.shp", "c.shp"), FileType.SHP);

        assertEquals(List.of("c.shp"), firstColumns(result));
        assertFalse(result.hasError());
    }

    @Test
    @DisplayName("A failed geo candidate keeps the samples read before it")
    void load_GeoFailureKeepsPrevious() {
        LoadResult result = loader(FormatFamily.SINGLE_LAYER_GEO, false)
                .load(candidates("a.geojson", "bad.geojson"), FileType.GEOJSON);

        assertEquals(List.of("a.geojson"), firstColumns(result));
        assertEquals("Unable to read resource bad.geojson", result.error());
    }

    @Test
    @DisplayName("Geo accumulation keeps every layer")
    void load_GeoAccumulates() {
        LoadResult result = loader(FormatFamily.SINGLE_LAYER_GEO, true)
                .load(candidates("a.shp", "b.shp", "c.shp"), FileType.SHP);

        assertEquals(List.of("a.shp", "b.shp", "c.shp"), firstColumns(result));
    }

    @Test
    @DisplayName("A family without a loader fails every candidate")
    void load_NoLoader_Error() {
        LoadResult result = loader(FormatFamily.SPREADSHEET, false)
                .load(candidates("data.csv"), FileType.CSV);

        assertTrue(result.samples().isEmpty());
        assertEquals("Unable to read resource data.csv", result.error());
    }

    @Test
    @DisplayName("An unchecked failure in a reader is recorded like a read error")
    void load_UncheckedFailure_Recorded() {
        LoadResult result = loader(FormatFamily.DELIMITED_TEXT, false)
                .load(candidates("one.csv", "boom.csv", "two.csv"), FileType.CSV);

        assertEquals(List.of("one.csv", "two.csv"), firstColumns(result));
        assertEquals("Unable to read resource boom.csv", result.error());
    }

    @Test
    @DisplayName("A shapefile whose fields overrun the record length still yields a sample")
    void load_CorruptShapefile_DoesNotEscape(@TempDir Path tempDir) throws IOException {
        byte[] dbf = new DbfFixture(StandardCharsets.ISO_8859_1)
                .field("NAME", 'C', 10, 0)
                .field("PCODE", 'C', 10, 0)
                .record("a", "b")
                .toBytes();
        dbf[10] = 2;
        dbf[11] = 0;
        Path shp = Files.write(tempDir.resolve("admin.shp"), new byte[100]);
        Files.write(tempDir.resolve("admin.dbf"), dbf);

        LoadResult result = new SampledTableLoader().load(List.of(Candidate.of(shp)), FileType.SHP);

        assertFalse(result.hasError());
        assertEquals(List.of("NAME", "PCODE"), result.samples().tables().iterator().next().getColumns());
    }

    @Test
    @DisplayName("The default loaders cover every format family")
    void defaultLoaders_CoverAllFamilies() {
        assertEquals(FormatFamily.values().length, SampledTableLoader.defaultLoaders().size());
    }
}
