package pipeline;

import classify.LatLongClassifier;
import classify.PcodeClassifier;
import client.ICatalog;
import config.ConfigLoader;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import processing.ArchiveResolver;
import processing.SampledTableLoader;
import reference.CountryReference;
import reference.CountryReference.Country;
import tabular.HeaderNormalizer;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class PipelineTest {

    private static final String PCODED_CSV = "Country,ADM1PCODE\nKenya,KEN01\nKenya,KEN02\n";

    @TempDir
    Path tempDir;

    private final LocationChecker checker = new LocationChecker(
            new PcodeClassifier(new CountryReference(List.of(new Country("KEN", "KE", "Kenya")))),
            new LatLongClassifier(),
            new HeaderNormalizer(),
            new ArchiveResolver(file -> false),
            new SampledTableLoader());

    private Pipeline pipeline(ICatalog catalog) {
        return new Pipeline(catalog, checker, new StatusReportWriter(), "groups:\"ken\"",
                tempDir.resolve("scratch"), tempDir.resolve("reports/status.csv"));
    }

    @Test
    @DisplayName("Every resource gets a row; skipped formats and oversized files are never downloaded")
    void run_WritesOneRowPerResource() throws IOException {
        FakeResource pdf = FakeResource.of("report.pdf", "pdf", "%PDF");
        FakeResource huge = FakeResource.sized("census.csv", "csv", Pipeline.MAX_RESOURCE_BYTES + 1);
        FakeResource admin = FakeResource.of("admin1.csv", "csv", PCODED_CSV);
        FakeResource broken = FakeResource.unreachable("roads.shp", "shp");
        List<String> filters = new ArrayList<>();
        ICatalog catalog = filter -> {
            filters.add(filter);
            return List.of(new FakeDataset("ken-admin", pdf, huge, admin), new FakeDataset("ken-roads", broken));
        };

        List<StatusRow> rows = pipeline(catalog).run();

        assertEquals(List.of("groups:\"ken\""), filters);
        assertEquals(List.of(
                StatusRow.skipped("ken-admin", "report.pdf", "pdf", "Not checking format"),
                StatusRow.skipped("ken-admin", "census.csv", "csv", "Not checking files of this size"),
                new StatusRow("ken-admin", "admin1.csv", "csv", true, null, null),
                new StatusRow("ken-roads", "roads.shp", "shp", null, null, "Could not download file roads.shp")),
                rows);
        assertEquals(0, pdf.downloads());
        assertEquals(0, huge.downloads());
        assertEquals(1, admin.downloads());

        List<String> report = Files.readAllLines(tempDir.resolve("reports/status.csv"));
        assertEquals(List.of(
                "dataset name,resource name,format,pcoded,mis_pcoded,error",
                "ken-admin,report.pdf,pdf,,,Not checking format",
                "ken-admin,census.csv,csv,,,Not checking files of this size",
                "ken-admin,admin1.csv,csv,True,,",
                "ken-roads,roads.shp,shp,,,Could not download file roads.shp"), report);
    }

    @Test
    @DisplayName("A resource exactly at the size limit is still checked")
    void run_SizeLimitInclusive() throws IOException {
        FakeResource atLimit = FakeResource.sized("big.csv", "csv", Pipeline.MAX_RESOURCE_BYTES);
        List<StatusRow> rows = pipeline(filter -> List.of(new FakeDataset("ken-big", atLimit))).run();

        assertEquals(1, atLimit.downloads());
        assertEquals(1, rows.size());
    }

    @Test
    @DisplayName("The run's scratch area is removed afterwards")
    void run_CleansScratch() throws IOException {
        pipeline(filter -> List.of(new FakeDataset("ken-admin", FakeResource.of("admin1.csv", "csv", PCODED_CSV)))).run();

        try (Stream<Path> left = Files.list(tempDir.resolve("scratch"))) {
            assertEquals(0, left.count());
        }
    }

    @Test
    @DisplayName("No datasets still writes a report with just the header")
    void run_NoDatasets_HeaderOnly() throws IOException {
        assertTrue(pipeline(filter -> List.of()).run().isEmpty());
        assertEquals(List.of("dataset name,resource name,format,pcoded,mis_pcoded,error"),
                Files.readAllLines(tempDir.resolve("reports/status.csv")));
    }

    @Test
    @DisplayName("A failed search aborts the run without a report")
    void run_SearchFails_Throws() {
        Pipeline failing = pipeline(filter -> {
            throw new IOException("CKAN unavailable");
        });

        IOException e = assertThrows(IOException.class, failing::run);
        assertEquals("CKAN unavailable", e.getMessage());
        assertFalse(Files.exists(tempDir.resolve("reports/status.csv")));
    }

    @Test
    @DisplayName("fromConfig wires a pipeline from a properties file")
    void fromConfig_Wires() throws IOException {
        Path properties = Files.writeString(tempDir.resolve("location-check.properties"), String.join("\n",
                "Catalog.ckan_url=http://localhost:5000",
                "Paths.scratch_dir=" + tempDir.resolve("scratch"),
                "Paths.report_file=" + tempDir.resolve("report.csv"),
                ""));

        assertNotNull(Pipeline.fromConfig(new ConfigLoader(properties)));
    }
}
