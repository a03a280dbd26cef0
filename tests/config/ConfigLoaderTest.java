package config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    private Path write(String content) throws IOException {
        return Files.writeString(tempDir.resolve("location-check.properties"), content);
    }

    private static ConfigLoader load(Path file, Map<String, String> environment) throws IOException {
        return new ConfigLoader(file, environment::get);
    }

    @Test
    @DisplayName("Only the CKAN URL is required, everything else has a default")
    void load_Defaults() throws IOException {
        ConfigLoader config = load(write("Catalog.ckan_url=https://data.humdata.org\n"), Map.of());

        assertEquals("https://data.humdata.org", config.getCkanUrl());
        assertEquals("", config.getCkanApiKey());
        assertFalse(config.isApiKeyFromEnv());
        assertEquals("groups:\"tur\"", config.getSearchFilter());
        assertEquals("LocationExploration", config.getUserAgent());
        assertEquals(1000, config.getPageSize());
        assertEquals("TempLocationExploration", config.getScratchDir().getFileName().toString());
        assertEquals(config.getExecutionDir().resolve("datasets_location_status.csv").normalize(), config.getReportFile());
        assertNull(config.getCountryReference());
        assertFalse(config.isAccumulateGeoLayers());
    }

    @Test
    @DisplayName("Configured values are read, trailing comments stripped and the report directory created")
    void load_ConfiguredValues() throws IOException {
        Path reports = tempDir.resolve("out/reports");
        String content = String.join("\n",
                "Catalog.ckan_url=http://localhost:5000 # local instance",
                "Catalog.api_key=file-key",
                "Catalog.search_filter=groups:\"syr\"",
                "Catalog.user_agent=Tester",
                "Catalog.page_size=50",
                "Paths.scratch_dir=" + tempDir.resolve("scratch").toString().replace("\\", "/"),
                "Paths.report_file=" + reports.resolve("status.csv").toString().replace("\\", "/"),
                "Paths.country_reference=" + tempDir.resolve("countries.csv").toString().replace("\\", "/"),
                "Loading.accumulate_geo_layers=yes",
                "");

        ConfigLoader config = load(write(content), Map.of());

        assertEquals("http://localhost:5000", config.getCkanUrl());
        assertEquals("file-key", config.getCkanApiKey());
        assertEquals("groups:\"syr\"", config.getSearchFilter());
        assertEquals("Tester", config.getUserAgent());
        assertEquals(50, config.getPageSize());
        assertEquals(tempDir.resolve("scratch"), config.getScratchDir());
        assertEquals(reports.resolve("status.csv"), config.getReportFile());
        assertEquals(tempDir.resolve("countries.csv"), config.getCountryReference());
        assertTrue(config.isAccumulateGeoLayers());
        assertTrue(Files.isDirectory(reports));
    }

    @Test
    @DisplayName("CKAN_API_KEY from the environment overrides the file")
    void load_EnvironmentApiKey() throws IOException {
        Path file = write("Catalog.ckan_url=https://data.humdata.org\nCatalog.api_key=file-key\n");

        ConfigLoader config = load(file, Map.of("CKAN_API_KEY", "  env-key  "));

        assertEquals("env-key", config.getCkanApiKey());
        assertTrue(config.isApiKeyFromEnv());
    }

    @Test
    @DisplayName("Missing URL, bad scheme and non-positive page size are rejected")
    void load_InvalidValues() throws IOException {
        assertThrows(IllegalArgumentException.class, () -> load(write("Catalog.api_key=x\n"), Map.of()));
        assertThrows(IllegalArgumentException.class, () -> load(write("Catalog.ckan_url=ftp://example.org\n"), Map.of()));
        assertThrows(IllegalArgumentException.class,
                () -> load(write("Catalog.ckan_url=https://example.org\nCatalog.page_size=0\n"), Map.of()));
        assertThrows(IllegalArgumentException.class,
                () -> load(write("Catalog.ckan_url=https://example.org\nCatalog.page_size=many\n"), Map.of()));
    }

    @Test
    @DisplayName("Unrecognised booleans fall back to false")
    void load_UnknownBoolean_Default() throws IOException {
        ConfigLoader config = load(write("Catalog.ckan_url=https://example.org\nLoading.accumulate_geo_layers=maybe\n"), Map.of());
        assertFalse(config.isAccumulateGeoLayers());
    }

    @Test
    @DisplayName("A missing configuration file is an I/O error")
    void load_MissingFile_Throws() {
        assertThrows(IOException.class, () -> load(tempDir.resolve("absent.properties"), Map.of()));
    }
}
