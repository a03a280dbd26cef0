package config;

import util.LoggingUtil;
import org.slf4j.Logger;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.security.CodeSource;
import java.util.Locale;
import java.util.Objects;
import java.util.Properties;
import java.util.function.UnaryOperator;

/**
 * Loads, validates, and provides access to the location check configuration
 * from a properties file. Relative paths are resolved against the application's
 * execution directory; the CKAN API key may be overridden from the environment.
 *
 * This class is final; configuration values are immutable after construction.
 */
public final class ConfigLoader {

    // --- Constants for Property Keys ---
    static final String KEY_CKAN_URL = "Catalog.ckan_url";
    static final String KEY_CKAN_API_KEY = "Catalog.api_key";
    static final String KEY_SEARCH_FILTER = "Catalog.search_filter";
    static final String KEY_USER_AGENT = "Catalog.user_agent";
    static final String KEY_PAGE_SIZE = "Catalog.page_size";
    static final String KEY_SCRATCH_DIR = "Paths.scratch_dir";
    static final String KEY_REPORT_FILE = "Paths.report_file";
    static final String KEY_COUNTRY_REFERENCE = "Paths.country_reference";
    static final String KEY_ACCUMULATE_GEO_LAYERS = "Loading.accumulate_geo_layers";

    static final String ENV_CKAN_API_KEY = "CKAN_API_KEY";

    static final String DEFAULT_SEARCH_FILTER = "groups:\"tur\"";
    static final String DEFAULT_USER_AGENT = "LocationExploration";
    static final int DEFAULT_PAGE_SIZE = 1000;
    static final String DEFAULT_SCRATCH_DIR_NAME = "TempLocationExploration";
    static final String DEFAULT_REPORT_FILE = "datasets_location_status.csv";

    private static final Logger logger = LoggingUtil.getLogger(ConfigLoader.class);

    private final Path configPath;
    private final Properties properties;
    private final Path executionDir;

    private final String ckanUrl;
    private final String ckanApiKey;
    private final boolean apiKeyFromEnv;
    private final String searchFilter;
    private final String userAgent;
    private final int pageSize;
    private final Path scratchDir;
    private final Path reportFile;
    private final Path countryReference; // Optional, null means the bundled table
    private final boolean accumulateGeoLayers;

    public ConfigLoader(Path configPath) throws IOException {
        this(configPath, System::getenv);
    }

    ConfigLoader(Path configPath, UnaryOperator<String> environment) throws IOException {
        this.configPath = Objects.requireNonNull(configPath, "configPath cannot be null").toAbsolutePath();
        Objects.requireNonNull(environment, "environment cannot be null");
        this.properties = new Properties();
        this.executionDir = determineExecutionDirectory();
        logger.info("Resolved execution directory: {}", executionDir);

        if (!Files.isReadable(this.configPath)) {
            String errorMsg = String.format("Configuration file '%s' not found or not readable!", this.configPath);
            logger.error(errorMsg);
            throw new IOException(errorMsg);
        }

        try (InputStream input = new FileInputStream(this.configPath.toFile())) {
            properties.load(input);
            logger.info("Configuration properties loaded from: {}", this.configPath);

            this.ckanUrl = getRequiredProperty(KEY_CKAN_URL);
            String envKey = environment.apply(ENV_CKAN_API_KEY);
            this.apiKeyFromEnv = envKey != null && !envKey.trim().isEmpty();
            this.ckanApiKey = apiKeyFromEnv ? envKey.trim() : getProperty(KEY_CKAN_API_KEY, "");
            this.searchFilter = getProperty(KEY_SEARCH_FILTER, DEFAULT_SEARCH_FILTER);
            this.userAgent = getProperty(KEY_USER_AGENT, DEFAULT_USER_AGENT);
            this.pageSize = getPositiveIntProperty(KEY_PAGE_SIZE, DEFAULT_PAGE_SIZE);
            Path configuredScratch = getOptionalPathProperty(KEY_SCRATCH_DIR);
            this.scratchDir = (configuredScratch != null) ? configuredScratch
                    : Paths.get(System.getProperty("java.io.tmpdir"), DEFAULT_SCRATCH_DIR_NAME).toAbsolutePath();
            Path configuredReport = getOptionalPathProperty(KEY_REPORT_FILE);
            this.reportFile = (configuredReport != null) ? configuredReport : resolvePathProperty(DEFAULT_REPORT_FILE);
            this.countryReference = getOptionalPathProperty(KEY_COUNTRY_REFERENCE);
            this.accumulateGeoLayers = getBooleanProperty(KEY_ACCUMULATE_GEO_LAYERS, false);

            validateUrl(this.ckanUrl, KEY_CKAN_URL);
            validateReportDirectory();
            logLoadedConfiguration();

        } catch (IOException e) {
            String errorMsg = String.format("Error reading configuration file '%s': %s", this.configPath, e.getMessage());
            logger.error(errorMsg, e);
            throw new IOException(errorMsg, e);
        } catch (IllegalArgumentException | IllegalStateException e) {
            String errorMsg = String.format("Invalid configuration in '%s': %s", this.configPath, e.getMessage());
            logger.error(errorMsg, e);
            throw e;
        }
    }

    // --- Helper Methods ---

    private Path determineExecutionDirectory() {
        try {
            CodeSource codeSource = ConfigLoader.class.getProtectionDomain().getCodeSource();
            if (codeSource != null && codeSource.getLocation() != null) {
                Path path = Paths.get(codeSource.getLocation().toURI()).toAbsolutePath();
                if (Files.isDirectory(path)) {
                    logger.debug("Determined execution path (directory): {}", path);
                    return path;
                } else if (Files.isRegularFile(path) && path.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".jar")) {
                    logger.debug("Determined execution path (JAR file): {}", path);
                    return path.getParent();
                } else {
                    logger.warn("CodeSource location is neither a directory nor a JAR file: {}. Falling back to CWD.", path);
                }
            } else {
                logger.warn("Could not get CodeSource location. Falling back to CWD.");
            }
        } catch (URISyntaxException | SecurityException | InvalidPathException e) {
            logger.warn("Could not reliably determine execution directory (Error: {}). Falling back to CWD.", e.getMessage());
        }
        Path cwd = Paths.get(".").toAbsolutePath().normalize();
        logger.info("Execution directory determined via fallback (CWD): {}", cwd);
        return cwd;
    }

    // Values may carry a trailing '#' comment
    private String getProperty(String key, String defaultValue) {
        String value = properties.getProperty(key);
        if (value == null) return defaultValue;

        int commentIndex = value.indexOf(" #");
        if (commentIndex != -1) {
            value = value.substring(0, commentIndex);
        }
        value = value.trim();
        return value.isEmpty() ? defaultValue : value;
    }

    private String getRequiredProperty(String key) throws IllegalArgumentException {
        String value = getProperty(key, null);
        if (value == null) {
            throw new IllegalArgumentException(String.format("Required property '%s' is missing or empty", key));
        }
        return value;
    }

    private Path resolvePathProperty(String value) throws InvalidPathException {
        Path path = Paths.get(value);
        if (path.isAbsolute()) {
            logger.debug("Path '{}' is absolute.", path);
            return path.normalize();
        } else {
            Path resolvedPath = executionDir.resolve(value).normalize();
            logger.debug("Resolved relative path '{}' to '{}' based on execution directory '{}'.", value, resolvedPath, executionDir);
            return resolvedPath;
        }
    }

    private Path getOptionalPathProperty(String key) throws IllegalArgumentException {
        String pathStr = getProperty(key, "");
        if (pathStr.isEmpty()) {
            return null;
        }
        try {
            return resolvePathProperty(pathStr);
        } catch (InvalidPathException e) {
            throw new IllegalArgumentException(String.format("Invalid path format for key '%s': '%s'", key, pathStr), e);
        }
    }

    private int getPositiveIntProperty(String key, int defaultValue) {
        String value = getProperty(key, null);
        if (value == null) {
            return defaultValue;
        }
        try {
            int parsed = Integer.parseInt(value);
            if (parsed < 1) {
                throw new IllegalArgumentException(String.format("Property '%s' must be positive, got %d", key, parsed));
            }
            return parsed;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(String.format("Property '%s' is not a number: '%s'", key, value), e);
        }
    }

    private boolean getBooleanProperty(String key, boolean defaultValue) {
        String value = getProperty(key, null);
        if (value == null) {
            return defaultValue;
        }
        return switch (value.toLowerCase(Locale.ROOT)) {
            case "true", "yes", "1" -> true;
            case "false", "no", "0" -> false;
            default -> {
                logger.warn("Unrecognized boolean value for key '{}': '{}'. Using default: {}", key, value, defaultValue);
                yield defaultValue;
            }
        };
    }

    private void validateUrl(String urlString, String key) throws IllegalArgumentException {
        try {
            URI uri = new URI(urlString);
            String scheme = uri.getScheme();
            if (!"http".equalsIgnoreCase(scheme) && !"https".equalsIgnoreCase(scheme)) {
                throw new IllegalArgumentException(
                        String.format("Invalid URL scheme for key '%s': '%s'. Must be http or https.", key, urlString)
                );
            }
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException(
                    String.format("Invalid URL syntax for key '%s': '%s'", key, urlString), e
            );
        }
    }

    private void validateReportDirectory() throws IOException {
        Path parent = reportFile.getParent();
        if (parent == null) {
            return;
        }
        if (Files.exists(parent) && !Files.isDirectory(parent)) {
            throw new IOException(String.format("Report directory '%s' exists but is not a directory.", parent));
        }
        if (!Files.exists(parent)) {
            logger.warn("Report directory '{}' does not exist. Attempting to create.", parent);
            Files.createDirectories(parent);
        }
        if (!Files.isWritable(parent)) {
            throw new IOException(String.format("Report directory '%s' is not writable.", parent));
        }
    }

    private void logLoadedConfiguration() {
        logger.info("--- Loaded Configuration Summary ---");
        logger.info("{}: {}", KEY_CKAN_URL, ckanUrl);
        logger.info("CKAN API Key Source: {}", apiKeyFromEnv ? "Environment Variable (" + ENV_CKAN_API_KEY + ")"
                : (ckanApiKey.isEmpty() ? "none" : "Config File (" + KEY_CKAN_API_KEY + ")"));
        logger.info("{}: {}", KEY_SEARCH_FILTER, searchFilter);
        logger.info("{}: {}", KEY_USER_AGENT, userAgent);
        logger.info("{}: {}", KEY_PAGE_SIZE, pageSize);
        logger.info("{}: {}", KEY_SCRATCH_DIR, scratchDir);
        logger.info("{}: {}", KEY_REPORT_FILE, reportFile);
        logger.info("{}: {}", KEY_COUNTRY_REFERENCE, countryReference != null ? countryReference : "bundled");
        logger.info("{}: {}", KEY_ACCUMULATE_GEO_LAYERS, accumulateGeoLayers);
        logger.info("--- End Configuration Summary ---");
    }

    // --- Public Getters ---
    public Path getConfigPath() { return configPath; }
    public String getCkanUrl() { return ckanUrl; }
    public String getCkanApiKey() { return ckanApiKey; }
    public boolean isApiKeyFromEnv() { return apiKeyFromEnv; }
    public String getSearchFilter() { return searchFilter; }
    public String getUserAgent() { return userAgent; }
    public int getPageSize() { return pageSize; }
    public Path getScratchDir() { return scratchDir; }
    public Path getReportFile() { return reportFile; }
    public Path getCountryReference() { return countryReference; }
    public boolean isAccumulateGeoLayers() { return accumulateGeoLayers; }
    public Path getExecutionDir() { return executionDir; }
}
