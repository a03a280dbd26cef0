package pipeline;

import classify.LatLongClassifier;
import classify.PcodeClassifier;
import client.CkanHandler;
import client.ICatalog;
import client.IDatasetHandle;
import client.IResourceHandle;
import config.ConfigLoader;
import org.slf4j.Logger;
import processing.ArchiveResolver;
import processing.FileType;
import processing.SampledTableLoader;
import reference.CountryReference;
import reference.CountryReferenceLoader;
import tabular.HeaderNormalizer;
import util.LoggingUtil;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Runs one location-check pass over a catalog: searches the datasets, checks each
 * resource on its own and writes one status row per resource.
 * This class is final and not intended for subclassing.
 */
public final class Pipeline {

    private static final Logger logger = LoggingUtil.getLogger(Pipeline.class);

    /** Resources declared larger than this are never downloaded. */
    public static final long MAX_RESOURCE_BYTES = 1073741824L;

    static final String SKIP_FORMAT = "Not checking format";
    static final String SKIP_SIZE = "Not checking files of this size";

    private final ICatalog catalog;
    private final LocationChecker checker;
    private final StatusReportWriter reportWriter;
    private final String searchFilter;
    private final Path scratchDir;
    private final Path reportFile;

    private int datasetsFound = 0;
    private int resourcesChecked = 0;
    private int resourcesSkipped = 0;
    private int resourcesFailed = 0;

    public Pipeline(ICatalog catalog, LocationChecker checker, StatusReportWriter reportWriter,
                    String searchFilter, Path scratchDir, Path reportFile) {
        this.catalog = Objects.requireNonNull(catalog, "catalog cannot be null");
        this.checker = Objects.requireNonNull(checker, "checker cannot be null");
        this.reportWriter = Objects.requireNonNull(reportWriter, "reportWriter cannot be null");
        this.searchFilter = searchFilter;
        this.scratchDir = Objects.requireNonNull(scratchDir, "scratchDir cannot be null");
        this.reportFile = Objects.requireNonNull(reportFile, "reportFile cannot be null");
    }

    /**
     * Wires the CKAN client, the country reference and the readers from the configuration.
     *
     * @throws IOException if the country reference cannot be loaded
     */
    public static Pipeline fromConfig(ConfigLoader config) throws IOException {
        Objects.requireNonNull(config, "ConfigLoader cannot be null");
        CkanHandler ckanHandler = new CkanHandler(config.getCkanUrl(), config.getCkanApiKey(),
                config.getUserAgent(), config.getPageSize());
        CountryReference countries = CountryReferenceLoader.load(config.getCountryReference());
        LocationChecker checker = new LocationChecker(
                new PcodeClassifier(countries),
                new LatLongClassifier(),
                new HeaderNormalizer(),
                new ArchiveResolver(),
                new SampledTableLoader(config.isAccumulateGeoLayers()));
        logger.info("Pipeline initialized.");
        return new Pipeline(ckanHandler, checker, new StatusReportWriter(),
                config.getSearchFilter(), config.getScratchDir(), config.getReportFile());
    }

    /**
     * Checks every resource of every dataset matching the search filter and writes the report.
     *
     * @return the rows written, in dataset and resource listing order
     * @throws IOException if the catalog cannot be searched or the report cannot be written
     */
    public List<StatusRow> run() throws IOException {
        Instant runStartTime = Instant.now();
        logger.info("==================================================");
        logger.info("--- Starting Location Check Run ---");
        logger.info("Timestamp: {}", LocalDateTime.now().format(DateTimeFormatter.ISO_DATE_TIME));
        logger.info("Search filter: {}", searchFilter);
        logger.info("==================================================");

        datasetsFound = 0;
        resourcesChecked = 0;
        resourcesSkipped = 0;
        resourcesFailed = 0;
        List<StatusRow> rows = new ArrayList<>();

        try (ScratchDirectory runScratch = ScratchDirectory.create(scratchDir)) {
            List<IDatasetHandle> datasets = catalog.searchDatasets(searchFilter);
            datasetsFound = datasets.size();
            logger.info("Found {} datasets", datasets.size());

            for (IDatasetHandle dataset : datasets) {
                logger.info("Checking {}", dataset.getName());
                for (IResourceHandle resource : dataset.getResources()) {
                    rows.add(checkResource(dataset, resource, runScratch.path()));
                }
            }
            reportWriter.write(reportFile, rows);
        } catch (IOException e) {
            logger.error("Location check run aborted: {}", e.getMessage(), e);
            throw e;
        } finally {
            logRunSummary(Duration.between(runStartTime, Instant.now()));
        }
        return Collections.unmodifiableList(rows);
    }

    private StatusRow checkResource(IDatasetHandle dataset, IResourceHandle resource, Path scratchRoot) {
        String format = resource.getFileType();
        if (!FileType.isAllowed(format)) {
            logger.debug("Not checking {} of format '{}'", resource.getName(), format);
            resourcesSkipped++;
            return StatusRow.skipped(dataset.getName(), resource.getName(), format, SKIP_FORMAT);
        }
        Long size = resource.getSize();
        if (size != null && size > MAX_RESOURCE_BYTES) {
            logger.info("Not checking {}: {} bytes exceeds the size limit", resource.getName(), size);
            resourcesSkipped++;
            return StatusRow.skipped(dataset.getName(), resource.getName(), format, SKIP_SIZE);
        }

        LocationVerdict verdict = checker.checkResource(resource, scratchRoot);
        resourcesChecked++;
        if (verdict.hasError()) {
            resourcesFailed++;
        }
        logger.debug("{} / {}: pcoded={}, latlong={}, error={}", dataset.getName(), resource.getName(),
                verdict.pcoded(), verdict.latLonged(), verdict.error());
        return StatusRow.checked(dataset.getName(), resource.getName(), format, verdict);
    }

    private void logRunSummary(Duration runDuration) {
        logger.info("==================================================");
        logger.info("--- Location Check Run Summary ---");
        logger.info("Datasets found    : {}", datasetsFound);
        logger.info("Resources checked : {}", resourcesChecked);
        logger.info("Resources skipped : {}", resourcesSkipped);
        logger.info("Checks with errors: {}", resourcesFailed);
        double durationSeconds = runDuration.toMillis() / 1000.0;
        logger.info("Total Duration    : {} seconds.", String.format("%.3f", durationSeconds));
        logger.info("==================================================");
    }
}
