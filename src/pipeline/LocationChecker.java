package pipeline;

import classify.LatLongClassifier;
import classify.PcodeClassifier;
import client.IDatasetHandle;
import client.IResourceHandle;
import org.slf4j.Logger;
import processing.ArchiveResolver;
import processing.Candidate;
import processing.FileType;
import processing.FormatFamily;
import processing.LocationExceptions.DownloadException;
import processing.LocationExceptions.LocationCheckException;
import processing.LocationExceptions.UnsupportedFormatException;
import processing.SampledTableLoader;
import processing.SampledTableLoader.LoadResult;
import tabular.HeaderNormalizer;
import tabular.SampleSet;
import util.LoggingUtil;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Decides whether a dataset, or a single resource, carries pcode or latitude/longitude
 * columns. Resources are examined in listing order; the first pcode match ends the scan
 * and the first download, extraction or unrecoverable read failure ends it with an error.
 * Every check works in its own scratch directory, removed when the check returns.
 */
public final class LocationChecker {

    private static final Logger logger = LoggingUtil.getLogger(LocationChecker.class);

    private final PcodeClassifier pcodeClassifier;
    private final LatLongClassifier latLongClassifier;
    private final HeaderNormalizer headerNormalizer;
    private final ArchiveResolver archiveResolver;
    private final SampledTableLoader tableLoader;

    public LocationChecker(PcodeClassifier pcodeClassifier, LatLongClassifier latLongClassifier,
                           HeaderNormalizer headerNormalizer, ArchiveResolver archiveResolver,
                           SampledTableLoader tableLoader) {
        this.pcodeClassifier = Objects.requireNonNull(pcodeClassifier, "pcodeClassifier must not be null");
        this.latLongClassifier = Objects.requireNonNull(latLongClassifier, "latLongClassifier must not be null");
        this.headerNormalizer = Objects.requireNonNull(headerNormalizer, "headerNormalizer must not be null");
        this.archiveResolver = Objects.requireNonNull(archiveResolver, "archiveResolver must not be null");
        this.tableLoader = Objects.requireNonNull(tableLoader, "tableLoader must not be null");
    }

    /** Checks every resource of {@code dataset}, working below {@code scratchRoot}. */
    public LocationVerdict checkLocation(IDatasetHandle dataset, Path scratchRoot) {
        return check(dataset.getName(), dataset.getFileTypes(), dataset.getResources(), scratchRoot);
    }

    /** Checks one resource as if it were the only one of its dataset. */
    public LocationVerdict checkResource(IResourceHandle resource, Path scratchRoot) {
        return check(resource.getName(), List.of(resource.getFileType()), List.of(resource), scratchRoot);
    }

    static void requireCheckableTypes(List<String> fileTypes) throws UnsupportedFormatException {
        if (fileTypes.stream().noneMatch(FileType::isAllowed)) {
            throw new UnsupportedFormatException();
        }
    }

    private LocationVerdict check(String subject, List<String> fileTypes, List<IResourceHandle> resources, Path scratchRoot) {
        try {
            requireCheckableTypes(fileTypes);
        } catch (UnsupportedFormatException e) {
            logger.info("[{}] None of the file types {} can be checked", subject, fileTypes);
            return LocationVerdict.unknown(e.getMessage());
        }

        Boolean pcoded = null;
        Boolean latLonged = null;
        String error = null;
        try (ScratchDirectory scratch = ScratchDirectory.create(scratchRoot)) {
            for (IResourceHandle resource : resources) {
                Optional<FileType> declared = FileType.fromDeclared(resource.getFileType());
                if (declared.isEmpty()) {
                    logger.debug("[{}] Skipping resource {} of type '{}'", subject, resource.getName(), resource.getFileType());
                    continue;
                }
                FileType type = declared.get();
                logger.info("Checking {}", resource.getName());

                List<Candidate> candidates;
                try {
                    Path file = download(resource, scratch.path());
                    candidates = archiveResolver.resolve(file, type, resource.getName(), scratch.path());
                } catch (LocationCheckException e) {
                    logger.warn("[{}] {}", resource.getName(), e.getMessage(), e);
                    return new LocationVerdict(pcoded, latLonged, e.getMessage());
                }

                LoadResult loaded = tableLoader.load(candidates, type);
                if (loaded.hasError()) {
                    error = loaded.error();
                    if (loaded.samples().isEmpty()) {
                        return new LocationVerdict(pcoded, latLonged, error);
                    }
                }
                SampleSet samples = normalize(loaded.samples(), type);

                if (pcodeClassifier.hasPcode(samples)) {
                    logger.info("[{}] Pcode column found in {}", subject, resource.getName());
                    pcoded = Boolean.TRUE;
                    break;
                }
                if (!Boolean.TRUE.equals(latLonged) && type.hasCoordinateColumns()
                        && latLongClassifier.hasLatLong(samples)) {
                    logger.info("[{}] Latitude and longitude columns found in {}", subject, resource.getName());
                    latLonged = Boolean.TRUE;
                }
            }
        } catch (IOException e) {
            logger.error("[{}] Could not create a scratch directory below {}: {}", subject, scratchRoot, e.getMessage(), e);
            return new LocationVerdict(pcoded, latLonged, "Could not create scratch directory " + scratchRoot);
        }

        if (error == null) {
            if (!Boolean.TRUE.equals(pcoded)) {
                pcoded = Boolean.FALSE;
            }
            if (Boolean.FALSE.equals(pcoded) && !Boolean.TRUE.equals(latLonged)) {
                latLonged = Boolean.FALSE;
            }
        }
        return new LocationVerdict(pcoded, latLonged, error);
    }

    private static Path download(IResourceHandle resource, Path folder) throws DownloadException {
        try {
            return resource.download(folder);
        } catch (IOException e) {
            throw DownloadException.forResource(resource.getName(), e);
        }
    }

    private SampleSet normalize(SampleSet samples, FileType type) {
        FormatFamily family = type.getFamily();
        if (!family.isTabular()) {
            return samples;
        }
        boolean delimitedText = family == FormatFamily.DELIMITED_TEXT;
        return samples.map(table -> headerNormalizer.normalize(table, delimitedText));
    }
}
