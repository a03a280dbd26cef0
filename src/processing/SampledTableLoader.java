package processing;

import org.slf4j.Logger;
import processing.LocationExceptions.ReadException;
import tabular.SampleSet;
import tabular.Table;
import util.LoggingUtil;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Reads capped samples from every candidate of a resource, dispatching on the format
 * family of the declared type. A candidate that fails is recorded and skipped; the
 * message of the last failure is returned with whatever was read.
 */
public final class SampledTableLoader {

    private static final Logger logger = LoggingUtil.getLogger(SampledTableLoader.class);

    /** Rows read from each sheet, layer or file. */
    public static final int MAX_SAMPLE_ROWS = 100;

    /**
     * Samples read from one resource and the last read failure, if any.
     *
     * @param samples tables read, never null
     * @param error   message of the last failed candidate, or {@code null}
     */
    public record LoadResult(SampleSet samples, String error) {
        public LoadResult {
            Objects.requireNonNull(samples, "samples must not be null");
        }

        public boolean hasError() {
            return error != null;
        }
    }

    private final Map<FormatFamily, ITableLoader> loaders;
    private final boolean accumulateGeoLayers;

    public SampledTableLoader() {
        this(false);
    }

    /**
     * @param accumulateGeoLayers keep the samples of every geo candidate instead of only
     *                            the last one read
     */
    public SampledTableLoader(boolean accumulateGeoLayers) {
        this(defaultLoaders(), accumulateGeoLayers);
    }

    SampledTableLoader(Map<FormatFamily, ITableLoader> loaders, boolean accumulateGeoLayers) {
        this.loaders = Objects.requireNonNull(loaders, "loaders must not be null");
        this.accumulateGeoLayers = accumulateGeoLayers;
    }

    static Map<FormatFamily, ITableLoader> defaultLoaders() {
        Map<FormatFamily, ITableLoader> map = new EnumMap<>(FormatFamily.class);
        map.put(FormatFamily.SPREADSHEET, new SpreadsheetLoader());
        map.put(FormatFamily.DELIMITED_TEXT, new DelimitedTextLoader());
        map.put(FormatFamily.SINGLE_LAYER_GEO, new SingleLayerGeoLoader());
        map.put(FormatFamily.MULTI_LAYER_GEO, new MultiLayerGeoLoader(ArchiveResolver.defaultContainers()));
        return map;
    }

    public LoadResult load(List<Candidate> candidates, FileType type) {
        Objects.requireNonNull(candidates, "candidates must not be null");
        Objects.requireNonNull(type, "type must not be null");
        ITableLoader loader = loaders.get(type.getFamily());

        SampleSet samples = new SampleSet();
        String error = null;
        for (Candidate candidate : candidates) {
            List<Table> tables;
            try {
                if (loader == null) {
                    throw new ReadException(ReadException.messageFor(candidate.displayName()));
                }
                tables = loader.read(candidate, type, MAX_SAMPLE_ROWS);
            } catch (ReadException e) {
                logger.warn("Could not read {} as {}: {}", candidate, type.getDeclaredName(),
                        e.getCause() != null ? e.getCause().getMessage() : e.getMessage());
                error = e.getMessage();
                continue;
            } catch (RuntimeException e) {
                // reader libraries signal corrupt input with unchecked exceptions too
                logger.warn("Could not read {} as {}", candidate, type.getDeclaredName(), e);
                error = ReadException.messageFor(candidate.displayName());
                continue;
            }
            if (type.getFamily().isGeo() && !accumulateGeoLayers) {
                samples = new SampleSet();
            }
            tables.forEach(samples::add);
            logger.debug("{} table(s) sampled from {}", tables.size(), candidate);
        }
        return new LoadResult(samples, error);
    }
}
