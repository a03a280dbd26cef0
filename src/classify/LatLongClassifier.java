package classify;

import org.slf4j.Logger;
import tabular.HeaderNormalizer;
import tabular.SampleSet;
import tabular.Table;
import util.LoggingUtil;

import java.util.regex.Pattern;

/**
 * Detects coordinate columns. A sample counts as lat/long-coded once it holds both a
 * latitude column and a longitude column whose values mostly parse as coordinates. The
 * two roles may be met by different columns or by one column matching both headers.
 */
public final class LatLongClassifier {

    private static final Logger logger = LoggingUtil.getLogger(LatLongClassifier.class);

    static final Pattern LATITUDE_HEADER = Pattern.compile(
            "(.*latitude?.*)|(lat)|((point.?)?y)|(#\\s?geo\\s?\\+\\s?lat)",
            Pattern.CASE_INSENSITIVE);
    static final Pattern LONGITUDE_HEADER = Pattern.compile(
            "(.*longitude?.*)|(lon(g)?)|((point.?)?x)|(#\\s?geo\\s?\\+\\s?lon)",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern LABEL_SPLITTER = Pattern.compile(Pattern.quote(HeaderNormalizer.HEADER_SEPARATOR));

    /** @return true as soon as one sample has both roles confirmed */
    public boolean hasLatLong(SampleSet samples) {
        for (Table table : samples.tables()) {
            if (hasLatLongColumns(table)) {
                return true;
            }
        }
        return false;
    }

    boolean hasLatLongColumns(Table table) {
        boolean latitude = false;
        boolean longitude = false;
        for (int c = 0; c < table.columnCount(); c++) {
            String label = table.columnName(c);
            boolean latitudeHeader = headerMatches(LATITUDE_HEADER, label);
            boolean longitudeHeader = headerMatches(LONGITUDE_HEADER, label);
            if (latitudeHeader && !latitude) {
                ColumnTally tally = ColumnTally.of(table.columnValues(c), CoordinatePatterns::isLatitude);
                logger.debug("Latitude candidate '{}': {} match(es), {} mismatch(es)", label, tally.matches(), tally.mismatches());
                latitude = tally.qualifies();
            }
            if (longitudeHeader && !longitude) {
                ColumnTally tally = ColumnTally.of(table.columnValues(c), CoordinatePatterns::isLongitude);
                logger.debug("Longitude candidate '{}': {} match(es), {} mismatch(es)", label, tally.matches(), tally.mismatches());
                longitude = tally.qualifies();
            }
            if (latitude && longitude) {
                return true;
            }
        }
        return false;
    }

    static boolean headerMatches(Pattern header, String label) {
        for (String piece : LABEL_SPLITTER.split(label)) {
            if (header.matcher(piece).lookingAt()) {
                return true;
            }
        }
        return false;
    }
}
