package classify;

import org.slf4j.Logger;
import reference.CountryReference;
import tabular.HeaderNormalizer;
import tabular.SampleSet;
import tabular.Table;
import util.LoggingUtil;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Detects administrative p-code columns: text columns whose header reads like a p-code
 * header and whose values mostly start with a country code followed by digits.
 *
 * <p>The value pattern is built once from the country reference passed in.</p>
 */
public final class PcodeClassifier {

    private static final Logger logger = LoggingUtil.getLogger(PcodeClassifier.class);

    static final Pattern HEADER_PATTERN = Pattern.compile(
            "((adm)?.*p?.?cod.*)|(#\\s?adm\\s?\\d?\\+?\\s?p?(code)?)",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern LABEL_SPLITTER = Pattern.compile(Pattern.quote(HeaderNormalizer.HEADER_SEPARATOR));

    private final Pattern valuePattern;

    public PcodeClassifier(CountryReference countries) {
        Objects.requireNonNull(countries, "countries must not be null");
        if (countries.isEmpty()) {
            throw new IllegalArgumentException("Country reference must not be empty");
        }
        List<String> codes = new ArrayList<>(countries.iso3Codes());
        codes.addAll(countries.iso2Codes());
        List<String> quoted = new ArrayList<>(codes.size());
        codes.forEach(code -> quoted.add(Pattern.quote(code)));
        this.valuePattern = Pattern.compile("(" + String.join("|", quoted) + ")\\d+", Pattern.CASE_INSENSITIVE);
        logger.debug("Built p-code pattern from {} country codes", codes.size());
    }

    /** @return true as soon as one sample holds a qualifying p-code column */
    public boolean hasPcode(SampleSet samples) {
        for (Table table : samples.tables()) {
            if (hasPcodeColumn(table)) {
                return true;
            }
        }
        return false;
    }

    boolean hasPcodeColumn(Table table) {
        for (int c = 0; c < table.columnCount(); c++) {
            if (!table.columnType(c).isText() || !isPcodeHeader(table.columnName(c))) {
                continue;
            }
            ColumnTally tally = ColumnTally.of(table.columnValues(c), this::isPcode);
            logger.debug("P-code candidate '{}': {} match(es), {} mismatch(es)",
                    table.columnName(c), tally.matches(), tally.mismatches());
            if (tally.qualifies()) {
                return true;
            }
        }
        return false;
    }

    /** Whether any of the merged label's pieces reads like a p-code header. */
    static boolean isPcodeHeader(String label) {
        for (String piece : LABEL_SPLITTER.split(label)) {
            if (HEADER_PATTERN.matcher(piece).lookingAt()) {
                return true;
            }
        }
        return false;
    }

    boolean isPcode(String value) {
        return valuePattern.matcher(value).lookingAt();
    }
}
