package tabular;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Static helpers shared by the loaders and the header normalizer: missing-value tests,
 * cell-to-text conversion, column type inference and column label handling.
 */
public final class Cells {

    /** Prefix given to columns whose header cell was empty. */
    public static final String PLACEHOLDER_PREFIX = "Unnamed";

    private static final Pattern PLACEHOLDER = Pattern.compile("^" + PLACEHOLDER_PREFIX + ".*");
    private static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private Cells() {
        throw new UnsupportedOperationException("Utility class - cannot be instantiated");
    }

    /** A cell is missing when it holds nothing or an empty string. */
    public static boolean isMissing(Object value) {
        return value == null || (value instanceof String && ((String) value).isEmpty());
    }

    /**
     * Renders a cell the way it reads in the source file: whole doubles keep a trailing
     * {@code .0}, booleans are {@code True}/{@code False}, timestamps use a space separator.
     *
     * @return the text, or {@code null} for a missing cell
     */
    public static String toText(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof String) {
            return (String) value;
        }
        if (value instanceof Double || value instanceof Float) {
            return doubleToText(((Number) value).doubleValue());
        }
        if (value instanceof Number) {
            return value.toString();
        }
        if (value instanceof Boolean) {
            return ((Boolean) value) ? "True" : "False";
        }
        if (value instanceof LocalDateTime) {
            return TIMESTAMP_FORMAT.format((TemporalAccessor) value);
        }
        if (value instanceof LocalDate) {
            return value.toString();
        }
        return String.valueOf(value);
    }

    private static String doubleToText(double d) {
        if (Double.isNaN(d) || Double.isInfinite(d)) {
            return Double.toString(d);
        }
        double abs = Math.abs(d);
        if (d == Math.rint(d) && abs < 1e16) {
            return (long) d + ".0";
        }
        if (abs >= 1e-4 && abs < 1e16) {
            return BigDecimal.valueOf(d).stripTrailingZeros().toPlainString();
        }
        return Double.toString(d);
    }

    /**
     * Infers the storage type of a column from its values. All-missing columns are numeric,
     * mixed columns fall back to text.
     */
    public static ColumnType inferType(List<?> values) {
        boolean sawValue = false;
        boolean numbers = true;
        boolean booleans = true;
        boolean temporals = true;
        for (Object value : values) {
            if (isMissing(value)) {
                continue;
            }
            sawValue = true;
            numbers &= value instanceof Number;
            booleans &= value instanceof Boolean;
            temporals &= value instanceof TemporalAccessor;
        }
        if (!sawValue || numbers) {
            return ColumnType.NUMBER;
        }
        if (booleans) {
            return ColumnType.BOOLEAN;
        }
        if (temporals) {
            return ColumnType.DATETIME;
        }
        return ColumnType.TEXT;
    }

    public static boolean isPlaceholder(String label) {
        return label != null && PLACEHOLDER.matcher(label).matches();
    }

    /** Placeholder label for the column at {@code index}. */
    public static String placeholder(int index) {
        return PLACEHOLDER_PREFIX + ": " + index;
    }

    /**
     * Makes labels unique by suffixing repeats with {@code .1}, {@code .2}, ... in order of
     * appearance, skipping suffixes already in use.
     */
    public static List<String> dedupeLabels(List<String> labels) {
        Set<String> taken = new HashSet<>();
        List<String> unique = new ArrayList<>(labels.size());
        for (String label : labels) {
            String candidate = label;
            int suffix = 1;
            while (taken.contains(candidate)) {
                candidate = label + "." + suffix++;
            }
            taken.add(candidate);
            unique.add(candidate);
        }
        return unique;
    }
}
