package classify;

import tabular.Cells;

import java.util.List;
import java.util.function.Predicate;

/**
 * Match counts for the non-missing values of one column.
 *
 * @param matches    values accepted by the pattern test
 * @param mismatches values rejected by it
 */
public record ColumnTally(int matches, int mismatches) {

    /** Largest number of rejected values a column may carry and still qualify. */
    public static final int MISMATCH_TOLERANCE = 5;

    /**
     * Counts the non-missing values of {@code values} accepted by {@code test}.
     * Values are compared in their text form.
     */
    public static ColumnTally of(List<Object> values, Predicate<String> test) {
        int matches = 0;
        int mismatches = 0;
        for (Object value : values) {
            if (Cells.isMissing(value)) {
                continue;
            }
            if (test.test(Cells.toText(value))) {
                matches++;
            } else {
                mismatches++;
            }
        }
        return new ColumnTally(matches, mismatches);
    }

    /** At least one match and no more than {@link #MISMATCH_TOLERANCE} mismatches. */
    public boolean qualifies() {
        return matches > 0 && mismatches <= MISMATCH_TOLERANCE;
    }
}
