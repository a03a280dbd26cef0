package tabular;

import org.slf4j.Logger;
import util.LoggingUtil;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Rebuilds the header of a raw sample so every column carries a unique, meaningful label
 * and only data rows remain.
 *
 * <p>Handles the layouts found in published spreadsheets and CSV files:</p>
 * <ul>
 *   <li>no header read at all (every label is a placeholder): the first row becomes the header;</li>
 *   <li>a human header followed by an HXL tag row: both are merged into one label per column;</li>
 *   <li>a multi-row title block above the data (spreadsheets only): the first rows are merged.</li>
 * </ul>
 * Merged labels join their pieces top to bottom with {@link #HEADER_SEPARATOR}.
 * Stateless and thread-safe.
 */
public final class HeaderNormalizer {

    private static final Logger logger = LoggingUtil.getLogger(HeaderNormalizer.class);

    public static final String HEADER_SEPARATOR = "||";

    static final int TAG_ROW_SCAN_LIMIT = 10;
    static final int DEFAULT_DATA_START = 3;

    private static final Pattern HXL_TAG = Pattern.compile("^#.*", Pattern.DOTALL);

    /**
     * @param raw           the sample as read
     * @param delimitedText whether the sample came from a delimited-text file, whose first
     *                      line is trusted as the header when no tag row exists
     * @return the normalized sample, flagged as header-resolved
     */
    public Table normalize(Table raw, boolean delimitedText) {
        if (raw.isHeaderResolved()) {
            return raw;
        }
        Table table = dropEmptyRowsAndColumns(raw);
        if (table.columnCount() == 0 || table.rowCount() == 0) {
            return table.markHeaderResolved();
        }

        if (table.getColumns().stream().allMatch(Cells::isPlaceholder)) {
            table = promoteFirstRow(table);
        }
        if (!table.getTypes().stream().allMatch(ColumnType::isText)) {
            // typed columns mean the reader already found the header
            return table.markHeaderResolved();
        }
        if (table.rowCount() <= 1) {
            return table.markHeaderResolved();
        }

        int tagRow = findTagRow(table);
        if (tagRow >= 0) {
            logger.debug("HXL tag row found at index {}", tagRow);
            return mergeHeaderRows(table, tagRow + 1);
        }
        if (delimitedText) {
            return table.markHeaderResolved();
        }
        int dataStart = Math.min(DEFAULT_DATA_START, table.rowCount());
        logger.debug("No tag row; merging the first {} row(s) into the header", dataStart);
        return mergeHeaderRows(table, dataStart);
    }

    static Table dropEmptyRowsAndColumns(Table table) {
        List<Integer> keptRows = new ArrayList<>();
        for (int r = 0; r < table.rowCount(); r++) {
            if (!table.getRows().get(r).stream().allMatch(Cells::isMissing)) {
                keptRows.add(r);
            }
        }
        List<Integer> keptColumns = new ArrayList<>();
        for (int c = 0; c < table.columnCount(); c++) {
            for (int r : keptRows) {
                if (!Cells.isMissing(table.cell(r, c))) {
                    keptColumns.add(c);
                    break;
                }
            }
        }
        return table.select(keptRows, keptColumns);
    }

    /** Uses row 0 as the header; empty cells keep a placeholder for their position. */
    static Table promoteFirstRow(Table table) {
        List<String> labels = new ArrayList<>(table.columnCount());
        for (int c = 0; c < table.columnCount(); c++) {
            Object cell = table.cell(0, c);
            labels.add(Cells.isMissing(cell) ? Cells.placeholder(c) : Cells.toText(cell));
        }
        return table.withColumns(Cells.dedupeLabels(labels)).dropLeadingRows(1);
    }

    /**
     * @return index of the first of the leading rows whose cells are all empty or HXL tags,
     *         or -1 when there is none
     */
    static int findTagRow(Table table) {
        int limit = Math.min(TAG_ROW_SCAN_LIMIT, table.rowCount());
        for (int r = 0; r < limit; r++) {
            if (isTagRow(table.getRows().get(r))) {
                return r;
            }
        }
        return -1;
    }

    private static boolean isTagRow(List<Object> row) {
        for (Object cell : row) {
            if (!Cells.isMissing(cell) && !HXL_TAG.matcher(Cells.toText(cell)).matches()) {
                return false;
            }
        }
        return true;
    }

    /**
     * Folds rows {@code [0, dataStart)} into the labels and drops them. A label that is a
     * placeholder is left out of the merge unless nothing else is available.
     */
    private static Table mergeHeaderRows(Table table, int dataStart) {
        List<String> labels = new ArrayList<>(table.columnCount());
        for (int c = 0; c < table.columnCount(); c++) {
            String label = table.columnName(c);
            List<String> parts = new ArrayList<>();
            if (!Cells.isPlaceholder(label)) {
                parts.add(label);
            }
            for (int r = 0; r < dataStart; r++) {
                Object cell = table.cell(r, c);
                if (!Cells.isMissing(cell)) {
                    parts.add(Cells.toText(cell));
                }
            }
            labels.add(parts.isEmpty() ? label : String.join(HEADER_SEPARATOR, parts));
        }
        return table.withColumns(Cells.dedupeLabels(labels))
                .dropLeadingRows(dataStart)
                .markHeaderResolved();
    }
}
