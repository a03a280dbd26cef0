package tabular;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Immutable in-memory sample of a table: column labels, one inferred type per column
 * and the sampled rows. Every row holds exactly one cell per column; missing cells are
 * {@code null}.
 *
 * <p>A table whose header has been reconstructed by {@link HeaderNormalizer} is flagged
 * as header-resolved and is returned unchanged by further normalization.</p>
 */
public final class Table {

    private final List<String> columns;
    private final List<ColumnType> types;
    private final List<List<Object>> rows;
    private final boolean headerResolved;

    public Table(List<String> columns, List<ColumnType> types, List<List<Object>> rows) {
        this(columns, types, rows, false);
    }

    private Table(List<String> columns, List<ColumnType> types, List<List<Object>> rows, boolean headerResolved) {
        Objects.requireNonNull(columns, "columns must not be null");
        Objects.requireNonNull(types, "types must not be null");
        Objects.requireNonNull(rows, "rows must not be null");
        if (columns.size() != types.size()) {
            throw new IllegalArgumentException(String.format(
                    "Column count %d does not match type count %d", columns.size(), types.size()));
        }
        List<List<Object>> rowCopies = new ArrayList<>(rows.size());
        for (List<Object> row : rows) {
            if (row.size() != columns.size()) {
                throw new IllegalArgumentException(String.format(
                        "Row has %d cells but the table has %d columns", row.size(), columns.size()));
            }
            rowCopies.add(Collections.unmodifiableList(new ArrayList<>(row)));
        }
        this.columns = List.copyOf(columns);
        this.types = List.copyOf(types);
        this.rows = Collections.unmodifiableList(rowCopies);
        this.headerResolved = headerResolved;
    }

    /**
     * Builds a table from raw rows, inferring each column's type from its values.
     */
    public static Table fromRows(List<String> columns, List<List<Object>> rows) {
        List<ColumnType> types = new ArrayList<>(columns.size());
        for (int c = 0; c < columns.size(); c++) {
            final int column = c;
            List<Object> values = new ArrayList<>(rows.size());
            rows.forEach(row -> values.add(row.get(column)));
            types.add(Cells.inferType(values));
        }
        return new Table(columns, types, rows);
    }

    public List<String> getColumns() {
        return columns;
    }

    public List<ColumnType> getTypes() {
        return types;
    }

    public List<List<Object>> getRows() {
        return rows;
    }

    public int columnCount() {
        return columns.size();
    }

    public int rowCount() {
        return rows.size();
    }

    public String columnName(int column) {
        return columns.get(column);
    }

    public ColumnType columnType(int column) {
        return types.get(column);
    }

    public Object cell(int row, int column) {
        return rows.get(row).get(column);
    }

    /** Values of one column in row order, missing cells included. */
    public List<Object> columnValues(int column) {
        List<Object> values = new ArrayList<>(rows.size());
        for (List<Object> row : rows) {
            values.add(row.get(column));
        }
        return values;
    }

    public boolean isEmpty() {
        return rows.isEmpty() || columns.isEmpty();
    }

    public boolean isHeaderResolved() {
        return headerResolved;
    }

    /** Same cells and types under new labels. */
    public Table withColumns(List<String> newColumns) {
        return new Table(newColumns, types, rows, headerResolved);
    }

    /** Drops the first {@code count} rows. */
    public Table dropLeadingRows(int count) {
        int from = Math.min(Math.max(count, 0), rows.size());
        return new Table(columns, types, rows.subList(from, rows.size()), headerResolved);
    }

    /** Keeps only the given rows and columns, in the given order. */
    public Table select(List<Integer> rowIndexes, List<Integer> columnIndexes) {
        List<String> keptColumns = new ArrayList<>(columnIndexes.size());
        List<ColumnType> keptTypes = new ArrayList<>(columnIndexes.size());
        for (int c : columnIndexes) {
            keptColumns.add(columns.get(c));
            keptTypes.add(types.get(c));
        }
        List<List<Object>> keptRows = new ArrayList<>(rowIndexes.size());
        for (int r : rowIndexes) {
            List<Object> source = rows.get(r);
            List<Object> row = new ArrayList<>(columnIndexes.size());
            for (int c : columnIndexes) {
                row.add(source.get(c));
            }
            keptRows.add(row);
        }
        return new Table(keptColumns, keptTypes, keptRows, headerResolved);
    }

    public Table markHeaderResolved() {
        return headerResolved ? this : new Table(columns, types, rows, true);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Table)) return false;
        Table that = (Table) o;
        return columns.equals(that.columns) && types.equals(that.types) && rows.equals(that.rows);
    }

    @Override
    public int hashCode() {
        return Objects.hash(columns, types, rows);
    }

    @Override
    public String toString() {
        return "Table{columns=" + columns + ", rows=" + rows.size() + '}';
    }
}
