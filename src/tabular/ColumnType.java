package tabular;

/**
 * Storage type of a sampled column, as inferred by the loader that read it.
 * Only {@link #TEXT} columns are candidates for code matching.
 */
public enum ColumnType {
    TEXT,
    NUMBER,
    BOOLEAN,
    DATETIME,
    BINARY,
    GEOMETRY;

    public boolean isText() {
        return this == TEXT;
    }
}
