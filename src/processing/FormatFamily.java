package processing;

/**
 * Reader families. Each family has one loader in {@link SampledTableLoader}'s dispatch table.
 */
public enum FormatFamily {
    /** Workbooks; every sheet is a separate sample. */
    SPREADSHEET(true, false),
    /** Delimited text with a header line. */
    DELIMITED_TEXT(true, false),
    /** Vector files holding one feature table. */
    SINGLE_LAYER_GEO(false, true),
    /** Containers holding several named layers. */
    MULTI_LAYER_GEO(false, true);

    private final boolean tabular;
    private final boolean geo;

    FormatFamily(boolean tabular, boolean geo) {
        this.tabular = tabular;
        this.geo = geo;
    }

    /** Whether raw samples need their header reconstructed. */
    public boolean isTabular() {
        return tabular;
    }

    /** Whether each read replaces the samples of previous candidates. */
    public boolean isGeo() {
        return geo;
    }
}
