package processing;

import java.util.Arrays;
import java.util.Optional;

/**
 * The file types that can be checked, with the extension searched for inside archives and
 * the reader family used to load them. Declared names are matched case-sensitively.
 */
public enum FileType {
    CSV("csv", "csv", FormatFamily.DELIMITED_TEXT, true),
    GEODATABASE("geodatabase", "gdb", FormatFamily.MULTI_LAYER_GEO, false),
    GEOJSON("geojson", "geojson", FormatFamily.SINGLE_LAYER_GEO, false),
    GEOPACKAGE("geopackage", "gpkg", FormatFamily.MULTI_LAYER_GEO, false),
    JSON("json", "json", FormatFamily.SINGLE_LAYER_GEO, true),
    SHP("shp", "shp", FormatFamily.SINGLE_LAYER_GEO, false),
    TOPOJSON("topojson", "topojson", FormatFamily.SINGLE_LAYER_GEO, false),
    XLS("xls", "xls", FormatFamily.SPREADSHEET, true),
    XLSX("xlsx", "xlsx", FormatFamily.SPREADSHEET, true);

    private final String declaredName;
    private final String extension;
    private final FormatFamily family;
    private final boolean coordinateColumns;

    FileType(String declaredName, String extension, FormatFamily family, boolean coordinateColumns) {
        this.declaredName = declaredName;
        this.extension = extension;
        this.family = family;
        this.coordinateColumns = coordinateColumns;
    }

    /** Name as declared in the catalog, e.g. {@code geodatabase}. */
    public String getDeclaredName() {
        return declaredName;
    }

    /** File suffix without the dot, e.g. {@code gdb}. */
    public String getExtension() {
        return extension;
    }

    public FormatFamily getFamily() {
        return family;
    }

    /** Whether coordinates live in ordinary text columns and are worth a lat/long check. */
    public boolean hasCoordinateColumns() {
        return coordinateColumns;
    }

    public static Optional<FileType> fromDeclared(String declaredName) {
        if (declaredName == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(t -> t.declaredName.equals(declaredName))
                .findFirst();
    }

    public static boolean isAllowed(String declaredName) {
        return fromDeclared(declaredName).isPresent();
    }
}
