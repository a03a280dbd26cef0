package processing;

import org.slf4j.Logger;
import processing.LocationExceptions.ReadException;
import tabular.ColumnType;
import tabular.Table;
import util.LoggingUtil;

import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Properties;
import java.util.Set;

/**
 * Reads OGC GeoPackage files through the SQLite JDBC driver. Layers are the feature and
 * attribute tables registered in {@code gpkg_contents}; geometry columns come from
 * {@code gpkg_geometry_columns}.
 */
final class GeoPackageContainer implements IGeoContainer {

    private static final Logger logger = LoggingUtil.getLogger(GeoPackageContainer.class);

    private static final String LIST_LAYERS =
            "SELECT table_name FROM gpkg_contents WHERE data_type IN ('features', 'attributes') ORDER BY rowid";
    private static final String GEOMETRY_COLUMNS =
            "SELECT column_name FROM gpkg_geometry_columns WHERE table_name = ?";

    @Override
    public List<String> listLayers(Path container) throws ReadException {
        try (Connection connection = open(container);
             Statement statement = connection.createStatement();
             ResultSet rs = statement.executeQuery(LIST_LAYERS)) {
            List<String> layers = new ArrayList<>();
            while (rs.next()) {
                layers.add(rs.getString(1));
            }
            logger.debug("GeoPackage {} lists {} layer(s): {}", container.getFileName(), layers.size(), layers);
            return layers;
        } catch (SQLException e) {
            throw ReadException.forFile(String.valueOf(container.getFileName()), e);
        }
    }

    @Override
    public Table readLayer(Path container, String layer, int maxRows) throws ReadException {
        try (Connection connection = open(container)) {
            if (!listLayers(container).contains(layer)) {
                throw new ReadException("Unable to read resource " + layer);
            }
            Set<String> geometryColumns = geometryColumns(connection, layer);

            List<String> columns = new ArrayList<>();
            List<ColumnType> types = new ArrayList<>();
            try (Statement statement = connection.createStatement();
                 ResultSet info = statement.executeQuery("PRAGMA table_info(" + quote(layer) + ")")) {
                while (info.next()) {
                    String name = info.getString("name");
                    columns.add(name);
                    types.add(geometryColumns.contains(name) ? ColumnType.GEOMETRY : typeOf(info.getString("type")));
                }
            }

            List<List<Object>> rows = new ArrayList<>();
            String select = "SELECT * FROM " + quote(layer) + " LIMIT " + maxRows;
            try (Statement statement = connection.createStatement();
                 ResultSet rs = statement.executeQuery(select)) {
                while (rs.next()) {
                    List<Object> row = new ArrayList<>(columns.size());
                    for (int c = 0; c < columns.size(); c++) {
                        row.add(convert(rs.getObject(c + 1), types.get(c)));
                    }
                    rows.add(row);
                }
            }
            return new Table(columns, types, rows);
        } catch (SQLException e) {
            throw ReadException.forFile(layer, e);
        }
    }

    private static Connection open(Path container) throws SQLException, ReadException {
        if (!Files.isRegularFile(container)) {
            throw new ReadException("Unable to read resource " + container.getFileName());
        }
        Properties properties = new Properties();
        properties.setProperty("open_mode", "1");
        return DriverManager.getConnection("jdbc:sqlite:" + container.toAbsolutePath(), properties);
    }

    private static Set<String> geometryColumns(Connection connection, String layer) throws SQLException {
        Set<String> names = new HashSet<>();
        try (PreparedStatement statement = connection.prepareStatement(GEOMETRY_COLUMNS)) {
            statement.setString(1, layer);
            try (ResultSet rs = statement.executeQuery()) {
                while (rs.next()) {
                    names.add(rs.getString(1));
                }
            }
        } catch (SQLException e) {
            // attribute-only packages may omit the table
            logger.debug("No gpkg_geometry_columns for layer {}: {}", layer, e.getMessage());
        }
        return names;
    }

    static ColumnType typeOf(String declared) {
        String type = (declared == null) ? "" : declared.trim().toUpperCase(Locale.ROOT);
        if (type.startsWith("TEXT")) {
            return ColumnType.TEXT;
        }
        switch (type) {
            case "INTEGER", "INT", "MEDIUMINT", "SMALLINT", "TINYINT", "REAL", "DOUBLE", "FLOAT":
                return ColumnType.NUMBER;
            case "BOOLEAN":
                return ColumnType.BOOLEAN;
            case "DATE", "DATETIME":
                return ColumnType.DATETIME;
            case "BLOB":
                return ColumnType.BINARY;
            default:
                return ColumnType.TEXT;
        }
    }

    private static Object convert(Object value, ColumnType type) {
        if (value == null) {
            return null;
        }
        if (type == ColumnType.BOOLEAN && value instanceof Number) {
            return ((Number) value).intValue() != 0;
        }
        if (type == ColumnType.TEXT && !(value instanceof String)) {
            return String.valueOf(value);
        }
        return value;
    }

    private static String quote(String identifier) {
        return "\"" + identifier.replace("\"", "\"\"") + "\"";
    }
}
