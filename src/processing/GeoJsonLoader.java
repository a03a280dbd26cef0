package processing;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import processing.LocationExceptions.ReadException;
import tabular.Cells;
import tabular.ColumnType;
import tabular.Table;
import util.LoggingUtil;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Reads the attribute table of GeoJSON and TopoJSON documents with Jackson. Each feature's
 * {@code properties} become a row; the geometry is kept as an opaque trailing column.
 * For TopoJSON only the first object of the topology is read.
 */
final class GeoJsonLoader implements ITableLoader {

    private static final Logger logger = LoggingUtil.getLogger(GeoJsonLoader.class);

    static final String GEOMETRY_COLUMN = "geometry";

    private final ObjectMapper objectMapper;

    GeoJsonLoader() {
        this(new ObjectMapper());
    }

    GeoJsonLoader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public List<Table> read(Candidate candidate, FileType type, int maxRows) throws ReadException {
        JsonNode root;
        try {
            root = objectMapper.readTree(candidate.file().toFile());
        } catch (IOException e) {
            throw ReadException.forFile(candidate.displayName(), e);
        }
        List<JsonNode> features = features(root);
        if (features == null) {
            throw ReadException.forFile(candidate.displayName(),
                    new IOException("Not a GeoJSON or TopoJSON document"));
        }
        Table table = toTable(features.subList(0, Math.min(maxRows, features.size())));
        logger.debug("Read {} feature(s) with {} column(s) from {}", table.rowCount(), table.columnCount(), candidate.displayName());
        return List.of(table);
    }

    /** @return the feature-like nodes of the document, or {@code null} if it is not geo JSON */
    static List<JsonNode> features(JsonNode root) {
        if (root == null || !root.isObject()) {
            return null;
        }
        String type = root.path("type").asText("");
        List<JsonNode> features = new ArrayList<>();
        switch (type) {
            case "FeatureCollection":
                root.path("features").forEach(features::add);
                return features;
            case "Feature":
                features.add(root);
                return features;
            case "Topology":
                Iterator<JsonNode> objects = root.path("objects").elements();
                if (!objects.hasNext()) {
                    return features;
                }
                JsonNode first = objects.next();
                if ("GeometryCollection".equals(first.path("type").asText())) {
                    first.path("geometries").forEach(features::add);
                } else {
                    features.add(first);
                }
                return features;
            default:
                return null;
        }
    }

    private static Table toTable(List<JsonNode> features) {
        Set<String> names = new LinkedHashSet<>();
        for (JsonNode feature : features) {
            feature.path("properties").fieldNames().forEachRemaining(names::add);
        }
        names.remove(GEOMETRY_COLUMN);
        List<String> columns = new ArrayList<>(names);

        List<List<Object>> rows = new ArrayList<>(features.size());
        for (JsonNode feature : features) {
            JsonNode properties = feature.path("properties");
            List<Object> row = new ArrayList<>(columns.size() + 1);
            for (String column : columns) {
                row.add(value(properties.get(column)));
            }
            // TopoJSON geometries carry their own shape fields instead of a geometry member
            JsonNode geometry = feature.has(GEOMETRY_COLUMN) ? feature.get(GEOMETRY_COLUMN) : feature;
            row.add(geometry.isNull() ? null : geometry.toString());
            rows.add(row);
        }

        List<ColumnType> types = new ArrayList<>(columns.size() + 1);
        for (int c = 0; c < columns.size(); c++) {
            final int column = c;
            List<Object> values = new ArrayList<>(rows.size());
            rows.forEach(row -> values.add(row.get(column)));
            types.add(Cells.inferType(values));
        }
        columns.add(GEOMETRY_COLUMN);
        types.add(ColumnType.GEOMETRY);
        return new Table(columns, types, rows);
    }

    private static Object value(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        if (node.isTextual()) {
            return node.asText();
        }
        if (node.isIntegralNumber() && node.canConvertToLong()) {
            return node.asLong();
        }
        if (node.isNumber()) {
            return node.asDouble();
        }
        if (node.isBoolean()) {
            return node.asBoolean();
        }
        return node.toString();
    }
}
