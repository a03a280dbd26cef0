package processing;

import org.slf4j.Logger;
import processing.LocationExceptions.ReadException;
import tabular.Table;
import util.LoggingUtil;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Esri file geodatabase directories. Layer names and their table files come from the
 * {@code GDB_SystemCatalog} table ({@code a00000001.gdbtable}); the system tables it lists
 * are not layers. Layers are read with {@link GdbTableReader}.
 */
final class FileGeodatabaseContainer implements IGeoContainer {

    private static final Logger logger = LoggingUtil.getLogger(FileGeodatabaseContainer.class);

    static final String SYSTEM_CATALOG = "a00000001.gdbtable";
    private static final String SYSTEM_TABLE_PREFIX = "gdb_";
    private static final String NAME_FIELD = "Name";

    @Override
    public List<String> listLayers(Path container) throws ReadException {
        List<String> layers = new ArrayList<>();
        for (Map.Entry<String, Long> table : catalog(container).entrySet()) {
            String name = table.getKey();
            if (name.toLowerCase(Locale.ROOT).startsWith(SYSTEM_TABLE_PREFIX)) {
                continue;
            }
            if (!Files.isRegularFile(tableFile(container, table.getValue()))) {
                logger.debug("Geodatabase {} lists '{}' without a table file, skipping", container.getFileName(), name);
                continue;
            }
            layers.add(name);
        }
        logger.debug("Geodatabase {} lists {} layer(s): {}", container.getFileName(), layers.size(), layers);
        return layers;
    }

    @Override
    public Table readLayer(Path container, String layer, int maxRows) throws ReadException {
        Long id = catalog(container).get(layer);
        if (id == null) {
            throw ReadException.forFile(layer, new NoSuchFileException(container.resolve(layer).toString()));
        }
        try {
            Table table = GdbTableReader.read(tableFile(container, id), maxRows).toTable();
            logger.debug("Read {} row(s) x {} column(s) from layer {} of {}",
                    table.rowCount(), table.columnCount(), layer, container.getFileName());
            return table;
        } catch (IOException e) {
            throw ReadException.forFile(layer, e);
        }
    }

    static Path tableFile(Path container, long id) {
        return container.resolve(String.format("a%08x.gdbtable", id));
    }

    /** Table names mapped to their ids, in catalog order. */
    private static Map<String, Long> catalog(Path container) throws ReadException {
        String containerName = String.valueOf(container.getFileName());
        if (!Files.isDirectory(container)) {
            throw ReadException.forFile(containerName, new NoSuchFileException(container.toString()));
        }
        try {
            GdbTableReader.Contents contents = GdbTableReader.read(container.resolve(SYSTEM_CATALOG), Integer.MAX_VALUE);
            int idColumn = contents.objectIdIndex();
            int nameColumn = contents.indexOf(NAME_FIELD);
            if (idColumn < 0 || nameColumn < 0) {
                throw new IOException(SYSTEM_CATALOG + " is not a system catalog");
            }
            Map<String, Long> tables = new LinkedHashMap<>();
            for (List<Object> row : contents.rows()) {
                Object name = row.get(nameColumn);
                if (name != null) {
                    tables.put(name.toString(), ((Number) row.get(idColumn)).longValue());
                }
            }
            return tables;
        } catch (IOException e) {
            throw ReadException.forFile(containerName, e);
        }
    }
}
