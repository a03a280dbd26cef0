package processing;

import com.google.common.io.MoreFiles;
import org.slf4j.Logger;
import processing.LocationExceptions.ReadException;
import tabular.Table;
import util.LoggingUtil;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.StandardCharsets;
import java.nio.charset.UnsupportedCharsetException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;

/**
 * Reads a shapefile's attribute table from its sibling {@code .dbf}. The text encoding
 * comes from the {@code .cpg} sidecar when present and defaults to ISO-8859-1.
 */
final class ShapefileLoader implements ITableLoader {

    private static final Logger logger = LoggingUtil.getLogger(ShapefileLoader.class);

    static final Charset DEFAULT_CHARSET = StandardCharsets.ISO_8859_1;

    @Override
    public List<Table> read(Candidate candidate, FileType type, int maxRows) throws ReadException {
        Path shp = candidate.file();
        try {
            if (!Files.isRegularFile(shp)) {
                throw new NoSuchFileException(shp.toString());
            }
            Path dbf = sibling(shp, "dbf");
            if (dbf == null) {
                throw new NoSuchFileException("No .dbf next to " + shp.getFileName());
            }
            Path cpg = sibling(shp, "cpg");
            Charset charset = (cpg == null) ? DEFAULT_CHARSET : charsetOf(Files.readString(cpg, StandardCharsets.US_ASCII));
            Table table = DbfReader.read(dbf, charset, maxRows);
            logger.debug("Read {} record(s) with {} field(s) from {} ({})",
                    table.rowCount(), table.columnCount(), dbf.getFileName(), charset);
            return List.of(table);
        } catch (IOException e) {
            throw ReadException.forFile(candidate.displayName(), e);
        }
    }

    /** Sidecar with the same base name and the given extension in any letter case. */
    static Path sibling(Path shp, String ext) {
        String base = MoreFiles.getNameWithoutExtension(shp);
        for (String candidate : List.of(base + "." + ext, base + "." + ext.toUpperCase())) {
            Path sibling = shp.resolveSibling(candidate);
            if (Files.isRegularFile(sibling)) {
                return sibling;
            }
        }
        return null;
    }

    static Charset charsetOf(String declared) {
        String name = declared.trim();
        if (name.isEmpty()) {
            return DEFAULT_CHARSET;
        }
        // ANSI code pages are often written as a bare number
        if (name.chars().allMatch(Character::isDigit)) {
            name = name.startsWith("8859") ? "ISO-8859-" + name.substring(4) : "windows-" + name;
        }
        try {
            return Charset.forName(name);
        } catch (IllegalCharsetNameException | UnsupportedCharsetException e) {
            logger.debug("Unknown code page '{}', falling back to {}", declared.trim(), DEFAULT_CHARSET);
            return DEFAULT_CHARSET;
        }
    }
}
