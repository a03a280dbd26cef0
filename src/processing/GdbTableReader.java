package processing;

import tabular.ColumnType;
import tabular.Table;

import java.io.EOFException;
import java.io.IOException;
import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.NoSuchFileException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;

/**
 * Reader for the tables of an Esri file geodatabase in the ArcGIS 10 layout. Field
 * descriptors and rows live in the {@code .gdbtable} file, row offsets in the sibling
 * {@code .gdbtablx} index. Geometry and binary values are returned as raw bytes.
 */
final class GdbTableReader {

    static final int TABLE_MAGIC = 3;

    static final int INT16 = 0;
    static final int INT32 = 1;
    static final int FLOAT32 = 2;
    static final int FLOAT64 = 3;
    static final int STRING = 4;
    static final int DATETIME = 5;
    static final int OBJECTID = 6;
    static final int GEOMETRY = 7;
    static final int BINARY = 8;
    static final int GUID = 10;
    static final int GLOBALID = 11;
    static final int XML = 12;

    private static final int TABLE_HEADER_LENGTH = 40;
    private static final int INDEX_HEADER_LENGTH = 16;
    private static final int ROWS_PER_BLOCK = 1024;
    private static final int HAS_DEFAULT = 4;
    private static final int MAX_GRID_SIZES = 3;
    private static final LocalDateTime DATE_EPOCH = LocalDateTime.of(1899, 12, 30, 0, 0);

    /** One column of a table. */
    record Field(String name, int type, boolean nullable) {

        ColumnType columnType() {
            switch (type) {
                case INT16, INT32, FLOAT32, FLOAT64, OBJECTID:
                    return ColumnType.NUMBER;
                case DATETIME:
                    return ColumnType.DATETIME;
                case GEOMETRY:
                    return ColumnType.GEOMETRY;
                case BINARY:
                    return ColumnType.BINARY;
                default:
                    return ColumnType.TEXT;
            }
        }
    }

    /** Fields and live rows of a table; the object id is included as a regular value. */
    record Contents(List<Field> fields, List<List<Object>> rows) {

        Table toTable() {
            List<String> columns = new ArrayList<>(fields.size());
            List<ColumnType> types = new ArrayList<>(fields.size());
            for (Field field : fields) {
                columns.add(field.name());
                types.add(field.columnType());
            }
            return new Table(columns, types, rows);
        }

        int indexOf(String fieldName) {
            for (int i = 0; i < fields.size(); i++) {
                if (fields.get(i).name().equalsIgnoreCase(fieldName)) {
                    return i;
                }
            }
            return -1;
        }

        int objectIdIndex() {
            for (int i = 0; i < fields.size(); i++) {
                if (fields.get(i).type() == OBJECTID) {
                    return i;
                }
            }
            return -1;
        }
    }

    private GdbTableReader() {
        throw new UnsupportedOperationException("Utility class - cannot be instantiated");
    }

    /** The {@code .gdbtablx} index next to {@code table}. */
    static Path indexFor(Path table) {
        String name = table.getFileName().toString();
        return table.resolveSibling(name.substring(0, name.length() - "gdbtable".length()) + "gdbtablx");
    }

    /**
     * Reads the field descriptors and up to {@code maxRows} live rows. Deleted rows are skipped.
     *
     * @throws IOException if either file is missing, truncated or in an unsupported layout
     */
    static Contents read(Path table, int maxRows) throws IOException {
        Path index = indexFor(table);
        if (!Files.isRegularFile(index)) {
            throw new NoSuchFileException("No .gdbtablx next to " + table.getFileName());
        }
        try (FileChannel data = FileChannel.open(table, StandardOpenOption.READ);
             FileChannel offsets = FileChannel.open(index, StandardOpenOption.READ)) {
            ByteBuffer header = readAt(data, 0, TABLE_HEADER_LENGTH);
            int magic = header.getInt(0);
            if (magic != TABLE_MAGIC) {
                throw new IOException("Unsupported geodatabase table version " + magic + " in " + table.getFileName());
            }
            int maxRowSize = header.getInt(8);
            long fieldsOffset = header.getLong(32);
            int sectionLength = readAt(data, fieldsOffset, 4).getInt(0);
            if (sectionLength <= 0 || fieldsOffset + 4 + sectionLength > data.size()) {
                throw new IOException("Corrupt field section in " + table.getFileName());
            }
            List<Field> fields = parseFields(readAt(data, fieldsOffset + 4, sectionLength));

            RowIndex rowIndex = RowIndex.read(offsets);
            List<List<Object>> rows = new ArrayList<>();
            for (long fid = 0; fid < rowIndex.slots && rows.size() < maxRows; fid++) {
                long offset = rowIndex.offsetOf(offsets, fid);
                if (offset == 0) {
                    continue;
                }
                int length = readAt(data, offset, 4).getInt(0);
                if (length < 0 || (maxRowSize > 0 && length > maxRowSize)) {
                    throw new IOException("Corrupt row " + (fid + 1) + " in " + table.getFileName());
                }
                rows.add(parseRow(readAt(data, offset + 4, length), fields, fid + 1));
            }
            return new Contents(fields, rows);
        } catch (BufferUnderflowException | IndexOutOfBoundsException | IllegalArgumentException e) {
            throw new IOException("Corrupt geodatabase table " + table.getFileName(), e);
        }
    }

    static List<Field> parseFields(ByteBuffer section) throws IOException {
        section.getInt(); // version
        skip(section, 4); // geometry type and flags
        int count = Short.toUnsignedInt(section.getShort());
        List<Field> fields = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            String name = utf16(section, Byte.toUnsignedInt(section.get()));
            utf16(section, Byte.toUnsignedInt(section.get())); // alias
            int type = section.get();
            int flags;
            switch (type) {
                case OBJECTID:
                    skip(section, 2);
                    fields.add(new Field(name, type, false));
                    continue;
                case GEOMETRY:
                    section.get();
                    flags = section.get();
                    skipGeometryDescriptor(section);
                    break;
                case STRING:
                    section.getInt(); // max length
                    flags = section.get();
                    if ((flags & HAS_DEFAULT) != 0) {
                        skip(section, (int) Math.min(readVarUInt(section), Integer.MAX_VALUE));
                    }
                    break;
                case INT16, INT32, FLOAT32, FLOAT64, DATETIME:
                    section.get(); // width
                    flags = section.get();
                    if ((flags & HAS_DEFAULT) != 0) {
                        skip(section, Byte.toUnsignedInt(section.get()));
                    }
                    break;
                case BINARY, GUID, GLOBALID, XML:
                    section.get();
                    flags = section.get();
                    break;
                default:
                    throw new IOException("Unsupported field type " + type + " for field " + name);
            }
            fields.add(new Field(name, type, (flags & 1) != 0));
        }
        return fields;
    }

    /** Skips the spatial reference, origins, tolerances, extent and grid sizes of a geometry field. */
    private static void skipGeometryDescriptor(ByteBuffer section) {
        skip(section, Short.toUnsignedInt(section.getShort())); // WKT
        int geometryFlags = section.get();
        boolean hasM = (geometryFlags & 2) != 0;
        boolean hasZ = (geometryFlags & 4) != 0;
        int doubles = 3 + (hasM ? 2 : 0) + (hasZ ? 2 : 0) // origins and scales
                + 1 + (hasM ? 1 : 0) + (hasZ ? 1 : 0)     // tolerances
                + 4;                                      // xy extent
        skip(section, doubles * 8);
        // an optional z/m extent precedes the grid sizes, recognised by its leading zero byte and count
        while (true) {
            int marker = section.get(section.position());
            int gridSizes = section.getInt(section.position() + 1);
            if (marker == 0 && gridSizes >= 1 && gridSizes <= MAX_GRID_SIZES) {
                skip(section, 5 + gridSizes * 8);
                return;
            }
            skip(section, 8);
        }
    }

    static List<Object> parseRow(ByteBuffer blob, List<Field> fields, long objectId) throws IOException {
        int nullableCount = 0;
        for (Field field : fields) {
            if (field.nullable()) {
                nullableCount++;
            }
        }
        byte[] nullFlags = new byte[(nullableCount + 7) / 8];
        blob.get(nullFlags);

        List<Object> row = new ArrayList<>(fields.size());
        int nullable = 0;
        for (Field field : fields) {
            if (field.type() == OBJECTID) {
                row.add(objectId);
                continue;
            }
            if (field.nullable()) {
                boolean isNull = (nullFlags[nullable >> 3] & (1 << (nullable & 7))) != 0;
                nullable++;
                if (isNull) {
                    row.add(null);
                    continue;
                }
            }
            row.add(readValue(blob, field));
        }
        return row;
    }

    private static Object readValue(ByteBuffer blob, Field field) throws IOException {
        switch (field.type()) {
            case INT16:
                return (long) blob.getShort();
            case INT32:
                return (long) blob.getInt();
            case FLOAT32:
                return (double) blob.getFloat();
            case FLOAT64:
                return blob.getDouble();
            case DATETIME:
                return toDateTime(blob.getDouble());
            case STRING, XML:
                return new String(bytes(blob, readVarUInt(blob)), StandardCharsets.UTF_8);
            case GEOMETRY, BINARY:
                return bytes(blob, readVarUInt(blob));
            case GUID, GLOBALID:
                return guid(bytes(blob, 16));
            default:
                throw new IOException("Unsupported field type " + field.type() + " for field " + field.name());
        }
    }

    /** Days since 1899-12-30, the OLE automation date. */
    static LocalDateTime toDateTime(double days) {
        return DATE_EPOCH.plus(Math.round(days * 86_400_000d), ChronoUnit.MILLIS);
    }

    static String guid(byte[] b) {
        ByteBuffer le = ByteBuffer.wrap(b).order(ByteOrder.LITTLE_ENDIAN);
        return String.format("{%08X-%04X-%04X-%02X%02X-%02X%02X%02X%02X%02X%02X}",
                le.getInt(0), le.getShort(4), le.getShort(6),
                b[8], b[9], b[10], b[11], b[12], b[13], b[14], b[15]);
    }

    static long readVarUInt(ByteBuffer buffer) throws IOException {
        long value = 0;
        for (int shift = 0; shift < 64; shift += 7) {
            int b = Byte.toUnsignedInt(buffer.get());
            value |= (long) (b & 0x7F) << shift;
            if ((b & 0x80) == 0) {
                return value;
            }
        }
        throw new IOException("Malformed variable-length integer");
    }

    private static byte[] bytes(ByteBuffer buffer, long length) throws IOException {
        if (length < 0 || length > buffer.remaining()) {
            throw new IOException("Value of " + length + " bytes overruns its row");
        }
        byte[] bytes = new byte[(int) length];
        buffer.get(bytes);
        return bytes;
    }

    private static String utf16(ByteBuffer buffer, int chars) {
        byte[] bytes = new byte[chars * 2];
        buffer.get(bytes);
        return new String(bytes, StandardCharsets.UTF_16LE);
    }

    private static void skip(ByteBuffer buffer, int count) {
        buffer.position(buffer.position() + count);
    }

    private static ByteBuffer readAt(FileChannel channel, long position, int length) throws IOException {
        ByteBuffer buffer = ByteBuffer.allocate(length).order(ByteOrder.LITTLE_ENDIAN);
        while (buffer.hasRemaining()) {
            if (channel.read(buffer, position + buffer.position()) < 0) {
                throw new EOFException("Unexpected end of geodatabase file at " + (position + buffer.position()));
            }
        }
        buffer.flip();
        return buffer;
    }

    /**
     * Row offsets from a {@code .gdbtablx} file. Blocks of 1024 offsets may be left out of
     * the file, in which case a trailing bitmap tells which blocks are present.
     */
    private static final class RowIndex {

        private final long slots;
        private final int offsetSize;
        private final int[] blockPositions;

        private RowIndex(long slots, int offsetSize, int[] blockPositions) {
            this.slots = slots;
            this.offsetSize = offsetSize;
            this.blockPositions = blockPositions;
        }

        static RowIndex read(FileChannel index) throws IOException {
            ByteBuffer header = readAt(index, 0, INDEX_HEADER_LENGTH);
            int blocks = header.getInt(4);
            long slots = Integer.toUnsignedLong(header.getInt(8));
            int offsetSize = header.getInt(12);
            if (offsetSize < 4 || offsetSize > 6) {
                throw new IOException("Unsupported row offset size " + offsetSize);
            }
            if (blocks <= 0) {
                return new RowIndex(0, offsetSize, null);
            }
            long trailer = INDEX_HEADER_LENGTH + (long) blocks * ROWS_PER_BLOCK * offsetSize;
            if (index.size() < trailer + 16) {
                return new RowIndex(slots, offsetSize, null);
            }
            ByteBuffer sparse = readAt(index, trailer, 16);
            int bitmapWords = sparse.getInt(0);
            int totalBlocks = sparse.getInt(4);
            if (bitmapWords == 0) {
                return new RowIndex(slots, offsetSize, null);
            }
            ByteBuffer bitmap = readAt(index, trailer + 16, bitmapWords * 4);
            int[] positions = new int[totalBlocks];
            int present = 0;
            for (int block = 0; block < totalBlocks; block++) {
                boolean set = (bitmap.get(block >> 3) & (1 << (block & 7))) != 0;
                positions[block] = set ? present++ : -1;
            }
            return new RowIndex(slots, offsetSize, positions);
        }

        /** @return the row's offset in the table file, or 0 for a deleted or absent row */
        long offsetOf(FileChannel index, long fid) throws IOException {
            long block = fid / ROWS_PER_BLOCK;
            long position = block;
            if (blockPositions != null) {
                if (block >= blockPositions.length || blockPositions[(int) block] < 0) {
                    return 0;
                }
                position = blockPositions[(int) block];
            }
            long entry = position * ROWS_PER_BLOCK + fid % ROWS_PER_BLOCK;
            ByteBuffer raw = readAt(index, INDEX_HEADER_LENGTH + entry * offsetSize, offsetSize);
            long offset = 0;
            for (int i = offsetSize - 1; i >= 0; i--) {
                offset = (offset << 8) | Byte.toUnsignedInt(raw.get(i));
            }
            return offset;
        }
    }
}
