package processing;

import tabular.ColumnType;
import tabular.Table;

import java.io.BufferedInputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * Minimal dBase III reader for the attribute table of a shapefile. Reads the field
 * descriptors and up to a given number of live records; deleted records are skipped.
 */
final class DbfReader {

    private static final int FILE_HEADER_LENGTH = 32;
    private static final int FIELD_DESCRIPTOR_LENGTH = 32;
    private static final byte HEADER_TERMINATOR = 0x0D;
    private static final byte END_OF_FILE = 0x1A;
    private static final byte DELETED = '*';
    private static final DateTimeFormatter DBF_DATE = DateTimeFormatter.BASIC_ISO_DATE;

    /** One column of the table. */
    record Field(String name, char type, int length, int decimals) {

        ColumnType columnType() {
            switch (type) {
                case 'N', 'F':
                    return ColumnType.NUMBER;
                case 'L':
                    return ColumnType.BOOLEAN;
                case 'D':
                    return ColumnType.DATETIME;
                default:
                    return ColumnType.TEXT;
            }
        }
    }

    private DbfReader() {
        throw new UnsupportedOperationException("Utility class - cannot be instantiated");
    }

    static Table read(Path dbf, Charset charset, int maxRows) throws IOException {
        try (InputStream in = new BufferedInputStream(Files.newInputStream(dbf))) {
            ByteBuffer header = ByteBuffer.wrap(readFully(in, FILE_HEADER_LENGTH)).order(ByteOrder.LITTLE_ENDIAN);
            int recordCount = header.getInt(4);
            int headerLength = Short.toUnsignedInt(header.getShort(8));
            int recordLength = Short.toUnsignedInt(header.getShort(10));
            if (headerLength < FILE_HEADER_LENGTH + 1 || recordLength < 1) {
                throw new IOException("Corrupt dBase header in " + dbf.getFileName());
            }

            byte[] descriptorBlock = readFully(in, headerLength - FILE_HEADER_LENGTH);
            List<Field> fields = parseFields(descriptorBlock, charset);

            List<List<Object>> rows = new ArrayList<>();
            for (int r = 0; r < recordCount && rows.size() < maxRows; r++) {
                byte[] record = in.readNBytes(recordLength);
                if (record.length == 0 || record[0] == END_OF_FILE) {
                    break;
                }
                if (record.length < recordLength) {
                    throw new EOFException("Truncated record " + r + " in " + dbf.getFileName());
                }
                if (record[0] == DELETED) {
                    continue;
                }
                rows.add(parseRecord(record, fields, charset));
            }

            List<String> columns = new ArrayList<>(fields.size());
            List<ColumnType> types = new ArrayList<>(fields.size());
            for (Field field : fields) {
                columns.add(field.name());
                types.add(field.columnType());
            }
            return new Table(columns, types, rows);
        }
    }

    static List<Field> parseFields(byte[] block, Charset charset) throws IOException {
        List<Field> fields = new ArrayList<>();
        for (int offset = 0; offset + FIELD_DESCRIPTOR_LENGTH <= block.length; offset += FIELD_DESCRIPTOR_LENGTH) {
            if (block[offset] == HEADER_TERMINATOR) {
                return fields;
            }
            int nameLength = 0;
            while (nameLength < 11 && block[offset + nameLength] != 0) {
                nameLength++;
            }
            String name = new String(block, offset, nameLength, charset).trim();
            char type = (char) block[offset + 11];
            int length = Byte.toUnsignedInt(block[offset + 16]);
            int decimals = Byte.toUnsignedInt(block[offset + 17]);
            fields.add(new Field(name, type, length, decimals));
        }
        if (fields.isEmpty()) {
            throw new IOException("dBase header declares no fields");
        }
        return fields;
    }

    private static List<Object> parseRecord(byte[] record, List<Field> fields, Charset charset) {
        List<Object> row = new ArrayList<>(fields.size());
        int offset = 1;
        for (Field field : fields) {
            if (offset >= record.length) {
                // fields declared wider than the record
                row.add(null);
                continue;
            }
            int length = Math.min(field.length(), record.length - offset);
            String raw = new String(record, offset, length, charset).trim();
            row.add(convert(raw, field));
            offset += field.length();
        }
        return row;
    }

    static Object convert(String raw, Field field) {
        if (raw.isEmpty()) {
            return null;
        }
        switch (field.type()) {
            case 'N', 'F':
                if (raw.chars().allMatch(ch -> ch == '*')) {
                    return null;
                }
                try {
                    if (field.decimals() == 0 && raw.indexOf('.') < 0) {
                        return Long.parseLong(raw);
                    }
                    return Double.parseDouble(raw);
                } catch (NumberFormatException e) {
                    return null;
                }
            case 'L':
                char flag = Character.toUpperCase(raw.charAt(0));
                if (flag == 'T' || flag == 'Y') {
                    return Boolean.TRUE;
                }
                if (flag == 'F' || flag == 'N') {
                    return Boolean.FALSE;
                }
                return null;
            case 'D':
                try {
                    return LocalDate.parse(raw, DBF_DATE);
                } catch (DateTimeParseException e) {
                    return null;
                }
            default:
                return raw;
        }
    }

    private static byte[] readFully(InputStream in, int length) throws IOException {
        byte[] bytes = in.readNBytes(length);
        if (bytes.length < length) {
            throw new EOFException("Unexpected end of dBase file");
        }
        return bytes;
    }
}
