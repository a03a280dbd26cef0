package processing;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Writes small dBase III files for the shapefile tests.
 */
final class DbfFixture {

    private final Charset charset;
    private final List<DbfReader.Field> fields = new ArrayList<>();
    private final List<byte[]> records = new ArrayList<>();

    DbfFixture(Charset charset) {
        this.charset = charset;
    }

    DbfFixture field(String name, char type, int length, int decimals) {
        fields.add(new DbfReader.Field(name, type, length, decimals));
        return this;
    }

    DbfFixture record(String... values) {
        return addRecord(' ', values);
    }

    DbfFixture deletedRecord(String... values) {
        return addRecord('*', values);
    }

    private DbfFixture addRecord(char flag, String... values) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        out.write(flag);
        for (int i = 0; i < fields.size(); i++) {
            DbfReader.Field field = fields.get(i);
            byte[] value = values[i].getBytes(charset);
            byte[] cell = new byte[field.length()];
            Arrays.fill(cell, (byte) ' ');
            boolean numeric = field.type() == 'N' || field.type() == 'F';
            int start = numeric ? field.length() - value.length : 0;
            System.arraycopy(value, 0, cell, start, value.length);
            out.writeBytes(cell);
        }
        records.add(out.toByteArray());
        return this;
    }

    byte[] toBytes() {
        int recordLength = 1 + fields.stream().mapToInt(DbfReader.Field::length).sum();
        int headerLength = 32 + 32 * fields.size() + 1;

        ByteBuffer header = ByteBuffer.allocate(32).order(ByteOrder.LITTLE_ENDIAN);
        header.put(0, (byte) 0x03);
        header.put(1, (byte) 124);
        header.put(2, (byte) 1);
        header.put(3, (byte) 1);
        header.putInt(4, records.size());
        header.putShort(8, (short) headerLength);
        header.putShort(10, (short) recordLength);

        ByteArrayOutputStream out = new ByteArrayOutputStream();
        out.writeBytes(header.array());
        for (DbfReader.Field field : fields) {
            byte[] descriptor = new byte[32];
            byte[] name = field.name().getBytes(charset);
            System.arraycopy(name, 0, descriptor, 0, Math.min(name.length, 10));
            descriptor[11] = (byte) field.type();
            descriptor[16] = (byte) field.length();
            descriptor[17] = (byte) field.decimals();
            out.writeBytes(descriptor);
        }
        out.write(0x0D);
        records.forEach(out::writeBytes);
        out.write(0x1A);
        return out.toByteArray();
    }

    Path writeTo(Path file) throws IOException {
        return Files.write(file, toBytes());
    }
}
