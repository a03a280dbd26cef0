package reference;

import com.opencsv.CSVReader;
import com.opencsv.exceptions.CsvValidationException;
import org.apache.commons.io.input.BOMInputStream;
import org.slf4j.Logger;
import util.LoggingUtil;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Reads a {@link CountryReference} from a CSV file with an {@code iso3,iso2,name} header.
 * Column order is taken from the header; extra columns are ignored.
 */
public final class CountryReferenceLoader {

    private static final Logger logger = LoggingUtil.getLogger(CountryReferenceLoader.class);

    /** Classpath location of the bundled country table. */
    public static final String BUNDLED_RESOURCE = "/countries.csv";

    private CountryReferenceLoader() {
        throw new UnsupportedOperationException("Utility class - cannot be instantiated");
    }

    /** Loads the bundled country table. */
    public static CountryReference loadBundled() throws IOException {
        try (InputStream in = CountryReferenceLoader.class.getResourceAsStream(BUNDLED_RESOURCE)) {
            if (in == null) {
                throw new FileNotFoundException("Bundled country reference not found on classpath: " + BUNDLED_RESOURCE);
            }
            return read(in, BUNDLED_RESOURCE);
        }
    }

    /** Loads the table at {@code path}, or the bundled one when {@code path} is null. */
    public static CountryReference load(Path path) throws IOException {
        if (path == null) {
            return loadBundled();
        }
        if (!Files.isReadable(path)) {
            throw new FileNotFoundException("Country reference file not found or not readable: " + path);
        }
        try (InputStream in = Files.newInputStream(path)) {
            return read(in, path.toString());
        }
    }

    static CountryReference read(InputStream in, String source) throws IOException {
        Objects.requireNonNull(in, "input stream must not be null");
        InputStream bomless = BOMInputStream.builder().setInputStream(in).get();
        try (Reader reader = new InputStreamReader(bomless, StandardCharsets.UTF_8);
             CSVReader csv = new CSVReader(reader)) {
            String[] header = csv.readNext();
            if (header == null) {
                throw new IOException("Country reference is empty: " + source);
            }
            int iso3Index = indexOf(header, "iso3", source);
            int iso2Index = indexOf(header, "iso2", source);
            int nameIndex = indexOfOptional(header, "name");

            List<CountryReference.Country> countries = new ArrayList<>();
            String[] line;
            while ((line = csv.readNext()) != null) {
                if (line.length <= Math.max(iso3Index, iso2Index)) {
                    continue;
                }
                String iso3 = line[iso3Index].trim();
                String iso2 = line[iso2Index].trim();
                if (iso3.isEmpty() || iso2.isEmpty()) {
                    logger.debug("Skipping country row without codes in {}: {}", source, String.join(",", line));
                    continue;
                }
                String name = (nameIndex >= 0 && nameIndex < line.length) ? line[nameIndex].trim() : "";
                countries.add(new CountryReference.Country(iso3, iso2, name));
            }
            logger.info("Loaded {} countries from {}", countries.size(), source);
            return new CountryReference(countries);
        } catch (CsvValidationException e) {
            throw new IOException("Malformed country reference " + source + ": " + e.getMessage(), e);
        }
    }

    private static int indexOf(String[] header, String column, String source) throws IOException {
        int index = indexOfOptional(header, column);
        if (index < 0) {
            throw new IOException(String.format("Country reference %s has no '%s' column", source, column));
        }
        return index;
    }

    private static int indexOfOptional(String[] header, String column) {
        for (int i = 0; i < header.length; i++) {
            if (header[i].trim().toLowerCase(Locale.ROOT).equals(column)) {
                return i;
            }
        }
        return -1;
    }
}
