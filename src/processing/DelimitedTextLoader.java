package processing;

import com.opencsv.CSVReader;
import com.opencsv.CSVReaderBuilder;
import com.opencsv.exceptions.CsvException;
import org.apache.commons.io.input.BOMInputStream;
import org.slf4j.Logger;
import processing.LocationExceptions.ReadException;
import tabular.Cells;
import tabular.Table;
import util.LoggingUtil;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Reads comma-separated UTF-8 files with opencsv. The first non-blank line is the header,
 * the usual missing-value markers become nulls and columns made entirely of numbers or
 * booleans are converted. Header labels are kept as read, surrounding whitespace included.
 */
final class DelimitedTextLoader implements ITableLoader {

    private static final Logger logger = LoggingUtil.getLogger(DelimitedTextLoader.class);

    static final Set<String> MISSING_MARKERS = Set.of(
            "", "#N/A", "#N/A N/A", "#NA", "-1.#IND", "-1.#QNAN", "-NaN", "-nan", "1.#IND", "1.#QNAN",
            "<NA>", "N/A", "NA", "NULL", "NaN", "None", "n/a", "nan", "null");

    private static final Set<String> TRUE_VALUES = Set.of("true", "True", "TRUE");
    private static final Set<String> FALSE_VALUES = Set.of("false", "False", "FALSE");

    @Override
    public List<Table> read(Candidate candidate, FileType type, int maxRows) throws ReadException {
        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
        try (InputStream in = BOMInputStream.builder().setInputStream(Files.newInputStream(candidate.file())).get();
             Reader reader = new InputStreamReader(in, decoder);
             CSVReader csv = new CSVReaderBuilder(reader).build()) {

            String[] header = nextNonBlank(csv);
            if (header == null) {
                logger.debug("{} has no content", candidate.displayName());
                return List.of();
            }
            List<String> labels = new ArrayList<>(header.length);
            for (int c = 0; c < header.length; c++) {
                labels.add(header[c].isEmpty() ? Cells.placeholder(c) : header[c]);
            }

            List<List<String>> raw = new ArrayList<>();
            String[] line;
            while (raw.size() < maxRows && (line = nextNonBlank(csv)) != null) {
                if (line.length > header.length) {
                    throw new ReadException(String.format("Unable to read resource %s: expected %d fields, saw %d on line %d",
                            candidate.displayName(), header.length, line.length, csv.getLinesRead()));
                }
                List<String> row = new ArrayList<>(header.length);
                for (int c = 0; c < header.length; c++) {
                    row.add(c < line.length ? line[c] : "");
                }
                raw.add(row);
            }
            logger.debug("Read {} row(s) x {} column(s) from {}", raw.size(), labels.size(), candidate.displayName());
            return List.of(Table.fromRows(Cells.dedupeLabels(labels), convertColumns(raw, header.length)));
        } catch (ReadException e) {
            throw e;
        } catch (IOException | CsvException e) {
            throw ReadException.forFile(candidate.displayName(), e);
        }
    }

    private static String[] nextNonBlank(CSVReader csv) throws IOException, CsvException {
        String[] line;
        while ((line = csv.readNext()) != null) {
            if (!(line.length == 1 && line[0].isEmpty())) {
                return line;
            }
        }
        return null;
    }

    /** Replaces missing markers with null and converts columns that are wholly numeric or boolean. */
    static List<List<Object>> convertColumns(List<List<String>> raw, int width) {
        List<List<Object>> rows = new ArrayList<>(raw.size());
        for (List<String> r : raw) {
            List<Object> row = new ArrayList<>(width);
            for (String cell : r) {
                row.add(MISSING_MARKERS.contains(cell) ? null : cell);
            }
            rows.add(row);
        }
        for (int c = 0; c < width; c++) {
            convertColumn(rows, c);
        }
        return rows;
    }

    private static void convertColumn(List<List<Object>> rows, int column) {
        boolean longs = true;
        boolean doubles = true;
        boolean booleans = true;
        boolean any = false;
        for (List<Object> row : rows) {
            String value = (String) row.get(column);
            if (value == null) {
                continue;
            }
            any = true;
            longs &= parseLong(value) != null;
            doubles &= parseDouble(value) != null;
            booleans &= TRUE_VALUES.contains(value) || FALSE_VALUES.contains(value);
        }
        if (!any || !(longs || doubles || booleans)) {
            return;
        }
        boolean hasNull = rows.stream().anyMatch(row -> row.get(column) == null);
        for (List<Object> row : rows) {
            String value = (String) row.get(column);
            if (value == null) {
                continue;
            }
            if (longs && !hasNull) {
                row.set(column, parseLong(value));
            } else if (longs || doubles) {
                // missing values force a float column
                row.set(column, parseDouble(value));
            } else {
                row.set(column, TRUE_VALUES.contains(value));
            }
        }
    }

    private static Long parseLong(String value) {
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static Double parseDouble(String value) {
        String trimmed = value.trim();
        String lower = trimmed.toLowerCase(Locale.ROOT);
        // Java accepts suffixes and hex forms that are not numbers in a CSV
        if (trimmed.isEmpty() || lower.endsWith("d") || lower.endsWith("f") || lower.startsWith("0x")) {
            return null;
        }
        try {
            return Double.parseDouble(trimmed);
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
