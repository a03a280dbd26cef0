package pipeline;

import com.opencsv.CSVWriter;
import org.slf4j.Logger;
import util.LoggingUtil;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Writes the status report as CSV with a fixed header. Booleans are written as
 * {@code True}/{@code False} and nulls as empty cells; fields are quoted only when needed.
 */
public final class StatusReportWriter {

    private static final Logger logger = LoggingUtil.getLogger(StatusReportWriter.class);

    static final String[] HEADER = {"dataset name", "resource name", "format", "pcoded", "mis_pcoded", "error"};

    public void write(Path reportFile, List<StatusRow> rows) throws IOException {
        Objects.requireNonNull(reportFile, "reportFile must not be null");
        Objects.requireNonNull(rows, "rows must not be null");
        Path parent = reportFile.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (Writer out = Files.newBufferedWriter(reportFile, StandardCharsets.UTF_8);
             CSVWriter csv = new CSVWriter(out, CSVWriter.DEFAULT_SEPARATOR, CSVWriter.DEFAULT_QUOTE_CHARACTER,
                     CSVWriter.DEFAULT_ESCAPE_CHARACTER, "\n")) {
            csv.writeNext(HEADER, false);
            for (StatusRow row : rows) {
                csv.writeNext(toLine(row), false);
            }
            csv.flush();
            if (csv.checkError()) {
                throw new IOException("Failed writing status report " + reportFile);
            }
        }
        logger.info("Wrote {} status row(s) to {}", rows.size(), reportFile);
    }

    static String[] toLine(StatusRow row) {
        return new String[]{
                text(row.datasetName()),
                text(row.resourceName()),
                text(row.format()),
                flag(row.pcoded()),
                flag(row.misPcoded()),
                text(row.error())
        };
    }

    private static String text(String value) {
        return (value == null) ? "" : value;
    }

    private static String flag(Boolean value) {
        if (value == null) {
            return "";
        }
        return value ? "True" : "False";
    }
}
