package processing;

import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.DateUtil;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.slf4j.Logger;
import processing.LocationExceptions.ReadException;
import tabular.Cells;
import tabular.Table;
import util.LoggingUtil;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads every sheet of an xls or xlsx workbook with Apache POI. The first non-blank row of
 * a sheet is taken as its header; blank header cells get placeholder labels.
 */
final class SpreadsheetLoader implements ITableLoader {

    private static final Logger logger = LoggingUtil.getLogger(SpreadsheetLoader.class);

    @Override
    public List<Table> read(Candidate candidate, FileType type, int maxRows) throws ReadException {
        List<Table> tables = new ArrayList<>();
        try (Workbook workbook = WorkbookFactory.create(candidate.file().toFile(), null, true)) {
            for (int s = 0; s < workbook.getNumberOfSheets(); s++) {
                Sheet sheet = workbook.getSheetAt(s);
                Table table = readSheet(sheet, maxRows);
                if (table == null) {
                    logger.debug("Sheet '{}' of {} is empty, skipping", sheet.getSheetName(), candidate.displayName());
                    continue;
                }
                logger.debug("Read {} row(s) x {} column(s) from sheet '{}'",
                        table.rowCount(), table.columnCount(), sheet.getSheetName());
                tables.add(table);
            }
        } catch (IOException | IllegalArgumentException | IllegalStateException e) {
            // POI reports unreadable and encrypted workbooks through unchecked exceptions as well
            throw ReadException.forFile(candidate.displayName(), e);
        }
        return tables;
    }

    /** @return the sheet's sample, or {@code null} when the sheet holds no cells */
    private static Table readSheet(Sheet sheet, int maxRows) {
        int headerIndex = -1;
        for (int r = sheet.getFirstRowNum(); r >= 0 && r <= sheet.getLastRowNum(); r++) {
            if (!isBlank(sheet.getRow(r))) {
                headerIndex = r;
                break;
            }
        }
        if (headerIndex < 0) {
            return null;
        }

        int lastDataRow = Math.min(sheet.getLastRowNum(), headerIndex + maxRows);
        int width = 0;
        for (int r = headerIndex; r <= lastDataRow; r++) {
            Row row = sheet.getRow(r);
            if (row != null && row.getLastCellNum() > width) {
                width = row.getLastCellNum();
            }
        }

        List<Object> headerCells = readRow(sheet.getRow(headerIndex), width);
        List<String> labels = new ArrayList<>(width);
        for (int c = 0; c < width; c++) {
            Object value = headerCells.get(c);
            labels.add(Cells.isMissing(value) ? Cells.placeholder(c) : Cells.toText(value));
        }

        List<List<Object>> rows = new ArrayList<>();
        for (int r = headerIndex + 1; r <= lastDataRow; r++) {
            rows.add(readRow(sheet.getRow(r), width));
        }
        return Table.fromRows(Cells.dedupeLabels(labels), rows);
    }

    private static boolean isBlank(Row row) {
        if (row == null) {
            return true;
        }
        for (Cell cell : row) {
            if (!Cells.isMissing(cellValue(cell))) {
                return false;
            }
        }
        return true;
    }

    private static List<Object> readRow(Row row, int width) {
        List<Object> values = new ArrayList<>(width);
        for (int c = 0; c < width; c++) {
            values.add(row == null ? null : cellValue(row.getCell(c)));
        }
        return values;
    }

    /**
     * Converts a cell to a Java value: text, {@link Long} for whole numbers, {@link Double},
     * {@link Boolean} or {@link java.time.LocalDateTime}. Blank, empty and error cells are null.
     */
    static Object cellValue(Cell cell) {
        if (cell == null) {
            return null;
        }
        CellType type = cell.getCellType();
        if (type == CellType.FORMULA) {
            type = cell.getCachedFormulaResultType();
        }
        switch (type) {
            case STRING:
                String text = cell.getStringCellValue();
                return (text == null || text.isEmpty()) ? null : text;
            case NUMERIC:
                if (DateUtil.isCellDateFormatted(cell)) {
                    return cell.getLocalDateTimeCellValue();
                }
                double number = cell.getNumericCellValue();
                if (number == Math.rint(number) && !Double.isInfinite(number) && Math.abs(number) < 1e15) {
                    return (long) number;
                }
                return number;
            case BOOLEAN:
                return cell.getBooleanCellValue();
            default:
                return null;
        }
    }
}
