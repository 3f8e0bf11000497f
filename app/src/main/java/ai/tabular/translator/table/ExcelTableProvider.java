package ai.tabular.translator.table;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.apache.poi.hssf.usermodel.HSSFWorkbook;
import org.apache.poi.ss.usermodel.DataFormatter;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Excel provider: reads the first sheet with the first row as header, cell values as
 * displayed; writes a single-sheet workbook in the format matching the file extension.
 */
public class ExcelTableProvider implements TableProvider {

    private static final Logger LOGGER = LoggerFactory.getLogger(ExcelTableProvider.class);
    private static final String SHEET_NAME = "translated";

    @Override
    public Table read(Path path) {
        DataFormatter formatter = new DataFormatter();
        try (InputStream input = Files.newInputStream(path);
             Workbook workbook = WorkbookFactory.create(input)) {
            if (workbook.getNumberOfSheets() == 0) {
                throw new TableIoException("Workbook has no sheets: " + path);
            }
            Sheet sheet = workbook.getSheetAt(0);
            Row headerRow = sheet.getRow(sheet.getFirstRowNum());
            if (headerRow == null) {
                throw new TableIoException("Workbook has no header row: " + path);
            }
            List<String> header = readRow(headerRow, headerRow.getLastCellNum(), formatter);
            List<List<String>> rows = new ArrayList<>();
            for (int r = sheet.getFirstRowNum() + 1; r <= sheet.getLastRowNum(); r++) {
                Row row = sheet.getRow(r);
                rows.add(row == null ? List.of() : readRow(row, row.getLastCellNum(), formatter));
            }
            Table table = HeaderNormalizer.toTable(header, rows);
            LOGGER.info("Loaded {} ({} rows, {} columns)", path.getFileName(), table.rowCount(), table.columnCount());
            return table;
        } catch (NoSuchFileException ex) {
            throw new TableIoException("File not found: " + path, ex);
        } catch (IOException ex) {
            throw new TableIoException("Failed to read " + path, ex);
        } catch (IllegalArgumentException ex) {
            throw new TableIoException("Invalid table in " + path + ": " + ex.getMessage(), ex);
        }
    }

    @Override
    public void write(Table table, Path path) {
        try (Workbook workbook = isLegacyFormat(path) ? new HSSFWorkbook() : new XSSFWorkbook()) {
            Sheet sheet = workbook.createSheet(SHEET_NAME);
            writeRow(sheet.createRow(0), table.columnIds());
            for (int r = 0; r < table.rowCount(); r++) {
                writeRow(sheet.createRow(r + 1), table.row(r));
            }
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (OutputStream output = Files.newOutputStream(path)) {
                workbook.write(output);
            }
        } catch (IOException ex) {
            throw new TableIoException("Failed to write " + path, ex);
        }
        LOGGER.info("Saved translated table to {}", path);
    }

    private List<String> readRow(Row row, int width, DataFormatter formatter) {
        int cells = Math.max(0, width);
        List<String> values = new ArrayList<>(cells);
        for (int c = 0; c < cells; c++) {
            org.apache.poi.ss.usermodel.Cell cell = row.getCell(c, Row.MissingCellPolicy.RETURN_BLANK_AS_NULL);
            values.add(cell == null ? "" : formatter.formatCellValue(cell));
        }
        return values;
    }

    private static boolean isLegacyFormat(Path path) {
        return path.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".xls");
    }

    private void writeRow(Row row, List<String> values) {
        for (int c = 0; c < values.size(); c++) {
            row.createCell(c).setCellValue(values.get(c));
        }
    }
}
