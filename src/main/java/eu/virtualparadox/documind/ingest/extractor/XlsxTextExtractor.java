package eu.virtualparadox.documind.ingest.extractor;

import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.DataFormatter;
import org.apache.poi.ss.usermodel.FormulaEvaluator;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Excel (OOXML) extractor based on Apache POI.
 * <p>Each sheet starts with a {@code Sheet: <name>} line followed by its non-empty rows, cells
 * joined with {@code " | "}. Cells are rendered as Excel displays them, formulas evaluated.</p>
 */
@Component
public final class XlsxTextExtractor implements TextExtractor {

    @Override
    public Set<String> supportedExtensions() {
        return Set.of(".xlsx");
    }

    @Override
    public String extractText(final InputStream content) throws IOException {
        try (XSSFWorkbook workbook = new XSSFWorkbook(content)) {
            final DataFormatter formatter = new DataFormatter(Locale.ROOT);
            final FormulaEvaluator evaluator = workbook.getCreationHelper().createFormulaEvaluator();

            final StringBuilder text = new StringBuilder();
            for (final Sheet sheet : workbook) {
                text.append("Sheet: ").append(sheet.getSheetName()).append('\n');
                for (final Row row : sheet) {
                    final String line = rowText(row, formatter, evaluator);
                    if (!line.isBlank()) {
                        text.append(line).append('\n');
                    }
                }
                text.append('\n');
            }
            return text.toString().strip();
        }
    }

    private static String rowText(final Row row, final DataFormatter formatter, final FormulaEvaluator evaluator) {
        final List<String> cells = new ArrayList<>();
        boolean empty = true;
        for (int i = 0; i < row.getLastCellNum(); i++) {
            final Cell cell = row.getCell(i);
            final String value = cell == null ? "" : formatter.formatCellValue(cell, evaluator);
            empty &= value.isBlank();
            cells.add(value);
        }
        return empty ? "" : String.join(CsvTextExtractor.CELL_SEPARATOR, cells);
    }
}
