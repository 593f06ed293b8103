package eu.virtualparadox.documind.ingest.extractor;

import org.apache.poi.xwpf.usermodel.IBodyElement;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;
import org.apache.poi.xwpf.usermodel.XWPFTable;
import org.apache.poi.xwpf.usermodel.XWPFTableCell;
import org.apache.poi.xwpf.usermodel.XWPFTableRow;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Word (OOXML) extractor based on Apache POI.
 * <p>Body paragraphs and tables are emitted in document order, one paragraph or table row per
 * line. Table cells are joined with {@code " | "} like spreadsheet rows.</p>
 */
@Component
public final class DocxTextExtractor implements TextExtractor {

    @Override
    public Set<String> supportedExtensions() {
        return Set.of(".docx");
    }

    @Override
    public String extractText(final InputStream content) throws IOException {
        try (XWPFDocument document = new XWPFDocument(content)) {
            final StringBuilder text = new StringBuilder();
            for (final IBodyElement element : document.getBodyElements()) {
                if (element instanceof XWPFParagraph paragraph) {
                    text.append(paragraph.getText()).append('\n');
                } else if (element instanceof XWPFTable table) {
                    appendTable(table, text);
                }
            }
            return text.toString().strip();
        }
    }

    private static void appendTable(final XWPFTable table, final StringBuilder text) {
        for (final XWPFTableRow row : table.getRows()) {
            final List<String> cells = new ArrayList<>();
            boolean empty = true;
            for (final XWPFTableCell cell : row.getTableCells()) {
                final String value = cell.getText().strip();
                empty &= value.isEmpty();
                cells.add(value);
            }
            if (!empty) {
                text.append(String.join(CsvTextExtractor.CELL_SEPARATOR, cells)).append('\n');
            }
        }
    }
}
