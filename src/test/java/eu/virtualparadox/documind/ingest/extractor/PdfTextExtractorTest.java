package eu.virtualparadox.documind.ingest.extractor;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;

class PdfTextExtractorTest {

    private final PdfTextExtractor extractor = new PdfTextExtractor();

    private static byte[] pdf(String... pages) throws IOException {
        try (PDDocument document = new PDDocument(); ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            for (String text : pages) {
                PDPage page = new PDPage();
                document.addPage(page);
                if (text.isEmpty()) {
                    continue;
                }
                try (PDPageContentStream stream = new PDPageContentStream(document, page)) {
                    stream.beginText();
                    stream.setFont(PDType1Font.HELVETICA, 12);
                    stream.newLineAtOffset(72, 700);
                    stream.showText(text);
                    stream.endText();
                }
            }
            document.save(out);
            return out.toByteArray();
        }
    }

    @Test
    @DisplayName("Text of every page is extracted in page order")
    void extractsPages() throws IOException {
        String text = extractor.extractText(new ByteArrayInputStream(pdf("First page text.", "", "Third page text.")));

        assertThat(text).contains("First page text.").contains("Third page text.");
        assertThat(text.indexOf("First")).isLessThan(text.indexOf("Third"));
    }

    @Test
    @DisplayName("A PDF without text yields blank output")
    void emptyPdf() throws IOException {
        assertThat(extractor.extractText(new ByteArrayInputStream(pdf("")))).isBlank();
    }
}
