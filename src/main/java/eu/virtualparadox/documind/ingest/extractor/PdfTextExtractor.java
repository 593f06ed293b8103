package eu.virtualparadox.documind.ingest.extractor;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.Set;

/**
 * PDF extractor based on Apache PDFBox.
 * <p>Pages are stripped one by one and joined with a line break, so a sentence continuing on the
 * next page stays intact for the chunker.</p>
 */
@Component
public final class PdfTextExtractor implements TextExtractor {

    @Override
    public Set<String> supportedExtensions() {
        return Set.of(".pdf");
    }

    @Override
    public String extractText(final InputStream content) throws IOException {
        try (PDDocument pdf = PDDocument.load(content)) {
            final int pageCount = pdf.getNumberOfPages();
            final PDFTextStripper stripper = new PDFTextStripper();

            final StringBuilder text = new StringBuilder();
            for (int page = 1; page <= pageCount; page++) {
                stripper.setStartPage(page);
                stripper.setEndPage(page);

                final String pageText = stripper.getText(pdf);
                if (!pageText.isBlank()) {
                    text.append(pageText).append('\n');
                }
            }
            return text.toString();
        }
    }
}
