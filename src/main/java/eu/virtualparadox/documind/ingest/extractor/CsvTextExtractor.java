package eu.virtualparadox.documind.ingest.extractor;

import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Flattens a CSV file into one line per record, cells joined with {@code " | "}.
 * The header record comes first. Quoted cells may contain separators and doubled quotes,
 * but not line breaks.
 */
@Component
public final class CsvTextExtractor implements TextExtractor {

    static final String CELL_SEPARATOR = " | ";

    @Override
    public Set<String> supportedExtensions() {
        return Set.of(".csv");
    }

    @Override
    public String extractText(final InputStream content) throws IOException {
        final StringBuilder text = new StringBuilder();
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(content, StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (line.isBlank()) {
                    continue;
                }
                text.append(String.join(CELL_SEPARATOR, parseRecord(line))).append('\n');
            }
        }
        return text.toString().strip();
    }

    static List<String> parseRecord(final String line) {
        final List<String> cells = new ArrayList<>();
        final StringBuilder cell = new StringBuilder();
        boolean quoted = false;

        for (int i = 0; i < line.length(); i++) {
            final char c = line.charAt(i);
            if (quoted) {
                if (c == '"' && i + 1 < line.length() && line.charAt(i + 1) == '"') {
                    cell.append('"');
                    i++;
                } else if (c == '"') {
                    quoted = false;
                } else {
                    cell.append(c);
                }
            } else if (c == '"') {
                quoted = true;
            } else if (c == ',') {
                cells.add(cell.toString().trim());
                cell.setLength(0);
            } else {
                cell.append(c);
            }
        }
        cells.add(cell.toString().trim());
        return cells;
    }
}
