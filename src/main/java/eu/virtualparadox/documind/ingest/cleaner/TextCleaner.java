package eu.virtualparadox.documind.ingest.cleaner;

import org.springframework.stereotype.Component;

import java.text.Normalizer;
import java.util.regex.Pattern;

@Component
public class TextCleaner {

    private static final Pattern LINE_ENDINGS = Pattern.compile("\\r\\n?");
    private static final Pattern ZERO_WIDTH = Pattern.compile("[\\u200B\\u200C\\u200D\\uFEFF]");
    private static final Pattern FORMAT_CHARS = Pattern.compile("\\p{Cf}");
    // every control char except TAB and LF
    private static final Pattern CONTROL_CHARS = Pattern.compile("[\\p{Cc}&&[^\\t\\n]]");
    private static final Pattern HORIZONTAL_WHITESPACE = Pattern.compile("[ \\t\\x0B\\f]+");
    private static final Pattern SPACE_AROUND_NEWLINE = Pattern.compile(" ?\\n ?");
    private static final Pattern BLANK_LINES = Pattern.compile("\\n{3,}");

    /**
     * Cleans extracted text by removing control characters, zero-width spaces and soft hyphens
     * while keeping diacritics and line structure.
     * <p>
     * Line breaks survive (normalised to {@code \n}, at most one blank line in a row) because the
     * chunker uses them as fallback boundaries. Runs of horizontal whitespace collapse into a
     * single space.
     *
     * @param input raw text, may be {@code null}
     * @return cleaned text, never {@code null}
     */
    public String cleanText(final String input) {
        if (input == null || input.isEmpty()) {
            return "";
        }

        String text = Normalizer.normalize(input, Normalizer.Form.NFC);
        text = LINE_ENDINGS.matcher(text).replaceAll("\n");
        // zero-width and similar → SPACE
        text = ZERO_WIDTH.matcher(text).replaceAll(" ");
        // non-breaking space → SPACE
        text = text.replace('\u00A0', ' ');
        // soft hyphen → remove
        text = text.replace("\u00AD", "");
        // other format chars → SPACE
        text = FORMAT_CHARS.matcher(text).replaceAll(" ");
        text = CONTROL_CHARS.matcher(text).replaceAll("");
        text = HORIZONTAL_WHITESPACE.matcher(text).replaceAll(" ");
        text = SPACE_AROUND_NEWLINE.matcher(text).replaceAll("\n");
        text = BLANK_LINES.matcher(text).replaceAll("\n\n");
        return text.trim();
    }
}
