package eu.virtualparadox.documind.summary;

import eu.virtualparadox.documind.rag.context.ELanguage;
import eu.virtualparadox.documind.summary.model.ContentAnalysis;
import eu.virtualparadox.documind.summary.model.DocumentStatistics;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Heuristic, model-free parts of a document summary: key points, statistics, classification,
 * overview and the extractive fallback summary.
 * <p>
 * Spreadsheets ({@code .csv}, {@code .xlsx}) and PDFs get dedicated rules; every other type is
 * treated as running text.
 */
@Component
public class DocumentProfiler {

    static final int MAX_KEY_POINTS = 10;
    static final int MAX_GENERAL_KEY_POINTS = 8;

    static final String FALLBACK_SUMMARY = "This document contains structured information that requires detailed review.";

    private static final Pattern EMAIL = Pattern.compile("\\b[A-Za-z0-9._%+-]+@[A-Za-z0-9.-]+\\.[A-Za-z]{2,}\\b");
    private static final Pattern PHONE = Pattern.compile("\\b\\d{10}\\b");
    private static final Pattern TEN_DIGITS = Pattern.compile("\\d{10}");
    private static final Pattern NUMBER = Pattern.compile("\\b\\d+\\.?\\d*\\b");
    private static final Pattern YEAR = Pattern.compile("\\b\\d{4}\\b");
    private static final Pattern NAME = Pattern.compile("\\b[A-Z][a-z]+\\s+[A-Z][a-z]+");
    private static final Pattern ANY_NUMBER = Pattern.compile("\\d+\\.?\\d*");

    private static final List<String> ACADEMIC_DATA = List.of("score", "grade", "percent", "cpi", "gpa");
    private static final List<String> IMPORTANT = List.of("important", "key", "summary", "conclusion", "result", "finding", "recommendation");

    // ---------- Key points ----------

    /**
     * @return at most {@value #MAX_KEY_POINTS} key points, chosen by file type
     */
    public List<String> keyPoints(final String content, final String fileType) {
        final List<String> points;
        if (isSpreadsheet(fileType)) {
            points = spreadsheetKeyPoints(content);
        } else if (isPdf(fileType)) {
            points = pdfKeyPoints(content);
        } else {
            points = generalKeyPoints(content);
        }
        return points.size() > MAX_KEY_POINTS ? List.copyOf(points.subList(0, MAX_KEY_POINTS)) : points;
    }

    private List<String> spreadsheetKeyPoints(final String content) {
        final List<String> points = new ArrayList<>();
        for (final String raw : lines(content)) {
            final String line = raw.strip();
            if (line.isEmpty()) {
                continue;
            }
            final String excerpt = StringUtils.left(line, 100) + "...";
            final String lower = line.toLowerCase(Locale.ROOT);

            if (TEN_DIGITS.matcher(line).find() && line.indexOf('@') >= 0) {
                points.add("Contact information found: " + excerpt);
            }
            if (ANY_NUMBER.matcher(line).find() && containsAny(lower, ACADEMIC_DATA)) {
                points.add("Academic data: " + excerpt);
            }
            if (NAME.matcher(line).find()) {
                points.add("Name entry: " + excerpt);
            }
        }
        return points.isEmpty() ? List.of("Spreadsheet contains structured data with multiple entries.") : points;
    }

    private List<String> pdfKeyPoints(final String content) {
        final List<String> points = new ArrayList<>();
        for (final String raw : sentences(content)) {
            final String sentence = raw.strip();
            if (sentence.length() < 20) {
                continue;
            }
            if (containsAny(sentence.toLowerCase(Locale.ROOT), IMPORTANT)) {
                points.add(sentence.length() > 150 ? sentence.substring(0, 150) + "..." : sentence);
            }
        }
        return points.isEmpty() ? List.of("PDF document contains detailed information.") : points;
    }

    private List<String> generalKeyPoints(final String content) {
        final List<String> points = new ArrayList<>();
        for (final String raw : sentences(content)) {
            final String sentence = raw.strip();
            if (sentence.length() >= 30 && sentence.length() <= 200) {
                points.add(sentence);
                if (points.size() == MAX_GENERAL_KEY_POINTS) {
                    break;
                }
            }
        }
        return points;
    }

    // ---------- Statistics ----------

    public DocumentStatistics statistics(final String content, final long fileSizeBytes) {
        final int words = words(content);
        final double averageSentenceLength = Math.round(words * 100.0 / sentences(content).length) / 100.0;

        return new DocumentStatistics(
                words,
                content.length(),
                lines(content).length,
                fileSizeBytes,
                averageSentenceLength,
                count(EMAIL, content),
                count(PHONE, content),
                count(NUMBER, content));
    }

    // ---------- Classification ----------

    public ContentAnalysis analyze(final String content, final String fileType) {
        return new ContentAnalysis(
                documentType(content, fileType),
                ELanguage.detect(content).getDisplayName(),
                categories(content),
                dataTypes(content));
    }

    String documentType(final String content, final String fileType) {
        final String lower = content.toLowerCase(Locale.ROOT);
        if (isSpreadsheet(fileType)) {
            if (containsAny(lower, List.of("contact", "phone", "email", "student", "candidate"))) {
                return "Contact/Student Database";
            }
            if (containsAny(lower, List.of("financial", "revenue", "cost", "budget"))) {
                return "Financial Data";
            }
            return "Structured Data";
        }
        if (isPdf(fileType)) {
            if (containsAny(lower, List.of("report", "analysis", "study"))) {
                return "Report/Analysis";
            }
            if (containsAny(lower, List.of("manual", "guide", "instruction"))) {
                return "Manual/Guide";
            }
            return "Document";
        }
        return "Text Document";
    }

    List<String> categories(final String content) {
        final String lower = content.toLowerCase(Locale.ROOT);
        final List<String> categories = new ArrayList<>();
        if (containsAny(lower, List.of("contact", "phone", "email", "address"))) {
            categories.add("Contact Information");
        }
        if (containsAny(lower, List.of("academic", "student", "grade", "score", "cpi", "gpa"))) {
            categories.add("Academic Data");
        }
        if (containsAny(lower, List.of("financial", "revenue", "cost", "budget", "money"))) {
            categories.add("Financial Information");
        }
        if (containsAny(lower, List.of("technical", "code", "programming", "software"))) {
            categories.add("Technical Content");
        }
        if (containsAny(lower, List.of("legal", "agreement", "contract", "terms"))) {
            categories.add("Legal Content");
        }
        return categories.isEmpty() ? List.of("General Content") : categories;
    }

    List<String> dataTypes(final String content) {
        final List<String> types = new ArrayList<>();
        if (EMAIL.matcher(content).find()) {
            types.add("Email Addresses");
        }
        if (PHONE.matcher(content).find()) {
            types.add("Phone Numbers");
        }
        if (YEAR.matcher(content).find()) {
            types.add("Years/Dates");
        }
        if (NAME.matcher(content).find()) {
            types.add("Names");
        }
        if (NUMBER.matcher(content).find()) {
            types.add("Numerical Data");
        }
        return types.isEmpty() ? List.of("Text Content") : types;
    }

    // ---------- Overview ----------

    public String quickOverview(final String content, final String fileType) {
        if (isSpreadsheet(fileType)) {
            int entries = 0;
            for (final String line : lines(content)) {
                if (!line.isBlank()) {
                    entries++;
                }
            }
            return "This spreadsheet contains approximately " + entries + " data entries with structured information.";
        }
        if (isPdf(fileType)) {
            return "This PDF document contains approximately " + words(content) + " words of detailed information.";
        }
        return "This document contains approximately " + words(content) + " words of text content.";
    }

    /**
     * The first three sentences of 20 to 150 characters, used when no model summary is available.
     */
    public String fallbackSummary(final String content) {
        final List<String> picked = new ArrayList<>(3);
        for (final String raw : sentences(content)) {
            final String sentence = raw.strip();
            if (sentence.length() >= 20 && sentence.length() <= 150) {
                picked.add(sentence);
            }
            if (picked.size() >= 3) {
                break;
            }
        }
        return picked.isEmpty() ? FALLBACK_SUMMARY : String.join(". ", picked) + ".";
    }

    // ---------- Helpers ----------

    static boolean isSpreadsheet(final String fileType) {
        return ".csv".equalsIgnoreCase(fileType) || ".xlsx".equalsIgnoreCase(fileType);
    }

    static boolean isPdf(final String fileType) {
        return ".pdf".equalsIgnoreCase(fileType);
    }

    private static String[] sentences(final String content) {
        return content.split("\\.", -1);
    }

    private static String[] lines(final String content) {
        return content.split("\n", -1);
    }

    private static int words(final String content) {
        return StringUtils.split(content).length;
    }

    private static int count(final Pattern pattern, final String content) {
        final Matcher matcher = pattern.matcher(content);
        int count = 0;
        while (matcher.find()) {
            count++;
        }
        return count;
    }

    private static boolean containsAny(final String lower, final List<String> keywords) {
        for (final String keyword : keywords) {
            if (lower.contains(keyword)) {
                return true;
            }
        }
        return false;
    }
}
