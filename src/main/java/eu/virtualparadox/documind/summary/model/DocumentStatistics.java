package eu.virtualparadox.documind.summary.model;

/**
 * Counts measured on the extracted text of a document.
 *
 * @param averageSentenceLength words per period-delimited sentence, rounded to two decimals
 * @param phoneCount            ten-digit numbers
 */
public record DocumentStatistics(int wordCount,
                                 int characterCount,
                                 int lineCount,
                                 long fileSizeBytes,
                                 double averageSentenceLength,
                                 int emailCount,
                                 int phoneCount,
                                 int numberCount) {
}
