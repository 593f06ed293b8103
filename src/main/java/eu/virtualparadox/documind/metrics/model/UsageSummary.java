package eu.virtualparadox.documind.metrics.model;

import java.time.LocalDate;
import java.util.List;

/**
 * Usage statistics of one owner.
 *
 * @param totalQueries             number of answered queries
 * @param totalDocumentAccesses    number of recorded document actions
 * @param averageResponseTimeMillis mean of the positive response times, 0 without any
 * @param commonQueryWords         most frequent meaningful words of the queries
 * @param documentUsage            recorded actions per document, most used first
 * @param queryTrend               queries per day for the last seven active days
 */
public record UsageSummary(long totalQueries,
                           long totalDocumentAccesses,
                           double averageResponseTimeMillis,
                           List<WordCount> commonQueryWords,
                           List<DocumentUsage> documentUsage,
                           List<DailyCount> queryTrend) {

    public record WordCount(String word, long count) {
    }

    public record DocumentUsage(String documentId, long accessCount) {
    }

    public record DailyCount(LocalDate date, long count) {
    }

    public static UsageSummary empty() {
        return new UsageSummary(0, 0, 0.0, List.of(), List.of(), List.of());
    }
}
