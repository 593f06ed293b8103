package eu.virtualparadox.documind.summary.model;

import java.time.Instant;
import java.util.List;

/**
 * Summary of one document.
 *
 * @param executiveSummary text written by the language model, or extracted sentences when
 *                         {@code aiGenerated} is {@code false}
 * @param keyPoints        at most ten notable lines or sentences
 */
public record DocumentSummary(String summaryId,
                              String documentId,
                              String filename,
                              String fileType,
                              long fileSize,
                              Instant uploadedAt,
                              Instant generatedAt,
                              String executiveSummary,
                              boolean aiGenerated,
                              List<String> keyPoints,
                              DocumentStatistics statistics,
                              ContentAnalysis contentAnalysis,
                              String quickOverview) {

    public DocumentSummary {
        keyPoints = List.copyOf(keyPoints);
    }
}
