package eu.virtualparadox.documind.metrics;

import eu.virtualparadox.documind.metrics.model.UsageSummary;

import java.time.Duration;

/**
 * Receives usage events of the query and document endpoints.
 * Implementations must be thread-safe and must never fail the calling request.
 */
public interface MetricsSink {

    void recordQuery(final String ownerId, final String query, final String documentId, final Duration responseTime);

    void recordDocumentAction(final String ownerId, final String documentId, final EDocumentAction action);

    UsageSummary summarize(final String ownerId);

}
