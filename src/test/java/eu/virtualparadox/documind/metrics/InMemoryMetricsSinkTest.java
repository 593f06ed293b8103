package eu.virtualparadox.documind.metrics;

import eu.virtualparadox.documind.metrics.model.UsageSummary;
import eu.virtualparadox.documind.metrics.model.UsageSummary.DailyCount;
import eu.virtualparadox.documind.metrics.model.UsageSummary.DocumentUsage;
import eu.virtualparadox.documind.metrics.model.UsageSummary.WordCount;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;

class InMemoryMetricsSinkTest {

    /**
     * Clock the test moves forward by hand.
     */
    private static final class SteppingClock extends Clock {
        private Instant now = Instant.parse("2025-05-01T12:00:00Z");

        void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }

    private final SteppingClock clock = new SteppingClock();
    private final InMemoryMetricsSink sink = new InMemoryMetricsSink(clock);

    @Test
    @DisplayName("An owner without events gets the empty summary")
    void emptySummary() {
        assertEquals(UsageSummary.empty(), sink.summarize("nobody"));
    }

    @Test
    @DisplayName("Counts and average response time cover only the owner's events")
    void totalsPerOwner() {
        sink.recordQuery("alice", "solar panels", null, Duration.ofMillis(100));
        sink.recordQuery("alice", "battery storage", "doc1", Duration.ofMillis(300));
        sink.recordQuery("alice", "cached answer", null, Duration.ZERO);
        sink.recordQuery("bob", "unrelated question", null, Duration.ofMillis(5000));
        sink.recordDocumentAction("alice", "doc1", EDocumentAction.UPLOAD);

        UsageSummary summary = sink.summarize("alice");

        assertEquals(3, summary.totalQueries());
        assertEquals(1, summary.totalDocumentAccesses());
        // zero durations are left out of the average
        assertEquals(200.0, summary.averageResponseTimeMillis());
    }

    @Test
    @DisplayName("Common words skip short words and stop words, most frequent first")
    void commonWords() {
        sink.recordQuery("alice", "what are solar panels", null, Duration.ofMillis(1));
        sink.recordQuery("alice", "Solar power and solar storage", null, Duration.ofMillis(1));
        sink.recordQuery("alice", "where are panels installed", null, Duration.ofMillis(1));

        assertThat(sink.summarize("alice").commonQueryWords())
                .containsExactly(
                        new WordCount("solar", 3),
                        new WordCount("panels", 2),
                        new WordCount("installed", 1),
                        new WordCount("power", 1),
                        new WordCount("storage", 1));
    }

    @Test
    @DisplayName("Document usage counts every recorded action per document")
    void documentUsage() {
        sink.recordDocumentAction("alice", "doc1", EDocumentAction.UPLOAD);
        sink.recordDocumentAction("alice", "doc2", EDocumentAction.UPLOAD);
        sink.recordDocumentAction("alice", "doc2", EDocumentAction.QUERY);
        sink.recordDocumentAction("alice", "doc2", EDocumentAction.VIEW);

        assertThat(sink.summarize("alice").documentUsage())
                .containsExactly(new DocumentUsage("doc2", 3), new DocumentUsage("doc1", 1));
    }

    @Test
    @DisplayName("The trend lists queries per day for the last seven active days")
    void trend() {
        for (int day = 0; day < 9; day++) {
            for (int i = 0; i <= day % 2; i++) {
                sink.recordQuery("alice", "query", null, Duration.ofMillis(1));
            }
            clock.advance(Duration.ofDays(1));
        }

        assertThat(sink.summarize("alice").queryTrend())
                .hasSize(7)
                .first()
                .isEqualTo(new DailyCount(LocalDate.of(2025, 5, 3), 1));
        assertThat(sink.summarize("alice").queryTrend())
                .last()
                .isEqualTo(new DailyCount(LocalDate.of(2025, 5, 9), 1));
        assertEquals(new DailyCount(LocalDate.of(2025, 5, 4), 2), sink.summarize("alice").queryTrend().get(1));
    }

    @Test
    @DisplayName("Clearing discards all events")
    void clear() {
        sink.recordQuery("alice", "solar", null, Duration.ofMillis(1));
        sink.clear();

        assertEquals(UsageSummary.empty(), sink.summarize("alice"));
    }
}
