package eu.virtualparadox.documind.metrics;

import eu.virtualparadox.documind.metrics.model.UsageSummary;
import eu.virtualparadox.documind.metrics.model.UsageSummary.DailyCount;
import eu.virtualparadox.documind.metrics.model.UsageSummary.DocumentUsage;
import eu.virtualparadox.documind.metrics.model.UsageSummary.WordCount;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Keeps usage events in memory for the lifetime of the application context.
 */
@Slf4j
@Component
public class InMemoryMetricsSink implements MetricsSink {

    static final int TOP_WORDS = 5;
    static final int TREND_DAYS = 7;
    private static final int MIN_WORD_LENGTH = 4;
    private static final Set<String> STOP_WORDS = Set.of("what", "how", "where", "when", "why", "the", "and", "or", "but");

    private record QueryEvent(Instant timestamp, String query, String documentId, Duration responseTime) {
    }

    private record AccessEvent(Instant timestamp, String documentId, EDocumentAction action) {
    }

    private final Map<String, List<QueryEvent>> queries = new ConcurrentHashMap<>();
    private final Map<String, List<AccessEvent>> accesses = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryMetricsSink() {
        this(Clock.systemUTC());
    }

    InMemoryMetricsSink(final Clock clock) {
        this.clock = clock;
    }

    @Override
    public void recordQuery(final String ownerId, final String query, final String documentId, final Duration responseTime) {
        queries.computeIfAbsent(ownerId, k -> new CopyOnWriteArrayList<>())
                .add(new QueryEvent(clock.instant(), query, documentId, responseTime == null ? Duration.ZERO : responseTime));
    }

    @Override
    public void recordDocumentAction(final String ownerId, final String documentId, final EDocumentAction action) {
        accesses.computeIfAbsent(ownerId, k -> new CopyOnWriteArrayList<>())
                .add(new AccessEvent(clock.instant(), documentId, action));
    }

    @Override
    public UsageSummary summarize(final String ownerId) {
        final List<QueryEvent> ownerQueries = queries.getOrDefault(ownerId, List.of());
        final List<AccessEvent> ownerAccesses = accesses.getOrDefault(ownerId, List.of());
        if (ownerQueries.isEmpty() && ownerAccesses.isEmpty()) {
            return UsageSummary.empty();
        }

        return new UsageSummary(
                ownerQueries.size(),
                ownerAccesses.size(),
                averageResponseTime(ownerQueries),
                commonWords(ownerQueries),
                documentUsage(ownerAccesses),
                queryTrend(ownerQueries));
    }

    @PreDestroy
    public void clear() {
        log.debug("Discarding usage events of {} owners", queries.size() + accesses.size());
        queries.clear();
        accesses.clear();
    }

    private double averageResponseTime(final List<QueryEvent> events) {
        return events.stream()
                .mapToLong(e -> e.responseTime().toMillis())
                .filter(ms -> ms > 0)
                .average()
                .orElse(0.0);
    }

    private List<WordCount> commonWords(final List<QueryEvent> events) {
        final Map<String, Long> counts = events.stream()
                .flatMap(e -> List.of(e.query().toLowerCase(Locale.ROOT).split("\\s+")).stream())
                .filter(w -> w.length() >= MIN_WORD_LENGTH && !STOP_WORDS.contains(w))
                .collect(Collectors.groupingBy(Function.identity(), Collectors.counting()));

        return counts.entrySet().stream()
                .sorted(Map.Entry.<String, Long>comparingByValue().reversed().thenComparing(Map.Entry.<String, Long>comparingByKey()))
                .limit(TOP_WORDS)
                .map(e -> new WordCount(e.getKey(), e.getValue()))
                .toList();
    }

    private List<DocumentUsage> documentUsage(final List<AccessEvent> events) {
        final Map<String, Long> counts = events.stream()
                .collect(Collectors.groupingBy(e -> e.documentId() == null ? "unknown" : e.documentId(), Collectors.counting()));

        return counts.entrySet().stream()
                .map(e -> new DocumentUsage(e.getKey(), e.getValue()))
                .sorted(Comparator.comparingLong(DocumentUsage::accessCount).reversed().thenComparing(DocumentUsage::documentId))
                .toList();
    }

    private List<DailyCount> queryTrend(final List<QueryEvent> events) {
        final TreeMap<LocalDate, Long> daily = events.stream()
                .collect(Collectors.groupingBy(e -> LocalDate.ofInstant(e.timestamp(), ZoneOffset.UTC), TreeMap::new, Collectors.counting()));

        final List<DailyCount> trend = new ArrayList<>();
        daily.forEach((date, count) -> trend.add(new DailyCount(date, count)));
        return trend.subList(Math.max(0, trend.size() - TREND_DAYS), trend.size());
    }
}
