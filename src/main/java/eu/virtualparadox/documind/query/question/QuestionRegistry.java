package eu.virtualparadox.documind.query.question;

import eu.virtualparadox.documind.query.model.QueryRequest;
import eu.virtualparadox.documind.query.model.QueryResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Keeps asynchronous query jobs. Once a job reaches a terminal status it no longer changes, and
 * it is dropped {@link #RETENTION} after finishing.
 */
@Slf4j
@Service
public class QuestionRegistry {

    public static final Duration RETENTION = Duration.ofHours(1);

    private final AtomicLong counter;
    private final Map<Long, QuestionJob> jobs;
    private final Clock clock;
    private final Duration retention;

    public QuestionRegistry() {
        this(Clock.systemUTC(), RETENTION);
    }

    QuestionRegistry(Clock clock, Duration retention) {
        this.counter = new AtomicLong(0);
        this.jobs = new ConcurrentHashMap<>();
        this.clock = clock;
        this.retention = retention;
    }

    public QuestionJob createJob(String ownerId, QueryRequest request) {
        evictFinished();
        long id = counter.incrementAndGet();
        QuestionJob job = new QuestionJob(id, ownerId, request);
        jobs.put(id, job);
        return job;
    }

    public Optional<QuestionJob> getJob(long id) {
        return Optional.ofNullable(jobs.get(id));
    }

    public void attach(long id, Future<?> future) {
        jobs.computeIfPresent(id, (k, job) -> {
            job.setFuture(future);
            if (job.getStatus() == EQuestionStatus.CANCELLED) {
                future.cancel(true);
            }
            return job;
        });
    }

    public void updateStatus(long id, EQuestionStatus status) {
        jobs.computeIfPresent(id, (k, job) -> {
            if (!job.getStatus().isTerminal()) {
                job.setStatus(status);
            }
            return job;
        });
    }

    public void complete(long id, QueryResult result) {
        jobs.computeIfPresent(id, (k, job) -> {
            if (!job.getStatus().isTerminal()) {
                job.setResult(result);
                job.setStatus(EQuestionStatus.COMPLETED);
                job.setFinishedAt(clock.instant());
            }
            return job;
        });
    }

    public void fail(long id, String error) {
        jobs.computeIfPresent(id, (k, job) -> {
            if (!job.getStatus().isTerminal()) {
                job.setError(error);
                job.setStatus(EQuestionStatus.FAILED);
                job.setFinishedAt(clock.instant());
            }
            return job;
        });
    }

    /**
     * Cancels a job that has not finished yet, interrupting its worker.
     *
     * @return {@code true} if the job was cancelled by this call
     */
    public boolean cancel(long id) {
        final boolean[] cancelled = {false};
        jobs.computeIfPresent(id, (k, job) -> {
            if (!job.getStatus().isTerminal()) {
                job.setStatus(EQuestionStatus.CANCELLED);
                job.setFinishedAt(clock.instant());
                if (job.getFuture() != null) {
                    job.getFuture().cancel(true);
                }
                cancelled[0] = true;
            }
            return job;
        });
        return cancelled[0];
    }

    /**
     * Drops jobs that finished longer ago than the retention period. Runs on every
     * {@link #createJob}.
     *
     * @return number of jobs removed
     */
    public int evictFinished() {
        final Instant cutoff = clock.instant().minus(retention);
        final int before = jobs.size();
        jobs.values().removeIf(job -> job.getFinishedAt() != null && job.getFinishedAt().isBefore(cutoff));
        final int removed = before - jobs.size();
        if (removed > 0) {
            log.debug("Evicted {} finished jobs", removed);
        }
        return removed;
    }
}
