package lab.commentsearch.search.service;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;
import lab.commentsearch.search.config.CommentSearchProperties;
import lab.commentsearch.search.domain.CommentSearchJob;
import lab.commentsearch.search.exception.JobStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.SmartLifecycle;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Component;

/**
 * The single consumer of {@link JobQueue}. Takes one id at a time, claims the job and
 * hands it to {@link CommentSearchJobProcessor}; an error in one job never stops the
 * loop.
 */
@Component
@ConditionalOnProperty(name = "comment-search.worker.enabled", havingValue = "true", matchIfMissing = true)
public class CommentSearchWorker implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(CommentSearchWorker.class);
    private final JobQueue queue;
    private final JobStore jobStore;
    private final CommentSearchJobProcessor processor;
    private final CommentSearchProperties properties;
    private final ThreadPoolTaskExecutor executor;
    private final AtomicBoolean running = new AtomicBoolean(false);

    public CommentSearchWorker(JobQueue queue,
                               JobStore jobStore,
                               CommentSearchJobProcessor processor,
                               CommentSearchProperties properties,
                               @Qualifier("searchWorkerExecutor") ThreadPoolTaskExecutor executor) {
        this.queue = queue;
        this.jobStore = jobStore;
        this.processor = processor;
        this.properties = properties;
        this.executor = executor;
    }

    @Override
    public void start() {
        if (running.compareAndSet(false, true)) {
            executor.execute(this::workerLoop);
            log.info("Comment search worker started queued={}", queue.size());
        }
    }

    @Override
    public void stop() {
        if (running.compareAndSet(true, false)) {
            log.info("Comment search worker stopping");
        }
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }

    private void workerLoop() {
        Duration pollTimeout = Duration.ofMillis(properties.getWorker().getPollTimeoutMs());
        while (running.get()) {
            try {
                processNext(pollTimeout);
            } catch (InterruptedException e) {
                log.info("Comment search worker interrupted, shutting down");
                Thread.currentThread().interrupt();
                break;
            } catch (Exception e) {
                log.error("Comment search worker encountered unexpected error", e);
            }
        }
        log.info("Comment search worker stopped");
    }

    /**
     * Handles at most one queued job.
     *
     * @return {@code true} if an id was taken from the queue
     */
    boolean processNext(Duration timeout) throws InterruptedException {
        Optional<UUID> next = queue.dequeue(timeout);
        if (next.isEmpty()) {
            return false;
        }
        UUID jobId = next.get();
        if (!withStoreRetry(jobId, "claim", () -> jobStore.claim(jobId))) {
            log.debug("Skipping jobId={} already claimed or finished", jobId);
            return true;
        }
        Optional<CommentSearchJob> job = withStoreRetry(jobId, "load", () -> jobStore.get(jobId));
        if (job.isEmpty()) {
            log.error("Claimed job vanished jobId={}", jobId);
            return true;
        }
        long startedMs = System.currentTimeMillis();
        processor.process(job.get());
        log.info("Finished jobId={} in {}ms", jobId, System.currentTimeMillis() - startedMs);
        return true;
    }

    /**
     * Repeats a store call until it succeeds. An interrupt during the backoff ends the
     * wait; the job is then picked up by recovery on the next start.
     */
    private <T> T withStoreRetry(UUID jobId, String operation, Supplier<T> action) throws InterruptedException {
        for (int attempt = 1; ; attempt++) {
            try {
                return action.get();
            } catch (JobStoreException ex) {
                log.error("Store {} failed jobId={} attempt={} message={}", operation, jobId, attempt, ex.getMessage());
                Thread.sleep(properties.getStoreRetryBackoffMs() * (1L << Math.min(attempt - 1, 6)));
            }
        }
    }
}
