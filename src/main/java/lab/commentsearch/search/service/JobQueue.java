package lab.commentsearch.search.service;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import org.springframework.stereotype.Component;

/**
 * FIFO of job ids waiting for the worker. Any number of threads may enqueue; the
 * worker is the only consumer. The queue holds ids only, the job record itself stays
 * in {@link JobStore}, which is how the queue is rebuilt after a restart.
 */
@Component
public class JobQueue {

    private final BlockingQueue<UUID> pending = new LinkedBlockingQueue<>();

    public void enqueue(UUID jobId) {
        pending.add(jobId);
    }

    /**
     * Waits up to {@code timeout} for the next id.
     */
    public Optional<UUID> dequeue(Duration timeout) throws InterruptedException {
        return Optional.ofNullable(pending.poll(timeout.toMillis(), TimeUnit.MILLISECONDS));
    }

    public int size() {
        return pending.size();
    }
}
