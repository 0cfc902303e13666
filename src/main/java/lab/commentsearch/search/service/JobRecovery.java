package lab.commentsearch.search.service;

import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.stereotype.Component;

/**
 * Rebuilds the queue from the store once all beans exist and before the worker
 * starts. Jobs a previous run left {@code PROCESSING} are run again from the start.
 */
@Component
public class JobRecovery implements SmartInitializingSingleton {

    private static final Logger log = LoggerFactory.getLogger(JobRecovery.class);
    private final JobStore jobStore;
    private final JobQueue queue;
    private final SearchProcessingMetrics metrics;

    public JobRecovery(JobStore jobStore, JobQueue queue, SearchProcessingMetrics metrics) {
        this.jobStore = jobStore;
        this.queue = queue;
        this.metrics = metrics;
    }

    @Override
    public void afterSingletonsInstantiated() {
        recover();
    }

    public int recover() {
        int interrupted = jobStore.recoverInterrupted();
        metrics.recordRecovered(interrupted);
        if (interrupted > 0) {
            log.warn("Recovered interrupted jobs count={}", interrupted);
        }
        List<UUID> pending = jobStore.listPending();
        pending.forEach(queue::enqueue);
        log.info("Job queue rebuilt pending={} interrupted={}", pending.size(), interrupted);
        return pending.size();
    }
}
