package lab.commentsearch.search.service;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import lab.commentsearch.search.config.CommentSearchProperties;
import lab.commentsearch.search.domain.CommentSearchJob;
import lab.commentsearch.search.exception.JobStoreException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

class CommentSearchWorkerStepTest {

    private final JobQueue queue = new JobQueue();
    private final JobStore jobStore = mock(JobStore.class);
    private final CommentSearchJobProcessor processor = mock(CommentSearchJobProcessor.class);
    private CommentSearchWorker worker;

    @BeforeEach
    void setUp() {
        CommentSearchProperties properties = new CommentSearchProperties();
        properties.setStoreRetryBackoffMs(1);
        worker = new CommentSearchWorker(queue, jobStore, processor, properties, new ThreadPoolTaskExecutor());
    }

    @Test
    void emptyQueueDoesNothing() throws InterruptedException {
        assertFalse(worker.processNext(Duration.ofMillis(10)));
        verify(processor, never()).process(any());
    }

    @Test
    void claimedJobIsProcessed() throws InterruptedException {
        UUID id = UUID.randomUUID();
        CommentSearchJob job = newJob(id);
        when(jobStore.claim(id)).thenReturn(true);
        when(jobStore.get(id)).thenReturn(Optional.of(job));
        queue.enqueue(id);

        assertTrue(worker.processNext(Duration.ZERO));
        verify(processor).process(job);
    }

    @Test
    void jobClaimedElsewhereIsSkipped() throws InterruptedException {
        UUID id = UUID.randomUUID();
        when(jobStore.claim(id)).thenReturn(false);
        queue.enqueue(id);

        assertTrue(worker.processNext(Duration.ZERO));
        verify(processor, never()).process(any());
    }

    @Test
    void storeFailureOnClaimIsRetriedUntilTheJobRuns() throws InterruptedException {
        UUID id = UUID.randomUUID();
        CommentSearchJob job = newJob(id);
        when(jobStore.claim(id))
                .thenThrow(new JobStoreException("db down", null))
                .thenThrow(new JobStoreException("db down", null))
                .thenReturn(true);
        when(jobStore.get(id)).thenReturn(Optional.of(job));
        queue.enqueue(id);

        assertTrue(worker.processNext(Duration.ZERO));

        verify(jobStore, times(3)).claim(id);
        verify(processor).process(job);
    }

    @Test
    void storeFailureLoadingClaimedJobIsRetried() throws InterruptedException {
        UUID id = UUID.randomUUID();
        CommentSearchJob job = newJob(id);
        when(jobStore.claim(id)).thenReturn(true);
        when(jobStore.get(id))
                .thenThrow(new JobStoreException("db down", null))
                .thenReturn(Optional.of(job));
        queue.enqueue(id);

        assertTrue(worker.processNext(Duration.ZERO));

        verify(jobStore, times(2)).get(id);
        verify(processor).process(job);
    }

    @Test
    void interruptDuringClaimRetryLeavesJobForRecovery() {
        UUID id = UUID.randomUUID();
        when(jobStore.claim(id)).thenAnswer(invocation -> {
            Thread.currentThread().interrupt();
            throw new JobStoreException("db down", null);
        });
        queue.enqueue(id);

        assertThrows(InterruptedException.class, () -> worker.processNext(Duration.ZERO));

        verify(jobStore, times(1)).claim(id);
        verify(processor, never()).process(any());
    }

    private static CommentSearchJob newJob(UUID id) {
        return new CommentSearchJob(id, "https://youtu.be/x", List.of("a"), "a@b.com");
    }
}
