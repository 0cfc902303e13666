package lab.commentsearch.search.service;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.time.Duration;
import java.util.List;
import java.util.UUID;
import lab.commentsearch.search.domain.CommentSearchJob;
import lab.commentsearch.search.domain.CommentSearchStatus;
import lab.commentsearch.search.repository.CommentSearchJobRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

@SpringBootTest
class JobRecoveryTest {

    @Autowired
    private JobRecovery recovery;

    @Autowired
    private JobStore jobStore;

    @Autowired
    private JobQueue queue;

    @Autowired
    private CommentSearchJobRepository repository;

    @BeforeEach
    void reset() throws InterruptedException {
        repository.deleteAll();
        while (queue.dequeue(Duration.ZERO).isPresent()) {
            // drain ids left by earlier tests
        }
    }

    @Test
    @DisplayName("A job left PROCESSING by a crash is queued again as PENDING, in submission order")
    void interruptedJobIsRequeuedInSubmissionOrder() throws InterruptedException {
        UUID first = jobStore.create(job());
        UUID interrupted = jobStore.create(job());
        UUID last = jobStore.create(job());
        jobStore.claim(interrupted);

        int queued = recovery.recover();

        assertEquals(3, queued);
        assertEquals(CommentSearchStatus.PENDING, jobStore.get(interrupted).orElseThrow().getStatus());
        assertEquals(first, queue.dequeue(Duration.ZERO).orElseThrow());
        assertEquals(interrupted, queue.dequeue(Duration.ZERO).orElseThrow());
        assertEquals(last, queue.dequeue(Duration.ZERO).orElseThrow());
        assertEquals(0, queue.size());
    }

    @Test
    void finishedJobsAreNotQueued() {
        UUID done = jobStore.create(job());
        jobStore.claim(done);
        jobStore.update(done, stored -> stored.markFailed("gone", java.time.Instant.now()));

        assertEquals(0, recovery.recover());
        assertEquals(0, queue.size());
        assertEquals(CommentSearchStatus.FAILED, jobStore.get(done).orElseThrow().getStatus());
    }

    private static CommentSearchJob job() {
        return new CommentSearchJob(UUID.randomUUID(), "https://www.youtube.com/watch?v=X", List.of("a"), "a@b.com");
    }
}
