package lab.commentsearch.search.service;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Consumer;
import java.util.function.Supplier;
import lab.commentsearch.search.domain.CommentSearchJob;
import lab.commentsearch.search.domain.CommentSearchStatus;
import lab.commentsearch.search.exception.JobStoreException;
import lab.commentsearch.search.repository.CommentSearchJobRepository;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Durable source of truth for comment search jobs.
 *
 * <p>Every write is committed before the method returns. Updates to one job are
 * serialised by a row lock, so concurrent callers never interleave mutations of the
 * same record. Persistence failures surface as {@link JobStoreException}.
 */
@Service
public class JobStore {

    private final CommentSearchJobRepository repository;
    private final TransactionTemplate transactionTemplate;
    private final TransactionTemplate readOnlyTemplate;

    public JobStore(CommentSearchJobRepository repository, PlatformTransactionManager transactionManager) {
        this.repository = repository;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.readOnlyTemplate = new TransactionTemplate(transactionManager);
        this.readOnlyTemplate.setReadOnly(true);
    }

    public UUID create(CommentSearchJob job) {
        return execute("create " + job.getId(), () -> repository.saveAndFlush(job).getId());
    }

    public Optional<CommentSearchJob> get(UUID id) {
        return execute("get " + id, () -> readOnlyTemplate.execute(status -> repository.findById(id)));
    }

    /**
     * Applies {@code mutation} to the locked record and commits it.
     *
     * @return the updated job, or empty when no job has this id
     */
    public Optional<CommentSearchJob> update(UUID id, Consumer<CommentSearchJob> mutation) {
        return execute("update " + id, () -> transactionTemplate.execute(status ->
                repository.findByIdForUpdate(id).map(job -> {
                    mutation.accept(job);
                    return repository.saveAndFlush(job);
                })));
    }

    /**
     * Ids of jobs waiting for the worker, oldest submission first.
     */
    public List<UUID> listPending() {
        return execute("list pending", () ->
                repository.findIdsInSubmissionOrder(CommentSearchStatus.PENDING));
    }

    /**
     * Moves a job from {@code PENDING} to {@code PROCESSING}. Only one caller can win.
     */
    public boolean claim(UUID id) {
        return execute("claim " + id, () -> repository.claim(id,
                CommentSearchStatus.PENDING,
                CommentSearchStatus.PROCESSING,
                Instant.now()) == 1);
    }

    /**
     * Puts every job left in {@code PROCESSING} by a previous run back to {@code PENDING}.
     */
    public int recoverInterrupted() {
        return execute("recover interrupted", () -> repository.recoverInterrupted(
                CommentSearchStatus.PROCESSING,
                CommentSearchStatus.PENDING));
    }

    public long countByStatus(CommentSearchStatus status) {
        return execute("count " + status, () -> repository.countByStatus(status));
    }

    private <T> T execute(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (DataAccessException | TransactionException ex) {
            throw new JobStoreException("Job store " + operation + " failed: " + ex.getMessage(), ex);
        }
    }
}
