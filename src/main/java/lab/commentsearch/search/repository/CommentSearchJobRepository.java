package lab.commentsearch.search.repository;

import jakarta.persistence.LockModeType;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import lab.commentsearch.search.domain.CommentSearchJob;
import lab.commentsearch.search.domain.CommentSearchStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

public interface CommentSearchJobRepository extends JpaRepository<CommentSearchJob, UUID> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select j from CommentSearchJob j where j.id = :id")
    Optional<CommentSearchJob> findByIdForUpdate(@Param("id") UUID id);

    @Query("select j.id from CommentSearchJob j where j.status = :status order by j.submittedAt asc, j.id asc")
    List<UUID> findIdsInSubmissionOrder(@Param("status") CommentSearchStatus status);

    long countByStatus(CommentSearchStatus status);

    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("update CommentSearchJob j set j.status = :processing, j.startedAt = :now where j.id = :id and j.status = :pending")
    int claim(@Param("id") UUID id,
              @Param("pending") CommentSearchStatus pending,
              @Param("processing") CommentSearchStatus processing,
              @Param("now") Instant now);

    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("update CommentSearchJob j set j.status = :pending, j.startedAt = null where j.status = :processing")
    int recoverInterrupted(@Param("processing") CommentSearchStatus processing,
                           @Param("pending") CommentSearchStatus pending);
}
