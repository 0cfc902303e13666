package lab.commentsearch.search.domain;

import jakarta.persistence.CollectionTable;
import jakarta.persistence.Column;
import jakarta.persistence.ElementCollection;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.Lob;
import jakarta.persistence.OrderColumn;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;
import lab.commentsearch.search.exception.IllegalJobTransitionException;

/**
 * One submitted comment search and its lifecycle state.
 *
 * <p>Request fields are fixed at construction. Result fields are written once, by
 * {@link #markCompleted} or {@link #markFailed}, and only while the job is
 * {@link CommentSearchStatus#PROCESSING}. The move from {@code PENDING} to
 * {@code PROCESSING} and back (crash recovery) is done by conditional updates in the
 * repository so that only one worker can win a claim.
 */
@Entity
@Table(name = "comment_search_job")
public class CommentSearchJob {

    @Id
    private UUID id;

    @Column(name = "video_url", nullable = false, updatable = false, length = 2048)
    private String videoUrl;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "comment_search_job_phrase", joinColumns = @JoinColumn(name = "job_id"))
    @OrderColumn(name = "position")
    @Column(name = "phrase", nullable = false, length = 500)
    private List<String> phrases = new ArrayList<>();

    @Column(nullable = false, updatable = false)
    private String email;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private CommentSearchStatus status;

    @Column(name = "submitted_at", nullable = false, updatable = false)
    private Instant submittedAt;

    @Column(name = "started_at")
    private Instant startedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    @Column(name = "comment_count")
    private Integer commentCount;

    @Column(name = "scanned_count")
    private Integer scannedCount;

    @Column(name = "email_sent")
    private Boolean emailSent;

    @Lob
    @Column(name = "error_message")
    private String errorMessage;

    @Lob
    @Column(name = "matches_json")
    private String matchesJson;

    protected CommentSearchJob() {
    }

    public CommentSearchJob(UUID id, String videoUrl, List<String> phrases, String email) {
        this.id = id;
        this.videoUrl = videoUrl;
        this.phrases = new ArrayList<>(phrases);
        this.email = email;
        this.status = CommentSearchStatus.PENDING;
    }

    @PrePersist
    void onCreate() {
        if (submittedAt == null) {
            submittedAt = Instant.now();
        }
    }

    public void markCompleted(int commentCount, int scannedCount, boolean emailSent, String matchesJson, Instant now) {
        requireProcessing(CommentSearchStatus.COMPLETED);
        this.status = CommentSearchStatus.COMPLETED;
        this.commentCount = commentCount;
        this.scannedCount = scannedCount;
        this.emailSent = emailSent;
        this.matchesJson = matchesJson;
        this.completedAt = notBeforeSubmission(now);
    }

    public void markFailed(String errorMessage, Instant now) {
        requireProcessing(CommentSearchStatus.FAILED);
        this.status = CommentSearchStatus.FAILED;
        this.errorMessage = errorMessage == null || errorMessage.isBlank() ? "Unknown error" : errorMessage;
        this.completedAt = notBeforeSubmission(now);
    }

    private void requireProcessing(CommentSearchStatus target) {
        if (status != CommentSearchStatus.PROCESSING) {
            throw new IllegalJobTransitionException(id, status, target);
        }
    }

    private Instant notBeforeSubmission(Instant now) {
        return submittedAt != null && now.isBefore(submittedAt) ? submittedAt : now;
    }

    public UUID getId() {
        return id;
    }

    public String getVideoUrl() {
        return videoUrl;
    }

    public List<String> getPhrases() {
        return Collections.unmodifiableList(phrases);
    }

    public String getEmail() {
        return email;
    }

    public CommentSearchStatus getStatus() {
        return status;
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    public Instant getSubmittedAt() {
        return submittedAt;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public Instant getCompletedAt() {
        return completedAt;
    }

    public Integer getCommentCount() {
        return commentCount;
    }

    public Integer getScannedCount() {
        return scannedCount;
    }

    public Boolean getEmailSent() {
        return emailSent;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public String getMatchesJson() {
        return matchesJson;
    }
}
