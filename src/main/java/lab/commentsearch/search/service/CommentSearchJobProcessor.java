package lab.commentsearch.search.service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Consumer;
import lab.commentsearch.search.client.CommentSource;
import lab.commentsearch.search.config.CommentSearchProperties;
import lab.commentsearch.search.domain.CommentSearchJob;
import lab.commentsearch.search.domain.MatchedComment;
import lab.commentsearch.search.domain.VideoComment;
import lab.commentsearch.search.exception.CommentRetrievalException;
import lab.commentsearch.search.exception.JobStoreException;
import lab.commentsearch.search.matching.PhraseMatcher;
import lab.commentsearch.search.matching.TimestampLinker;
import lab.commentsearch.search.notification.Notifier;
import lab.commentsearch.search.notification.SearchReportFormatter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Runs the search pipeline for one claimed job: fetch comments, match phrases, link
 * timestamps, mail the report and persist the terminal state.
 */
@Component
public class CommentSearchJobProcessor {

    private static final Logger log = LoggerFactory.getLogger(CommentSearchJobProcessor.class);
    private static final int PROGRESS_EVERY = 100;

    private final JobStore jobStore;
    private final CommentSource commentSource;
    private final Notifier notifier;
    private final PhraseMatcher phraseMatcher;
    private final TimestampLinker timestampLinker;
    private final SearchReportFormatter reportFormatter;
    private final MatchesJsonCodec matchesCodec;
    private final CommentSearchProperties properties;
    private final SearchProcessingMetrics metrics;

    public CommentSearchJobProcessor(JobStore jobStore,
                                     CommentSource commentSource,
                                     Notifier notifier,
                                     PhraseMatcher phraseMatcher,
                                     TimestampLinker timestampLinker,
                                     SearchReportFormatter reportFormatter,
                                     MatchesJsonCodec matchesCodec,
                                     CommentSearchProperties properties,
                                     SearchProcessingMetrics metrics) {
        this.jobStore = jobStore;
        this.commentSource = commentSource;
        this.notifier = notifier;
        this.phraseMatcher = phraseMatcher;
        this.timestampLinker = timestampLinker;
        this.reportFormatter = reportFormatter;
        this.matchesCodec = matchesCodec;
        this.properties = properties;
        this.metrics = metrics;
    }

    /**
     * Processes a job the caller has already claimed. Never throws for pipeline
     * errors; they end the job as {@code FAILED}. An interrupt ends processing without
     * a terminal write and leaves the job to recovery.
     */
    public void process(CommentSearchJob job) {
        UUID jobId = job.getId();
        Instant started = Instant.now();
        log.info("Processing jobId={} videoUrl={} phrases={}", jobId, job.getVideoUrl(), job.getPhrases());

        List<VideoComment> comments;
        try {
            comments = fetchComments(job.getVideoUrl());
        } catch (RuntimeException ex) {
            if (isInterruption(ex)) {
                abandon(jobId);
                return;
            }
            if (ex instanceof CommentRetrievalException) {
                log.warn("Retrieval failed jobId={} statusCode={} message={}",
                        jobId, ((CommentRetrievalException) ex).getStatusCode(), ex.getMessage());
                fail(jobId, ex.getMessage(), started);
            } else {
                log.error("Unexpected retrieval error jobId={}", jobId, ex);
                fail(jobId, "Unexpected error: " + ex.getMessage(), started);
            }
            return;
        }

        List<MatchedComment> matches;
        String matchesJson;
        try {
            matches = match(job, comments);
            matchesJson = matchesCodec.write(matches);
        } catch (RuntimeException ex) {
            log.error("Matching failed jobId={}", jobId, ex);
            fail(jobId, "Unexpected error: " + ex.getMessage(), started);
            return;
        }

        boolean notified = !matches.isEmpty();
        boolean emailSent = notified && notify(job, matches);
        if (Thread.currentThread().isInterrupted()) {
            abandon(jobId);
            return;
        }
        int commentCount = matches.size();
        int scanned = comments.size();
        if (persistTerminal(jobId, stored -> stored.markCompleted(commentCount, scanned, emailSent, matchesJson, Instant.now()))) {
            metrics.recordCompleted(elapsedMs(started), scanned, commentCount, notified, emailSent);
            log.info("Completed jobId={} scanned={} matched={} emailSent={}", jobId, scanned, commentCount, emailSent);
        }
    }

    private List<VideoComment> fetchComments(String videoUrl) {
        int maxAttempts = Math.max(1, properties.getMaxRetries() + 1);
        for (int attempt = 1; ; attempt++) {
            try {
                return commentSource.fetchComments(videoUrl);
            } catch (CommentRetrievalException ex) {
                if (!ex.isRetryable() || attempt >= maxAttempts) {
                    throw ex;
                }
                log.warn("Retryable retrieval error videoUrl={} attempt={} message={}", videoUrl, attempt, ex.getMessage());
                if (!sleepBackoff(properties.getBackoffMs(), attempt)) {
                    throw ex;
                }
            }
        }
    }

    private List<MatchedComment> match(CommentSearchJob job, List<VideoComment> comments) {
        List<MatchedComment> matches = new ArrayList<>();
        int scanned = 0;
        for (VideoComment comment : comments) {
            scanned++;
            if (scanned % PROGRESS_EVERY == 0) {
                log.info("Scanned jobId={} comments={} matched={}", job.getId(), scanned, matches.size());
            }
            if (phraseMatcher.matches(comment.text(), job.getPhrases())) {
                matches.add(new MatchedComment(
                        comment.text(),
                        comment.author(),
                        comment.likes(),
                        comment.publishedTime(),
                        timestampLinker.commentLink(job.getVideoUrl(), comment.commentId()),
                        timestampLinker.link(comment.text(), job.getVideoUrl())));
            }
        }
        return matches;
    }

    private boolean notify(CommentSearchJob job, List<MatchedComment> matches) {
        try {
            return notifier.send(job.getEmail(),
                    reportFormatter.subject(job.getPhrases()),
                    reportFormatter.body(job.getVideoUrl(), job.getPhrases(), matches));
        } catch (RuntimeException ex) {
            log.warn("Notifier error jobId={} message={}", job.getId(), ex.getMessage());
            return false;
        }
    }

    /**
     * Leaves an interrupted job {@code PROCESSING} so the next start runs it again.
     * The interrupt flag stays set for the worker loop.
     */
    private void abandon(UUID jobId) {
        Thread.currentThread().interrupt();
        log.warn("Interrupted while processing jobId={}; job stays PROCESSING until restart", jobId);
    }

    private static boolean isInterruption(Throwable ex) {
        if (Thread.currentThread().isInterrupted()) {
            return true;
        }
        for (Throwable cause = ex; cause != null; cause = cause.getCause()) {
            if (cause instanceof InterruptedException) {
                return true;
            }
        }
        return false;
    }

    private void fail(UUID jobId, String errorMessage, Instant started) {
        if (persistTerminal(jobId, stored -> stored.markFailed(errorMessage, Instant.now()))) {
            metrics.recordFailed(elapsedMs(started));
        }
    }

    /**
     * Writes the terminal state, retrying store failures until the write lands. Gives
     * up only when the worker thread is interrupted, leaving the job
     * {@code PROCESSING} for recovery on the next start.
     */
    private boolean persistTerminal(UUID jobId, Consumer<CommentSearchJob> transition) {
        for (int attempt = 1; ; attempt++) {
            try {
                Optional<CommentSearchJob> updated = jobStore.update(jobId, transition);
                if (updated.isEmpty()) {
                    log.error("Job disappeared before its result was stored jobId={}", jobId);
                    return false;
                }
                return true;
            } catch (JobStoreException ex) {
                log.error("Cannot store result jobId={} attempt={} message={}", jobId, attempt, ex.getMessage());
                if (!sleepBackoff(properties.getStoreRetryBackoffMs(), attempt)) {
                    log.error("Interrupted while storing result jobId={}; job stays PROCESSING until restart", jobId);
                    return false;
                }
            }
        }
    }

    private boolean sleepBackoff(long baseMs, int attempt) {
        long backoff = baseMs * (1L << Math.min(attempt - 1, 6));
        try {
            Thread.sleep(backoff);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private static long elapsedMs(Instant started) {
        return Duration.between(started, Instant.now()).toMillis();
    }
}
