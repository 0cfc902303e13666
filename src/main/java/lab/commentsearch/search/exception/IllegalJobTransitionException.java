package lab.commentsearch.search.exception;

import java.util.UUID;
import lab.commentsearch.search.domain.CommentSearchStatus;

public class IllegalJobTransitionException extends IllegalStateException {

    private final UUID jobId;
    private final CommentSearchStatus from;
    private final CommentSearchStatus to;

    public IllegalJobTransitionException(UUID jobId, CommentSearchStatus from, CommentSearchStatus to) {
        super("Job " + jobId + " cannot move from " + from + " to " + to);
        this.jobId = jobId;
        this.from = from;
        this.to = to;
    }

    public UUID getJobId() {
        return jobId;
    }

    public CommentSearchStatus getFrom() {
        return from;
    }

    public CommentSearchStatus getTo() {
        return to;
    }
}
