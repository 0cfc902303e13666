package lab.commentsearch.search.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import lab.commentsearch.search.domain.CommentSearchJob;
import lab.commentsearch.search.domain.CommentSearchStatus;
import lab.commentsearch.search.domain.MatchedComment;

/**
 * What the status endpoint returns for one job. {@code result} is present only for
 * completed jobs and {@code error} only for failed ones.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CommentSearchJobView(@JsonProperty("request_id") UUID requestId,
                                   @JsonProperty("video_url") String videoUrl,
                                   List<String> phrases,
                                   String email,
                                   CommentSearchStatus status,
                                   @JsonProperty("submission_time") Instant submissionTime,
                                   @JsonProperty("completion_time") Instant completionTime,
                                   Result result,
                                   String error,
                                   List<MatchedComment> matches) {

    public static CommentSearchJobView from(CommentSearchJob job, List<MatchedComment> matches) {
        Result result = null;
        if (job.getStatus() == CommentSearchStatus.COMPLETED) {
            result = new Result(job.getCommentCount(), Boolean.TRUE.equals(job.getEmailSent()), job.getScannedCount());
        }
        return new CommentSearchJobView(job.getId(), job.getVideoUrl(), List.copyOf(job.getPhrases()), job.getEmail(),
                job.getStatus(), job.getSubmittedAt(), job.getCompletedAt(), result, job.getErrorMessage(),
                job.getStatus() == CommentSearchStatus.COMPLETED ? matches : null);
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Result(@JsonProperty("comment_count") Integer commentCount,
                         @JsonProperty("email_sent") boolean emailSent,
                         @JsonProperty("scanned_count") Integer scannedCount) {
    }
}
