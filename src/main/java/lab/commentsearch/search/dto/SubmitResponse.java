package lab.commentsearch.search.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.UUID;
import lab.commentsearch.search.domain.CommentSearchStatus;

public record SubmitResponse(@JsonProperty("request_id") UUID requestId,
                             CommentSearchStatus status,
                             String message) {

    public static SubmitResponse accepted(UUID requestId) {
        return new SubmitResponse(requestId, CommentSearchStatus.PENDING, "Request submitted successfully");
    }
}
