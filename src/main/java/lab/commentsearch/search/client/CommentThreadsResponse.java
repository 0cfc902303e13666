package lab.commentsearch.search.client;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;
import lab.commentsearch.search.domain.VideoComment;

/**
 * The subset of a YouTube Data API {@code commentThreads} page that the search reads.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CommentThreadsResponse(String nextPageToken, List<Item> items) {

    public List<Item> itemsOrEmpty() {
        return items == null ? List.of() : items;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Item(String id, ThreadSnippet snippet) {

        VideoComment toComment() {
            Comment comment = snippet == null ? null : snippet.topLevelComment();
            CommentSnippet details = comment == null ? null : comment.snippet();
            if (details == null) {
                return new VideoComment(id, null, "", 0L, null);
            }
            String text = details.textOriginal() != null ? details.textOriginal() : details.textDisplay();
            String commentId = comment.id() != null ? comment.id() : id;
            return new VideoComment(commentId, details.authorDisplayName(), text == null ? "" : text,
                    details.likeCount(), details.publishedAt());
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ThreadSnippet(Comment topLevelComment) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Comment(String id, CommentSnippet snippet) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record CommentSnippet(String textDisplay,
                                 String textOriginal,
                                 String authorDisplayName,
                                 long likeCount,
                                 String publishedAt) {
    }
}
