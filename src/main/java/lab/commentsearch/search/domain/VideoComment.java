package lab.commentsearch.search.domain;

/**
 * A top-level comment as supplied by a {@code CommentSource}. Only {@code text} is
 * required; the other fields may be {@code null} when the source does not know them.
 */
public record VideoComment(String commentId,
                           String author,
                           String text,
                           long likes,
                           String publishedTime) {

    public static VideoComment ofText(String text) {
        return new VideoComment(null, null, text, 0L, null);
    }
}
