package lab.commentsearch.search.client;

import java.util.List;
import lab.commentsearch.search.domain.VideoComment;
import lab.commentsearch.search.exception.CommentRetrievalException;

/**
 * Supplies the raw comments of a video.
 */
public interface CommentSource {

    /**
     * Returns every comment the source can read for the video, newest first.
     *
     * @throws CommentRetrievalException when the source cannot be reached, the video is
     *                                   inaccessible or the response cannot be read
     */
    List<VideoComment> fetchComments(String videoUrl);
}
