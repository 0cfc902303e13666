package lab.commentsearch.search.domain;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

public record MatchedComment(String text,
                             String author,
                             long likes,
                             @JsonProperty("published_time") String publishedTime,
                             String link,
                             List<TimestampLink> timestamps) {
}
