package lab.commentsearch.search.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

public record SubmitRequest(@JsonProperty("video_url") String videoUrl,
                            List<String> phrases,
                            String email) {
}
