package lab.commentsearch.search.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;
import lab.commentsearch.search.domain.MatchedComment;
import org.springframework.stereotype.Component;

/**
 * Stores matched comments in the {@code matches_json} column.
 */
@Component
public class MatchesJsonCodec {

    private static final TypeReference<List<MatchedComment>> MATCHES = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    public MatchesJsonCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String write(List<MatchedComment> matches) {
        try {
            return objectMapper.writeValueAsString(matches);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Cannot encode matched comments", ex);
        }
    }

    public List<MatchedComment> read(String json) {
        if (json == null || json.isBlank()) {
            return List.of();
        }
        try {
            return objectMapper.readValue(json, MATCHES);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Cannot decode matched comments", ex);
        }
    }
}
