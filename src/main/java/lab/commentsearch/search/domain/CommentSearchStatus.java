package lab.commentsearch.search.domain;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum CommentSearchStatus {
    PENDING,
    PROCESSING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
