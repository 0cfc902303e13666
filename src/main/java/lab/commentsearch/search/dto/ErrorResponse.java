package lab.commentsearch.search.dto;

public record ErrorResponse(String error) {
}
