package lab.commentsearch.search.domain;

public record TimestampLink(String text, int seconds, String link) {
}
