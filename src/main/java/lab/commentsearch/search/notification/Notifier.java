package lab.commentsearch.search.notification;

/**
 * Delivers a search report. Implementations report delivery failure through the
 * return value and never throw.
 */
public interface Notifier {

    /**
     * @return {@code true} when the message was accepted for delivery
     */
    boolean send(String email, String subject, String body);
}
