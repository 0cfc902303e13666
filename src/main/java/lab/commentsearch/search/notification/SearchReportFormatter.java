package lab.commentsearch.search.notification;

import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;
import lab.commentsearch.search.domain.MatchedComment;
import lab.commentsearch.search.domain.TimestampLink;
import org.springframework.stereotype.Component;
import org.springframework.web.util.HtmlUtils;

/**
 * Builds the subject and HTML body of the mail sent for a finished search.
 */
@Component
public class SearchReportFormatter {

    private static final DateTimeFormatter GENERATED_ON =
            DateTimeFormatter.ofPattern("MMMM dd, yyyy 'at' hh:mm a", Locale.ENGLISH);

    public String subject(List<String> phrases) {
        return "YouTube Comment Search Results: " + String.join(", ", phrases);
    }

    public String body(String videoUrl, List<String> phrases, List<MatchedComment> matches) {
        return body(videoUrl, phrases, matches, ZonedDateTime.now(ZoneId.systemDefault()));
    }

    String body(String videoUrl, List<String> phrases, List<MatchedComment> matches, ZonedDateTime generatedOn) {
        StringBuilder html = new StringBuilder();
        html.append("<html><body>");
        html.append("<h2>YouTube Comment Search Results</h2>");
        html.append("<p>Video: <a href=\"").append(escape(videoUrl)).append("\">")
                .append(escape(videoUrl)).append("</a></p>");
        html.append("<p>Phrases: ");
        for (int i = 0; i < phrases.size(); i++) {
            if (i > 0) {
                html.append(", ");
            }
            html.append("<strong>").append(escape(phrases.get(i))).append("</strong>");
        }
        html.append("</p>");
        html.append("<p>Found ").append(matches.size())
                .append(matches.size() == 1 ? " matching comment." : " matching comments.").append("</p>");
        for (int i = 0; i < matches.size(); i++) {
            appendComment(html, i + 1, matches.get(i));
        }
        html.append("<p><small>Generated on ").append(GENERATED_ON.format(generatedOn)).append("</small></p>");
        html.append("</body></html>");
        return html.toString();
    }

    private void appendComment(StringBuilder html, int index, MatchedComment comment) {
        html.append("<div style=\"margin-bottom:16px\">");
        html.append("<h3>Match #").append(index).append("</h3>");
        html.append("<p><strong>").append(escape(orUnknown(comment.author()))).append("</strong>");
        html.append(" &middot; ").append(comment.likes()).append(" likes");
        if (comment.publishedTime() != null) {
            html.append(" &middot; ").append(escape(comment.publishedTime()));
        }
        html.append("</p>");
        html.append("<p>").append(escape(comment.text()).replace("\n", "<br>")).append("</p>");
        html.append("<p><a href=\"").append(escape(comment.link())).append("\">View comment</a></p>");
        List<TimestampLink> timestamps = comment.timestamps();
        if (timestamps != null && !timestamps.isEmpty()) {
            html.append("<ul>");
            for (TimestampLink timestamp : timestamps) {
                html.append("<li><a href=\"").append(escape(timestamp.link())).append("\">")
                        .append(escape(timestamp.text())).append("</a></li>");
            }
            html.append("</ul>");
        }
        html.append("</div>");
    }

    private static String orUnknown(String value) {
        return value == null || value.isBlank() ? "Unknown" : value;
    }

    private static String escape(String value) {
        return value == null ? "" : HtmlUtils.htmlEscape(value);
    }
}
