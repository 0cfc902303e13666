package lab.commentsearch.search.matching;

import java.util.Collection;
import java.util.Locale;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Decides whether a comment contains every required phrase.
 *
 * <p>Both sides are case-folded and whitespace-normalised before the substring test,
 * so {@code "Great   VIDEO"} contains {@code "great video"}. An empty phrase
 * collection matches every comment.
 */
@Component
public class PhraseMatcher {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    public boolean matches(String comment, Collection<String> phrases) {
        String haystack = normalize(comment);
        for (String phrase : phrases) {
            if (!haystack.contains(normalize(phrase))) {
                return false;
            }
        }
        return true;
    }

    static String normalize(String value) {
        if (value == null) {
            return "";
        }
        return WHITESPACE.matcher(value).replaceAll(" ").trim().toLowerCase(Locale.ROOT);
    }
}
