package lab.commentsearch.search.matching;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lab.commentsearch.search.domain.TimestampLink;
import org.springframework.stereotype.Component;
import org.springframework.web.util.UriComponentsBuilder;

/**
 * Finds {@code M:SS}, {@code MM:SS}, {@code H:MM:SS} and {@code HH:MM:SS} references in
 * comment text and turns each into a link that opens the video at that offset.
 */
@Component
public class TimestampLinker {

    // digits or colons on either side mean the token is part of something longer
    private static final Pattern TIMESTAMP = Pattern.compile(
            "(?<![\\d:])(\\d{1,2}):(\\d{2})(?::(\\d{2}))?(?![\\d:])");

    public List<TimestampLink> link(String text, String videoUrl) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }
        List<TimestampLink> links = new ArrayList<>();
        Set<Integer> seen = new HashSet<>();
        Matcher matcher = TIMESTAMP.matcher(text);
        while (matcher.find()) {
            Optional<Integer> seconds = toSeconds(matcher);
            if (seconds.isPresent() && seen.add(seconds.get())) {
                links.add(new TimestampLink(matcher.group(), seconds.get(), deepLink(videoUrl, seconds.get())));
            }
        }
        return links;
    }

    /**
     * Parses a single token; empty when it is not a valid timestamp.
     */
    public Optional<Integer> parseSeconds(String token) {
        Matcher matcher = TIMESTAMP.matcher(token);
        if (!matcher.matches()) {
            return Optional.empty();
        }
        return toSeconds(matcher);
    }

    public String deepLink(String videoUrl, int seconds) {
        return UriComponentsBuilder.fromUriString(videoUrl)
                .replaceQueryParam("t", seconds + "s")
                .build()
                .toUriString();
    }

    public String commentLink(String videoUrl, String commentId) {
        if (commentId == null || commentId.isBlank()) {
            return videoUrl;
        }
        return UriComponentsBuilder.fromUriString(videoUrl)
                .replaceQueryParam("lc", commentId)
                .build()
                .toUriString();
    }

    private Optional<Integer> toSeconds(Matcher matcher) {
        int first = Integer.parseInt(matcher.group(1));
        int second = Integer.parseInt(matcher.group(2));
        String third = matcher.group(3);
        if (third == null) {
            if (first > 59 || second > 59) {
                return Optional.empty();
            }
            return Optional.of(first * 60 + second);
        }
        int seconds = Integer.parseInt(third);
        if (second > 59 || seconds > 59) {
            return Optional.empty();
        }
        return Optional.of(first * 3600 + second * 60 + seconds);
    }
}
