package lab.commentsearch.search.matching;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class PhraseMatcherTest {

    private final PhraseMatcher matcher = new PhraseMatcher();

    @Test
    void matchesWhenEveryPhraseIsPresent() {
        assertTrue(matcher.matches("This is great, check the timestamp 1:23", List.of("great", "timestamp")));
    }

    @Test
    void rejectsWhenAnyPhraseIsMissing() {
        assertFalse(matcher.matches("this is great, check 1:23", List.of("great", "timestamp")));
        assertFalse(matcher.matches("unrelated", List.of("great")));
    }

    @Test
    void ignoresCaseOnBothSides() {
        assertTrue(matcher.matches("What a GREAT Video", List.of("great video")));
        assertTrue(matcher.matches("what a great video", List.of("GREAT VIDEO")));
    }

    @Test
    void normalisesWhitespaceRuns() {
        assertTrue(matcher.matches("great\n\n   video", List.of("great video")));
        assertTrue(matcher.matches("great video", List.of("  great\tvideo ")));
    }

    @Test
    void phraseOrderDoesNotMatter() {
        assertTrue(matcher.matches("second then first", List.of("first", "second")));
    }

    @Test
    @DisplayName("An empty phrase set matches every comment")
    void emptyPhraseSetMatchesEverything() {
        assertTrue(matcher.matches("anything at all", List.of()));
        assertTrue(matcher.matches("", List.of()));
    }

    @Test
    void nullCommentOnlyMatchesEmptyPhraseSet() {
        assertTrue(matcher.matches(null, List.of()));
        assertFalse(matcher.matches(null, List.of("x")));
    }

    @Test
    @DisplayName("Dropping a required phrase never turns a match into a non-match")
    void droppingAPhraseNeverLosesMatches() {
        List<String> comments = List.of("great video at 1:23", "great", "video", "nothing here", "Great VIDEO");
        List<String> phrases = List.of("great", "video");
        for (String comment : comments) {
            boolean withBoth = matcher.matches(comment, phrases);
            for (String dropped : phrases) {
                List<String> fewer = phrases.stream().filter(p -> !p.equals(dropped)).toList();
                if (withBoth) {
                    assertTrue(matcher.matches(comment, fewer), comment + " without " + dropped);
                }
            }
        }
    }
}
