package lab.commentsearch.search.client;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import lab.commentsearch.search.config.CommentSearchProperties;
import lab.commentsearch.search.domain.VideoComment;
import lab.commentsearch.search.exception.CommentRetrievalException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.core.codec.CodecException;
import org.springframework.http.HttpStatusCode;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.util.UriComponents;
import org.springframework.web.util.UriComponentsBuilder;
import reactor.core.publisher.Mono;

/**
 * Reads top-level comments through the YouTube Data API v3 {@code commentThreads}
 * endpoint, following {@code nextPageToken} until the last page (or
 * {@code comment-search.max-pages}).
 */
@Component
public class YoutubeCommentClient implements CommentSource {

    private static final Logger log = LoggerFactory.getLogger(YoutubeCommentClient.class);
    private final WebClient webClient;
    private final CommentSearchProperties properties;
    private final Timer successTimer;
    private final Timer errorTimer;

    public YoutubeCommentClient(WebClient youtubeWebClient,
                                CommentSearchProperties properties,
                                ObjectProvider<MeterRegistry> meterRegistryProvider) {
        this.webClient = youtubeWebClient;
        this.properties = properties;
        MeterRegistry registry = meterRegistryProvider.getIfAvailable();
        if (registry == null) {
            successTimer = null;
            errorTimer = null;
        } else {
            successTimer = Timer.builder("comment-search.retrieval")
                    .tag("result", "success")
                    .register(registry);
            errorTimer = Timer.builder("comment-search.retrieval")
                    .tag("result", "error")
                    .register(registry);
        }
    }

    @Override
    public List<VideoComment> fetchComments(String videoUrl) {
        String videoId = extractVideoId(videoUrl);
        long startedNs = System.nanoTime();
        try {
            List<VideoComment> comments = new ArrayList<>();
            String pageToken = null;
            int pages = 0;
            do {
                CommentThreadsResponse page = fetchPage(videoId, pageToken);
                if (page == null) {
                    break;
                }
                page.itemsOrEmpty().forEach(item -> comments.add(item.toComment()));
                pageToken = page.nextPageToken();
                pages++;
                log.debug("Fetched comment page videoId={} page={} total={}", videoId, pages, comments.size());
            } while (pageToken != null && !pageToken.isBlank() && !pageLimitReached(pages));
            recordTimer(successTimer, startedNs);
            log.info("Fetched comments videoId={} pages={} count={}", videoId, pages, comments.size());
            return comments;
        } catch (RuntimeException ex) {
            recordTimer(errorTimer, startedNs);
            throw ex;
        }
    }

    static String extractVideoId(String videoUrl) {
        UriComponents uri;
        try {
            uri = UriComponentsBuilder.fromUriString(videoUrl).build();
        } catch (IllegalArgumentException ex) {
            throw new CommentRetrievalException("Invalid video URL " + videoUrl, null, false);
        }
        String videoId;
        String host = uri.getHost();
        if (host != null && host.endsWith("youtu.be")) {
            List<String> segments = uri.getPathSegments();
            videoId = segments.isEmpty() ? null : segments.get(0);
        } else {
            videoId = uri.getQueryParams().getFirst("v");
        }
        if (videoId == null || videoId.isBlank()) {
            throw new CommentRetrievalException("Cannot determine video id from " + videoUrl, null, false);
        }
        return videoId;
    }

    private CommentThreadsResponse fetchPage(String videoId, String pageToken) {
        try {
            return webClient.get()
                    .uri(builder -> {
                        builder.path("/commentThreads")
                                .queryParam("part", "snippet")
                                .queryParam("videoId", videoId)
                                .queryParam("maxResults", properties.getPageSize())
                                .queryParam("order", "time")
                                .queryParam("textFormat", "plainText");
                        if (properties.getYoutubeApiKey() != null && !properties.getYoutubeApiKey().isBlank()) {
                            builder.queryParam("key", properties.getYoutubeApiKey());
                        }
                        if (pageToken != null) {
                            builder.queryParam("pageToken", pageToken);
                        }
                        return builder.build();
                    })
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, httpResponse -> httpResponse.bodyToMono(String.class)
                            .defaultIfEmpty("")
                            .flatMap(body -> Mono.error(toException(httpResponse.statusCode(), body))))
                    .bodyToMono(CommentThreadsResponse.class)
                    .block();
        } catch (WebClientRequestException ex) {
            throw new CommentRetrievalException("Timeout or connection error: " + ex.getMessage(), null, true);
        } catch (CodecException ex) {
            throw new CommentRetrievalException("Unreadable comment response: " + ex.getMessage(), null, false);
        }
    }

    private boolean pageLimitReached(int pages) {
        return properties.getMaxPages() > 0 && pages >= properties.getMaxPages();
    }

    private CommentRetrievalException toException(HttpStatusCode status, String body) {
        int statusCode = status.value();
        boolean retryable = status.is5xxServerError() || statusCode == 429;
        String message = "Comment API error " + statusCode + " " + body;
        return new CommentRetrievalException(message, statusCode, retryable);
    }

    private void recordTimer(Timer timer, long startedNs) {
        if (timer == null) {
            return;
        }
        long duration = System.nanoTime() - startedNs;
        if (duration > 0L) {
            timer.record(duration, TimeUnit.NANOSECONDS);
        }
    }
}
