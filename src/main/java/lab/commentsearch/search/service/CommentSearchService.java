package lab.commentsearch.search.service;

import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.regex.Pattern;
import lab.commentsearch.search.domain.CommentSearchJob;
import lab.commentsearch.search.exception.JobValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class CommentSearchService {

    private static final Logger log = LoggerFactory.getLogger(CommentSearchService.class);
    private static final Pattern EMAIL = Pattern.compile("^[^@\\s]+@[^@\\s]+$");

    private final JobStore jobStore;
    private final JobQueue queue;

    public CommentSearchService(JobStore jobStore, JobQueue queue) {
        this.jobStore = jobStore;
        this.queue = queue;
    }

    /**
     * Validates the request, stores a {@code PENDING} job and queues it.
     *
     * @return the new job id
     * @throws JobValidationException when the request is malformed; nothing is stored
     */
    public UUID submit(String videoUrl, List<String> phrases, String email) {
        requirePresent("video_url", videoUrl);
        requirePresent("phrases", phrases);
        requirePresent("email", email);

        String url = videoUrl.trim();
        if (!url.contains("youtube.com/watch") && !url.contains("youtu.be/")) {
            throw new JobValidationException("Invalid YouTube URL");
        }
        if (phrases.isEmpty() || phrases.stream().anyMatch(phrase -> phrase == null || phrase.isBlank())) {
            throw new JobValidationException("Phrases must be a non-empty list of non-empty strings");
        }
        String address = email.trim();
        if (!EMAIL.matcher(address).matches()) {
            throw new JobValidationException("Invalid email address");
        }

        List<String> distinctPhrases = phrases.stream()
                .map(String::trim)
                .distinct()
                .toList();
        CommentSearchJob job = new CommentSearchJob(UUID.randomUUID(), url, distinctPhrases, address);
        UUID jobId = jobStore.create(job);
        queue.enqueue(jobId);
        log.info("Submitted jobId={} videoUrl={} phrases={}", jobId, url, distinctPhrases);
        return jobId;
    }

    private static void requirePresent(String field, Object value) {
        if (Objects.isNull(value)) {
            throw new JobValidationException("Missing required field: " + field);
        }
    }
}
