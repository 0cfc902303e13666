package lab.commentsearch.search.service;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import lab.commentsearch.search.domain.CommentSearchJob;
import lab.commentsearch.search.domain.MatchedComment;
import lab.commentsearch.search.dto.CommentSearchJobView;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Read path for polling clients. Reads the stored record only and never waits on the
 * worker.
 */
@Service
public class JobStatusService {

    private static final Logger log = LoggerFactory.getLogger(JobStatusService.class);
    private final JobStore jobStore;
    private final MatchesJsonCodec matchesCodec;

    public JobStatusService(JobStore jobStore, MatchesJsonCodec matchesCodec) {
        this.jobStore = jobStore;
        this.matchesCodec = matchesCodec;
    }

    public Optional<CommentSearchJobView> getStatus(UUID jobId) {
        return jobStore.get(jobId).map(job -> CommentSearchJobView.from(job, readMatches(job)));
    }

    /**
     * A stored result that no longer decodes is reported without its matches.
     */
    private List<MatchedComment> readMatches(CommentSearchJob job) {
        try {
            return matchesCodec.read(job.getMatchesJson());
        } catch (IllegalStateException ex) {
            log.error("Unreadable stored matches jobId={} message={}", job.getId(), ex.getMessage());
            return null;
        }
    }
}
