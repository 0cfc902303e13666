package lab.commentsearch.search.service;

import lab.commentsearch.search.domain.CommentSearchStatus;
import lab.commentsearch.search.domain.SearchReport;
import org.springframework.stereotype.Service;

@Service
public class SearchReportService {

    private final JobStore jobStore;
    private final JobQueue queue;
    private final SearchProcessingMetrics metrics;

    public SearchReportService(JobStore jobStore, JobQueue queue, SearchProcessingMetrics metrics) {
        this.jobStore = jobStore;
        this.queue = queue;
        this.metrics = metrics;
    }

    public SearchReport report() {
        return new SearchReport(
                jobStore.countByStatus(CommentSearchStatus.PENDING),
                jobStore.countByStatus(CommentSearchStatus.PROCESSING),
                jobStore.countByStatus(CommentSearchStatus.COMPLETED),
                jobStore.countByStatus(CommentSearchStatus.FAILED),
                queue.size(),
                metrics.getTotalProcessed(),
                metrics.getTotalCompleted(),
                metrics.getTotalFailed(),
                metrics.getTotalRecovered(),
                metrics.getEmailsSent(),
                metrics.getEmailsNotSent(),
                metrics.getCommentsScanned(),
                metrics.getCommentsMatched(),
                metrics.getAvgProcessingMs());
    }
}
