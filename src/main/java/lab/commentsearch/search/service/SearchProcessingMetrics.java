package lab.commentsearch.search.service;

import java.util.concurrent.atomic.AtomicLong;
import org.springframework.stereotype.Component;

@Component
public class SearchProcessingMetrics {

    private final AtomicLong totalProcessed = new AtomicLong();
    private final AtomicLong totalCompleted = new AtomicLong();
    private final AtomicLong totalFailed = new AtomicLong();
    private final AtomicLong totalRecovered = new AtomicLong();
    private final AtomicLong emailsSent = new AtomicLong();
    private final AtomicLong emailsNotSent = new AtomicLong();
    private final AtomicLong commentsScanned = new AtomicLong();
    private final AtomicLong commentsMatched = new AtomicLong();
    private final AtomicLong totalProcessingMs = new AtomicLong();

    /**
     * @param notified whether a report mail was attempted; searches without matches send none
     */
    public void recordCompleted(long processingMs, int scanned, int matched, boolean notified, boolean emailSent) {
        totalProcessed.incrementAndGet();
        totalCompleted.incrementAndGet();
        totalProcessingMs.addAndGet(processingMs);
        commentsScanned.addAndGet(scanned);
        commentsMatched.addAndGet(matched);
        if (notified) {
            (emailSent ? emailsSent : emailsNotSent).incrementAndGet();
        }
    }

    public void recordFailed(long processingMs) {
        totalProcessed.incrementAndGet();
        totalFailed.incrementAndGet();
        totalProcessingMs.addAndGet(processingMs);
    }

    public void recordRecovered(int recovered) {
        if (recovered > 0) {
            totalRecovered.addAndGet(recovered);
        }
    }

    public long getTotalProcessed() {
        return totalProcessed.get();
    }

    public long getTotalCompleted() {
        return totalCompleted.get();
    }

    public long getTotalFailed() {
        return totalFailed.get();
    }

    public long getTotalRecovered() {
        return totalRecovered.get();
    }

    public long getEmailsSent() {
        return emailsSent.get();
    }

    public long getEmailsNotSent() {
        return emailsNotSent.get();
    }

    public long getAvgProcessingMs() {
        long processed = totalProcessed.get();
        return processed == 0 ? 0 : totalProcessingMs.get() / processed;
    }

    public long getCommentsScanned() {
        return commentsScanned.get();
    }

    public long getCommentsMatched() {
        return commentsMatched.get();
    }
}
