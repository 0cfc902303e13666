package lab.commentsearch.search.domain;

public record SearchReport(
        long pending,
        long processing,
        long completed,
        long failed,
        int queued,
        long totalProcessed,
        long totalCompleted,
        long totalFailed,
        long totalRecovered,
        long emailsSent,
        long emailsNotSent,
        long commentsScanned,
        long commentsMatched,
        long avgProcessingMs) {
}
