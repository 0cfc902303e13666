package lab.commentsearch.search.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "comment-search")
public class CommentSearchProperties {

    private String youtubeBaseUrl = "https://www.googleapis.com/youtube/v3";
    private String youtubeApiKey;
    private int pageSize = 100;
    // 0 reads every page
    private int maxPages = 0;
    private long httpTimeoutMs = 10000;
    private int httpMaxConnections = 10;
    private int maxRetries = 3;
    private long backoffMs = 500;
    private long storeRetryBackoffMs = 1000;
    private String mailFrom;
    private final Worker worker = new Worker();

    public String getYoutubeBaseUrl() {
        return youtubeBaseUrl;
    }

    public void setYoutubeBaseUrl(String youtubeBaseUrl) {
        this.youtubeBaseUrl = youtubeBaseUrl;
    }

    public String getYoutubeApiKey() {
        return youtubeApiKey;
    }

    public void setYoutubeApiKey(String youtubeApiKey) {
        this.youtubeApiKey = youtubeApiKey;
    }

    public int getPageSize() {
        return pageSize;
    }

    public void setPageSize(int pageSize) {
        this.pageSize = pageSize;
    }

    public int getMaxPages() {
        return maxPages;
    }

    public void setMaxPages(int maxPages) {
        this.maxPages = maxPages;
    }

    public long getHttpTimeoutMs() {
        return httpTimeoutMs;
    }

    public void setHttpTimeoutMs(long httpTimeoutMs) {
        this.httpTimeoutMs = httpTimeoutMs;
    }

    public int getHttpMaxConnections() {
        return httpMaxConnections;
    }

    public void setHttpMaxConnections(int httpMaxConnections) {
        this.httpMaxConnections = httpMaxConnections;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public void setMaxRetries(int maxRetries) {
        this.maxRetries = maxRetries;
    }

    public long getBackoffMs() {
        return backoffMs;
    }

    public void setBackoffMs(long backoffMs) {
        this.backoffMs = backoffMs;
    }

    public long getStoreRetryBackoffMs() {
        return storeRetryBackoffMs;
    }

    public void setStoreRetryBackoffMs(long storeRetryBackoffMs) {
        this.storeRetryBackoffMs = storeRetryBackoffMs;
    }

    public String getMailFrom() {
        return mailFrom;
    }

    public void setMailFrom(String mailFrom) {
        this.mailFrom = mailFrom;
    }

    public Worker getWorker() {
        return worker;
    }

    public static class Worker {

        private boolean enabled = true;
        private long pollTimeoutMs = 1000;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public long getPollTimeoutMs() {
            return pollTimeoutMs;
        }

        public void setPollTimeoutMs(long pollTimeoutMs) {
            this.pollTimeoutMs = pollTimeoutMs;
        }
    }
}
