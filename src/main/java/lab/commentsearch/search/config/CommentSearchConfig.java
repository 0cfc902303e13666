package lab.commentsearch.search.config;

import java.time.Duration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;
import reactor.netty.resources.ConnectionProvider;

@Configuration
@EnableConfigurationProperties(CommentSearchProperties.class)
public class CommentSearchConfig {

    /**
     * Jobs are processed strictly one at a time, so the worker gets a dedicated
     * single-thread executor that runs nothing else.
     */
    @Bean(name = "searchWorkerExecutor")
    ThreadPoolTaskExecutor searchWorkerExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(1);
        executor.setQueueCapacity(1);
        executor.setThreadNamePrefix("comment-search-worker-");
        executor.initialize();
        return executor;
    }

    @Bean
    WebClient youtubeWebClient(CommentSearchProperties properties) {
        ConnectionProvider provider = ConnectionProvider.builder("youtube-pool")
                .maxConnections(properties.getHttpMaxConnections())
                .pendingAcquireMaxCount(properties.getHttpMaxConnections() * 2)
                .build();
        HttpClient httpClient = HttpClient.create(provider)
                .responseTimeout(Duration.ofMillis(properties.getHttpTimeoutMs()));
        return WebClient.builder()
                .baseUrl(properties.getYoutubeBaseUrl())
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(4 * 1024 * 1024))
                .build();
    }
}
