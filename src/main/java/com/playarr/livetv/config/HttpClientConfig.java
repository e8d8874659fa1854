package com.playarr.livetv.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.http.HttpClient;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Outbound HTTP client and the two worker pools used by the sync.
 * The fetch pool size is the cap on concurrent upstream requests.
 */
@Configuration
public class HttpClientConfig {

    private final LiveTvProperties properties;

    public HttpClientConfig(LiveTvProperties properties) {
        this.properties = properties;
    }

    @Bean("upstreamHttpClient")
    public HttpClient upstreamHttpClient() {
        return HttpClient.newBuilder()
                .connectTimeout(properties.getFetch().getConnectTimeout())
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    @Bean(name = "upstreamFetchExecutor", destroyMethod = "shutdownNow")
    public ExecutorService upstreamFetchExecutor() {
        return Executors.newFixedThreadPool(
                properties.getFetch().getMaxConcurrency(), namedThreads("livetv-fetch-"));
    }

    @Bean(name = "userProcessingExecutor", destroyMethod = "shutdownNow")
    public ExecutorService userProcessingExecutor() {
        return Executors.newFixedThreadPool(
                properties.getProcessing().getMaxConcurrency(), namedThreads("livetv-user-"));
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
