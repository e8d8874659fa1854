package com.playarr.livetv.client;

import com.playarr.livetv.config.LiveTvProperties;
import com.playarr.livetv.exception.SyncCancelledException;
import com.playarr.livetv.exception.UpstreamFetchException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.io.ByteArrayInputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Locale;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Performs the single HTTP GET made for each upstream playlist or guide URL.
 * No retries here; a failure is reported once and the orchestrator decides what it means for users.
 */
@Component
public class UpstreamFetcher {

    private static final Logger logger = LoggerFactory.getLogger(UpstreamFetcher.class);
    private static final String USER_AGENT = "Playarr-LiveTV/1.0";

    private final HttpClient httpClient;
    private final Duration requestTimeout;

    @Autowired
    public UpstreamFetcher(@Qualifier("upstreamHttpClient") HttpClient httpClient, LiveTvProperties properties) {
        this(httpClient, properties.getFetch().getRequestTimeout());
    }

    /**
     * Constructor for testing with a custom HttpClient.
     */
    UpstreamFetcher(HttpClient httpClient, Duration requestTimeout) {
        this.httpClient = httpClient;
        this.requestTimeout = requestTimeout;
    }

    /**
     * GET {@code url}. The request timeout bounds the whole exchange, headers and body alike, so an
     * upstream that stalls mid-body fails with {@link UpstreamFetchException.ErrorType#TIMEOUT}.
     *
     * @return the body, as text or as a lazily decompressed gzip stream
     * @throws UpstreamFetchException on a non-2xx status, a transport failure or a timeout
     * @throws SyncCancelledException if the calling thread is interrupted while waiting
     */
    public FetchedPayload fetch(String url) {
        HttpRequest request;
        try {
            request = HttpRequest.newBuilder()
                    .uri(URI.create(url.trim()))
                    .header("User-Agent", USER_AGENT)
                    .timeout(requestTimeout)
                    .GET()
                    .build();
        } catch (IllegalArgumentException e) {
            throw UpstreamFetchException.network(url, e);
        }

        logger.debug("Fetching {}", url);
        HttpResponse<byte[]> response = await(
                httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofByteArray()), url);

        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            logger.warn("Upstream {} responded with HTTP {}", url, status);
            throw UpstreamFetchException.badStatus(url, status);
        }

        byte[] body = response.body() == null ? new byte[0] : response.body();
        if (isGzipped(request.uri(), response.headers().firstValue("Content-Type").orElse(""))) {
            logger.debug("Treating {} compressed bytes from {} as gzip", body.length, url);
            return FetchedPayload.gzipped(url, new ByteArrayInputStream(body));
        }

        String text = new String(body, StandardCharsets.UTF_8);
        logger.debug("Fetched {} characters from {}", text.length(), url);
        return FetchedPayload.text(url, text);
    }

    private HttpResponse<byte[]> await(CompletableFuture<HttpResponse<byte[]>> pending, String url) {
        try {
            return pending.get(requestTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            pending.cancel(true);
            logger.warn("Timed out fetching {} after {}", url, requestTimeout);
            throw UpstreamFetchException.timeout(url, e);
        } catch (InterruptedException e) {
            pending.cancel(true);
            Thread.currentThread().interrupt();
            throw new SyncCancelledException("Interrupted while fetching " + url, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            if (cause instanceof HttpTimeoutException) {
                logger.warn("Timed out fetching {}", url);
                throw UpstreamFetchException.timeout(url, cause);
            }
            logger.warn("Network error fetching {}: {}", url, cause.getMessage());
            throw UpstreamFetchException.network(url, cause);
        }
    }

    static boolean isGzipped(URI uri, String contentType) {
        String path = uri.getPath();
        if (path != null && path.toLowerCase(Locale.ROOT).endsWith(".gz")) {
            return true;
        }
        return contentType.toLowerCase(Locale.ROOT).contains("gzip");
    }
}
