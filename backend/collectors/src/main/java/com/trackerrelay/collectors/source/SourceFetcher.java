package com.trackerrelay.collectors.source;

import com.trackerrelay.collectors.api.FetchResult;
import com.trackerrelay.collectors.api.HttpCalls;
import com.trackerrelay.collectors.api.PipelineContext;
import com.trackerrelay.core.model.Failure;
import com.trackerrelay.core.model.FailureKind;
import com.trackerrelay.core.util.RetryPolicy;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.logging.Logger;

public class SourceFetcher {
    static final String RETRIES_EXHAUSTED_DETAIL = "max_retries_exhausted";
    private static final Logger LOGGER = Logger.getLogger(SourceFetcher.class.getName());

    private final PipelineContext ctx;
    private final Duration requestTimeout;
    private final RetryPolicy retryPolicy;

    public SourceFetcher(PipelineContext ctx, Duration requestTimeout, RetryPolicy retryPolicy) {
        this.ctx = ctx;
        this.requestTimeout = requestTimeout;
        this.retryPolicy = retryPolicy;
    }

    public FetchResult fetch(String url) {
        HttpRequest request;
        try {
            request = HttpRequest.newBuilder(URI.create(url))
                    .GET()
                    .timeout(requestTimeout)
                    .build();
        } catch (IllegalArgumentException e) {
            LOGGER.warning("Invalid source URL " + url + ": " + e.getMessage());
            return FetchResult.failed(Failure.of(FailureKind.MALFORMED_ENDPOINT, url, e));
        }

        for (int attempt = 0; attempt < retryPolicy.maxAttempts(); attempt++) {
            Failure failure;
            try {
                HttpResponse<String> response = HttpCalls.send(ctx.httpClient(), request,
                        HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8), requestTimeout);
                if (response.statusCode() < 400) {
                    LOGGER.info("Fetched source " + url);
                    return FetchResult.succeeded(url, response.body());
                }
                failure = new Failure(FailureKind.HTTP_STATUS, url, "HTTP " + response.statusCode());
            } catch (HttpTimeoutException e) {
                failure = Failure.of(FailureKind.TIMEOUT, url, e);
            } catch (IOException e) {
                failure = Failure.of(FailureKind.CONNECTION, url, e);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return FetchResult.failed(new Failure(FailureKind.INTERRUPTED, url, "interrupted while fetching"));
            }

            if (!failure.isTransient()) {
                LOGGER.warning("Fetching " + url + " failed: " + failure.detail());
                return FetchResult.failed(failure);
            }
            if (!retryPolicy.hasAttemptAfter(attempt)) {
                LOGGER.warning("Giving up on " + url + " after " + (attempt + 1) + " attempts: " + failure);
                break;
            }
            Duration delay = retryPolicy.delayAfter(attempt);
            LOGGER.warning("Attempt " + (attempt + 1) + "/" + retryPolicy.maxAttempts() + " failed for " + url
                    + " (" + failure.kind() + "), retrying in " + delay.toMillis() + "ms");
            try {
                ctx.sleeper().sleep(delay);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return FetchResult.failed(new Failure(FailureKind.INTERRUPTED, url, "interrupted during backoff"));
            }
        }
        return FetchResult.failed(new Failure(FailureKind.RETRIES_EXHAUSTED, url, RETRIES_EXHAUSTED_DETAIL));
    }
}
