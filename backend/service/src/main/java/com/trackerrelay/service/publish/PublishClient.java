package com.trackerrelay.service.publish;

import com.trackerrelay.collectors.api.PipelineContext;
import com.trackerrelay.core.events.AlertRaised;
import com.trackerrelay.core.events.ArtifactPublished;
import com.trackerrelay.core.model.Failure;
import com.trackerrelay.core.model.FailureKind;
import com.trackerrelay.core.util.RetryPolicy;
import com.trackerrelay.service.config.PublishConfig;

import java.io.IOException;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.Map;
import java.util.function.UnaryOperator;
import java.util.logging.Logger;

// Read, compare, then conditional PUT against the contents API.
public class PublishClient {
    private static final Logger LOGGER = Logger.getLogger(PublishClient.class.getName());

    private final PipelineContext ctx;
    private final ContentStoreClient store;
    private final PublishConfig config;
    private final RetryPolicy retryPolicy;

    public PublishClient(PipelineContext ctx, ContentStoreClient store, PublishConfig config) {
        this.ctx = ctx;
        this.store = store;
        this.config = config;
        this.retryPolicy = config.retryPolicy();
    }

    public PublishOutcome publish(String path, String content, String message) {
        return report(doPublish(path, ignored -> content, message, false));
    }

    public PublishOutcome publishDerived(String path, UnaryOperator<String> transform, String message) {
        return report(doPublish(path, transform, message, true));
    }

    private PublishOutcome doPublish(String path, UnaryOperator<String> contentFor, String message, boolean requireCurrent) {
        CurrentState current;
        try {
            current = fetchCurrent(path);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return PublishOutcome.failed(new Failure(FailureKind.INTERRUPTED, path, "interrupted while reading current content"));
        }

        if (requireCurrent && current.artifact() == null) {
            Failure cause = current.failure();
            return PublishOutcome.failed(new Failure(
                    FailureKind.MISSING_VERSION,
                    path,
                    cause == null ? "no current content" : cause.detail()
            ));
        }

        String content = contentFor.apply(current.artifact() == null ? "" : current.artifact().content());
        if (current.artifact() != null && current.artifact().sameContentAs(content)) {
            LOGGER.info("Content unchanged, skipping write: " + path);
            return PublishOutcome.skipped(path);
        }

        if (current.failure() != null) {
            if (!path.equals(config.primaryPath())) {
                return PublishOutcome.failed(new Failure(
                        FailureKind.MISSING_VERSION,
                        path,
                        "no version token: " + current.failure().detail()
                ));
            }
            LOGGER.warning("Could not read current " + path + " (" + current.failure().detail()
                    + "), writing without a version token");
        }

        String sha = current.artifact() == null ? null : current.artifact().sha();
        try {
            return write(path, content, message, sha, current.rateLimit());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return PublishOutcome.failed(new Failure(FailureKind.INTERRUPTED, path, "interrupted while writing"));
        }
    }

    private CurrentState fetchCurrent(String path) throws InterruptedException {
        Failure lastFailure = null;
        int attempt = 0;
        int throttledWaits = 0;
        while (attempt < retryPolicy.maxAttempts()) {
            ContentResponse response;
            try {
                response = store.get(path);
            } catch (HttpTimeoutException e) {
                lastFailure = Failure.of(FailureKind.TIMEOUT, path, e);
                backOff(path, attempt++, lastFailure);
                continue;
            } catch (IOException e) {
                lastFailure = Failure.of(FailureKind.CONNECTION, path, e);
                backOff(path, attempt++, lastFailure);
                continue;
            }

            if (response.status() == 200 && response.artifact() != null) {
                return CurrentState.found(response.artifact(), response.rateLimit());
            }
            if (response.status() == 404) {
                LOGGER.info("No current version of " + path + ", it will be created");
                return CurrentState.absent(response.rateLimit());
            }
            if (response.isThrottled()) {
                if (throttledWaits++ >= retryPolicy.maxAttempts()) {
                    lastFailure = new Failure(FailureKind.RETRIES_EXHAUSTED, path, "rate limit did not reset");
                    break;
                }
                waitForReset(path, response.rateLimit());
                continue;
            }
            lastFailure = statusFailure(path, response.status());
            if (!lastFailure.isTransient()) {
                LOGGER.warning("Reading " + path + " failed with HTTP " + response.status());
                return CurrentState.failed(lastFailure);
            }
            backOff(path, attempt++, lastFailure);
        }
        return CurrentState.failed(exhausted(path, lastFailure));
    }

    private PublishOutcome write(String path, String content, String message, String sha, RateLimit pending)
            throws InterruptedException {
        RateLimit quota = pending;
        Failure lastFailure = null;
        int attempt = 0;
        int throttledWaits = 0;
        while (attempt < retryPolicy.maxAttempts()) {
            if (quota != null && quota.nearlyExhausted()) {
                waitForReset(path, quota);
            }
            quota = null;

            ContentResponse response;
            try {
                response = store.put(path, content, message, sha);
            } catch (HttpTimeoutException e) {
                lastFailure = Failure.of(FailureKind.TIMEOUT, path, e);
                backOff(path, attempt++, lastFailure);
                continue;
            } catch (IOException e) {
                lastFailure = Failure.of(FailureKind.CONNECTION, path, e);
                backOff(path, attempt++, lastFailure);
                continue;
            }

            if (response.isSuccess()) {
                LOGGER.info("Updated " + path);
                return PublishOutcome.updated(path);
            }
            if (response.isThrottled()) {
                if (throttledWaits++ >= retryPolicy.maxAttempts()) {
                    return PublishOutcome.failed(new Failure(FailureKind.RETRIES_EXHAUSTED, path, "rate limit did not reset"));
                }
                waitForReset(path, response.rateLimit());
                continue;
            }
            LOGGER.warning("Write of " + path + " failed with HTTP " + response.status() + ": " + abbreviate(response.body()));
            lastFailure = statusFailure(path, response.status());
            if (!lastFailure.isTransient()) {
                return PublishOutcome.failed(lastFailure);
            }
            quota = response.rateLimit();
            backOff(path, attempt++, lastFailure);
        }
        return PublishOutcome.failed(exhausted(path, lastFailure));
    }

    private void waitForReset(String path, RateLimit rateLimit) throws InterruptedException {
        Duration wait = rateLimit.waitFrom(ctx.clock().instant());
        LOGGER.warning("Rate limit nearly exhausted (remaining " + rateLimit.remaining() + ") while publishing "
                + path + ", waiting " + wait.toSeconds() + "s");
        ctx.sleeper().sleep(wait);
    }

    private void backOff(String path, int attempt, Failure failure) throws InterruptedException {
        if (!retryPolicy.hasAttemptAfter(attempt)) {
            return;
        }
        Duration delay = retryPolicy.delayAfter(attempt);
        LOGGER.warning("Attempt " + (attempt + 1) + "/" + retryPolicy.maxAttempts() + " for " + path
                + " failed (" + failure.kind() + ": " + failure.detail() + "), retrying in " + delay.toMillis() + "ms");
        ctx.sleeper().sleep(delay);
    }

    private PublishOutcome report(PublishOutcome outcome) {
        Failure failure = outcome.failure();
        ctx.eventBus().publish(new ArtifactPublished(
                ctx.clock().instant(),
                outcome.path(),
                outcome.status().name(),
                failure == null ? null : failure.kind().name(),
                failure == null ? null : failure.detail()
        ));
        if (failure != null) {
            ctx.eventBus().publish(new AlertRaised(
                    ctx.clock().instant(),
                    "publish",
                    "Publishing " + outcome.path() + " failed: " + failure.detail(),
                    Map.of("path", outcome.path(), "kind", failure.kind().name())
            ));
        }
        return outcome;
    }

    private static Failure statusFailure(String path, int status) {
        String detail = "HTTP " + status;
        if (status == 403) {
            LOGGER.severe("Forbidden: " + path);
            return new Failure(FailureKind.FORBIDDEN, path, detail);
        }
        return new Failure(FailureKind.REMOTE_STATUS, path, detail);
    }

    private static Failure exhausted(String path, Failure lastFailure) {
        if (lastFailure == null) {
            return new Failure(FailureKind.RETRIES_EXHAUSTED, path, "max_retries");
        }
        if (lastFailure.kind() == FailureKind.RETRIES_EXHAUSTED) {
            return lastFailure;
        }
        return new Failure(FailureKind.RETRIES_EXHAUSTED, path, lastFailure.detail());
    }

    private static String abbreviate(String body) {
        if (body == null) {
            return "";
        }
        return body.length() <= 200 ? body : body.substring(0, 200) + "...";
    }

    private record CurrentState(RemoteArtifact artifact, Failure failure, RateLimit rateLimit) {
        static CurrentState found(RemoteArtifact artifact, RateLimit rateLimit) {
            return new CurrentState(artifact, null, rateLimit);
        }

        static CurrentState absent(RateLimit rateLimit) {
            return new CurrentState(null, null, rateLimit);
        }

        static CurrentState failed(Failure failure) {
            return new CurrentState(null, failure, null);
        }
    }
}
