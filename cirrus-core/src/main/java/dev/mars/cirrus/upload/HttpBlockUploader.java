package dev.mars.cirrus.upload;

/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */


import dev.mars.cirrus.core.exceptions.UploadException;
import dev.mars.cirrus.monitoring.TransferTelemetryMetrics;
import io.vertx.core.Vertx;
import io.vertx.core.buffer.Buffer;
import io.vertx.ext.web.client.HttpResponse;
import io.vertx.ext.web.client.WebClient;
import io.vertx.ext.web.client.WebClientOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * {@link BlockUploader} backed by the Vert.x {@link WebClient}.
 *
 * <p>Each attempt is a {@code PUT} with {@code Content-Type: application/octet-stream}. Any
 * non-2xx status, transport error or timeout counts as a failed attempt. Attempts are
 * separated by a linear backoff of {@code attempt * retryDelay}.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class HttpBlockUploader implements BlockUploader {

    private static final Logger logger = LoggerFactory.getLogger(HttpBlockUploader.class);
    private static final String USER_AGENT = "Cirrus/1.0";
    private static final int CONNECT_TIMEOUT_MS = 10_000;
    private static final long ABANDON_MARGIN_MS = 1_000;

    private final WebClient webClient;
    private final long retryDelayMs;
    private final TransferTelemetryMetrics metrics;

    public HttpBlockUploader(Vertx vertx, long retryDelayMs) {
        this.webClient = WebClient.create(vertx, new WebClientOptions()
                .setConnectTimeout(CONNECT_TIMEOUT_MS)
                .setUserAgent(USER_AGENT));
        this.retryDelayMs = retryDelayMs;
        this.metrics = TransferTelemetryMetrics.getInstance();
        logger.debug("HttpBlockUploader initialized (retryDelay={}ms)", retryDelayMs);
    }

    @Override
    public void upload(String transferId, String url, byte[] body, Duration timeout, int maxAttempts)
            throws UploadException {
        int attempts = Math.max(1, maxAttempts);
        int lastStatus = -1;
        Throwable lastError = null;

        for (int attempt = 1; attempt <= attempts; attempt++) {
            if (attempt > 1) {
                metrics.recordRetryAttempt(attempt);
                sleepBeforeRetry(transferId, attempt - 1, lastStatus, lastError);
            }

            try {
                // the idle timeout makes Vert.x reset a stalled request; the wait below only backs it up
                HttpResponse<Buffer> response = webClient.putAbs(url)
                        .putHeader("Content-Type", "application/octet-stream")
                        .idleTimeout(timeout.toMillis())
                        .sendBuffer(Buffer.buffer(body))
                        .toCompletionStage()
                        .toCompletableFuture()
                        .get(timeout.toMillis() + ABANDON_MARGIN_MS, TimeUnit.MILLISECONDS);

                lastStatus = response.statusCode();
                if (lastStatus >= 200 && lastStatus < 300) {
                    logger.debug("PUT {} bytes for {} succeeded on attempt {}", body.length, transferId, attempt);
                    return;
                }
                lastError = null;
                logger.warn("Upload attempt {}/{} for {} returned HTTP {}", attempt, attempts, transferId, lastStatus);
            } catch (ExecutionException e) {
                lastStatus = -1;
                lastError = e.getCause() != null ? e.getCause() : e;
                logger.warn("Upload attempt {}/{} for {} failed: {}", attempt, attempts, transferId, lastError.getMessage());
            } catch (TimeoutException e) {
                lastStatus = -1;
                lastError = e;
                logger.warn("Upload attempt {}/{} for {} timed out after {}ms",
                        attempt, attempts, transferId, timeout.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new UploadException(transferId, "Upload interrupted", attempt, e);
            }
        }

        String message = "Upload failed after " + attempts + " retries";
        if (lastError != null) {
            throw new UploadException(transferId, message, attempts, lastError);
        }
        throw new UploadException(transferId, message, attempts, lastStatus);
    }

    private void sleepBeforeRetry(String transferId, int failedAttempt, int lastStatus, Throwable lastError)
            throws UploadException {
        long delay = failedAttempt * retryDelayMs;
        try {
            Thread.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            String cause = lastError != null ? lastError.getMessage() : "HTTP " + lastStatus;
            throw new UploadException(transferId, "Upload interrupted during retry backoff (" + cause + ")",
                    failedAttempt, e);
        }
    }

    @Override
    public void close() {
        logger.debug("Closing HttpBlockUploader WebClient");
        webClient.close();
    }
}
