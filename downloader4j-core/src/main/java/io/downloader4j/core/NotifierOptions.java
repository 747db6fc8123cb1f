package io.downloader4j.core;

import java.time.Duration;
import java.util.Objects;

/**
 * Settings of a callback notifier.
 *
 * <ul>
 *   <li>concurrency: number of workers delivering callbacks in parallel</li>
 *   <li>downloadUrl: absolute base URL of client-facing download links; the job id is appended as the last path segment</li>
 *   <li>callbackTimeout: hard cap on a single callback request, independent of any download timeout</li>
 *   <li>maxCallbackAttempts: delivery attempts per job before the callback is marked failed</li>
 *   <li>pollBackoff: pause of the dispatcher after an empty, unavailable or failing queue pop</li>
 *   <li>scanBatchSize: page size of the startup recovery scan</li>
 * </ul>
 */
public record NotifierOptions(
        int concurrency,
        String downloadUrl,
        Duration callbackTimeout,
        int maxCallbackAttempts,
        Duration pollBackoff,
        int scanBatchSize
) {
    public static final Duration DEFAULT_CALLBACK_TIMEOUT = Duration.ofSeconds(3);
    public static final int DEFAULT_MAX_CALLBACK_ATTEMPTS = 2;
    public static final Duration DEFAULT_POLL_BACKOFF = Duration.ofSeconds(1);
    public static final int DEFAULT_SCAN_BATCH_SIZE = 50;

    public static NotifierOptions defaults(int concurrency, String downloadUrl) {
        return new NotifierOptions(
                concurrency,
                downloadUrl,
                DEFAULT_CALLBACK_TIMEOUT,
                DEFAULT_MAX_CALLBACK_ATTEMPTS,
                DEFAULT_POLL_BACKOFF,
                DEFAULT_SCAN_BATCH_SIZE
        );
    }

    /**
     * @throws IllegalArgumentException when any setting is out of range
     */
    public void validate() {
        if (concurrency <= 0) {
            throw new IllegalArgumentException("notifier concurrency must be a positive number");
        }
        Objects.requireNonNull(downloadUrl, "downloadUrl must not be null");
        requirePositive(callbackTimeout, "callbackTimeout");
        requirePositive(pollBackoff, "pollBackoff");
        if (maxCallbackAttempts <= 0) {
            throw new IllegalArgumentException("maxCallbackAttempts must be a positive number");
        }
        if (scanBatchSize <= 0) {
            throw new IllegalArgumentException("scanBatchSize must be a positive number");
        }
    }

    private static void requirePositive(Duration d, String name) {
        Objects.requireNonNull(d, name + " must not be null");
        if (d.isZero() || d.isNegative()) {
            throw new IllegalArgumentException(name + " must be a positive duration");
        }
    }
}
