package io.downloader4j.config;

import io.downloader4j.core.NotifierOptions;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Runtime configuration for the callback notifier.
 */
@ConfigurationProperties(prefix = "downloader")
public class DownloaderProperties {
    private int notifierConcurrency = 4;
    private String downloadUrl; // required, absolute
    private Duration callbackTimeout = NotifierOptions.DEFAULT_CALLBACK_TIMEOUT;
    private int maxCallbackAttempts = NotifierOptions.DEFAULT_MAX_CALLBACK_ATTEMPTS;
    private Duration pollBackoff = NotifierOptions.DEFAULT_POLL_BACKOFF;
    private int scanBatchSize = NotifierOptions.DEFAULT_SCAN_BATCH_SIZE;
    private boolean ensureIndexesOnStartup = false;

    public NotifierOptions toNotifierOptions() {
        return new NotifierOptions(
                notifierConcurrency,
                downloadUrl,
                callbackTimeout,
                maxCallbackAttempts,
                pollBackoff,
                scanBatchSize
        );
    }

    public int getNotifierConcurrency() {
        return notifierConcurrency;
    }

    public void setNotifierConcurrency(int notifierConcurrency) {
        this.notifierConcurrency = notifierConcurrency;
    }

    public String getDownloadUrl() {
        return downloadUrl;
    }

    public void setDownloadUrl(String downloadUrl) {
        this.downloadUrl = downloadUrl;
    }

    public Duration getCallbackTimeout() {
        return callbackTimeout;
    }

    public void setCallbackTimeout(Duration callbackTimeout) {
        this.callbackTimeout = callbackTimeout;
    }

    public int getMaxCallbackAttempts() {
        return maxCallbackAttempts;
    }

    public void setMaxCallbackAttempts(int maxCallbackAttempts) {
        this.maxCallbackAttempts = maxCallbackAttempts;
    }

    public Duration getPollBackoff() {
        return pollBackoff;
    }

    public void setPollBackoff(Duration pollBackoff) {
        this.pollBackoff = pollBackoff;
    }

    public int getScanBatchSize() {
        return scanBatchSize;
    }

    public void setScanBatchSize(int scanBatchSize) {
        this.scanBatchSize = scanBatchSize;
    }

    public boolean isEnsureIndexesOnStartup() {
        return ensureIndexesOnStartup;
    }

    public void setEnsureIndexesOnStartup(boolean ensureIndexesOnStartup) {
        this.ensureIndexesOnStartup = ensureIndexesOnStartup;
    }
}
