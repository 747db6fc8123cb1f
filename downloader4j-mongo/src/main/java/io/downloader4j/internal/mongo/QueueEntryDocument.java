package io.downloader4j.internal.mongo;

import org.springframework.data.annotation.Id;

import java.time.Instant;

/**
 * Entry of a job queue collection. The id is the queued job's id, so a job is queued at most once.
 */
public class QueueEntryDocument {

    public static final String PENDING_DOWNLOADS = "pending_downloads";
    public static final String PENDING_CALLBACKS = "pending_callbacks";

    @Id
    private String id;

    private Instant enqueuedAt;

    public QueueEntryDocument() {
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public Instant getEnqueuedAt() {
        return enqueuedAt;
    }

    public void setEnqueuedAt(Instant enqueuedAt) {
        this.enqueuedAt = enqueuedAt;
    }
}
