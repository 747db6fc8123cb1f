package io.downloader4j.config;

import io.downloader4j.internal.mongo.JobDocument;
import io.downloader4j.internal.mongo.QueueEntryDocument;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.Index;

/**
 * MongoDB index definitions for the downloader collections.
 *
 * <p>Indexes are not created at startup unless {@code downloader.ensure-indexes-on-startup=true}.
 * In production they are usually managed by migration scripts.
 *
 * <h3>Required indexes</h3>
 * <ul>
 *   <li><b>idx_queue_order</b> on {@code pending_downloads} and {@code pending_callbacks}:
 *       { enqueuedAt: 1, _id: 1 }
 *       <br/>Used by pops, which take the oldest entry.</li>
 *   <li><b>idx_callback_state</b> on {@code download_jobs}: { callbackState: 1 }
 *       <br/>Used when listing permanently failed callbacks.</li>
 * </ul>
 *
 * <h3>Example mongosh script</h3>
 * <pre>
 * db.pending_downloads.createIndex({ enqueuedAt: 1, _id: 1 }, { name: "idx_queue_order" });
 * db.pending_callbacks.createIndex({ enqueuedAt: 1, _id: 1 }, { name: "idx_queue_order" });
 * db.download_jobs.createIndex({ callbackState: 1 }, { name: "idx_callback_state" });
 * </pre>
 */
public class DownloaderMongoIndexConfig {

    public static final String IDX_QUEUE_ORDER = "idx_queue_order";
    public static final String IDX_CALLBACK_STATE = "idx_callback_state";

    private final MongoTemplate mongoTemplate;

    public DownloaderMongoIndexConfig(MongoTemplate mongoTemplate) {
        this.mongoTemplate = mongoTemplate;
    }

    public void ensureIndexes() {
        mongoTemplate.indexOps(QueueEntryDocument.PENDING_DOWNLOADS).ensureIndex(queueOrderIndex());
        mongoTemplate.indexOps(QueueEntryDocument.PENDING_CALLBACKS).ensureIndex(queueOrderIndex());
        mongoTemplate.indexOps(JobDocument.class).ensureIndex(callbackStateIndex());
    }

    /**
     * Keys: enqueuedAt ASC, _id ASC
     */
    public static Index queueOrderIndex() {
        return new Index()
                .on("enqueuedAt", Sort.Direction.ASC)
                .on("_id", Sort.Direction.ASC)
                .named(IDX_QUEUE_ORDER);
    }

    public static Index callbackStateIndex() {
        return new Index()
                .on("callbackState", Sort.Direction.ASC)
                .named(IDX_CALLBACK_STATE);
    }
}
