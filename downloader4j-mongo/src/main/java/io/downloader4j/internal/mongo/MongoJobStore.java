package io.downloader4j.internal.mongo;

import io.downloader4j.JobStore;
import io.downloader4j.core.Job;
import io.downloader4j.core.JobNotFoundException;
import io.downloader4j.core.JobState;
import io.downloader4j.core.JobStoreException;
import io.downloader4j.core.RetryLaterException;
import io.downloader4j.core.ScanPage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * MongoDB persistence layer for download jobs.
 *
 * <p>Layout:
 * <ul>
 *   <li>{@code download_jobs}: one document per job record</li>
 *   <li>{@code pending_downloads}, {@code pending_callbacks}: queue entries keyed by job id, ordered by enqueue time</li>
 * </ul>
 *
 * <p>A pop is a single {@code findAndModify} removal, so a queued entry is handed to at most one
 * consumer. Only one notifier process may run against a database: its startup scan treats every
 * {@code InProgress} callback as left over from a crash and would requeue deliveries another live
 * process still holds.
 */
public class MongoJobStore implements JobStore {
    private static final Logger log = LoggerFactory.getLogger(MongoJobStore.class);

    private final MongoTemplate mongoTemplate;

    public MongoJobStore(MongoTemplate mongoTemplate) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
    }

    @Override
    public void queuePendingDownload(Job job) {
        Objects.requireNonNull(job, "job must not be null");
        if (isBlank(job.getId())) {
            job.setId(UUID.randomUUID().toString());
        }
        job.setDownloadState(JobState.PENDING);
        saveJob(job);
        enqueue(QueueEntryDocument.PENDING_DOWNLOADS, job.getId());
    }

    @Override
    public Optional<Job> popDownload() {
        return pop(QueueEntryDocument.PENDING_DOWNLOADS);
    }

    @Override
    public void queuePendingCallback(Job job) {
        enqueue(QueueEntryDocument.PENDING_CALLBACKS, requireId(job));
    }

    @Override
    public Optional<Job> popCallback() {
        return pop(QueueEntryDocument.PENDING_CALLBACKS);
    }

    @Override
    public void saveJob(Job job) {
        requireId(job);
        try {
            mongoTemplate.save(toDocument(job));
        } catch (DataAccessException e) {
            throw translate("save job " + job.getId(), e);
        }
    }

    @Override
    public Job getJob(String id) {
        Objects.requireNonNull(id, "id must not be null");
        JobDocument doc;
        try {
            doc = mongoTemplate.findById(id, JobDocument.class);
        } catch (DataAccessException e) {
            throw translate("get job " + id, e);
        }
        if (doc == null) {
            throw new JobNotFoundException(id);
        }
        return toJob(doc);
    }

    @Override
    public void removeJob(String id) {
        Objects.requireNonNull(id, "id must not be null");
        try {
            mongoTemplate.remove(new Query(Criteria.where("_id").is(id)), JobDocument.class);
        } catch (DataAccessException e) {
            throw translate("remove job " + id, e);
        }
    }

    /**
     * Pages through job ids in ascending order. The cursor is the last id returned.
     */
    @Override
    public ScanPage scanKeys(String cursor, String prefix, int batchSize) {
        Objects.requireNonNull(cursor, "cursor must not be null");
        Objects.requireNonNull(prefix, "prefix must not be null");
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be a positive number");
        }

        String idPrefix;
        if (prefix.startsWith(JOB_KEY_PREFIX)) {
            idPrefix = prefix.substring(JOB_KEY_PREFIX.length());
        } else if (JOB_KEY_PREFIX.startsWith(prefix)) {
            idPrefix = "";
        } else {
            return new ScanPage(List.of(), SCAN_START);
        }

        Query q = new Query();
        boolean fromStart = SCAN_START.equals(cursor);
        if (!fromStart || !idPrefix.isEmpty()) {
            Criteria c = Criteria.where("_id");
            if (!fromStart) {
                c = c.gt(cursor);
            }
            if (!idPrefix.isEmpty()) {
                c = c.regex("^" + Pattern.quote(idPrefix));
            }
            q.addCriteria(c);
        }
        q.with(Sort.by(Sort.Order.asc("_id")));
        q.limit(batchSize);
        q.fields().include("_id");

        List<JobDocument> docs;
        try {
            docs = mongoTemplate.find(q, JobDocument.class);
        } catch (DataAccessException e) {
            throw translate("scan job keys", e);
        }

        List<String> keys = new ArrayList<>(docs.size());
        String lastId = null;
        for (JobDocument d : docs) {
            if (d != null && d.getId() != null) {
                keys.add(JOB_KEY_PREFIX + d.getId());
                lastId = d.getId();
            }
        }

        String next = (docs.size() < batchSize || lastId == null) ? SCAN_START : lastId;
        return new ScanPage(keys, next);
    }

    /**
     * Jobs whose callback permanently failed, kept for operator inspection.
     */
    public List<Job> findFailedCallbacks(int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be a positive number");
        }
        Query q = new Query(Criteria.where("callbackState").is(JobState.FAILED));
        q.with(Sort.by(Sort.Order.asc("_id")));
        q.limit(limit);

        try {
            return mongoTemplate.find(q, JobDocument.class).stream()
                    .map(MongoJobStore::toJob)
                    .toList();
        } catch (DataAccessException e) {
            throw translate("find failed callbacks", e);
        }
    }

    private void enqueue(String queue, String jobId) {
        Query q = new Query(Criteria.where("_id").is(jobId));
        Update u = new Update().setOnInsert("enqueuedAt", Instant.now());
        try {
            mongoTemplate.upsert(q, u, QueueEntryDocument.class, queue);
        } catch (DataAccessException e) {
            throw translate("queue job " + jobId + " to " + queue, e);
        }
    }

    private Optional<Job> pop(String queue) {
        Query q = new Query().with(Sort.by(Sort.Order.asc("enqueuedAt"), Sort.Order.asc("_id")));

        QueueEntryDocument entry;
        try {
            entry = mongoTemplate.findAndRemove(q, QueueEntryDocument.class, queue);
        } catch (DataAccessException e) {
            throw translate("pop " + queue, e);
        }
        if (entry == null) {
            return Optional.empty();
        }

        JobDocument doc;
        try {
            doc = mongoTemplate.findById(entry.getId(), JobDocument.class);
        } catch (DataAccessException e) {
            restore(queue, entry);
            throw translate("load queued job " + entry.getId(), e);
        }
        if (doc == null) {
            throw new JobStoreException("Queued job has no record: " + entry.getId());
        }
        return Optional.of(toJob(doc));
    }

    // Puts back an entry whose record could not be read, keeping its original position.
    private void restore(String queue, QueueEntryDocument entry) {
        try {
            mongoTemplate.insert(entry, queue);
        } catch (DataAccessException e) {
            log.error("Could not restore queue entry queue={} id={} msg={}", queue, entry.getId(), e.getMessage(), e);
        }
    }

    private static JobStoreException translate(String action, DataAccessException e) {
        if (e instanceof TransientDataAccessException || e instanceof DataAccessResourceFailureException) {
            return new RetryLaterException("Could not " + action + ", store temporarily unavailable: " + e.getMessage(), e);
        }
        return new JobStoreException("Could not " + action + ": " + e.getMessage(), e);
    }

    static JobDocument toDocument(Job job) {
        JobDocument doc = new JobDocument();
        doc.setId(job.getId());
        doc.setAggrId(job.getAggrId());
        doc.setUrl(job.getUrl());
        doc.setCallbackUrl(job.getCallbackUrl());
        doc.setExtra(job.getExtra());
        doc.setDownloadTimeout(job.getDownloadTimeout());
        doc.setDownloadState(job.getDownloadState());
        doc.setDownloadMeta(job.getDownloadMeta());
        doc.setCallbackState(job.getCallbackState());
        doc.setCallbackMeta(job.getCallbackMeta());
        doc.setCallbackCount(job.getCallbackCount());
        return doc;
    }

    static Job toJob(JobDocument doc) {
        Job job = new Job();
        job.setId(doc.getId());
        job.setAggrId(doc.getAggrId());
        job.setUrl(doc.getUrl());
        job.setCallbackUrl(doc.getCallbackUrl());
        job.setExtra(doc.getExtra());
        job.setDownloadTimeout(doc.getDownloadTimeout());
        if (doc.getDownloadState() != null) {
            job.setDownloadState(doc.getDownloadState());
        }
        job.setDownloadMeta(doc.getDownloadMeta());
        if (doc.getCallbackState() != null) {
            job.setCallbackState(doc.getCallbackState());
        }
        job.setCallbackMeta(doc.getCallbackMeta());
        job.setCallbackCount(doc.getCallbackCount());
        return job;
    }

    private static String requireId(Job job) {
        Objects.requireNonNull(job, "job must not be null");
        if (isBlank(job.getId())) {
            throw new IllegalArgumentException("job id must not be blank");
        }
        return job.getId();
    }

    private static boolean isBlank(String s) {
        return s == null || s.trim().isEmpty();
    }
}
