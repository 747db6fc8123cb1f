package io.downloader4j.internal;

import io.downloader4j.JobStore;
import io.downloader4j.core.Job;
import io.downloader4j.core.JobNotFoundException;
import io.downloader4j.core.JobState;
import io.downloader4j.core.JobStoreException;
import io.downloader4j.core.ScanPage;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * Process-local {@link JobStore}.
 *
 * <p>Records are copied on the way in and out, so a caller only changes stored state through
 * {@link #saveJob(Job)}. Queues are insertion-ordered sets of job ids, which makes queuing a job
 * that is already queued a no-op.
 */
public class InMemoryJobStore implements JobStore {

    private final ConcurrentSkipListMap<String, Job> jobs = new ConcurrentSkipListMap<>();

    private final Object queueLock = new Object();
    private final LinkedHashSet<String> pendingDownloads = new LinkedHashSet<>();
    private final LinkedHashSet<String> pendingCallbacks = new LinkedHashSet<>();

    @Override
    public void queuePendingDownload(Job job) {
        Objects.requireNonNull(job, "job must not be null");
        if (job.getId() == null || job.getId().isBlank()) {
            job.setId(UUID.randomUUID().toString());
        }
        job.setDownloadState(JobState.PENDING);
        saveJob(job);
        synchronized (queueLock) {
            pendingDownloads.add(job.getId());
        }
    }

    @Override
    public Optional<Job> popDownload() {
        return pop(pendingDownloads);
    }

    @Override
    public void queuePendingCallback(Job job) {
        String id = requireId(job);
        synchronized (queueLock) {
            pendingCallbacks.add(id);
        }
    }

    @Override
    public Optional<Job> popCallback() {
        return pop(pendingCallbacks);
    }

    @Override
    public void saveJob(Job job) {
        String id = requireId(job);
        jobs.put(id, new Job(job));
    }

    @Override
    public Job getJob(String id) {
        Objects.requireNonNull(id, "id must not be null");
        Job job = jobs.get(id);
        if (job == null) {
            throw new JobNotFoundException(id);
        }
        return new Job(job);
    }

    @Override
    public void removeJob(String id) {
        Objects.requireNonNull(id, "id must not be null");
        jobs.remove(id);
    }

    @Override
    public ScanPage scanKeys(String cursor, String prefix, int batchSize) {
        Objects.requireNonNull(cursor, "cursor must not be null");
        Objects.requireNonNull(prefix, "prefix must not be null");
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be a positive number");
        }

        NavigableMap<String, Job> tail = SCAN_START.equals(cursor) ? jobs : jobs.tailMap(cursor, false);
        List<String> keys = new ArrayList<>(batchSize);
        Iterator<Map.Entry<String, Job>> it = tail.entrySet().iterator();

        String lastVisited = null;
        int visited = 0;
        while (it.hasNext() && visited < batchSize) {
            String id = it.next().getKey();
            lastVisited = id;
            visited++;
            String key = JOB_KEY_PREFIX + id;
            if (key.startsWith(prefix)) {
                keys.add(key);
            }
        }

        String next = it.hasNext() ? lastVisited : SCAN_START;
        return new ScanPage(keys, next);
    }

    /**
     * Snapshot of the job ids waiting for callback delivery, in queue order.
     */
    public List<String> pendingCallbackIds() {
        synchronized (queueLock) {
            return List.copyOf(pendingCallbacks);
        }
    }

    /**
     * Snapshot of the job ids waiting for download, in queue order.
     */
    public List<String> pendingDownloadIds() {
        synchronized (queueLock) {
            return List.copyOf(pendingDownloads);
        }
    }

    private Optional<Job> pop(LinkedHashSet<String> queue) {
        String id;
        synchronized (queueLock) {
            Iterator<String> it = queue.iterator();
            if (!it.hasNext()) {
                return Optional.empty();
            }
            id = it.next();
            it.remove();
        }

        Job job = jobs.get(id);
        if (job == null) {
            throw new JobStoreException("Queued job has no record: " + id);
        }
        return Optional.of(new Job(job));
    }

    private static String requireId(Job job) {
        Objects.requireNonNull(job, "job must not be null");
        if (job.getId() == null || job.getId().isBlank()) {
            throw new IllegalArgumentException("job id must not be blank");
        }
        return job.getId();
    }
}
