package io.downloader4j;

import io.downloader4j.core.Job;
import io.downloader4j.core.JobNotFoundException;
import io.downloader4j.core.RetryLaterException;
import io.downloader4j.core.ScanPage;

import java.util.Optional;

/**
 * Durable store shared by the download processor and the notifier.
 *
 * <p>Holds a job-record table keyed by job id, a pending-download queue and a pending-callback
 * queue. Implementations must hand out a queued item to at most one consumer per enqueue and
 * must provide linearizable writes per job record.
 */
public interface JobStore {

    /**
     * Prefix of every job-record key returned by {@link #scanKeys(String, String, int)}.
     */
    String JOB_KEY_PREFIX = "jobs:";

    /**
     * Cursor value that starts a scan and marks its end.
     */
    String SCAN_START = "0";

    /**
     * Persist a newly submitted job in {@code Pending} download state and queue it for the processor.
     * Assigns an id when the job has none.
     */
    void queuePendingDownload(Job job);

    /**
     * Remove and return the next job awaiting download, or empty when there is none.
     */
    Optional<Job> popDownload();

    /**
     * Queue a job for callback delivery. Queuing a job that is already queued is a no-op.
     * The job record itself is not written.
     */
    void queuePendingCallback(Job job);

    /**
     * Remove and return the next job awaiting callback delivery.
     *
     * @return the job, or empty when no work is currently available
     * @throws RetryLaterException when the queue is transiently unavailable
     */
    Optional<Job> popCallback();

    /**
     * Persist the full current state of a job. Overwrites any previous state.
     */
    void saveJob(Job job);

    /**
     * @throws JobNotFoundException when no record exists for {@code id}
     */
    Job getJob(String id);

    void removeJob(String id);

    /**
     * Resumable enumeration of job-record keys.
     *
     * <p>Start with {@link #SCAN_START}; the scan is complete when the returned cursor is
     * {@link #SCAN_START} again. Records added or removed during a scan may or may not be returned.
     *
     * @param cursor    cursor returned by the previous call, or {@link #SCAN_START}
     * @param prefix    key prefix to match, normally {@link #JOB_KEY_PREFIX}
     * @param batchSize max number of keys per page
     */
    ScanPage scanKeys(String cursor, String prefix, int batchSize);
}
