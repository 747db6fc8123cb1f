package io.downloader4j.internal;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.downloader4j.JobStore;
import io.downloader4j.Notifier;
import io.downloader4j.core.CallbackDeliveryException;
import io.downloader4j.core.CallbackInfo;
import io.downloader4j.core.Job;
import io.downloader4j.core.JobNotFoundException;
import io.downloader4j.core.JobState;
import io.downloader4j.core.NotifierOptions;
import io.downloader4j.core.RetryLaterException;
import io.downloader4j.core.ScanPage;
import io.downloader4j.utils.DownloadUrls;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.util.HashSet;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Notifier that delivers callbacks for jobs taken from the store's pending-callback queue.
 *
 * <p>Runtime layout:
 * <ul>
 *   <li>one dispatcher thread popping jobs from the store</li>
 *   <li>a fixed pool of workers, each delivering one job at a time</li>
 *   <li>a synchronous handoff between them, so the dispatcher never pops more than the workers can take</li>
 * </ul>
 *
 * <p>Per job, a delivery attempt increments {@code callbackCount}, persists the callback as
 * {@code InProgress}, posts the payload and then either removes the record (2xx), requeues it,
 * or marks the callback {@code Failed} once {@code maxCallbackAttempts} is reached.
 * A record found {@code InProgress} at startup was interrupted by a crash and is requeued, which
 * assumes this notifier is the only one running against the store.
 */
public class CallbackNotifier implements Notifier {
    private static final Logger log = LoggerFactory.getLogger(CallbackNotifier.class);

    // Handed to each worker on shutdown.
    private static final Job SHUTDOWN = new Job();

    private static final long HANDOFF_POLL_MILLIS = 100;

    private final NotifierOptions options;
    private final JobStore jobStore;
    private final CallbackClient callbackClient;
    private final URI downloadUrl;

    private final AtomicBoolean started = new AtomicBoolean(false);
    private final Object lifecycleLock = new Object();

    // State of the current start/stop cycle; a dispatcher only ever looks at its own run.
    private volatile Run currentRun;

    public CallbackNotifier(NotifierOptions options, JobStore jobStore, ObjectMapper objectMapper) {
        this(options, jobStore, new CallbackClient(
                Objects.requireNonNull(options, "options must not be null").callbackTimeout(),
                Objects.requireNonNull(objectMapper, "objectMapper must not be null")));
    }

    public CallbackNotifier(NotifierOptions options, JobStore jobStore, CallbackClient callbackClient) {
        this.options = Objects.requireNonNull(options, "options must not be null");
        this.options.validate();
        this.jobStore = Objects.requireNonNull(jobStore, "jobStore must not be null");
        this.callbackClient = Objects.requireNonNull(callbackClient, "callbackClient must not be null");
        this.downloadUrl = DownloadUrls.parseBase(options.downloadUrl());
    }

    /**
     * Requeue rogue callbacks, then start the workers and the dispatcher. Idempotent.
     */
    @Override
    public void start() {
        synchronized (lifecycleLock) {
            if (!started.compareAndSet(false, true)) {
                return;
            }

            log.info("Notifier starting with concurrency={}, downloadUrl={}, callbackTimeout={}, maxCallbackAttempts={}, pollBackoff={}",
                    options.concurrency(),
                    downloadUrl,
                    options.callbackTimeout(),
                    options.maxCallbackAttempts(),
                    options.pollBackoff());

            try {
                requeueRogueCallbacks();

                Run run = new Run();
                AtomicInteger workerSeq = new AtomicInteger();
                ExecutorService pool = Executors.newFixedThreadPool(options.concurrency(), r -> {
                    Thread t = new Thread(r);
                    t.setName("downloader.notifier-worker-" + workerSeq.incrementAndGet());
                    t.setDaemon(true);
                    return t;
                });
                for (int i = 0; i < options.concurrency(); i++) {
                    pool.submit(() -> workerLoop(run));
                }

                run.dispatcher = new Thread(() -> dispatchLoop(run, pool));
                run.dispatcher.setName("downloader.notifier-dispatcher");
                run.dispatcher.setDaemon(true);
                run.dispatcher.start();
                currentRun = run;
            } catch (RuntimeException e) {
                started.set(false);
                throw e;
            }
        }

        log.info("Notifier started successfully.");
    }

    /**
     * Stop popping new work and wait until every worker has finished its current delivery. Idempotent.
     *
     * <p>A {@link #start()} issued while this call is still waiting begins a fresh run; the run being
     * stopped is unaffected by it.
     */
    @Override
    public void stop() {
        Run run;
        synchronized (lifecycleLock) {
            if (!started.compareAndSet(true, false)) {
                return;
            }
            run = currentRun;
            currentRun = null;
        }
        if (run == null) {
            return;
        }

        log.info("Notifier stopping...");
        run.running.set(false);
        run.stopSignal.countDown();

        try {
            run.dispatcher.join();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            run.dispatcher.interrupt();
        }
        log.info("Notifier stopped successfully.");
    }

    @Override
    public boolean isRunning() {
        return started.get();
    }

    /**
     * Scan every job record and requeue those whose callback is {@code InProgress}.
     *
     * <p>A live notifier always moves an {@code InProgress} callback forward, so such a record at
     * startup is left over from an interrupted run. The record itself is not modified.
     *
     * @return number of jobs requeued
     */
    public int requeueRogueCallbacks() {
        String cursor = JobStore.SCAN_START;
        Set<String> seen = new HashSet<>();
        int rogueCount = 0;

        do {
            ScanPage page;
            try {
                page = jobStore.scanKeys(cursor, JobStore.JOB_KEY_PREFIX, options.scanBatchSize());
            } catch (Exception e) {
                log.error("notifier recovery scan failed cursor={} msg={}", cursor, e.getMessage(), e);
                break;
            }

            for (String key : page.keys()) {
                String jobId = key.startsWith(JobStore.JOB_KEY_PREFIX)
                        ? key.substring(JobStore.JOB_KEY_PREFIX.length())
                        : key;
                if (!seen.add(jobId)) {
                    continue;
                }

                Job job;
                try {
                    job = jobStore.getJob(jobId);
                } catch (JobNotFoundException e) {
                    // removed since the scan page was read
                    continue;
                } catch (Exception e) {
                    log.error("Could not get job id={} msg={}", jobId, e.getMessage(), e);
                    continue;
                }

                if (job.getCallbackState() != JobState.IN_PROGRESS) {
                    continue;
                }

                try {
                    jobStore.queuePendingCallback(job);
                    rogueCount++;
                } catch (Exception e) {
                    log.error("Could not queue job for callback id={} msg={}", jobId, e.getMessage(), e);
                }
            }

            cursor = page.cursor();
        } while (!JobStore.SCAN_START.equals(cursor));

        log.info("Queued {} rogue callbacks", rogueCount);
        return rogueCount;
    }

    /**
     * Run one delivery attempt for {@code job}.
     *
     * <p>Delivery failures are turned into a requeue or a permanent failure and do not propagate.
     * Store failures do: if persisting the {@code InProgress} state fails, nothing is posted.
     */
    public void deliver(Job job) {
        Objects.requireNonNull(job, "job must not be null");

        job.setCallbackCount(job.getCallbackCount() + 1);
        markCallbackInProgress(job);

        try {
            CallbackInfo info = callbackInfo(job);
            callbackClient.post(job.getCallbackUrl(), info);
        } catch (CallbackDeliveryException e) {
            log.debug("Callback attempt failed id={} attempt={} msg={}", job.getId(), job.getCallbackCount(), e.getMessage());
            retryOrFail(job, e.getMessage());
            return;
        }

        jobStore.removeJob(job.getId());
        log.debug("Callback delivered id={} attempt={}", job.getId(), job.getCallbackCount());
    }

    /**
     * Build the payload for {@code job}.
     *
     * @throws CallbackDeliveryException when the job's download has not concluded
     */
    CallbackInfo callbackInfo(Job job) throws CallbackDeliveryException {
        JobState state = job.getDownloadState();
        if (state == null || !state.isTerminal()) {
            throw new CallbackDeliveryException("Invalid job download state: '"
                    + (state == null ? "" : state.value()) + "'");
        }

        boolean success = state == JobState.SUCCESS;
        return new CallbackInfo(
                success,
                job.getDownloadMeta(),
                job.getExtra(),
                success ? DownloadUrls.resolve(downloadUrl, job.getId()) : ""
        );
    }

    private void retryOrFail(Job job, String reason) {
        if (job.getCallbackCount() >= options.maxCallbackAttempts()) {
            markCallbackFailed(job, reason);
            return;
        }
        jobStore.queuePendingCallback(job);
    }

    private void markCallbackInProgress(Job job) {
        job.setCallbackState(JobState.IN_PROGRESS);
        job.setCallbackMeta("");
        jobStore.saveJob(job);
    }

    private void markCallbackFailed(Job job, String reason) {
        job.setCallbackState(JobState.FAILED);
        job.setCallbackMeta(reason);
        log.warn("Callback failed id={} aggrId={} destination={} attempts={} reason={}",
                job.getId(), job.getAggrId(), job.getCallbackUrl(), job.getCallbackCount(), reason);
        jobStore.saveJob(job);
    }

    private void dispatchLoop(Run run, ExecutorService pool) {
        try {
            while (run.running.get()) {
                Optional<Job> next;
                try {
                    next = jobStore.popCallback();
                } catch (RetryLaterException e) {
                    log.debug("notifier callback queue unavailable msg={}", e.getMessage());
                    pause(run);
                    continue;
                } catch (Exception e) {
                    log.error("notifier popCallback failed msg={}", e.getMessage(), e);
                    pause(run);
                    continue;
                }

                if (next.isEmpty()) {
                    pause(run);
                    continue;
                }

                Job job = next.get();
                boolean handedOff = false;
                try {
                    handedOff = handOff(run, job);
                } finally {
                    if (!handedOff) {
                        returnToQueue(job);
                    }
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            drainWorkers(run, pool);
        }
    }

    // Blocks until a worker takes the job, or returns false once stop() was called.
    private boolean handOff(Run run, Job job) throws InterruptedException {
        while (run.running.get()) {
            if (run.handoff.offer(job, HANDOFF_POLL_MILLIS, TimeUnit.MILLISECONDS)) {
                return true;
            }
        }
        return false;
    }

    private void returnToQueue(Job job) {
        try {
            jobStore.queuePendingCallback(job);
            log.debug("Returned undelivered job to callback queue id={}", job.getId());
        } catch (Exception e) {
            log.error("Could not return job to callback queue id={} msg={}", job.getId(), e.getMessage(), e);
        }
    }

    private void pause(Run run) throws InterruptedException {
        run.stopSignal.await(options.pollBackoff().toMillis(), TimeUnit.MILLISECONDS);
    }

    private void workerLoop(Run run) {
        while (true) {
            Job job;
            try {
                job = run.handoff.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
            if (job == SHUTDOWN) {
                return;
            }

            try {
                deliver(job);
            } catch (Exception e) {
                log.error("Notify error id={} msg={}", job.getId(), e.getMessage(), e);
            }
        }
    }

    // Each worker takes exactly one SHUTDOWN, and only after finishing its current job.
    private void drainWorkers(Run run, ExecutorService pool) {
        try {
            for (int i = 0; i < options.concurrency(); i++) {
                run.handoff.put(SHUTDOWN);
            }
            pool.shutdown();
            if (!pool.awaitTermination(options.callbackTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
                pool.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            pool.shutdownNow();
        }
    }

    private static final class Run {
        private final AtomicBoolean running = new AtomicBoolean(true);
        private final CountDownLatch stopSignal = new CountDownLatch(1);
        private final SynchronousQueue<Job> handoff = new SynchronousQueue<>();
        private Thread dispatcher;
    }
}
