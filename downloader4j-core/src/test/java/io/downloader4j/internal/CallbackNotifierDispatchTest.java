package io.downloader4j.internal;

import io.downloader4j.JobStore;
import io.downloader4j.core.Job;
import io.downloader4j.core.JobState;
import io.downloader4j.core.JobStoreException;
import io.downloader4j.core.NotifierOptions;
import io.downloader4j.core.RetryLaterException;
import io.downloader4j.core.ScanPage;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.atLeast;
import static org.mockito.Mockito.atMost;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class CallbackNotifierDispatchTest {

    private static final NotifierOptions OPTIONS = new NotifierOptions(
            2, "http://dl.example/files", Duration.ofSeconds(1), 2, Duration.ofMillis(50), 10);

    @Test
    void dispatcherShouldBackOffOnEmptyRetryLaterAndUnexpectedErrors() throws Exception {
        JobStore store = mock(JobStore.class);
        when(store.scanKeys(anyString(), anyString(), anyInt()))
                .thenReturn(new ScanPage(List.of(), JobStore.SCAN_START));
        when(store.popCallback())
                .thenThrow(new RetryLaterException("leased"))
                .thenThrow(new JobStoreException("connection reset"))
                .thenReturn(Optional.empty());

        CallbackNotifier notifier = new CallbackNotifier(OPTIONS, store, mock(CallbackClient.class));
        notifier.start();
        Thread.sleep(400);
        notifier.stop();

        // 400ms at a 50ms backoff; a busy loop would poll thousands of times
        verify(store, atLeast(3)).popCallback();
        verify(store, atMost(12)).popCallback();
    }

    @Test
    void recoveryScanShouldStopOnStoreErrorWithoutFailingStart() {
        JobStore store = mock(JobStore.class);
        when(store.scanKeys(anyString(), anyString(), anyInt()))
                .thenThrow(new JobStoreException("scan failed"));
        when(store.popCallback()).thenReturn(Optional.empty());

        CallbackNotifier notifier = new CallbackNotifier(OPTIONS, store, mock(CallbackClient.class));

        assertThat(notifier.requeueRogueCallbacks()).isZero();
        verify(store, never()).queuePendingCallback(any());
    }

    @Test
    void failureToPersistInProgressShouldAbortAttemptBeforePosting() {
        JobStore store = mock(JobStore.class);
        CallbackClient client = mock(CallbackClient.class);
        doThrow(new JobStoreException("write failed")).when(store).saveJob(any());

        CallbackNotifier notifier = new CallbackNotifier(OPTIONS, store, client);
        Job job = new Job();
        job.setId("job-1");
        job.setCallbackUrl("http://dst/cb");
        job.setDownloadState(JobState.SUCCESS);

        assertThatThrownBy(() -> notifier.deliver(job))
                .isInstanceOf(JobStoreException.class)
                .hasMessage("write failed");
        verifyNoInteractions(client);
        verify(store, never()).removeJob(anyString());
        verify(store, never()).queuePendingCallback(any());
    }

    @Test
    void startAndStopShouldBeIdempotent() {
        JobStore store = mock(JobStore.class);
        when(store.scanKeys(anyString(), anyString(), anyInt()))
                .thenReturn(new ScanPage(List.of(), JobStore.SCAN_START));
        when(store.popCallback()).thenReturn(Optional.empty());

        CallbackNotifier notifier = new CallbackNotifier(OPTIONS, store, mock(CallbackClient.class));
        notifier.start();
        notifier.start();
        assertThat(notifier.isRunning()).isTrue();

        notifier.stop();
        notifier.stop();
        assertThat(notifier.isRunning()).isFalse();
        verify(store, atMost(1)).scanKeys(anyString(), anyString(), anyInt());
    }

    @Test
    void restartDuringShutdownShouldNotKeepOldDispatcherAlive() throws Exception {
        JobStore store = mock(JobStore.class);
        when(store.scanKeys(anyString(), anyString(), anyInt()))
                .thenReturn(new ScanPage(List.of(), JobStore.SCAN_START));
        Job job = new Job();
        job.setId("job-1");
        job.setCallbackUrl("http://dst/cb");
        job.setDownloadState(JobState.SUCCESS);
        when(store.popCallback())
                .thenReturn(Optional.of(job))
                .thenReturn(Optional.empty());

        CountDownLatch posting = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        CallbackClient client = mock(CallbackClient.class);
        doAnswer(invocation -> {
            posting.countDown();
            release.await(5, TimeUnit.SECONDS);
            return null;
        }).when(client).post(anyString(), any());

        CallbackNotifier notifier = new CallbackNotifier(OPTIONS, store, client);
        notifier.start();
        assertThat(posting.await(5, TimeUnit.SECONDS)).isTrue();

        // stop() waits for the delivery in flight while the notifier is started again
        Thread stopper = new Thread(notifier::stop);
        stopper.start();
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (notifier.isRunning() && System.nanoTime() < deadline) {
            Thread.sleep(10);
        }
        assertThat(notifier.isRunning()).isFalse();

        notifier.start();
        release.countDown();
        stopper.join(5000);

        assertThat(stopper.isAlive()).isFalse();
        assertThat(notifier.isRunning()).isTrue();
        notifier.stop();
        assertThat(notifier.isRunning()).isFalse();
        verify(store).removeJob("job-1");
    }
}
