package io.downloader4j.internal.mongo;

import io.downloader4j.JobStore;
import io.downloader4j.core.CallbackDeliveryException;
import io.downloader4j.core.Job;
import io.downloader4j.core.JobNotFoundException;
import io.downloader4j.core.JobState;
import io.downloader4j.core.JobStoreException;
import io.downloader4j.core.NotifierOptions;
import io.downloader4j.core.ScanPage;
import io.downloader4j.internal.CallbackClient;
import io.downloader4j.internal.CallbackNotifier;
import com.mongodb.client.MongoClients;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;
import org.testcontainers.containers.MongoDBContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;

@Testcontainers(disabledWithoutDocker = true)
class MongoJobStoreIntegrationTest {

    @Container
    static final MongoDBContainer MONGO = new MongoDBContainer("mongo:7.0");

    private MongoTemplate mongoTemplate;
    private MongoJobStore jobStore;

    @BeforeEach
    void setUp() {
        mongoTemplate = new MongoTemplate(MongoClients.create(MONGO.getReplicaSetUrl()), "downloader4j_test");
        dropAll();
        jobStore = new MongoJobStore(mongoTemplate);
    }

    @AfterEach
    void tearDown() {
        dropAll();
    }

    @Test
    void saveJobShouldOverwriteAndGetJobShouldReadBack() {
        Job job = newJob("job-1", JobState.SUCCESS);
        job.setDownloadTimeout(30);
        jobStore.saveJob(job);

        job.setCallbackState(JobState.IN_PROGRESS);
        job.setCallbackCount(1);
        jobStore.saveJob(job);

        Job loaded = jobStore.getJob("job-1");
        assertThat(loaded.getAggrId()).isEqualTo("A");
        assertThat(loaded.getDownloadTimeout()).isEqualTo(30);
        assertThat(loaded.getDownloadState()).isEqualTo(JobState.SUCCESS);
        assertThat(loaded.getCallbackState()).isEqualTo(JobState.IN_PROGRESS);
        assertThat(loaded.getCallbackCount()).isEqualTo(1);
        assertThat(mongoTemplate.count(new Query(), JobDocument.class))
                .isEqualTo(1);

        jobStore.removeJob("job-1");
        assertThatThrownBy(() -> jobStore.getJob("job-1")).isInstanceOf(JobNotFoundException.class);
    }

    @Test
    void popCallbackShouldHandOutQueuedJobOnlyOnce() {
        Job job = newJob("job-2", JobState.FAILED);
        jobStore.saveJob(job);
        jobStore.queuePendingCallback(job);
        jobStore.queuePendingCallback(job);

        Optional<Job> first = jobStore.popCallback();
        Optional<Job> second = jobStore.popCallback();

        assertThat(first).isPresent();
        assertThat(first.get().getId()).isEqualTo("job-2");
        assertThat(second).isEmpty();
    }

    @Test
    void popCallbackShouldFailForQueuedJobWithoutRecord() {
        jobStore.queuePendingCallback(newJob("ghost", JobState.SUCCESS));

        assertThatThrownBy(() -> jobStore.popCallback())
                .isInstanceOf(JobStoreException.class)
                .hasMessageContaining("ghost");
        assertThat(jobStore.popCallback()).isEmpty();
    }

    @Test
    void queuePendingDownloadShouldAssignIdAndQueue() {
        Job job = newJob(null, JobState.SUCCESS);

        jobStore.queuePendingDownload(job);

        assertThat(job.getId()).isNotBlank();
        Job popped = jobStore.popDownload().orElseThrow();
        assertThat(popped.getId()).isEqualTo(job.getId());
        assertThat(popped.getDownloadState()).isEqualTo(JobState.PENDING);
        assertThat(jobStore.popCallback()).isEmpty();
    }

    @Test
    void scanKeysShouldPageThroughAllJobs() {
        for (int i = 0; i < 5; i++) {
            jobStore.saveJob(newJob("job-" + i, JobState.SUCCESS));
        }

        List<String> keys = new ArrayList<>();
        String cursor = JobStore.SCAN_START;
        int rounds = 0;
        do {
            ScanPage page = jobStore.scanKeys(cursor, JobStore.JOB_KEY_PREFIX, 2);
            keys.addAll(page.keys());
            cursor = page.cursor();
            rounds++;
        } while (!JobStore.SCAN_START.equals(cursor));

        assertThat(rounds).isEqualTo(3);
        assertThat(keys).containsExactly(
                "jobs:job-0", "jobs:job-1", "jobs:job-2", "jobs:job-3", "jobs:job-4");

        ScanPage filtered = jobStore.scanKeys(JobStore.SCAN_START, JobStore.JOB_KEY_PREFIX + "job-3", 10);
        assertThat(filtered.keys()).containsExactly("jobs:job-3");
        assertThat(filtered.cursor()).isEqualTo(JobStore.SCAN_START);
    }

    @Test
    void notifierShouldRequeueRogueCallbackWithoutTouchingRecord() {
        Job rogue = newJob("rogue", JobState.SUCCESS);
        rogue.setCallbackState(JobState.IN_PROGRESS);
        rogue.setCallbackCount(1);
        jobStore.saveJob(rogue);
        jobStore.saveJob(newJob("fresh", JobState.SUCCESS));

        CallbackNotifier notifier = new CallbackNotifier(options(), jobStore, mock(CallbackClient.class));

        assertThat(notifier.requeueRogueCallbacks()).isEqualTo(1);
        assertThat(notifier.requeueRogueCallbacks()).isEqualTo(1);

        assertThat(mongoTemplate.count(new Query(),
                QueueEntryDocument.PENDING_CALLBACKS)).isEqualTo(1);
        Job stored = jobStore.getJob("rogue");
        assertThat(stored.getCallbackState()).isEqualTo(JobState.IN_PROGRESS);
        assertThat(stored.getCallbackCount()).isEqualTo(1);
    }

    @Test
    void exhaustedCallbackShouldStayQueryableAsFailed() throws Exception {
        CallbackClient client = mock(CallbackClient.class);
        doThrow(new CallbackDeliveryException("Received Status: 500")).when(client).post(anyString(), any());
        CallbackNotifier notifier = new CallbackNotifier(options(), jobStore, client);

        Job job = newJob("job-9", JobState.SUCCESS);
        jobStore.saveJob(job);
        jobStore.queuePendingCallback(job);

        notifier.deliver(jobStore.popCallback().orElseThrow());
        notifier.deliver(jobStore.popCallback().orElseThrow());

        List<Job> failed = jobStore.findFailedCallbacks(10);
        assertThat(failed).hasSize(1);
        assertThat(failed.get(0).getId()).isEqualTo("job-9");
        assertThat(failed.get(0).getCallbackCount()).isEqualTo(2);
        assertThat(failed.get(0).getCallbackMeta()).isEqualTo("Received Status: 500");
        assertThat(jobStore.popCallback()).isEmpty();
    }

    private void dropAll() {
        mongoTemplate.dropCollection(JobDocument.class);
        mongoTemplate.dropCollection(QueueEntryDocument.PENDING_DOWNLOADS);
        mongoTemplate.dropCollection(QueueEntryDocument.PENDING_CALLBACKS);
    }

    private static NotifierOptions options() {
        return new NotifierOptions(1, "http://dl.example/files", Duration.ofSeconds(1), 2, Duration.ofMillis(100), 1);
    }

    private static Job newJob(String id, JobState downloadState) {
        Job job = new Job();
        job.setId(id);
        job.setAggrId("A");
        job.setUrl("http://src/x");
        job.setCallbackUrl("http://dst/cb");
        job.setDownloadState(downloadState);
        return job;
    }
}
