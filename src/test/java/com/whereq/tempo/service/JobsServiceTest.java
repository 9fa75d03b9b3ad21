package com.whereq.tempo.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.whereq.tempo.model.Job;
import com.whereq.tempo.model.JobStatus;
import com.whereq.tempo.model.WebhookJobData;
import com.whereq.tempo.scheduler.JobSchedulerEngine;
import com.whereq.tempo.store.JobRepository;
import com.whereq.tempo.task.TaskRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.context.ActiveProfiles;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.after;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@SpringBootTest(properties = "tempo.webhook.enabled=true")
@ActiveProfiles("test")
class JobsServiceTest {

    @Autowired
    private JobsService jobsService;

    @Autowired
    private JobSchedulerEngine engine;

    @Autowired
    private JobRepository jobRepository;

    @Autowired
    private TaskRegistry taskRegistry;

    @MockBean
    private WebhookNotifier webhookNotifier;

    @BeforeEach
    void setUp() {
        when(webhookNotifier.send(any())).thenReturn(Mono.just(true));
    }

    @Test
    void immediateJobCompletesAndNotifiesWebhook() {
        String jobId = jobsService.createJob("echo", null, null, List.of(42), Map.of("user_id", "alice"))
            .block();

        Job job = awaitFinished(jobId);

        assertThat(job.getStatus()).isEqualTo(JobStatus.COMPLETED);
        assertThat(job.getName()).isEqualTo("task_" + jobId);
        assertThat(job.getUserId()).isEqualTo("alice");
        assertThat(job.getResult().get("output").asText()).isEqualTo("42");
        assertThat(job.getError()).isNull();
        assertThat(job.isActive()).isFalse();
        verify(webhookNotifier, timeout(5000)).send(argThat(data ->
            jobId.equals(data.getId()) && "COMPLETED".equals(data.getStatus())));
    }

    @Test
    void failingJobRecordsErrorWithoutWebhook() {
        String jobId = jobsService.createJob("fail", null, "doomed", List.of("boom"), Map.of())
            .block();

        Job job = awaitFinished(jobId);

        assertThat(job.getStatus()).isEqualTo(JobStatus.FAILED);
        assertThat(job.getName()).isEqualTo("doomed");
        assertThat(job.getError()).isEqualTo("boom");
        assertThat(job.getResult()).isNull();
        assertThat(job.isActive()).isFalse();
        verify(webhookNotifier, never()).send(argThat(data -> jobId.equals(data.getId())));
    }

    @Test
    void cancellingBeforeFireKeepsTaskFromRunning() throws Exception {
        AtomicInteger runs = new AtomicInteger();
        String jobId = jobsService.createJob((args, kwargs) -> runs.incrementAndGet(),
                Instant.now().plusMillis(500), null, List.of(), Map.of("user_id", "carol"))
            .block();
        assertThat(engine.get(jobId)).isPresent();

        assertThat(jobsService.cancelJob(jobId, "carol").block()).isTrue();
        Thread.sleep(800);

        Job job = jobsService.getJob(jobId, null).block();
        assertThat(job.getStatus()).isEqualTo(JobStatus.CANCELLED);
        assertThat(job.isActive()).isFalse();
        assertThat(engine.get(jobId)).isEmpty();
        assertThat(runs).hasValue(0);
        verify(webhookNotifier, never()).send(argThat(data -> jobId.equals(data.getId())));
    }

    @Test
    void cancellingRunningJobKeepsItCancelledWhenTaskFinishes() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        String jobId = jobsService.createJob((args, kwargs) -> {
                started.countDown();
                release.await(5, TimeUnit.SECONDS);
                return "too late";
            }, null, null, List.of(), Map.of("user_id", "hank"))
            .block();
        assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();

        assertThat(jobsService.cancelJob(jobId, "hank").block()).isTrue();
        release.countDown();

        verify(webhookNotifier, after(500).never()).send(argThat(data -> jobId.equals(data.getId())));
        Job job = jobsService.getJob(jobId, null).block();
        assertThat(job.getStatus()).isEqualTo(JobStatus.CANCELLED);
        assertThat(job.getResult()).isNull();
        assertThat(job.getError()).isNull();
        assertThat(job.isActive()).isFalse();
    }

    @Test
    void cancellingUnknownJobReturnsFalseWithoutCreatingIt() {
        assertThat(jobsService.cancelJob("no-such-job", null).block()).isFalse();
        assertThat(jobRepository.findById("no-such-job")).isEmpty();
    }

    @Test
    void cancellingAnotherOwnersJobIsRefused() {
        String jobId = jobsService.createJob("echo", Instant.now().plus(1, ChronoUnit.HOURS), null,
                List.of("later"), Map.of("user_id", "dave"))
            .block();

        assertThat(jobsService.cancelJob(jobId, "mallory").block()).isFalse();
        assertThat(jobsService.getJob(jobId, "mallory").block()).isNull();
        assertThat(jobsService.getJob(jobId, "dave").block().getStatus()).isEqualTo(JobStatus.PENDING);

        assertThat(jobsService.cancelJob(jobId, "dave").block()).isTrue();
        assertThat(jobsService.cancelJob(jobId, "dave").block()).isTrue();
    }

    @Test
    void failureWithoutMessageRecordsExceptionName() {
        String jobId = jobsService.createJob((args, kwargs) -> {
                throw new UnsupportedOperationException();
            }, null, null, List.of(), Map.of())
            .block();

        Job job = awaitFinished(jobId);
        assertThat(job.getStatus()).isEqualTo(JobStatus.FAILED);
        assertThat(job.getError()).isEqualTo("UnsupportedOperationException");
    }

    @Test
    void cancellingFinishedJobLeavesItsStatus() {
        String jobId = jobsService.createJob("echo", null, null, List.of("done"), Map.of()).block();
        awaitFinished(jobId);

        assertThat(jobsService.cancelJob(jobId, null).block()).isFalse();
        assertThat(jobsService.getJob(jobId, null).block().getStatus()).isEqualTo(JobStatus.COMPLETED);
    }

    @Test
    void unknownTaskIsRejectedBeforeAnythingIsStored() {
        long before = jobRepository.count();

        assertThatThrownBy(() -> jobsService.createJob("no-such-task", null, null, List.of(), Map.of()).block())
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("no-such-task");
        assertThat(jobRepository.count()).isEqualTo(before);
    }

    @Test
    void listingRequiresOwner() {
        assertThatThrownBy(() -> jobsService.getJobs(null, null, null).collectList().block())
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("User ID is required");
        assertThat(jobsService.getUserJobs("nobody").collectList().block()).isEmpty();
    }

    @Test
    void pendingFilterSeparatesWaitingJobs() {
        String owner = "erin";
        String waiting = jobsService.createJob("echo", Instant.now().plus(1, ChronoUnit.HOURS), null,
                List.of("later"), Map.of("user_id", owner))
            .block();
        String done = jobsService.createJob("echo", null, null, List.of("now"), Map.of("user_id", owner))
            .block();
        awaitFinished(done);

        assertThat(ids(jobsService.getJobs(owner, true, null))).containsExactly(waiting);
        assertThat(ids(jobsService.getJobs(owner, false, null))).containsExactly(done);
        assertThat(ids(jobsService.getJobs(owner, null, JobStatus.COMPLETED))).containsExactly(done);
        assertThat(ids(jobsService.getUserJobs(owner))).containsExactlyInAnyOrder(waiting, done);

        jobsService.cancelJob(waiting, owner).block();
    }

    @Test
    void concurrentSubmissionsAllComplete() {
        String owner = "frank";
        List<String> jobIds = Flux.range(0, 20)
            .flatMap(i -> jobsService.createJob("echo", null, null, List.of(i), Map.of("user_id", owner)))
            .collectList()
            .block();

        assertThat(Set.copyOf(jobIds)).hasSize(20);
        jobIds.forEach(jobId -> assertThat(awaitFinished(jobId).getStatus()).isEqualTo(JobStatus.COMPLETED));
        assertThat(jobsService.getUserJobs(owner).collectList().block()).hasSize(20);
    }

    @Test
    void recordsFlowIdFromKeywordArguments() {
        String jobId = jobsService.createJob("echo", null, null, List.of(),
                Map.of("user_id", "gina", "flow_id", "flow-7"))
            .block();

        Job job = awaitFinished(jobId);
        assertThat(job.getFlowId()).isEqualTo("flow-7");
        // kwargs-only echo returns a map, which is stored as-is
        assertThat(job.getResult().get("flow_id").asText()).isEqualTo("flow-7");
        verify(webhookNotifier, timeout(5000)).send(argThat((WebhookJobData data) ->
            jobId.equals(data.getId()) && "flow-7".equals(data.getFlowId())));
    }

    @Test
    void runtimeRegisteredTaskCanBeScheduledByName() {
        taskRegistry.register("shout", (args, kwargs) -> args.stream()
            .map(arg -> String.valueOf(arg).toUpperCase())
            .collect(Collectors.joining(" ")));

        String jobId = jobsService.createJob("shout", null, null, List.of("hi", "there"), Map.of()).block();

        assertThat(awaitFinished(jobId).getResult().get("output").asText()).isEqualTo("HI THERE");
    }

    @Test
    void resultSerializationFallsBackToStringForm() {
        JsonNode object = jobsService.serializeResult("job-1", Map.of("answer", 42));
        assertThat(object.get("answer").asInt()).isEqualTo(42);

        JsonNode list = jobsService.serializeResult("job-1", List.of(1, 2));
        assertThat(list.get("output").asText()).isEqualTo("[1, 2]");

        JsonNode nothing = jobsService.serializeResult("job-1", null);
        assertThat(nothing.get("output").asText()).isEqualTo("null");

        JsonNode broken = jobsService.serializeResult("job-1", new Unserializable());
        assertThat(broken.get("output").asText()).isEqualTo("unserializable");
    }

    private Job awaitFinished(String jobId) {
        long deadline = System.currentTimeMillis() + 5000;
        Job job = jobsService.getJob(jobId, null).block();
        while (job != null && job.getStatus() == JobStatus.PENDING && System.currentTimeMillis() < deadline) {
            try {
                Thread.sleep(25);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException(e);
            }
            job = jobsService.getJob(jobId, null).block();
        }
        assertThat(job).isNotNull();
        assertThat(job.getStatus()).as("status of job %s", jobId).isNotEqualTo(JobStatus.PENDING);
        return job;
    }

    private static List<String> ids(Flux<Job> jobs) {
        return jobs.map(Job::getId).collectList().block();
    }

    public static class Unserializable {

        public String getValue() {
            throw new IllegalStateException("no value");
        }

        @Override
        public String toString() {
            return "unserializable";
        }
    }
}
