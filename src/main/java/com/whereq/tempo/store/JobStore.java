package com.whereq.tempo.store;

import com.whereq.tempo.exception.JobStoreException;
import com.whereq.tempo.model.Job;
import com.whereq.tempo.model.JobStatus;
import com.whereq.tempo.model.JobTrigger;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionCallback;
import org.springframework.transaction.support.TransactionTemplate;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Instant;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Durable job store backed by the {@code job} and {@code job_trigger} tables.
 * <p>
 * Every operation runs in its own transaction on the bounded elastic
 * scheduler. The returned publisher completes only after the commit; on any
 * error the transaction is rolled back and the previous state is kept.
 */
@Slf4j
@Service
public class JobStore {

    @Autowired
    private JobRepository jobRepository;

    @Autowired
    private JobTriggerRepository triggerRepository;

    @Autowired
    private TransactionTemplate transactionTemplate;

    /**
     * Insert or update a job. Idempotent on id.
     *
     * @param job job to persist
     * @return Mono with the committed job
     */
    public Mono<Job> put(Job job) {
        return inTransaction("put " + job.getId(), status -> jobRepository.save(job))
            .doOnSuccess(saved -> log.debug("Stored job {} with status {}", saved.getId(), saved.getStatus()));
    }

    /**
     * Look up a job by id.
     *
     * @param jobId job identifier
     * @param ownerFilter optional owner; a job owned by someone else is treated as absent
     * @return Mono with the job, empty if not found
     */
    public Mono<Job> lookup(String jobId, String ownerFilter) {
        return inTransaction("lookup " + jobId, status -> jobRepository.findById(jobId)
            .filter(job -> job.isOwnedBy(ownerFilter))
            .orElse(null));
    }

    /**
     * List the jobs of an owner.
     * <p>
     * Without a pending filter the query runs directly against the stored
     * status. With one, a job counts as pending when the scheduler still holds
     * a trigger for it and its stored status is PENDING; the status filter is
     * applied on top.
     *
     * @param ownerId owner identifier
     * @param pending optional pending filter
     * @param status optional status filter
     * @param pendingTriggerIds ids of triggers the scheduler has not fired yet
     * @return Flux of matching jobs, oldest first
     */
    public Flux<Job> list(String ownerId, Boolean pending, JobStatus status, Set<String> pendingTriggerIds) {
        return inTransaction("list " + ownerId, tx -> {
            if (pending == null) {
                return status == null
                    ? jobRepository.findByUserIdOrderByCreatedAtAsc(ownerId)
                    : jobRepository.findByUserIdAndStatusOrderByCreatedAtAsc(ownerId, status);
            }
            return jobRepository.findByUserIdOrderByCreatedAtAsc(ownerId).stream()
                .filter(job -> isPending(job, pendingTriggerIds) == pending)
                .filter(job -> status == null || job.getStatus() == status)
                .toList();
        }).flatMapMany(Flux::fromIterable);
    }

    /**
     * Atomically move a job to a new status.
     * <p>
     * A job already in a terminal status is returned unchanged with
     * {@code applied == false}. Otherwise the mutator runs on the managed
     * entity, the status is set, terminal jobs are deactivated and
     * {@code updated_at} is refreshed before commit.
     *
     * @param jobId job identifier
     * @param target status to move to
     * @param mutator extra changes applied with the transition
     * @return Mono with the transition outcome, empty if the job does not exist
     */
    public Mono<StatusTransition> transition(String jobId, JobStatus target, Consumer<Job> mutator) {
        return inTransaction("transition " + jobId + " to " + target, tx ->
            jobRepository.findById(jobId)
                .map(job -> {
                    JobStatus previous = job.getStatus();
                    if (!previous.canTransitionTo(target)) {
                        log.warn("Ignoring transition of job {} from {} to {}", jobId, previous, target);
                        return new StatusTransition(job, previous, false);
                    }
                    mutator.accept(job);
                    job.setStatus(target);
                    job.setActive(!target.isTerminal());
                    job.setUpdatedAt(Instant.now());
                    Job saved = jobRepository.save(job);
                    log.info("Job {} status updated: {} → {}", jobId, previous, target);
                    return new StatusTransition(saved, previous, true);
                })
                .orElse(null));
    }

    public Mono<Void> saveTrigger(JobTrigger trigger) {
        return inTransaction("save trigger " + trigger.getJobId(), tx -> triggerRepository.save(trigger))
            .then();
    }

    /**
     * Delete the mirror of a trigger. A row written by a later registration
     * under the same job id is left in place.
     *
     * @param jobId job identifier
     * @param createdAt registration time of the trigger whose mirror should go
     * @return Mono that completes after the commit
     */
    public Mono<Void> deleteTrigger(String jobId, Instant createdAt) {
        return inTransaction("delete trigger " + jobId, tx -> triggerRepository.findById(jobId)
            .filter(mirror -> createdAt.equals(mirror.getCreatedAt()))
            .map(mirror -> {
                triggerRepository.delete(mirror);
                return Boolean.TRUE;
            })
            .orElseGet(() -> {
                log.debug("No mirror of job {} registered at {} to delete", jobId, createdAt);
                return Boolean.FALSE;
            })).then();
    }

    public Flux<JobTrigger> loadTriggers() {
        return inTransaction("load triggers", tx -> triggerRepository.findAllByOrderByCreatedAtAsc())
            .flatMapMany(Flux::fromIterable);
    }

    private boolean isPending(Job job, Set<String> pendingTriggerIds) {
        return job.getStatus() == JobStatus.PENDING && pendingTriggerIds.contains(job.getId());
    }

    private <T> Mono<T> inTransaction(String operation, TransactionCallback<T> callback) {
        return Mono.fromCallable(() -> transactionTemplate.execute(callback))
            .subscribeOn(Schedulers.boundedElastic())
            .onErrorMap(e -> e instanceof DataAccessException || e instanceof TransactionException,
                e -> new JobStoreException("Job store operation failed: " + operation, e));
    }
}
