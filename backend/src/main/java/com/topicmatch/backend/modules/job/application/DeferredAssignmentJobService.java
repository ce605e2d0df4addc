package com.topicmatch.backend.modules.job.application;

import static org.springframework.http.HttpStatus.CONFLICT;
import static org.springframework.http.HttpStatus.NOT_FOUND;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.topicmatch.backend.global.error.ProblemException;
import com.topicmatch.backend.global.error.RetryableProblemException;
import com.topicmatch.backend.modules.job.domain.CompletionOutcome;
import com.topicmatch.backend.modules.job.domain.DeferredAssignmentJob;
import com.topicmatch.backend.modules.job.domain.DeferredJobStatus;
import com.topicmatch.backend.modules.job.domain.SolverKind;
import com.topicmatch.backend.modules.job.infrastructure.persistence.DeferredAssignmentJobRepository;
import com.topicmatch.backend.modules.job.presentation.dto.JobStatusResponse;
import com.topicmatch.backend.modules.solver.domain.CompiledRequest;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.NestedExceptionUtils;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Owns the job state machine. At most one job per period is {@code PENDING}; a terminal job never
 * changes status again, so repeated or late callbacks are harmless.
 */
@Service
@Transactional
public class DeferredAssignmentJobService {

    private static final Logger log = LoggerFactory.getLogger(DeferredAssignmentJobService.class);
    private static final String PENDING_UNIQUE_INDEX = "uq_deferred_job_pending_period";
    private static final TypeReference<Map<String, Object>> JSON_OBJECT = new TypeReference<>() {
    };

    private final DeferredAssignmentJobRepository jobRepository;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final Duration staleThreshold;

    public DeferredAssignmentJobService(
            DeferredAssignmentJobRepository jobRepository,
            ObjectMapper objectMapper,
            Clock clock,
            @Value("${app.assignment.stale-job-threshold:PT15M}") Duration staleThreshold
    ) {
        this.jobRepository = jobRepository;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.staleThreshold = staleThreshold;
    }

    public DeferredAssignmentJob create(UUID periodId, SolverKind kind, CompiledRequest compiled) {
        if (jobRepository.existsByPeriodIdAndStatus(periodId, DeferredJobStatus.PENDING)) {
            throw pendingJobExists(periodId);
        }
        Map<String, Object> payload = objectMapper.convertValue(compiled.request(), JSON_OBJECT);
        DeferredAssignmentJob job = new DeferredAssignmentJob(
                periodId,
                kind,
                payload,
                compiled.studentIds(),
                compiled.topicIds(),
                OffsetDateTime.now(clock)
        );
        try {
            DeferredAssignmentJob saved = jobRepository.saveAndFlush(job);
            log.info("Created deferred job {} ({}) for period {}: {} students, {} topics",
                    saved.getId(), kind, periodId, compiled.studentIds().size(), compiled.topicIds().size());
            return saved;
        } catch (DataIntegrityViolationException ex) {
            if (isPendingConflict(ex)) {
                throw new RetryableProblemException(CONFLICT, "PENDING_JOB_EXISTS",
                        "Another job for period %s was created concurrently".formatted(periodId), 1);
            }
            throw ex;
        }
    }

    /**
     * Marks the period's pending job, if any, as abandoned.
     *
     * @return id of the abandoned job
     */
    public Optional<UUID> abandonPending(UUID periodId, String reason) {
        Optional<DeferredAssignmentJob> pending = jobRepository.findFirstByPeriodIdAndStatus(periodId, DeferredJobStatus.PENDING);
        pending.ifPresent(job -> {
            job.abandon(reason, OffsetDateTime.now(clock));
            jobRepository.saveAndFlush(job);
            log.info("Abandoned deferred job {} of period {}: {}", job.getId(), periodId, reason);
        });
        return pending.map(DeferredAssignmentJob::getId);
    }

    /**
     * Stores the solver result on a pending job. Terminal jobs are left untouched and the outcome tells the
     * caller whether this was the first completion.
     */
    public CompletionOutcome complete(UUID jobId, String evaluationId, Map<String, Object> data, String dataHash) {
        DeferredAssignmentJob job = jobRepository.findByIdForUpdate(jobId)
                .orElseThrow(() -> jobNotFound(jobId));

        switch (job.getStatus()) {
            case PENDING -> {
                job.complete(evaluationId, data, dataHash, OffsetDateTime.now(clock));
                jobRepository.save(job);
                log.info("Deferred job {} completed (evaluation {})", jobId, evaluationId);
                return CompletionOutcome.COMPLETED;
            }
            case COMPLETED -> {
                if (Objects.equals(job.getResultHash(), dataHash)) {
                    log.debug("Duplicate completion for deferred job {}", jobId);
                    return CompletionOutcome.DUPLICATE;
                }
                log.warn("[ALERT][Job] Conflicting completion for job {}: stored hash {}, received {}; keeping stored result",
                        jobId, job.getResultHash(), dataHash);
                return CompletionOutcome.CONFLICTING;
            }
            default -> {
                log.info("Ignoring completion for deferred job {} in status {}", jobId, job.getStatus());
                return CompletionOutcome.IGNORED;
            }
        }
    }

    /**
     * Moves a pending job to FAILED. Returns false, and changes nothing, when the job is already terminal.
     */
    public boolean fail(UUID jobId, String error) {
        DeferredAssignmentJob job = jobRepository.findByIdForUpdate(jobId)
                .orElseThrow(() -> jobNotFound(jobId));
        if (job.getStatus().isTerminal()) {
            log.debug("Ignoring failure for deferred job {} in status {}", jobId, job.getStatus());
            return false;
        }
        job.fail(error, OffsetDateTime.now(clock));
        jobRepository.save(job);
        log.warn("Deferred job {} of period {} failed: {}", jobId, job.getPeriodId(), error);
        return true;
    }

    public void recordMaterialization(UUID jobId, String batchId) {
        DeferredAssignmentJob job = getJob(jobId);
        job.markMaterialized(batchId, OffsetDateTime.now(clock));
        jobRepository.save(job);
    }

    public void recordMaterializationFailure(UUID jobId, String error) {
        DeferredAssignmentJob job = getJob(jobId);
        job.markMaterializationFailed(error, OffsetDateTime.now(clock));
        jobRepository.save(job);
        log.warn("[ALERT][Job] Materialization of job {} failed: {}", jobId, error);
    }

    @Transactional(readOnly = true)
    public DeferredAssignmentJob getJob(UUID jobId) {
        return jobRepository.findById(jobId).orElseThrow(() -> jobNotFound(jobId));
    }

    @Transactional(readOnly = true)
    public boolean isLatestForPeriod(DeferredAssignmentJob job) {
        return jobRepository.findFirstByPeriodIdOrderByCreatedAtDesc(job.getPeriodId())
                .map(latest -> latest.getId().equals(job.getId()))
                .orElse(false);
    }

    @Transactional(readOnly = true)
    public JobStatusResponse getStatus(UUID jobId) {
        DeferredAssignmentJob job = getJob(jobId);
        OffsetDateTime now = OffsetDateTime.now(clock);
        Duration age = Duration.between(job.getCreatedAt(), now);
        boolean stale = job.isPending() && age.compareTo(staleThreshold) > 0;
        return new JobStatusResponse(
                job.getId(),
                job.getPeriodId(),
                job.getKind().name(),
                job.getStatus().name(),
                job.getError(),
                job.getCreatedAt(),
                job.getUpdatedAt(),
                Math.max(0, age.getSeconds()),
                stale,
                job.getMaterializationStatus().name(),
                job.getMaterializationError(),
                job.getBatchId()
        );
    }

    @Transactional(readOnly = true)
    public List<DeferredAssignmentJob> findStalePending() {
        OffsetDateTime threshold = OffsetDateTime.now(clock).minus(staleThreshold);
        return jobRepository.findByStatusAndCreatedAtBeforeOrderByCreatedAtAsc(DeferredJobStatus.PENDING, threshold);
    }

    private boolean isPendingConflict(DataIntegrityViolationException ex) {
        Throwable root = NestedExceptionUtils.getMostSpecificCause(ex);
        String message = root.getMessage();
        return message != null && message.contains(PENDING_UNIQUE_INDEX);
    }

    private static ProblemException pendingJobExists(UUID periodId) {
        return new ProblemException(CONFLICT, "PENDING_JOB_EXISTS",
                "Period %s already has a pending assignment job".formatted(periodId));
    }

    public static ProblemException jobNotFound(UUID jobId) {
        return new ProblemException(NOT_FOUND, "JOB_NOT_FOUND", "Deferred assignment job %s not found".formatted(jobId));
    }
}
