package com.topicmatch.backend.modules.trigger.application;

import static org.springframework.http.HttpStatus.UNAUTHORIZED;

import java.util.UUID;

import com.topicmatch.backend.global.error.ProblemException;
import com.topicmatch.backend.modules.assignment.application.AssignmentMaterializer;
import com.topicmatch.backend.modules.job.application.DeferredAssignmentJobService;
import com.topicmatch.backend.modules.job.domain.CompletionOutcome;
import com.topicmatch.backend.modules.trigger.infrastructure.solver.CallbackSignatureVerifier;
import com.topicmatch.backend.modules.trigger.presentation.dto.SolverCallbackRequest;
import com.topicmatch.backend.modules.trigger.presentation.dto.SolverCallbackResponse;
import com.topicmatch.backend.modules.trigger.presentation.dto.SolverFailureRequest;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;

/**
 * Handles solver callbacks. Completion, materialization and failure recording each run in their own
 * transaction: a failed materialization rolls back its batch but leaves the job COMPLETED with the error.
 */
@Service
public class SolverCallbackService {

    private static final Logger log = LoggerFactory.getLogger(SolverCallbackService.class);

    private final CallbackSignatureVerifier signatureVerifier;
    private final DeferredAssignmentJobService jobService;
    private final AssignmentMaterializer assignmentMaterializer;

    public SolverCallbackService(
            CallbackSignatureVerifier signatureVerifier,
            DeferredAssignmentJobService jobService,
            AssignmentMaterializer assignmentMaterializer
    ) {
        this.signatureVerifier = signatureVerifier;
        this.jobService = jobService;
        this.assignmentMaterializer = assignmentMaterializer;
    }

    public CallbackResult handleCompletion(SolverCallbackRequest request) {
        UUID jobId = request.deferredId();
        if (!signatureVerifier.verify(request.data(), request.hash())) {
            log.warn("[ALERT][Callback] Hash mismatch for deferred job {}", jobId);
            throw hashMismatch(jobId);
        }

        CompletionOutcome outcome = jobService.complete(jobId, request.evaluationId(), request.data(), request.hash());
        if (!outcome.isFirstCompletion()) {
            return new CallbackResult(HttpStatus.OK, new SolverCallbackResponse(jobId, outcome.name(), null, null));
        }

        try {
            String batchId = assignmentMaterializer.materialize(jobId);
            return new CallbackResult(HttpStatus.OK, new SolverCallbackResponse(jobId, outcome.name(), batchId, null));
        } catch (ProblemException ex) {
            String error = ex.getCode() + ": " + ex.getDetailMessage();
            jobService.recordMaterializationFailure(jobId, error);
            return new CallbackResult(HttpStatus.INTERNAL_SERVER_ERROR,
                    new SolverCallbackResponse(jobId, outcome.name(), null, error));
        } catch (RuntimeException ex) {
            log.error("Materialization of job {} failed unexpectedly", jobId, ex);
            String error = "MATERIALIZATION_FAILED: " + ex.getMessage();
            jobService.recordMaterializationFailure(jobId, error);
            return new CallbackResult(HttpStatus.INTERNAL_SERVER_ERROR,
                    new SolverCallbackResponse(jobId, outcome.name(), null, error));
        }
    }

    public SolverCallbackResponse handleFailure(UUID jobId, SolverFailureRequest request) {
        if (!signatureVerifier.verify(request.error(), request.hash())) {
            log.warn("[ALERT][Callback] Hash mismatch on failure report for deferred job {}", jobId);
            throw hashMismatch(jobId);
        }
        boolean changed = jobService.fail(jobId, request.error());
        return new SolverCallbackResponse(jobId, changed ? "FAILED" : "IGNORED", null, null);
    }

    private static ProblemException hashMismatch(UUID jobId) {
        return new ProblemException(UNAUTHORIZED, "CALLBACK_HASH_MISMATCH",
                "Callback signature does not match for job %s".formatted(jobId));
    }

    public record CallbackResult(HttpStatus status, SolverCallbackResponse body) {
    }
}
