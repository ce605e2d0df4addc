package com.topicmatch.backend.modules.trigger.application;

import java.util.UUID;

import com.topicmatch.backend.modules.job.application.DeferredAssignmentJobService;
import com.topicmatch.backend.modules.job.domain.DeferredJobStatus;
import com.topicmatch.backend.modules.trigger.infrastructure.solver.SolverClient;
import com.topicmatch.backend.modules.trigger.infrastructure.solver.SolverSubmission;
import com.topicmatch.backend.modules.trigger.infrastructure.solver.SolverSubmissionException;
import com.topicmatch.backend.modules.trigger.presentation.dto.AssignNowRequest;
import com.topicmatch.backend.modules.trigger.presentation.dto.AssignNowResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Entry point shared by "assign now" and the period-close sweep. The job is committed before the solver is
 * called, so a callback can never arrive for a job that does not exist yet.
 */
@Service
public class AssignmentTriggerService {

    private static final Logger log = LoggerFactory.getLogger(AssignmentTriggerService.class);

    private final AssignmentJobPreparer assignmentJobPreparer;
    private final DeferredAssignmentJobService jobService;
    private final SolverClient solverClient;
    private final String callbackUrl;

    public AssignmentTriggerService(
            AssignmentJobPreparer assignmentJobPreparer,
            DeferredAssignmentJobService jobService,
            SolverClient solverClient,
            @Value("${app.solver.callback-url}") String callbackUrl
    ) {
        this.assignmentJobPreparer = assignmentJobPreparer;
        this.jobService = jobService;
        this.solverClient = solverClient;
        this.callbackUrl = callbackUrl;
    }

    public AssignNowResponse assignNow(UUID periodId, AssignNowRequest request) {
        AssignNowRequest effective = request == null ? AssignNowRequest.defaults() : request;
        PreparedJob prepared = assignmentJobPreparer.prepare(periodId, effective);

        try {
            solverClient.submit(new SolverSubmission(prepared.jobId(), callbackUrl, prepared.input()));
        } catch (SolverSubmissionException ex) {
            String error = "Solver submission failed: " + ex.getMessage();
            jobService.fail(prepared.jobId(), error);
            log.warn("[ALERT][Solver] Job {} of period {} could not be submitted", prepared.jobId(), periodId, ex);
            return toResponse(prepared, DeferredJobStatus.FAILED, false, error);
        }
        return toResponse(prepared, DeferredJobStatus.PENDING, true, null);
    }

    private AssignNowResponse toResponse(PreparedJob prepared, DeferredJobStatus status, boolean submitted, String error) {
        return new AssignNowResponse(
                prepared.jobId(),
                prepared.periodId(),
                status.name(),
                submitted,
                error,
                prepared.supersededJobId(),
                prepared.numStudents(),
                prepared.numGroups(),
                prepared.studentsWithoutData()
        );
    }
}
