package com.topicmatch.backend.modules.trigger.application;

import static org.springframework.http.HttpStatus.CONFLICT;

import java.util.List;
import java.util.UUID;

import com.topicmatch.backend.global.error.ProblemException;
import com.topicmatch.backend.modules.job.application.DeferredAssignmentJobService;
import com.topicmatch.backend.modules.job.domain.DeferredAssignmentJob;
import com.topicmatch.backend.modules.job.domain.SolverKind;
import com.topicmatch.backend.modules.period.application.PeriodStatusResolver;
import com.topicmatch.backend.modules.period.application.SelectionPeriodService;
import com.topicmatch.backend.modules.period.domain.PeriodStatus;
import com.topicmatch.backend.modules.period.domain.SelectionPeriod;
import com.topicmatch.backend.modules.period.infrastructure.persistence.SelectionPeriodRepository;
import com.topicmatch.backend.modules.preference.application.QuestionnaireCompletionService;
import com.topicmatch.backend.modules.preference.presentation.dto.IncompleteStudentResponse;
import com.topicmatch.backend.modules.solver.application.CompilationSnapshotLoader;
import com.topicmatch.backend.modules.solver.application.GroupSizePlanner;
import com.topicmatch.backend.modules.solver.application.SolverRequestCompiler;
import com.topicmatch.backend.modules.solver.domain.CompilationInput;
import com.topicmatch.backend.modules.solver.domain.CompiledRequest;
import com.topicmatch.backend.modules.trigger.presentation.dto.AssignNowRequest;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Validates the period, compiles the request and swaps the pending job in one transaction. The period row
 * is locked so that two runs for the same period queue up instead of racing.
 */
@Service
@Transactional
public class AssignmentJobPreparer {

    static final String SUPERSEDED_REASON = "Superseded by a newer assignment run";

    private final SelectionPeriodRepository selectionPeriodRepository;
    private final PeriodStatusResolver periodStatusResolver;
    private final QuestionnaireCompletionService questionnaireCompletionService;
    private final CompilationSnapshotLoader snapshotLoader;
    private final SolverRequestCompiler compiler;
    private final DeferredAssignmentJobService jobService;
    private final SolverKind solverKind;
    private final boolean requireFullRoster;

    public AssignmentJobPreparer(
            SelectionPeriodRepository selectionPeriodRepository,
            PeriodStatusResolver periodStatusResolver,
            QuestionnaireCompletionService questionnaireCompletionService,
            CompilationSnapshotLoader snapshotLoader,
            SolverRequestCompiler compiler,
            DeferredAssignmentJobService jobService,
            @Value("${app.solver.kind:GA}") SolverKind solverKind,
            @Value("${app.assignment.require-full-roster:false}") boolean requireFullRoster
    ) {
        this.selectionPeriodRepository = selectionPeriodRepository;
        this.periodStatusResolver = periodStatusResolver;
        this.questionnaireCompletionService = questionnaireCompletionService;
        this.snapshotLoader = snapshotLoader;
        this.compiler = compiler;
        this.jobService = jobService;
        this.solverKind = solverKind;
        this.requireFullRoster = requireFullRoster;
    }

    PreparedJob prepare(UUID periodId, AssignNowRequest request) {
        SelectionPeriod period = selectionPeriodRepository.findByIdForUpdate(periodId)
                .orElseThrow(() -> SelectionPeriodService.periodNotFound(periodId));

        PeriodStatus status = periodStatusResolver.resolve(period);
        if (!request.override() && !status.acceptsAssignment()) {
            throw new ProblemException(CONFLICT, "PERIOD_NOT_CLOSED",
                    "Period %s is %s; close it or pass override".formatted(periodId, status))
                    .with("status", status.name());
        }

        List<IncompleteStudentResponse> incomplete = questionnaireCompletionService.findIncompleteStudents(periodId);
        if (!incomplete.isEmpty()) {
            throw new ProblemException(CONFLICT, "QUESTIONNAIRE_INCOMPLETE",
                    "%d students have not answered every required question".formatted(incomplete.size()))
                    .with("students", incomplete);
        }

        CompilationInput input = snapshotLoader.load(periodId, request.groupSizes(), request.rankingPercentage(),
                request.maxTimeSeconds());
        CompiledRequest compiled = compiler.compile(GroupSizePlanner.withDefaultSizes(input));

        if (requireFullRoster && !compiled.studentsWithoutData().isEmpty()) {
            throw new ProblemException(CONFLICT, "STUDENTS_WITHOUT_DATA",
                    "%d roster students submitted nothing".formatted(compiled.studentsWithoutData().size()))
                    .with("studentIds", compiled.studentsWithoutData());
        }

        UUID superseded = jobService.abandonPending(periodId, SUPERSEDED_REASON).orElse(null);
        DeferredAssignmentJob job = jobService.create(periodId, solverKind, compiled);

        return new PreparedJob(
                job.getId(),
                periodId,
                job.getRequest(),
                superseded,
                compiled.request().numStudents(),
                compiled.request().numGroups(),
                compiled.studentsWithoutData()
        );
    }
}
