package com.topicmatch.backend.modules.solver.application;

import java.util.UUID;

import com.topicmatch.backend.modules.preference.application.QuestionnaireCompletionService;
import com.topicmatch.backend.modules.solver.domain.CompilationInput;
import com.topicmatch.backend.modules.solver.domain.CompiledRequest;
import com.topicmatch.backend.modules.solver.presentation.dto.AssignmentPreviewRequest;
import com.topicmatch.backend.modules.solver.presentation.dto.AssignmentPreviewResponse;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Compiles what "assign now" would send, without creating a job.
 */
@Service
@Transactional(readOnly = true)
public class AssignmentPreviewService {

    private final CompilationSnapshotLoader snapshotLoader;
    private final SolverRequestCompiler compiler;
    private final QuestionnaireCompletionService questionnaireCompletionService;

    public AssignmentPreviewService(
            CompilationSnapshotLoader snapshotLoader,
            SolverRequestCompiler compiler,
            QuestionnaireCompletionService questionnaireCompletionService
    ) {
        this.snapshotLoader = snapshotLoader;
        this.compiler = compiler;
        this.questionnaireCompletionService = questionnaireCompletionService;
    }

    public AssignmentPreviewResponse preview(UUID periodId, AssignmentPreviewRequest options) {
        CompilationInput input = snapshotLoader.load(
                periodId,
                options == null ? null : options.groupSizes(),
                options == null ? null : options.rankingPercentage(),
                options == null ? null : options.maxTimeSeconds());
        CompiledRequest compiled = compiler.compile(GroupSizePlanner.withDefaultSizes(input));
        return new AssignmentPreviewResponse(
                periodId,
                compiled.request(),
                compiled.studentIds(),
                compiled.topicIds(),
                compiled.studentsWithoutData(),
                questionnaireCompletionService.findIncompleteStudents(periodId)
        );
    }
}
