package com.topicmatch.backend.modules.solver.application;

import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

import com.topicmatch.backend.modules.constraint.domain.AssignmentConstraint;
import com.topicmatch.backend.modules.constraint.infrastructure.persistence.AssignmentConstraintRepository;
import com.topicmatch.backend.modules.period.application.SelectionPeriodService;
import com.topicmatch.backend.modules.preference.domain.PeriodStudent;
import com.topicmatch.backend.modules.preference.infrastructure.persistence.PeriodStudentRepository;
import com.topicmatch.backend.modules.preference.infrastructure.persistence.PreferenceRepository;
import com.topicmatch.backend.modules.preference.infrastructure.persistence.StudentAnswerRepository;
import com.topicmatch.backend.modules.preference.infrastructure.persistence.StudentExclusionRepository;
import com.topicmatch.backend.modules.solver.domain.CompilationInput;
import com.topicmatch.backend.modules.topic.domain.Topic;
import com.topicmatch.backend.modules.topic.infrastructure.persistence.TopicRepository;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Reads a period into a detached {@link CompilationInput}.
 */
@Service
@Transactional(readOnly = true)
public class CompilationSnapshotLoader {

    private final SelectionPeriodService selectionPeriodService;
    private final TopicRepository topicRepository;
    private final AssignmentConstraintRepository constraintRepository;
    private final PreferenceRepository preferenceRepository;
    private final StudentAnswerRepository studentAnswerRepository;
    private final StudentExclusionRepository studentExclusionRepository;
    private final PeriodStudentRepository periodStudentRepository;

    public CompilationSnapshotLoader(
            SelectionPeriodService selectionPeriodService,
            TopicRepository topicRepository,
            AssignmentConstraintRepository constraintRepository,
            PreferenceRepository preferenceRepository,
            StudentAnswerRepository studentAnswerRepository,
            StudentExclusionRepository studentExclusionRepository,
            PeriodStudentRepository periodStudentRepository
    ) {
        this.selectionPeriodService = selectionPeriodService;
        this.topicRepository = topicRepository;
        this.constraintRepository = constraintRepository;
        this.preferenceRepository = preferenceRepository;
        this.studentAnswerRepository = studentAnswerRepository;
        this.studentExclusionRepository = studentExclusionRepository;
        this.periodStudentRepository = periodStudentRepository;
    }

    public CompilationInput load(UUID periodId, Map<UUID, Integer> groupSizes, Double rankingPercentage, Integer maxTimeSeconds) {
        selectionPeriodService.getPeriod(periodId);

        var topics = topicRepository.findByPeriodIdWithConstraints(periodId).stream()
                .map(CompilationSnapshotLoader::toTopicInput)
                .toList();
        var constraints = constraintRepository.findByPeriod_IdOrderByNameAsc(periodId).stream()
                .map(constraint -> new CompilationInput.ConstraintInput(
                        constraint.getId(),
                        constraint.getName(),
                        constraint.getCriterionType(),
                        constraint.getMinRatio(),
                        constraint.getMinStudents(),
                        constraint.getMaxStudents()))
                .toList();
        var preferences = preferenceRepository.findByPeriodId(periodId).stream()
                .map(preference -> new CompilationInput.PreferenceInput(preference.getStudentId(), preference.getTopicOrder()))
                .toList();
        var answers = studentAnswerRepository.findByPeriodIdWithQuestion(periodId).stream()
                .map(answer -> new CompilationInput.AnswerInput(
                        answer.getStudentId(),
                        answer.getQuestion().getId(),
                        answer.getQuestion().getCharacteristicName(),
                        answer.getNormalizedAnswer()))
                .toList();
        var exclusions = studentExclusionRepository.findByPeriodId(periodId).stream()
                .map(exclusion -> new CompilationInput.ExclusionInput(exclusion.getStudentA(), exclusion.getStudentB()))
                .toList();
        Set<String> roster = periodStudentRepository.findByPeriodId(periodId).stream()
                .map(PeriodStudent::getStudentId)
                .collect(Collectors.toSet());

        return new CompilationInput(periodId, topics, constraints, preferences, answers, exclusions, roster,
                groupSizes, rankingPercentage, maxTimeSeconds);
    }

    private static CompilationInput.TopicInput toTopicInput(Topic topic) {
        Set<UUID> constraintIds = topic.getConstraints().stream()
                .map(AssignmentConstraint::getId)
                .collect(Collectors.toSet());
        return new CompilationInput.TopicInput(
                topic.getId(),
                topic.getTitle(),
                topic.isActive(),
                topic.isPreferenceWeighted(),
                constraintIds);
    }
}
