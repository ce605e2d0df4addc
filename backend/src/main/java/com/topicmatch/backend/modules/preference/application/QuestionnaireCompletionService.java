package com.topicmatch.backend.modules.preference.application;

import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.UUID;
import java.util.stream.Collectors;

import com.topicmatch.backend.modules.preference.domain.Preference;
import com.topicmatch.backend.modules.preference.domain.Question;
import com.topicmatch.backend.modules.preference.domain.StudentAnswer;
import com.topicmatch.backend.modules.preference.infrastructure.persistence.PreferenceRepository;
import com.topicmatch.backend.modules.preference.infrastructure.persistence.QuestionRepository;
import com.topicmatch.backend.modules.preference.infrastructure.persistence.StudentAnswerRepository;
import com.topicmatch.backend.modules.preference.presentation.dto.IncompleteStudentResponse;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Finds participating students (any preference or answer) who have not answered every required question.
 */
@Service
@Transactional(readOnly = true)
public class QuestionnaireCompletionService {

    private final QuestionRepository questionRepository;
    private final PreferenceRepository preferenceRepository;
    private final StudentAnswerRepository studentAnswerRepository;

    public QuestionnaireCompletionService(
            QuestionRepository questionRepository,
            PreferenceRepository preferenceRepository,
            StudentAnswerRepository studentAnswerRepository
    ) {
        this.questionRepository = questionRepository;
        this.preferenceRepository = preferenceRepository;
        this.studentAnswerRepository = studentAnswerRepository;
    }

    public List<IncompleteStudentResponse> findIncompleteStudents(UUID periodId) {
        Set<UUID> requiredQuestionIds = questionRepository.findByPeriod_IdAndRequiredTrue(periodId).stream()
                .map(Question::getId)
                .collect(Collectors.toSet());
        if (requiredQuestionIds.isEmpty()) {
            return List.of();
        }

        Set<String> participants = new TreeSet<>();
        preferenceRepository.findByPeriodId(periodId).stream()
                .map(Preference::getStudentId)
                .forEach(participants::add);

        Map<String, Set<UUID>> answeredRequired = new HashMap<>();
        for (StudentAnswer answer : studentAnswerRepository.findByPeriodIdWithQuestion(periodId)) {
            participants.add(answer.getStudentId());
            UUID questionId = answer.getQuestion().getId();
            if (requiredQuestionIds.contains(questionId)) {
                answeredRequired.computeIfAbsent(answer.getStudentId(), key -> new HashSet<>()).add(questionId);
            }
        }

        int requiredCount = requiredQuestionIds.size();
        return participants.stream()
                .map(studentId -> new IncompleteStudentResponse(
                        studentId,
                        answeredRequired.getOrDefault(studentId, Set.of()).size(),
                        requiredCount))
                .filter(status -> status.answeredCount() < requiredCount)
                .sorted(Comparator.comparing(IncompleteStudentResponse::studentId))
                .toList();
    }
}
