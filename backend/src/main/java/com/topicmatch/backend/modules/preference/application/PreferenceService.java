package com.topicmatch.backend.modules.preference.application;

import static org.springframework.http.HttpStatus.BAD_REQUEST;
import static org.springframework.http.HttpStatus.NOT_FOUND;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

import com.topicmatch.backend.global.error.ProblemException;
import com.topicmatch.backend.modules.period.application.SelectionPeriodService;
import com.topicmatch.backend.modules.preference.domain.PeriodStudent;
import com.topicmatch.backend.modules.preference.domain.Preference;
import com.topicmatch.backend.modules.preference.domain.Question;
import com.topicmatch.backend.modules.preference.domain.StudentAnswer;
import com.topicmatch.backend.modules.preference.domain.StudentExclusion;
import com.topicmatch.backend.modules.preference.infrastructure.persistence.PeriodStudentRepository;
import com.topicmatch.backend.modules.preference.infrastructure.persistence.PreferenceRepository;
import com.topicmatch.backend.modules.preference.infrastructure.persistence.QuestionRepository;
import com.topicmatch.backend.modules.preference.infrastructure.persistence.StudentAnswerRepository;
import com.topicmatch.backend.modules.preference.infrastructure.persistence.StudentExclusionRepository;
import com.topicmatch.backend.modules.preference.presentation.dto.AnswerResponse;
import com.topicmatch.backend.modules.preference.presentation.dto.PreferenceResponse;
import com.topicmatch.backend.modules.preference.presentation.dto.SaveAnswersRequest;
import com.topicmatch.backend.modules.topic.domain.Topic;
import com.topicmatch.backend.modules.topic.infrastructure.persistence.TopicRepository;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional
public class PreferenceService {

    private final PreferenceRepository preferenceRepository;
    private final StudentAnswerRepository studentAnswerRepository;
    private final QuestionRepository questionRepository;
    private final PeriodStudentRepository periodStudentRepository;
    private final StudentExclusionRepository studentExclusionRepository;
    private final TopicRepository topicRepository;
    private final SelectionPeriodService selectionPeriodService;
    private final Clock clock;

    public PreferenceService(
            PreferenceRepository preferenceRepository,
            StudentAnswerRepository studentAnswerRepository,
            QuestionRepository questionRepository,
            PeriodStudentRepository periodStudentRepository,
            StudentExclusionRepository studentExclusionRepository,
            TopicRepository topicRepository,
            SelectionPeriodService selectionPeriodService,
            Clock clock
    ) {
        this.preferenceRepository = preferenceRepository;
        this.studentAnswerRepository = studentAnswerRepository;
        this.questionRepository = questionRepository;
        this.periodStudentRepository = periodStudentRepository;
        this.studentExclusionRepository = studentExclusionRepository;
        this.topicRepository = topicRepository;
        this.selectionPeriodService = selectionPeriodService;
        this.clock = clock;
    }

    /**
     * Replaces the student's ranked topic list. The order must not repeat a topic and every topic must
     * belong to the period.
     */
    public PreferenceResponse savePreference(UUID periodId, String studentId, List<UUID> topicOrder) {
        selectionPeriodService.getPeriod(periodId);
        String normalizedStudentId = requireStudentId(studentId);

        Set<UUID> distinct = new LinkedHashSet<>(topicOrder);
        if (distinct.size() != topicOrder.size()) {
            List<UUID> duplicates = topicOrder.stream()
                    .filter(topicId -> topicOrder.indexOf(topicId) != topicOrder.lastIndexOf(topicId))
                    .distinct()
                    .toList();
            throw new ProblemException(BAD_REQUEST, "DUPLICATE_TOPIC_IN_ORDER",
                    "topicOrder lists a topic more than once")
                    .with("topicIds", duplicates);
        }
        if (!distinct.isEmpty()) {
            Set<UUID> known = topicRepository.findByPeriod_IdAndIdIn(periodId, distinct).stream()
                    .map(Topic::getId)
                    .collect(Collectors.toSet());
            List<UUID> unknown = distinct.stream().filter(topicId -> !known.contains(topicId)).toList();
            if (!unknown.isEmpty()) {
                throw new ProblemException(BAD_REQUEST, "TOPIC_NOT_IN_PERIOD",
                        "topicOrder references topics outside period %s".formatted(periodId))
                        .with("topicIds", unknown);
            }
        }

        Preference preference = preferenceRepository.findByPeriodIdAndStudentId(periodId, normalizedStudentId)
                .orElseGet(() -> new Preference(periodId, normalizedStudentId));
        preference.replaceTopicOrder(topicOrder, OffsetDateTime.now(clock));
        Preference saved = preferenceRepository.save(preference);
        return new PreferenceResponse(periodId, normalizedStudentId, saved.getTopicOrder(), saved.getLastUpdated());
    }

    /**
     * Upserts one answer per question. A later answer to the same question overwrites the earlier one.
     */
    public List<AnswerResponse> saveAnswers(UUID periodId, String studentId, SaveAnswersRequest request) {
        selectionPeriodService.getPeriod(periodId);
        String normalizedStudentId = requireStudentId(studentId);
        OffsetDateTime now = OffsetDateTime.now(clock);

        List<AnswerResponse> responses = new ArrayList<>();
        for (SaveAnswersRequest.AnswerEntry entry : request.answers()) {
            responses.add(saveAnswer(periodId, normalizedStudentId, entry.questionId(), entry.value(), now));
        }
        return responses;
    }

    public AnswerResponse saveAnswer(UUID periodId, String studentId, UUID questionId, Object rawAnswer) {
        selectionPeriodService.getPeriod(periodId);
        return saveAnswer(periodId, requireStudentId(studentId), questionId, rawAnswer, OffsetDateTime.now(clock));
    }

    private AnswerResponse saveAnswer(UUID periodId, String studentId, UUID questionId, Object rawAnswer, OffsetDateTime now) {
        Question question = questionRepository.findById(questionId)
                .filter(candidate -> candidate.getPeriod().getId().equals(periodId))
                .orElseThrow(() -> new ProblemException(NOT_FOUND, "QUESTION_NOT_FOUND",
                        "Question %s not found in period %s".formatted(questionId, periodId)));

        double rawValue = AnswerNormalizer.rawValue(question, rawAnswer);
        double normalized = AnswerNormalizer.normalize(question, rawValue);

        StudentAnswer answer = studentAnswerRepository
                .findByPeriodIdAndStudentIdAndQuestion_Id(periodId, studentId, questionId)
                .orElseGet(() -> new StudentAnswer(periodId, studentId, question));
        answer.record(question.getKind(), rawValue, normalized, now);
        StudentAnswer saved = studentAnswerRepository.save(answer);
        return new AnswerResponse(questionId, saved.getRawKind().name(), saved.getRawValue(),
                saved.getNormalizedAnswer(), saved.getAnsweredAt());
    }

    public int addToRoster(UUID periodId, List<String> studentIds) {
        selectionPeriodService.getPeriod(periodId);
        int added = 0;
        for (String raw : new LinkedHashSet<>(studentIds)) {
            String studentId = requireStudentId(raw);
            if (!periodStudentRepository.existsByPeriodIdAndStudentId(periodId, studentId)) {
                periodStudentRepository.save(new PeriodStudent(periodId, studentId));
                added++;
            }
        }
        return added;
    }

    public void addExclusion(UUID periodId, String first, String second) {
        selectionPeriodService.getPeriod(periodId);
        String a = requireStudentId(first);
        String b = requireStudentId(second);
        if (a.equals(b)) {
            throw new ProblemException(BAD_REQUEST, "SELF_EXCLUSION", "A student cannot be excluded from themselves");
        }
        StudentExclusion exclusion = new StudentExclusion(periodId, a, b);
        if (!studentExclusionRepository.existsByPeriodIdAndStudentAAndStudentB(
                periodId, exclusion.getStudentA(), exclusion.getStudentB())) {
            studentExclusionRepository.save(exclusion);
        }
    }

    private static String requireStudentId(String studentId) {
        if (studentId == null || studentId.isBlank()) {
            throw new ProblemException(BAD_REQUEST, "STUDENT_ID_REQUIRED", "studentId must not be blank");
        }
        return studentId.trim();
    }
}
