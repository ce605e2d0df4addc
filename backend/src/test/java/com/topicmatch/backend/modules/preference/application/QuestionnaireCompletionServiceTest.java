package com.topicmatch.backend.modules.preference.application;

import static com.topicmatch.backend.support.TestEntities.withId;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

import com.topicmatch.backend.modules.preference.domain.Preference;
import com.topicmatch.backend.modules.preference.domain.Question;
import com.topicmatch.backend.modules.preference.domain.QuestionKind;
import com.topicmatch.backend.modules.preference.domain.StudentAnswer;
import com.topicmatch.backend.modules.preference.infrastructure.persistence.PreferenceRepository;
import com.topicmatch.backend.modules.preference.infrastructure.persistence.QuestionRepository;
import com.topicmatch.backend.modules.preference.infrastructure.persistence.StudentAnswerRepository;
import com.topicmatch.backend.modules.preference.presentation.dto.IncompleteStudentResponse;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class QuestionnaireCompletionServiceTest {

    private static final OffsetDateTime NOW = OffsetDateTime.parse("2025-01-01T00:00:00Z");

    @Mock
    private QuestionRepository questionRepository;

    @Mock
    private PreferenceRepository preferenceRepository;

    @Mock
    private StudentAnswerRepository studentAnswerRepository;

    private QuestionnaireCompletionService service;
    private UUID periodId;

    @BeforeEach
    void setUp() {
        service = new QuestionnaireCompletionService(questionRepository, preferenceRepository, studentAnswerRepository);
        periodId = UUID.randomUUID();
    }

    @Test
    @DisplayName("participants missing a required answer are reported with counts")
    void reportsIncompleteParticipants() {
        Question q1 = question();
        Question q2 = question();
        Question optional = question();
        when(questionRepository.findByPeriod_IdAndRequiredTrue(periodId)).thenReturn(List.of(q1, q2));
        when(preferenceRepository.findByPeriodId(periodId)).thenReturn(List.of(
                new Preference(periodId, "carol"),
                new Preference(periodId, "alice")));
        when(studentAnswerRepository.findByPeriodIdWithQuestion(periodId)).thenReturn(List.of(
                answer("alice", q1),
                answer("alice", q2),
                answer("bob", q1),
                answer("bob", optional)));

        List<IncompleteStudentResponse> incomplete = service.findIncompleteStudents(periodId);

        assertThat(incomplete).containsExactly(
                new IncompleteStudentResponse("bob", 1, 2),
                new IncompleteStudentResponse("carol", 0, 2));
    }

    @Test
    void noRequiredQuestionsMeansNobodyIsIncomplete() {
        when(questionRepository.findByPeriod_IdAndRequiredTrue(periodId)).thenReturn(List.of());

        assertThat(service.findIncompleteStudents(periodId)).isEmpty();
        verifyNoInteractions(preferenceRepository, studentAnswerRepository);
    }

    private StudentAnswer answer(String studentId, Question question) {
        StudentAnswer answer = new StudentAnswer(periodId, studentId, question);
        answer.record(QuestionKind.BOOLEAN, 1.0, 1.0, NOW);
        return answer;
    }

    private static Question question() {
        Question question = withId(new Question(), UUID.randomUUID());
        question.setKind(QuestionKind.BOOLEAN);
        return question;
    }
}
