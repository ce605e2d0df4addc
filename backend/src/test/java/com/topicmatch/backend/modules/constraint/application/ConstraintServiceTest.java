package com.topicmatch.backend.modules.constraint.application;

import static com.topicmatch.backend.support.TestEntities.withId;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.sql.SQLException;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.topicmatch.backend.global.error.ProblemException;
import com.topicmatch.backend.modules.constraint.domain.AssignmentConstraint;
import com.topicmatch.backend.modules.constraint.domain.CriterionType;
import com.topicmatch.backend.modules.constraint.infrastructure.persistence.AssignmentConstraintRepository;
import com.topicmatch.backend.modules.constraint.presentation.dto.ConstraintResponse;
import com.topicmatch.backend.modules.constraint.presentation.dto.CreateConstraintRequest;
import com.topicmatch.backend.modules.constraint.presentation.dto.UpdateConstraintRequest;
import com.topicmatch.backend.modules.period.application.SelectionPeriodService;
import com.topicmatch.backend.modules.period.domain.SelectionPeriod;
import com.topicmatch.backend.modules.preference.domain.Question;
import com.topicmatch.backend.modules.preference.infrastructure.persistence.QuestionRepository;
import com.topicmatch.backend.modules.topic.domain.Topic;
import com.topicmatch.backend.modules.topic.infrastructure.persistence.TopicRepository;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;

@ExtendWith(MockitoExtension.class)
class ConstraintServiceTest {

    @Mock
    private AssignmentConstraintRepository constraintRepository;

    @Mock
    private QuestionRepository questionRepository;

    @Mock
    private TopicRepository topicRepository;

    @Mock
    private SelectionPeriodService selectionPeriodService;

    private ConstraintService constraintService;
    private SelectionPeriod period;
    private UUID periodId;

    @BeforeEach
    void setUp() {
        constraintService = new ConstraintService(
                constraintRepository, questionRepository, topicRepository, selectionPeriodService);
        periodId = UUID.randomUUID();
        period = withId(new SelectionPeriod(), periodId);
    }

    @Test
    @DisplayName("minRatio percentages are stored as ratios exactly once")
    void createStoresRatio() {
        stubCreate();

        ConstraintResponse response = constraintService.create(periodId,
                new CreateConstraintRequest("  gpa ", null, CriterionType.MINIMIZE, 50.0, null, null));

        ArgumentCaptor<AssignmentConstraint> captor = ArgumentCaptor.forClass(AssignmentConstraint.class);
        verify(constraintRepository).saveAndFlush(captor.capture());
        assertThat(captor.getValue().getName()).isEqualTo("gpa");
        assertThat(captor.getValue().getMinRatio()).isEqualTo(0.5);
        assertThat(response.minRatio()).isEqualTo(0.5);
        assertThat(response.minRatioPercent()).isEqualTo(50.0);
        assertThat(response.periodId()).isEqualTo(periodId);
    }

    @Test
    void createKeepsSecondRatioIndependent() {
        stubCreate();

        ConstraintResponse response = constraintService.create(periodId,
                new CreateConstraintRequest("team", null, CriterionType.PULL, 75.0, 1, 3));

        assertThat(response.minRatio()).isEqualTo(0.75);
        assertThat(response.minStudents()).isEqualTo(1);
        assertThat(response.maxStudents()).isEqualTo(3);
    }

    @Test
    @DisplayName("bounds without a criterion type are rejected")
    void rejectsBoundsWithoutType() {
        when(selectionPeriodService.getPeriod(periodId)).thenReturn(period);
        when(constraintRepository.existsByPeriod_IdAndNameIgnoreCase(periodId, "gpa")).thenReturn(false);

        assertThatThrownBy(() -> constraintService.create(periodId,
                new CreateConstraintRequest("gpa", null, null, 40.0, null, null)))
                .isInstanceOfSatisfying(ProblemException.class, ex ->
                        assertThat(ex.getCode()).isEqualTo("CRITERION_TYPE_REQUIRED_FOR_BOUNDS"));
        verify(constraintRepository, never()).saveAndFlush(any());
    }

    @Test
    void rejectsMinAboveMax() {
        when(selectionPeriodService.getPeriod(periodId)).thenReturn(period);
        when(constraintRepository.existsByPeriod_IdAndNameIgnoreCase(periodId, "team")).thenReturn(false);

        assertThatThrownBy(() -> constraintService.create(periodId,
                new CreateConstraintRequest("team", null, CriterionType.PULL, null, 4, 2)))
                .isInstanceOfSatisfying(ProblemException.class, ex ->
                        assertThat(ex.getCode()).isEqualTo("INVALID_STUDENT_BOUND"));
    }

    @Test
    @DisplayName("duplicate names in a period conflict")
    void rejectsDuplicateName() {
        when(selectionPeriodService.getPeriod(periodId)).thenReturn(period);
        when(constraintRepository.existsByPeriod_IdAndNameIgnoreCase(periodId, "GPA")).thenReturn(true);

        assertThatThrownBy(() -> constraintService.create(periodId,
                new CreateConstraintRequest("GPA", null, null, null, null, null)))
                .isInstanceOfSatisfying(ProblemException.class, ex -> {
                    assertThat(ex.getCode()).isEqualTo("CONSTRAINT_NAME_DUPLICATE");
                    assertThat(ex.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
                });
    }

    @Test
    void translatesUniqueIndexViolation() {
        when(selectionPeriodService.getPeriod(periodId)).thenReturn(period);
        when(constraintRepository.existsByPeriod_IdAndNameIgnoreCase(periodId, "gpa")).thenReturn(false);
        when(constraintRepository.saveAndFlush(any())).thenThrow(new DataIntegrityViolationException("insert",
                new SQLException("duplicate key value violates unique constraint \"uq_constraint_period_name\"")));

        assertThatThrownBy(() -> constraintService.create(periodId,
                new CreateConstraintRequest("gpa", null, null, null, null, null)))
                .isInstanceOfSatisfying(ProblemException.class, ex ->
                        assertThat(ex.getCode()).isEqualTo("CONSTRAINT_NAME_DUPLICATE"));
    }

    @Test
    @DisplayName("clearCriterion turns a criterion into a plain category")
    void clearCriterion() {
        AssignmentConstraint existing = constraint("gpa", CriterionType.MAXIMIZE, 0.3);
        when(constraintRepository.findById(existing.getId())).thenReturn(Optional.of(existing));
        when(constraintRepository.saveAndFlush(existing)).thenReturn(existing);

        ConstraintResponse response = constraintService.update(periodId, existing.getId(),
                new UpdateConstraintRequest(null, null, null, null, null, null, true));

        assertThat(response.criterionType()).isNull();
        assertThat(response.minRatio()).isNull();
        assertThat(existing.isInert()).isTrue();
    }

    @Test
    void renameRelinksQuestions() {
        AssignmentConstraint existing = constraint("gpa", null, null);
        Question question = new Question();
        question.setCharacteristicName("gpa");
        when(constraintRepository.findById(existing.getId())).thenReturn(Optional.of(existing));
        when(constraintRepository.existsByPeriod_IdAndNameIgnoreCaseAndIdNot(periodId, "grades", existing.getId()))
                .thenReturn(false);
        when(questionRepository.findByPeriod_IdAndCharacteristicNameIgnoreCase(periodId, "gpa"))
                .thenReturn(List.of(question));
        when(constraintRepository.saveAndFlush(existing)).thenReturn(existing);

        constraintService.update(periodId, existing.getId(),
                new UpdateConstraintRequest("grades", null, null, null, null, null, false));

        assertThat(existing.getName()).isEqualTo("grades");
        assertThat(question.getCharacteristicName()).isEqualTo("grades");
    }

    @Test
    void updateOfConstraintInOtherPeriodIsNotFound() {
        AssignmentConstraint foreign = constraint("gpa", null, null);
        foreign.setPeriod(withId(new SelectionPeriod(), UUID.randomUUID()));
        when(constraintRepository.findById(foreign.getId())).thenReturn(Optional.of(foreign));

        assertThatThrownBy(() -> constraintService.update(periodId, foreign.getId(),
                new UpdateConstraintRequest("x", null, null, null, null, null, false)))
                .isInstanceOfSatisfying(ProblemException.class, ex ->
                        assertThat(ex.getCode()).isEqualTo("CONSTRAINT_NOT_FOUND"));
    }

    @Test
    @DisplayName("delete unlinks questions and detaches topics")
    void deleteUnlinksAndDetaches() {
        AssignmentConstraint existing = constraint("gpa", CriterionType.MINIMIZE, 0.5);
        Question question = new Question();
        question.setCharacteristicName("gpa");
        Topic topic = withId(new Topic(), UUID.randomUUID());
        topic.attachConstraint(existing);
        when(constraintRepository.findById(existing.getId())).thenReturn(Optional.of(existing));
        when(questionRepository.findByPeriod_IdAndCharacteristicNameIgnoreCase(periodId, "gpa"))
                .thenReturn(List.of(question));
        when(topicRepository.findByConstraints_Id(existing.getId())).thenReturn(List.of(topic));

        constraintService.delete(periodId, existing.getId());

        assertThat(question.getCharacteristicName()).isNull();
        assertThat(topic.getConstraints()).isEmpty();
        verify(constraintRepository).delete(existing);
    }

    @Test
    void blankNameIsRejected() {
        when(selectionPeriodService.getPeriod(periodId)).thenReturn(period);

        assertThatThrownBy(() -> constraintService.create(periodId,
                new CreateConstraintRequest("   ", null, null, null, null, null)))
                .isInstanceOfSatisfying(ProblemException.class, ex ->
                        assertThat(ex.getCode()).isEqualTo("NAME_REQUIRED"));
        verify(constraintRepository, never()).existsByPeriod_IdAndNameIgnoreCase(eq(periodId), anyString());
    }

    private void stubCreate() {
        when(selectionPeriodService.getPeriod(periodId)).thenReturn(period);
        when(constraintRepository.existsByPeriod_IdAndNameIgnoreCase(eq(periodId), anyString())).thenReturn(false);
        when(constraintRepository.saveAndFlush(any(AssignmentConstraint.class)))
                .thenAnswer(invocation -> withId(invocation.getArgument(0), UUID.randomUUID()));
    }

    private AssignmentConstraint constraint(String name, CriterionType type, Double ratio) {
        AssignmentConstraint constraint = withId(new AssignmentConstraint(), UUID.randomUUID());
        constraint.setPeriod(period);
        constraint.setName(name);
        constraint.setCriterionType(type);
        constraint.setMinRatio(ratio);
        return constraint;
    }
}
