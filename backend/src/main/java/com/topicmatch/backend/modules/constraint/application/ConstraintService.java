package com.topicmatch.backend.modules.constraint.application;

import static org.springframework.http.HttpStatus.BAD_REQUEST;
import static org.springframework.http.HttpStatus.CONFLICT;
import static org.springframework.http.HttpStatus.NOT_FOUND;

import java.util.List;
import java.util.UUID;

import com.topicmatch.backend.global.error.ProblemException;
import com.topicmatch.backend.modules.constraint.domain.AssignmentConstraint;
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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.NestedExceptionUtils;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional
public class ConstraintService {

    private static final Logger log = LoggerFactory.getLogger(ConstraintService.class);
    private static final String NAME_UNIQUE_INDEX = "uq_constraint_period_name";

    private final AssignmentConstraintRepository constraintRepository;
    private final QuestionRepository questionRepository;
    private final TopicRepository topicRepository;
    private final SelectionPeriodService selectionPeriodService;

    public ConstraintService(
            AssignmentConstraintRepository constraintRepository,
            QuestionRepository questionRepository,
            TopicRepository topicRepository,
            SelectionPeriodService selectionPeriodService
    ) {
        this.constraintRepository = constraintRepository;
        this.questionRepository = questionRepository;
        this.topicRepository = topicRepository;
        this.selectionPeriodService = selectionPeriodService;
    }

    @Transactional(readOnly = true)
    public List<ConstraintResponse> list(UUID periodId) {
        return constraintRepository.findByPeriod_IdOrderByNameAsc(periodId).stream()
                .map(constraint -> toResponse(constraint, periodId))
                .toList();
    }

    public ConstraintResponse create(UUID periodId, CreateConstraintRequest request) {
        SelectionPeriod period = selectionPeriodService.getPeriod(periodId);
        String name = normalizeName(request.name());
        if (constraintRepository.existsByPeriod_IdAndNameIgnoreCase(periodId, name)) {
            throw duplicateName(name);
        }

        AssignmentConstraint constraint = new AssignmentConstraint();
        constraint.setPeriod(period);
        constraint.setName(name);
        constraint.setDescription(trimToNull(request.description()));
        constraint.setCriterionType(request.criterionType());
        constraint.setMinRatio(RatioConversion.percentToRatio(request.minRatio()));
        constraint.setMinStudents(validateStudentBound("minStudents", request.minStudents()));
        constraint.setMaxStudents(validateStudentBound("maxStudents", request.maxStudents()));
        ensureConsistent(constraint);

        AssignmentConstraint saved = saveConstraint(constraint);
        log.info("Created constraint {} '{}' for period {}", saved.getId(), name, periodId);
        return toResponse(saved, periodId);
    }

    /**
     * Applies the non-null fields of the patch. {@code clearCriterion} turns the row back into a plain category.
     */
    public ConstraintResponse update(UUID periodId, UUID constraintId, UpdateConstraintRequest request) {
        AssignmentConstraint constraint = loadConstraint(periodId, constraintId);

        if (request.name() != null) {
            String name = normalizeName(request.name());
            if (!name.equalsIgnoreCase(constraint.getName())
                    && constraintRepository.existsByPeriod_IdAndNameIgnoreCaseAndIdNot(periodId, name, constraintId)) {
                throw duplicateName(name);
            }
            relinkQuestions(periodId, constraint.getName(), name);
            constraint.setName(name);
        }
        if (request.description() != null) {
            constraint.setDescription(trimToNull(request.description()));
        }
        if (request.clearCriterion()) {
            constraint.clearCriterion();
        }
        if (request.criterionType() != null) {
            constraint.setCriterionType(request.criterionType());
        }
        if (request.minRatio() != null) {
            constraint.setMinRatio(RatioConversion.percentToRatio(request.minRatio()));
        }
        if (request.minStudents() != null) {
            constraint.setMinStudents(validateStudentBound("minStudents", request.minStudents()));
        }
        if (request.maxStudents() != null) {
            constraint.setMaxStudents(validateStudentBound("maxStudents", request.maxStudents()));
        }
        ensureConsistent(constraint);

        return toResponse(saveConstraint(constraint), periodId);
    }

    /**
     * Deletes the constraint after unlinking questions that reference its name and detaching it from topics.
     */
    public void delete(UUID periodId, UUID constraintId) {
        AssignmentConstraint constraint = loadConstraint(periodId, constraintId);

        List<Question> linked = questionRepository.findByPeriod_IdAndCharacteristicNameIgnoreCase(
                periodId, constraint.getName());
        linked.forEach(question -> question.setCharacteristicName(null));

        List<Topic> topics = topicRepository.findByConstraints_Id(constraintId);
        topics.forEach(topic -> topic.detachConstraint(constraintId));

        constraintRepository.delete(constraint);
        log.info("Deleted constraint {} of period {} (unlinked {} questions, detached from {} topics)",
                constraintId, periodId, linked.size(), topics.size());
    }

    private AssignmentConstraint loadConstraint(UUID periodId, UUID constraintId) {
        return constraintRepository.findById(constraintId)
                .filter(constraint -> constraint.getPeriod().getId().equals(periodId))
                .orElseThrow(() -> new ProblemException(NOT_FOUND, "CONSTRAINT_NOT_FOUND",
                        "Constraint %s not found in period %s".formatted(constraintId, periodId)));
    }

    private void relinkQuestions(UUID periodId, String oldName, String newName) {
        if (oldName.equals(newName)) {
            return;
        }
        questionRepository.findByPeriod_IdAndCharacteristicNameIgnoreCase(periodId, oldName)
                .forEach(question -> question.setCharacteristicName(newName));
    }

    private void ensureConsistent(AssignmentConstraint constraint) {
        if (constraint.isInert() && constraint.hasBounds()) {
            throw new ProblemException(BAD_REQUEST, "CRITERION_TYPE_REQUIRED_FOR_BOUNDS",
                    "minRatio, minStudents and maxStudents require a criterionType");
        }
        Integer min = constraint.getMinStudents();
        Integer max = constraint.getMaxStudents();
        if (min != null && max != null && min > max) {
            throw new ProblemException(BAD_REQUEST, "INVALID_STUDENT_BOUND",
                    "minStudents (%d) must not exceed maxStudents (%d)".formatted(min, max));
        }
    }

    private Integer validateStudentBound(String field, Integer value) {
        if (value != null && value < 0) {
            throw new ProblemException(BAD_REQUEST, "INVALID_STUDENT_BOUND",
                    "%s must not be negative".formatted(field))
                    .with(field, value);
        }
        return value;
    }

    private AssignmentConstraint saveConstraint(AssignmentConstraint constraint) {
        try {
            return constraintRepository.saveAndFlush(constraint);
        } catch (DataIntegrityViolationException ex) {
            Throwable root = NestedExceptionUtils.getMostSpecificCause(ex);
            String message = root.getMessage();
            if (message != null && message.contains(NAME_UNIQUE_INDEX)) {
                throw duplicateName(constraint.getName());
            }
            throw ex;
        }
    }

    private ConstraintResponse toResponse(AssignmentConstraint constraint, UUID periodId) {
        return new ConstraintResponse(
                constraint.getId(),
                periodId,
                constraint.getName(),
                constraint.getDescription(),
                constraint.getCriterionType(),
                constraint.getMinRatio(),
                RatioConversion.ratioToPercent(constraint.getMinRatio()),
                constraint.getMinStudents(),
                constraint.getMaxStudents()
        );
    }

    private static ProblemException duplicateName(String name) {
        return new ProblemException(CONFLICT, "CONSTRAINT_NAME_DUPLICATE",
                "A constraint named '%s' already exists in this period".formatted(name));
    }

    private static String normalizeName(String raw) {
        String name = trimToNull(raw);
        if (name == null) {
            throw new ProblemException(BAD_REQUEST, "NAME_REQUIRED", "Constraint name must not be blank");
        }
        return name;
    }

    private static String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
