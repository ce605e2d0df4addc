package com.topicmatch.backend.support;

import java.time.OffsetDateTime;

import com.topicmatch.backend.modules.constraint.domain.AssignmentConstraint;
import com.topicmatch.backend.modules.constraint.domain.CriterionType;
import com.topicmatch.backend.modules.constraint.infrastructure.persistence.AssignmentConstraintRepository;
import com.topicmatch.backend.modules.period.domain.SelectionPeriod;
import com.topicmatch.backend.modules.period.infrastructure.persistence.SelectionPeriodRepository;
import com.topicmatch.backend.modules.preference.domain.Question;
import com.topicmatch.backend.modules.preference.domain.QuestionKind;
import com.topicmatch.backend.modules.preference.infrastructure.persistence.QuestionRepository;
import com.topicmatch.backend.modules.topic.domain.Topic;
import com.topicmatch.backend.modules.topic.infrastructure.persistence.TopicRepository;

import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

@Component
@Transactional
public class TestPeriodFactory {

    private final SelectionPeriodRepository selectionPeriodRepository;
    private final TopicRepository topicRepository;
    private final AssignmentConstraintRepository constraintRepository;
    private final QuestionRepository questionRepository;

    public TestPeriodFactory(
            SelectionPeriodRepository selectionPeriodRepository,
            TopicRepository topicRepository,
            AssignmentConstraintRepository constraintRepository,
            QuestionRepository questionRepository
    ) {
        this.selectionPeriodRepository = selectionPeriodRepository;
        this.topicRepository = topicRepository;
        this.constraintRepository = constraintRepository;
        this.questionRepository = questionRepository;
    }

    public SelectionPeriod createPeriod(String title, OffsetDateTime openDate, OffsetDateTime closeDate) {
        SelectionPeriod period = new SelectionPeriod();
        period.setTitle(title);
        period.setOpenDate(openDate);
        period.setCloseDate(closeDate);
        return selectionPeriodRepository.save(period);
    }

    public Topic createTopic(SelectionPeriod period, String title) {
        Topic topic = new Topic();
        topic.setPeriod(period);
        topic.setTitle(title);
        return topicRepository.save(topic);
    }

    public AssignmentConstraint createConstraint(SelectionPeriod period, String name, CriterionType type, Double minRatio) {
        AssignmentConstraint constraint = new AssignmentConstraint();
        constraint.setPeriod(period);
        constraint.setName(name);
        constraint.setCriterionType(type);
        constraint.setMinRatio(minRatio);
        return constraintRepository.save(constraint);
    }

    public Question createScaleQuestion(SelectionPeriod period, String text, int maxScale, String characteristicName) {
        Question question = new Question();
        question.setPeriod(period);
        question.setText(text);
        question.setKind(QuestionKind.SCALE);
        question.setMaxScale(maxScale);
        question.setCharacteristicName(characteristicName);
        return questionRepository.save(question);
    }
}
