package com.topicmatch.backend.modules.preference.domain;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.topicmatch.backend.global.jpa.AbstractTimestampedEntity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;

import org.hibernate.annotations.UuidGenerator;

@Entity
@Table(name = "student_answer")
public class StudentAnswer extends AbstractTimestampedEntity {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "period_id", nullable = false, columnDefinition = "uuid")
    private UUID periodId;

    @Column(name = "student_id", nullable = false, length = 64)
    private String studentId;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "question_id", nullable = false)
    private Question question;

    @Enumerated(EnumType.STRING)
    @Column(name = "raw_kind", nullable = false, length = 16)
    private QuestionKind rawKind;

    @Column(name = "raw_value", nullable = false)
    private double rawValue;

    @Column(name = "normalized_answer", nullable = false)
    private double normalizedAnswer;

    @Column(name = "answered_at", nullable = false)
    private OffsetDateTime answeredAt;

    protected StudentAnswer() {
    }

    public StudentAnswer(UUID periodId, String studentId, Question question) {
        this.periodId = periodId;
        this.studentId = studentId;
        this.question = question;
    }

    public UUID getId() {
        return id;
    }

    public UUID getPeriodId() {
        return periodId;
    }

    public String getStudentId() {
        return studentId;
    }

    public Question getQuestion() {
        return question;
    }

    public QuestionKind getRawKind() {
        return rawKind;
    }

    public double getRawValue() {
        return rawValue;
    }

    public double getNormalizedAnswer() {
        return normalizedAnswer;
    }

    public OffsetDateTime getAnsweredAt() {
        return answeredAt;
    }

    public void record(QuestionKind kind, double rawValue, double normalizedAnswer, OffsetDateTime answeredAt) {
        this.rawKind = kind;
        this.rawValue = rawValue;
        this.normalizedAnswer = normalizedAnswer;
        this.answeredAt = answeredAt;
    }
}
