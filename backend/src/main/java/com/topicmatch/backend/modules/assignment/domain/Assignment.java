package com.topicmatch.backend.modules.assignment.domain;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.topicmatch.backend.global.jpa.AbstractTimestampedEntity;
import com.topicmatch.backend.modules.topic.domain.Topic;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;

import org.hibernate.annotations.UuidGenerator;

/**
 * One student's topic within a batch. Rows are written once per batch and never updated.
 */
@Entity
@Table(name = "assignment")
public class Assignment extends AbstractTimestampedEntity {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "period_id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID periodId;

    @Column(name = "batch_id", nullable = false, updatable = false, length = 120)
    private String batchId;

    @Column(name = "student_id", nullable = false, updatable = false, length = 64)
    private String studentId;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "topic_id", nullable = false, updatable = false)
    private Topic topic;

    @Column(name = "assigned_at", nullable = false, updatable = false)
    private OffsetDateTime assignedAt;

    @Column(name = "original_rank", updatable = false)
    private Integer originalRank;

    protected Assignment() {
    }

    public Assignment(
            UUID periodId,
            String batchId,
            String studentId,
            Topic topic,
            OffsetDateTime assignedAt,
            Integer originalRank
    ) {
        this.periodId = periodId;
        this.batchId = batchId;
        this.studentId = studentId;
        this.topic = topic;
        this.assignedAt = assignedAt;
        this.originalRank = originalRank;
    }

    public UUID getId() {
        return id;
    }

    public UUID getPeriodId() {
        return periodId;
    }

    public String getBatchId() {
        return batchId;
    }

    public String getStudentId() {
        return studentId;
    }

    public Topic getTopic() {
        return topic;
    }

    public OffsetDateTime getAssignedAt() {
        return assignedAt;
    }

    public Integer getOriginalRank() {
        return originalRank;
    }
}
