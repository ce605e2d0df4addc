package com.topicmatch.backend.modules.preference.domain;

import java.util.UUID;

import com.topicmatch.backend.global.jpa.AbstractTimestampedEntity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import org.hibernate.annotations.UuidGenerator;

/**
 * Two students who must not share a group. Stored with {@code studentA < studentB}.
 */
@Entity
@Table(name = "student_exclusion")
public class StudentExclusion extends AbstractTimestampedEntity {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "period_id", nullable = false, columnDefinition = "uuid")
    private UUID periodId;

    @Column(name = "student_a", nullable = false, length = 64)
    private String studentA;

    @Column(name = "student_b", nullable = false, length = 64)
    private String studentB;

    protected StudentExclusion() {
    }

    public StudentExclusion(UUID periodId, String first, String second) {
        this.periodId = periodId;
        if (first.compareTo(second) < 0) {
            this.studentA = first;
            this.studentB = second;
        } else {
            this.studentA = second;
            this.studentB = first;
        }
    }

    public UUID getId() {
        return id;
    }

    public UUID getPeriodId() {
        return periodId;
    }

    public String getStudentA() {
        return studentA;
    }

    public String getStudentB() {
        return studentB;
    }
}
