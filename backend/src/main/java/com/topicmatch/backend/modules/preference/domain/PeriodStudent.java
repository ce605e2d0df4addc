package com.topicmatch.backend.modules.preference.domain;

import java.util.UUID;

import com.topicmatch.backend.global.jpa.AbstractTimestampedEntity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import org.hibernate.annotations.UuidGenerator;

@Entity
@Table(name = "period_student")
public class PeriodStudent extends AbstractTimestampedEntity {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "period_id", nullable = false, columnDefinition = "uuid")
    private UUID periodId;

    @Column(name = "student_id", nullable = false, length = 64)
    private String studentId;

    protected PeriodStudent() {
    }

    public PeriodStudent(UUID periodId, String studentId) {
        this.periodId = periodId;
        this.studentId = studentId;
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
}
