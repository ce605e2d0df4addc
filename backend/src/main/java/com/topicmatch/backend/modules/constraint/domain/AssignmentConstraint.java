package com.topicmatch.backend.modules.constraint.domain;

import java.util.UUID;

import com.topicmatch.backend.global.jpa.AbstractTimestampedEntity;
import com.topicmatch.backend.modules.period.domain.SelectionPeriod;

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

/**
 * Named trait of a period. Without a criterion type the row is only a category label and the
 * numeric bounds stay empty. {@code minRatio} is stored as a fraction in [0, 1].
 */
@Entity
@Table(name = "assignment_constraint")
public class AssignmentConstraint extends AbstractTimestampedEntity {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "period_id", nullable = false)
    private SelectionPeriod period;

    @Column(name = "name", nullable = false, length = 120)
    private String name;

    @Column(name = "description")
    private String description;

    @Enumerated(EnumType.STRING)
    @Column(name = "criterion_type", length = 16)
    private CriterionType criterionType;

    @Column(name = "min_ratio")
    private Double minRatio;

    @Column(name = "min_students")
    private Integer minStudents;

    @Column(name = "max_students")
    private Integer maxStudents;

    public UUID getId() {
        return id;
    }

    public SelectionPeriod getPeriod() {
        return period;
    }

    public void setPeriod(SelectionPeriod period) {
        this.period = period;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public CriterionType getCriterionType() {
        return criterionType;
    }

    public void setCriterionType(CriterionType criterionType) {
        this.criterionType = criterionType;
    }

    public Double getMinRatio() {
        return minRatio;
    }

    public void setMinRatio(Double minRatio) {
        this.minRatio = minRatio;
    }

    public Integer getMinStudents() {
        return minStudents;
    }

    public void setMinStudents(Integer minStudents) {
        this.minStudents = minStudents;
    }

    public Integer getMaxStudents() {
        return maxStudents;
    }

    public void setMaxStudents(Integer maxStudents) {
        this.maxStudents = maxStudents;
    }

    public boolean isInert() {
        return criterionType == null;
    }

    public boolean hasBounds() {
        return minRatio != null || minStudents != null || maxStudents != null;
    }

    public void clearCriterion() {
        this.criterionType = null;
        this.minRatio = null;
        this.minStudents = null;
        this.maxStudents = null;
    }
}
