package com.topicmatch.backend.modules.topic.domain;

import java.util.LinkedHashSet;
import java.util.Set;
import java.util.UUID;

import com.topicmatch.backend.global.jpa.AbstractTimestampedEntity;
import com.topicmatch.backend.modules.constraint.domain.AssignmentConstraint;
import com.topicmatch.backend.modules.period.domain.SelectionPeriod;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.JoinTable;
import jakarta.persistence.ManyToMany;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;

import org.hibernate.annotations.UuidGenerator;

@Entity
@Table(name = "topic")
public class Topic extends AbstractTimestampedEntity {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "period_id", nullable = false)
    private SelectionPeriod period;

    @Column(name = "title", nullable = false, length = 200)
    private String title;

    @Column(name = "description")
    private String description;

    @Column(name = "active", nullable = false)
    private boolean active = true;

    @Column(name = "preference_weighted", nullable = false)
    private boolean preferenceWeighted = true;

    @ManyToMany(fetch = FetchType.LAZY)
    @JoinTable(
            name = "topic_constraint",
            joinColumns = @JoinColumn(name = "topic_id"),
            inverseJoinColumns = @JoinColumn(name = "constraint_id")
    )
    private Set<AssignmentConstraint> constraints = new LinkedHashSet<>();

    public UUID getId() {
        return id;
    }

    public SelectionPeriod getPeriod() {
        return period;
    }

    public void setPeriod(SelectionPeriod period) {
        this.period = period;
    }

    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        this.title = title;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public boolean isActive() {
        return active;
    }

    public void setActive(boolean active) {
        this.active = active;
    }

    public boolean isPreferenceWeighted() {
        return preferenceWeighted;
    }

    public void setPreferenceWeighted(boolean preferenceWeighted) {
        this.preferenceWeighted = preferenceWeighted;
    }

    public Set<AssignmentConstraint> getConstraints() {
        return constraints;
    }

    public void attachConstraint(AssignmentConstraint constraint) {
        constraints.add(constraint);
    }

    public boolean detachConstraint(UUID constraintId) {
        return constraints.removeIf(constraint -> constraintId.equals(constraint.getId()));
    }
}
