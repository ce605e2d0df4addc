package com.topicmatch.backend.modules.period.domain;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.topicmatch.backend.global.jpa.AbstractTimestampedEntity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import org.hibernate.annotations.UuidGenerator;

/**
 * One assignment cycle. The lifecycle status is never stored; see {@code PeriodStatusResolver}.
 */
@Entity
@Table(name = "selection_period")
public class SelectionPeriod extends AbstractTimestampedEntity {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "title", nullable = false, length = 200)
    private String title;

    @Column(name = "description")
    private String description;

    @Column(name = "open_date", nullable = false)
    private OffsetDateTime openDate;

    @Column(name = "close_date", nullable = false)
    private OffsetDateTime closeDate;

    @Column(name = "active", nullable = false)
    private boolean active;

    @Column(name = "close_triggered_at")
    private OffsetDateTime closeTriggeredAt;

    public UUID getId() {
        return id;
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

    public OffsetDateTime getOpenDate() {
        return openDate;
    }

    public void setOpenDate(OffsetDateTime openDate) {
        this.openDate = openDate;
    }

    public OffsetDateTime getCloseDate() {
        return closeDate;
    }

    public void setCloseDate(OffsetDateTime closeDate) {
        this.closeDate = closeDate;
    }

    public boolean isActive() {
        return active;
    }

    public void setActive(boolean active) {
        this.active = active;
    }

    public OffsetDateTime getCloseTriggeredAt() {
        return closeTriggeredAt;
    }

    public void setCloseTriggeredAt(OffsetDateTime closeTriggeredAt) {
        this.closeTriggeredAt = closeTriggeredAt;
    }
}
