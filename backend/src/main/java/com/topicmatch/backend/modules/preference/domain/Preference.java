package com.topicmatch.backend.modules.preference.domain;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import com.topicmatch.backend.global.jpa.AbstractTimestampedEntity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.annotations.UuidGenerator;
import org.hibernate.type.SqlTypes;

/**
 * A student's ranked topic list for one period. Rank is the 1-based position in {@link #getTopicOrder()}.
 */
@Entity
@Table(name = "preference")
public class Preference extends AbstractTimestampedEntity {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "period_id", nullable = false, columnDefinition = "uuid")
    private UUID periodId;

    @Column(name = "student_id", nullable = false, length = 64)
    private String studentId;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "topic_order", nullable = false, columnDefinition = "jsonb")
    private List<String> topicOrder = new ArrayList<>();

    @Column(name = "last_updated", nullable = false)
    private OffsetDateTime lastUpdated;

    protected Preference() {
    }

    public Preference(UUID periodId, String studentId) {
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

    public List<UUID> getTopicOrder() {
        return topicOrder.stream().map(UUID::fromString).toList();
    }

    public void replaceTopicOrder(List<UUID> topicIds, OffsetDateTime updatedAt) {
        this.topicOrder = new ArrayList<>(topicIds.stream().map(UUID::toString).toList());
        this.lastUpdated = updatedAt;
    }

    /**
     * @return 1-based rank of the topic, or {@code null} when the student did not rank it
     */
    public Integer rankOf(UUID topicId) {
        int index = topicOrder.indexOf(topicId.toString());
        return index < 0 ? null : index + 1;
    }

    public OffsetDateTime getLastUpdated() {
        return lastUpdated;
    }
}
