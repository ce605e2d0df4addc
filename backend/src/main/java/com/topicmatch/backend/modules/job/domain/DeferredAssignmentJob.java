package com.topicmatch.backend.modules.job.domain;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.annotations.UuidGenerator;
import org.hibernate.type.SqlTypes;

/**
 * One asynchronous solver run. {@code PENDING} moves to exactly one terminal state; terminal jobs never
 * change status again. Timestamps are set from the service clock so that a no-op transition leaves
 * {@code updatedAt} untouched.
 */
@Entity
@Table(name = "deferred_assignment_job")
public class DeferredAssignmentJob {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "period_id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID periodId;

    @Enumerated(EnumType.STRING)
    @Column(name = "kind", nullable = false, length = 16)
    private SolverKind kind;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "request", nullable = false, columnDefinition = "jsonb")
    private Map<String, Object> request;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "student_ids", nullable = false, columnDefinition = "jsonb")
    private List<String> studentIds = new ArrayList<>();

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "topic_ids", nullable = false, columnDefinition = "jsonb")
    private List<String> topicIds = new ArrayList<>();

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private DeferredJobStatus status = DeferredJobStatus.PENDING;

    @Column(name = "evaluation_id", length = 200)
    private String evaluationId;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "result_data", columnDefinition = "jsonb")
    private Map<String, Object> resultData;

    @Column(name = "result_hash", length = 200)
    private String resultHash;

    @Column(name = "error")
    private String error;

    @Enumerated(EnumType.STRING)
    @Column(name = "materialization_status", nullable = false, length = 16)
    private MaterializationStatus materializationStatus = MaterializationStatus.NOT_STARTED;

    @Column(name = "materialization_error")
    private String materializationError;

    @Column(name = "batch_id", length = 120)
    private String batchId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private OffsetDateTime updatedAt;

    protected DeferredAssignmentJob() {
    }

    public DeferredAssignmentJob(
            UUID periodId,
            SolverKind kind,
            Map<String, Object> request,
            List<String> studentIds,
            List<UUID> topicIds,
            OffsetDateTime now
    ) {
        this.periodId = periodId;
        this.kind = kind;
        this.request = request;
        this.studentIds = new ArrayList<>(studentIds);
        this.topicIds = new ArrayList<>(topicIds.stream().map(UUID::toString).toList());
        this.createdAt = now;
        this.updatedAt = now;
    }

    public UUID getId() {
        return id;
    }

    public UUID getPeriodId() {
        return periodId;
    }

    public SolverKind getKind() {
        return kind;
    }

    public Map<String, Object> getRequest() {
        return request;
    }

    public List<String> getStudentIds() {
        return List.copyOf(studentIds);
    }

    public List<UUID> getTopicIds() {
        return topicIds.stream().map(UUID::fromString).toList();
    }

    public DeferredJobStatus getStatus() {
        return status;
    }

    public String getEvaluationId() {
        return evaluationId;
    }

    public Map<String, Object> getResultData() {
        return resultData;
    }

    public String getResultHash() {
        return resultHash;
    }

    public String getError() {
        return error;
    }

    public MaterializationStatus getMaterializationStatus() {
        return materializationStatus;
    }

    public String getMaterializationError() {
        return materializationError;
    }

    public String getBatchId() {
        return batchId;
    }

    public OffsetDateTime getCreatedAt() {
        return createdAt;
    }

    public OffsetDateTime getUpdatedAt() {
        return updatedAt;
    }

    public boolean isPending() {
        return status == DeferredJobStatus.PENDING;
    }

    public void complete(String evaluationId, Map<String, Object> resultData, String resultHash, OffsetDateTime now) {
        requirePending();
        this.status = DeferredJobStatus.COMPLETED;
        this.evaluationId = evaluationId;
        this.resultData = resultData;
        this.resultHash = resultHash;
        this.updatedAt = now;
    }

    public void fail(String error, OffsetDateTime now) {
        requirePending();
        this.status = DeferredJobStatus.FAILED;
        this.error = error;
        this.updatedAt = now;
    }

    public void abandon(String reason, OffsetDateTime now) {
        requirePending();
        this.status = DeferredJobStatus.ABANDONED;
        this.error = reason;
        this.updatedAt = now;
    }

    public void markMaterialized(String batchId, OffsetDateTime now) {
        this.materializationStatus = MaterializationStatus.MATERIALIZED;
        this.materializationError = null;
        this.batchId = batchId;
        this.updatedAt = now;
    }

    public void markMaterializationFailed(String error, OffsetDateTime now) {
        this.materializationStatus = MaterializationStatus.FAILED;
        this.materializationError = error;
        this.updatedAt = now;
    }

    private void requirePending() {
        if (status.isTerminal()) {
            throw new IllegalStateException("Job %s is already %s".formatted(id, status));
        }
    }
}
