package com.topicmatch.backend.modules.job.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.topicmatch.backend.modules.job.domain.DeferredAssignmentJob;
import com.topicmatch.backend.modules.job.domain.DeferredJobStatus;

import jakarta.persistence.LockModeType;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface DeferredAssignmentJobRepository extends JpaRepository<DeferredAssignmentJob, UUID> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select j from DeferredAssignmentJob j where j.id = :id")
    Optional<DeferredAssignmentJob> findByIdForUpdate(@Param("id") UUID id);

    Optional<DeferredAssignmentJob> findFirstByPeriodIdOrderByCreatedAtDesc(UUID periodId);

    Optional<DeferredAssignmentJob> findFirstByPeriodIdAndStatus(UUID periodId, DeferredJobStatus status);

    boolean existsByPeriodIdAndStatus(UUID periodId, DeferredJobStatus status);

    List<DeferredAssignmentJob> findByStatusAndCreatedAtBeforeOrderByCreatedAtAsc(
            DeferredJobStatus status,
            OffsetDateTime createdBefore
    );
}
