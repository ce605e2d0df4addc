package com.topicmatch.backend.modules.assignment.infrastructure.persistence;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.topicmatch.backend.modules.assignment.domain.Assignment;
import com.topicmatch.backend.modules.assignment.domain.AssignmentBatchView;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface AssignmentRepository extends JpaRepository<Assignment, UUID> {

    boolean existsByPeriodId(UUID periodId);

    /**
     * Any row of the most recently assigned batch; its batch id identifies the current batch.
     */
    Optional<Assignment> findFirstByPeriodIdOrderByAssignedAtDescBatchIdDesc(UUID periodId);

    @Query("""
            select a from Assignment a
            join fetch a.topic
            where a.batchId = :batchId
            order by a.studentId asc
            """)
    List<Assignment> findByBatchIdWithTopic(@Param("batchId") String batchId);

    @Query("""
            select a from Assignment a
            join fetch a.topic
            where a.batchId = :batchId and a.studentId = :studentId
            """)
    Optional<Assignment> findByBatchIdAndStudentIdWithTopic(
            @Param("batchId") String batchId,
            @Param("studentId") String studentId
    );

    @Query("""
            select a.batchId as batchId, min(a.assignedAt) as assignedAt, count(a) as assignmentCount
            from Assignment a
            where a.periodId = :periodId
            group by a.batchId
            order by min(a.assignedAt) desc
            """)
    List<AssignmentBatchView> summarizeBatches(@Param("periodId") UUID periodId);
}
