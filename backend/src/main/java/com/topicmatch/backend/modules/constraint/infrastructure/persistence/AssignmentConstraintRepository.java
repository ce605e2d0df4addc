package com.topicmatch.backend.modules.constraint.infrastructure.persistence;

import java.util.List;
import java.util.UUID;

import com.topicmatch.backend.modules.constraint.domain.AssignmentConstraint;

import org.springframework.data.jpa.repository.JpaRepository;

public interface AssignmentConstraintRepository extends JpaRepository<AssignmentConstraint, UUID> {

    List<AssignmentConstraint> findByPeriod_IdOrderByNameAsc(UUID periodId);

    boolean existsByPeriod_IdAndNameIgnoreCase(UUID periodId, String name);

    boolean existsByPeriod_IdAndNameIgnoreCaseAndIdNot(UUID periodId, String name, UUID constraintId);
}
