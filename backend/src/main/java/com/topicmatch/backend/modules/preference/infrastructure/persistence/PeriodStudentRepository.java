package com.topicmatch.backend.modules.preference.infrastructure.persistence;

import java.util.List;
import java.util.UUID;

import com.topicmatch.backend.modules.preference.domain.PeriodStudent;

import org.springframework.data.jpa.repository.JpaRepository;

public interface PeriodStudentRepository extends JpaRepository<PeriodStudent, UUID> {

    List<PeriodStudent> findByPeriodId(UUID periodId);

    boolean existsByPeriodIdAndStudentId(UUID periodId, String studentId);
}
