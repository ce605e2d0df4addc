package com.topicmatch.backend.modules.preference.infrastructure.persistence;

import java.util.List;
import java.util.UUID;

import com.topicmatch.backend.modules.preference.domain.StudentExclusion;

import org.springframework.data.jpa.repository.JpaRepository;

public interface StudentExclusionRepository extends JpaRepository<StudentExclusion, UUID> {

    List<StudentExclusion> findByPeriodId(UUID periodId);

    boolean existsByPeriodIdAndStudentAAndStudentB(UUID periodId, String studentA, String studentB);
}
