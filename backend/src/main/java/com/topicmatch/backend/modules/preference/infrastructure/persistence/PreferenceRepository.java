package com.topicmatch.backend.modules.preference.infrastructure.persistence;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.topicmatch.backend.modules.preference.domain.Preference;

import org.springframework.data.jpa.repository.JpaRepository;

public interface PreferenceRepository extends JpaRepository<Preference, UUID> {

    List<Preference> findByPeriodId(UUID periodId);

    Optional<Preference> findByPeriodIdAndStudentId(UUID periodId, String studentId);
}
