package com.topicmatch.backend.modules.preference.infrastructure.persistence;

import java.util.List;
import java.util.UUID;

import com.topicmatch.backend.modules.preference.domain.Question;

import org.springframework.data.jpa.repository.JpaRepository;

public interface QuestionRepository extends JpaRepository<Question, UUID> {

    List<Question> findByPeriod_IdOrderByDisplayOrderAsc(UUID periodId);

    List<Question> findByPeriod_IdAndRequiredTrue(UUID periodId);

    List<Question> findByPeriod_IdAndCharacteristicNameIgnoreCase(UUID periodId, String characteristicName);
}
