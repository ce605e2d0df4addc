package com.topicmatch.backend.modules.period.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.topicmatch.backend.modules.period.domain.SelectionPeriod;

import jakarta.persistence.LockModeType;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface SelectionPeriodRepository extends JpaRepository<SelectionPeriod, UUID> {

    List<SelectionPeriod> findByActiveTrue();

    List<SelectionPeriod> findByActiveTrueAndCloseTriggeredAtIsNullAndCloseDateLessThanEqual(OffsetDateTime threshold);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select p from SelectionPeriod p where p.id = :id")
    Optional<SelectionPeriod> findByIdForUpdate(@Param("id") UUID id);
}
