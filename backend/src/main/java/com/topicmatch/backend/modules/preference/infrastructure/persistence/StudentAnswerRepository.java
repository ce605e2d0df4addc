package com.topicmatch.backend.modules.preference.infrastructure.persistence;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.topicmatch.backend.modules.preference.domain.StudentAnswer;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface StudentAnswerRepository extends JpaRepository<StudentAnswer, UUID> {

    @Query("""
            select a from StudentAnswer a
            join fetch a.question
            where a.periodId = :periodId
            """)
    List<StudentAnswer> findByPeriodIdWithQuestion(@Param("periodId") UUID periodId);

    Optional<StudentAnswer> findByPeriodIdAndStudentIdAndQuestion_Id(UUID periodId, String studentId, UUID questionId);
}
