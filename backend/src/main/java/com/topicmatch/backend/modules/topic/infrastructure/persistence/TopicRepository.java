package com.topicmatch.backend.modules.topic.infrastructure.persistence;

import java.util.Collection;
import java.util.List;
import java.util.UUID;

import com.topicmatch.backend.modules.topic.domain.Topic;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface TopicRepository extends JpaRepository<Topic, UUID> {

    @Query("""
            select distinct t from Topic t
            left join fetch t.constraints
            where t.period.id = :periodId
            """)
    List<Topic> findByPeriodIdWithConstraints(@Param("periodId") UUID periodId);

    List<Topic> findByPeriod_IdAndIdIn(UUID periodId, Collection<UUID> topicIds);

    List<Topic> findByConstraints_Id(UUID constraintId);
}
